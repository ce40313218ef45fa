package com.example.identity_gateway.repository;

import com.example.identity_gateway.model.LocalUserRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class LocalUserRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<LocalUserRecord> findByUserLogin(String userLogin) {
    final String sql =
        """
        SELECT id, "userLogin", "custId", "avatarUrl", extra, "encryptedPid"
        FROM "User"
        WHERE "userLogin" = :userLogin
        ORDER BY id
        LIMIT 1
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userLogin", userLogin);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public LocalUserRecord insert(LocalUserRecord user) {
    final String sql =
        """
        INSERT INTO "User" ("userLogin", "custId", "encryptedPid")
        VALUES (:userLogin, :custId, :encryptedPid)
        RETURNING id, "userLogin", "custId", "avatarUrl", extra, "encryptedPid"
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userLogin", user.userLogin(), Types.VARCHAR)
            .addValue("custId", user.custId(), Types.BIGINT)
            .addValue("encryptedPid", user.encryptedPid(), Types.VARCHAR);
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  private LocalUserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new LocalUserRecord(
        rs.getLong("id"),
        rs.getString("userLogin"),
        rs.getObject("custId", Long.class),
        rs.getString("avatarUrl"),
        rs.getString("extra"),
        rs.getString("encryptedPid"));
  }
}
