package com.example.identity_gateway.service;

import com.example.identity_gateway.model.LocalUserRecord;
import com.example.identity_gateway.model.LocalUserResolution;
import com.example.identity_gateway.model.ProfileRecord;
import com.example.identity_gateway.repository.LocalUserRepository;
import java.util.Optional;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LocalUserService {

  private static final Logger logger = LoggerFactory.getLogger(LocalUserService.class);

  private final LocalUserRepository localUserRepository;

  /**
   * userLogin のローカルユーザーを返し、無ければ profile の内容で作成する。
   *
   * <p>同じ userLogin の初回リクエストが並行した場合、一意制約違反になった側は再読込して勝者の行を返す。
   */
  public LocalUserResolution findOrCreate(String userLogin, @NonNull ProfileRecord profile) {
    if (userLogin == null || userLogin.isBlank()) {
      throw new IllegalArgumentException("userLogin is required");
    }
    final Optional<LocalUserRecord> existing = localUserRepository.findByUserLogin(userLogin);
    if (existing.isPresent()) {
      logger.debug("local user found");
      return LocalUserResolution.found(existing.get());
    }

    final LocalUserRecord candidate =
        LocalUserRecord.newUser(
            blankToNull(profile.userLogin()),
            profile.custId() > 0 ? profile.custId() : null,
            blankToNull(profile.encryptedPid()));
    try {
      final LocalUserRecord inserted = localUserRepository.insert(candidate);
      logger.debug("local user inserted id={}", inserted.id());
      return LocalUserResolution.inserted(inserted);
    } catch (DataIntegrityViolationException ex) {
      logger.info("local user insert conflicted, reading the concurrently inserted row");
      final String lookupLogin = candidate.userLogin() == null ? userLogin : candidate.userLogin();
      final LocalUserRecord winner =
          localUserRepository.findByUserLogin(lookupLogin).orElseThrow(() -> ex);
      return LocalUserResolution.found(winner);
    }
  }

  private String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
