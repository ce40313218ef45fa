package com.example.identity_gateway.repository;

import com.example.identity_gateway.model.CachedUserRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RedisUserCacheRepository implements UserCacheRepository {

  private static final Logger logger = LoggerFactory.getLogger(RedisUserCacheRepository.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  private final ObjectMapper objectMapper;

  public RedisUserCacheRepository(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  public boolean exists(String userLogin) {
    final String key = userKey(userLogin);
    logger.debug("checking cached user key={}", key);
    return Boolean.TRUE.equals(redisTemplate.hasKey(key));
  }

  @Override
  public void save(String userLogin, CachedUserRecord user, Duration ttl) {
    final String key = userKey(userLogin);
    logger.debug("saving cached user key={} ttl={}", key, ttl);
    final String json;
    try {
      json = objectMapper.writeValueAsString(user.withExtra(normalizeExtra(user.extra())));
    } catch (JsonProcessingException ex) {
      throw new UserCacheException("failed to serialize cached user", ex);
    }
    redisTemplate.opsForValue().set(key, json, ttl);
  }

  // extra はそのまま埋め込まれるため、単一の JSON 値でなければ書き込まない。空文字は null 扱い。
  private String normalizeExtra(String extra) {
    if (extra == null || extra.isBlank()) {
      return null;
    }
    try {
      objectMapper
          .reader()
          .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
          .readTree(extra);
    } catch (JsonProcessingException ex) {
      throw new UserCacheException("cached user extra is not valid json", ex);
    }
    return extra;
  }

  static String userKey(String userLogin) {
    return "SAPIUser:" + userLogin;
  }
}
