/*
 * どこで: identity-gateway インフラ設定
 * 何を: ユーザーキャッシュ用の Redis 接続 (単体 / クラスタ) と StringRedisTemplate を提供する
 * なぜ: 環境ごとに Redis の構成が異なり、コマンドタイムアウトでリクエストの滞留を防ぐため
 */
package com.example.identity_gateway.config;

import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisClusterConfiguration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@EnableConfigurationProperties(UserCacheProperties.class)
public class RedisConfig {

  @Bean
  LettuceConnectionFactory redisConnectionFactory(UserCacheProperties properties) {
    final LettuceClientConfiguration clientConfiguration =
        LettuceClientConfiguration.builder().commandTimeout(properties.commandTimeout()).build();
    if (Boolean.TRUE.equals(properties.clusterMode())) {
      final RedisClusterConfiguration cluster =
          new RedisClusterConfiguration(List.of(properties.host() + ":" + properties.port()));
      return new LettuceConnectionFactory(cluster, clientConfiguration);
    }
    return new LettuceConnectionFactory(
        new RedisStandaloneConfiguration(properties.host(), properties.port()),
        clientConfiguration);
  }

  @Bean
  StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }
}
