package com.example.identity_gateway.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.redis.connection.RedisNode;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

class RedisConfigTest {

  // 接続は遅延されるため Redis 無しでもファクトリの構成だけを検証できる
  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(RedisConfig.class)
          .withPropertyValues(
              "identity.user-cache.host=cache.internal",
              "identity.user-cache.port=7000",
              "identity.user-cache.command-timeout=500ms");

  @Test
  void clusterModeBuildsClusterFactoryWithSeedNode() {
    contextRunner
        .withPropertyValues("identity.user-cache.cluster-mode=true")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final LettuceConnectionFactory factory =
                  context.getBean(LettuceConnectionFactory.class);
              assertThat(factory.isClusterAware()).isTrue();
              assertThat(factory.getClusterConfiguration().getClusterNodes())
                  .extracting(RedisNode::getHost, RedisNode::getPort)
                  .containsExactly(org.assertj.core.groups.Tuple.tuple("cache.internal", 7000));
              assertThat(factory.getClientConfiguration().getCommandTimeout())
                  .isEqualTo(Duration.ofMillis(500));
              assertThat(context).hasSingleBean(StringRedisTemplate.class);
            });
  }

  @Test
  void standaloneModeBuildsStandaloneFactory() {
    contextRunner
        .withPropertyValues("identity.user-cache.cluster-mode=false")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final LettuceConnectionFactory factory =
                  context.getBean(LettuceConnectionFactory.class);
              assertThat(factory.isClusterAware()).isFalse();
              assertThat(factory.getStandaloneConfiguration().getHostName())
                  .isEqualTo("cache.internal");
              assertThat(factory.getStandaloneConfiguration().getPort()).isEqualTo(7000);
              assertThat(factory.getClientConfiguration().getCommandTimeout())
                  .isEqualTo(Duration.ofMillis(500));
            });
  }
}
