package com.example.identity_gateway.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "identity.user-cache")
public record UserCacheProperties(
    @NotBlank String host,
    @NotNull Integer port,
    @NotNull Boolean clusterMode,
    Duration commandTimeout) {

  public UserCacheProperties {
    commandTimeout = commandTimeout == null ? Duration.ofSeconds(2) : commandTimeout;
  }
}
