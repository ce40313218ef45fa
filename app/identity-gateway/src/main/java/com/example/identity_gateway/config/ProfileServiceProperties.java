package com.example.identity_gateway.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "identity.profile-service")
public record ProfileServiceProperties(
    @NotBlank String baseUrl,
    @NotBlank String authKey,
    String userDetailsPath,
    Duration connectTimeout,
    Duration readTimeout) {

  public ProfileServiceProperties {
    userDetailsPath =
        userDetailsPath == null || userDetailsPath.isBlank()
            ? "/sporty-api/user/details"
            : userDetailsPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(3) : readTimeout;
  }

  @Override
  public String toString() {
    return "ProfileServiceProperties[baseUrl="
        + baseUrl
        + ", userDetailsPath="
        + userDetailsPath
        + ", connectTimeout="
        + connectTimeout
        + ", readTimeout="
        + readTimeout
        + "]";
  }
}
