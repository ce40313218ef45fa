package com.example.identity_gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "identity.resolution")
public record IdentityResolutionProperties(Boolean enabled) {

  public IdentityResolutionProperties {
    enabled = enabled == null ? Boolean.TRUE : enabled;
  }
}
