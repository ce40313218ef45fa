package com.example.identity_gateway.config;

import com.example.credential.BearerTokenCodec;
import com.example.credential.CredentialLoginResolver;
import com.example.credential.SessionCookieCodec;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CredentialProperties.class)
public class CredentialCodecConfig {

  @Bean
  BearerTokenCodec bearerTokenCodec(CredentialProperties properties) {
    return new BearerTokenCodec(properties.bearerTokenPassphrase());
  }

  @Bean
  SessionCookieCodec sessionCookieCodec(CredentialProperties properties) {
    // 鍵長が AES の要件を満たさない場合はここで起動失敗させる
    return new SessionCookieCodec(properties.pidCookieKey(), properties.pidCookieIvSeed());
  }

  @Bean
  CredentialLoginResolver credentialLoginResolver(
      BearerTokenCodec bearerTokenCodec, SessionCookieCodec sessionCookieCodec) {
    return new CredentialLoginResolver(bearerTokenCodec, sessionCookieCodec);
  }
}
