/*
 * どこで: identity-gateway の設定バインド
 * 何を: 認証情報の復号に使う秘密値を保持する
 * なぜ: 秘密値の欠落をリクエスト時ではなく起動時に検知するため
 */
package com.example.identity_gateway.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "identity.credential")
public record CredentialProperties(
    @NotBlank String bearerTokenPassphrase,
    @NotBlank String pidCookieKey,
    @NotBlank String pidCookieIvSeed) {

  @Override
  public String toString() {
    return "CredentialProperties[****]";
  }
}
