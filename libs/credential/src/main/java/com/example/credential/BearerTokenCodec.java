/*
 * どこで: libs/credential
 * 何を: アクセストークン (Authorization ヘッダ / クエリ / アプリ Cookie) の解析と userLogin 復号
 * なぜ: 旧アプリが発行する OpenSSL 互換の salted AES-256-CBC トークンを読むため
 */
package com.example.credential;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

public class BearerTokenCodec {

  static final int SALTED_HEADER_LENGTH = 16;
  static final int SALT_OFFSET = 8;
  static final int KEY_LENGTH = 32;
  static final int IV_LENGTH = 16;
  static final int USER_LOGIN_FIELD_INDEX = 5;

  private final byte[] passphrase;

  public BearerTokenCodec(String passphrase) {
    if (passphrase == null || passphrase.isEmpty()) {
      throw new IllegalArgumentException("bearer token passphrase is required");
    }
    this.passphrase = passphrase.getBytes(StandardCharsets.UTF_8);
  }

  /**
   * 生の値を {@link BearerToken} に分解する。
   *
   * <p>空白区切りの末尾がトークン値、その直前がスキーム名。先頭に余分な語があっても無視する。
   */
  public static BearerToken decode(String raw) {
    final String decoded = CredentialText.unescape(raw == null ? "" : raw, "access token");
    final String[] parts = decoded.split(" ", -1);
    final String value = parts[parts.length - 1];
    final String kind = parts.length > 1 ? parts[parts.length - 2] : BearerToken.DEFAULT_KIND;
    return new BearerToken(kind, value);
  }

  public String resolveLogin(BearerToken token) {
    if (!token.isValid()) {
      throw new CredentialDecodingException(
          CredentialDecodingException.Reason.MALFORMED_CREDENTIAL, "access token value is empty");
    }
    final byte[] raw = decodeBase64(token.value());
    if (raw.length <= SALTED_HEADER_LENGTH) {
      throw new CredentialDecodingException(
          CredentialDecodingException.Reason.MALFORMED_CREDENTIAL, "access token is too short");
    }
    // 先頭 8 byte は "Salted__" マジック、続く 8 byte が salt
    final byte[] salt = Arrays.copyOfRange(raw, SALT_OFFSET, SALTED_HEADER_LENGTH);
    final byte[] message = Arrays.copyOfRange(raw, SALTED_HEADER_LENGTH, raw.length);

    final OpenSslKeyDerivation.KeyMaterial material =
        OpenSslKeyDerivation.derive(passphrase, salt, KEY_LENGTH, IV_LENGTH);
    final byte[] plain = AesCbc.decrypt(material.key(), material.iv(), message);

    // 平文は '|' 区切りのため、パディングは除去しない
    final String[] fields = new String(plain, StandardCharsets.UTF_8).split("\\|", -1);
    if (fields.length <= USER_LOGIN_FIELD_INDEX) {
      throw new CredentialDecodingException(
          CredentialDecodingException.Reason.DECRYPTION_FAILURE,
          "error when reading userLogin from access token");
    }
    return fields[USER_LOGIN_FIELD_INDEX];
  }

  private byte[] decodeBase64(String value) {
    final String standard = value.replace('-', '/').replace('_', '+');
    try {
      return Base64.getDecoder().decode(standard);
    } catch (IllegalArgumentException ex) {
      throw new CredentialDecodingException(
          CredentialDecodingException.Reason.MALFORMED_CREDENTIAL,
          "error when decoding access token",
          ex);
    }
  }
}
