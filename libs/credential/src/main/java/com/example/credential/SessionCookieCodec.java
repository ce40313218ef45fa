/*
 * どこで: libs/credential
 * 何を: pid Cookie の解析と、暗号化 pid の AES-CBC + PKCS7 復号
 * なぜ: Web サイトのログイン Cookie から userLogin を得るため
 */
package com.example.credential;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;

public class SessionCookieCodec {

  private final byte[] key;
  private final byte[] iv;

  public SessionCookieCodec(String key, String ivSeed) {
    if (key == null || key.isEmpty()) {
      throw new IllegalArgumentException("pid cookie key is required");
    }
    if (ivSeed == null || ivSeed.isEmpty()) {
      throw new IllegalArgumentException("pid cookie iv seed is required");
    }
    this.key = key.getBytes(StandardCharsets.UTF_8);
    if (!AesCbc.isValidKeyLength(this.key.length)) {
      throw new IllegalArgumentException(
          "pid cookie key must be 16, 24 or 32 bytes but was " + this.key.length);
    }
    this.iv = deriveIv(ivSeed);
  }

  /** {@code status:_:pid:encrypted} 形式を位置で分解する。足りない要素は空/false のまま。 */
  public static SessionCookie decode(String raw) {
    final String decoded = CredentialText.unescape(raw == null ? "" : raw, "cookie");
    final String[] parts = decoded.split(":", -1);
    final String status = parts[0];
    final String pid = parts.length > 2 ? parts[2] : "";
    final boolean encrypted = parts.length > 3 && "1".equals(parts[3]);
    return new SessionCookie(status, pid, encrypted);
  }

  /**
   * Cookie から userLogin を返す。未ログイン (status が L 以外) の場合はエラーではなく空文字を返す。
   */
  public String resolveLogin(SessionCookie cookie) {
    if (!cookie.isValid()) {
      throw new CredentialDecodingException(
          CredentialDecodingException.Reason.INVALID_CREDENTIAL, "invalid cookie found");
    }
    if (!cookie.isLoggedIn()) {
      return "";
    }
    if (!cookie.encrypted()) {
      throw new CredentialDecodingException(
          CredentialDecodingException.Reason.UNSUPPORTED_CREDENTIAL,
          "legacy cookie not implemented");
    }
    return decrypt(cookie.pid());
  }

  private String decrypt(String pid) {
    final byte[] cipherText;
    try {
      cipherText = Base64.getDecoder().decode(pid);
    } catch (IllegalArgumentException ex) {
      throw new CredentialDecodingException(
          CredentialDecodingException.Reason.MALFORMED_CREDENTIAL,
          "error when decoding encrypted pid cookie",
          ex);
    }
    final byte[] plain = AesCbc.decrypt(key, iv, cipherText);
    return new String(Pkcs7Padding.unpad(plain, AesCbc.BLOCK_SIZE), StandardCharsets.UTF_8);
  }

  // MD5(seed) の 16 進表現の先頭 16 文字を、そのまま IV のバイト列として使う
  static byte[] deriveIv(String ivSeed) {
    try {
      final byte[] digest =
          MessageDigest.getInstance("MD5").digest(ivSeed.getBytes(StandardCharsets.UTF_8));
      final String hex = HexFormat.of().formatHex(digest);
      return hex.substring(0, AesCbc.BLOCK_SIZE).getBytes(StandardCharsets.US_ASCII);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("MD5 algorithm not available", ex);
    }
  }
}
