package com.example.identity_gateway;

import com.example.credential.BearerTokenCodec;
import com.example.credential.CredentialLoginResolver;
import com.example.credential.OpenSslKeyDerivation;
import com.example.credential.SessionCookieCodec;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/** 本番と同じ方式で暗号化した認証情報をテスト用に作る。 */
public final class TestCredentials {

  public static final String PASSPHRASE = "0123456789abcdef";
  public static final String PID_KEY = "0123456789abcdef";
  public static final String PID_IV_SEED = "pid-iv-seed";

  private TestCredentials() {}

  public static CredentialLoginResolver loginResolver() {
    return new CredentialLoginResolver(
        new BearerTokenCodec(PASSPHRASE), new SessionCookieCodec(PID_KEY, PID_IV_SEED));
  }

  /** ログインを 6 番目のフィールドに持つアクセストークン値。 */
  public static String accessToken(String userLogin) {
    final byte[] salt = "tstsalt1".getBytes(StandardCharsets.US_ASCII);
    final OpenSslKeyDerivation.KeyMaterial material =
        OpenSslKeyDerivation.derive(PASSPHRASE.getBytes(StandardCharsets.UTF_8), salt, 32, 16);
    final String plain = "v1|app|1700000000|device|cust|" + userLogin + "|end";
    final byte[] encrypted =
        encrypt(material.key(), material.iv(), plain.getBytes(StandardCharsets.UTF_8));
    final byte[] payload = new byte[16 + encrypted.length];
    System.arraycopy("Salted__".getBytes(StandardCharsets.US_ASCII), 0, payload, 0, 8);
    System.arraycopy(salt, 0, payload, 8, 8);
    System.arraycopy(encrypted, 0, payload, 16, encrypted.length);
    return Base64.getEncoder()
        .withoutPadding()
        .encodeToString(payload)
        .replace('/', '-')
        .replace('+', '_');
  }

  /** ログイン済み・暗号化ありの pid Cookie 値 (URL エスケープ済み)。 */
  public static String pidCookie(String userLogin) {
    final byte[] encrypted =
        encrypt(
            PID_KEY.getBytes(StandardCharsets.UTF_8),
            pidIv(),
            userLogin.getBytes(StandardCharsets.UTF_8));
    final String raw = "L:0:" + Base64.getEncoder().encodeToString(encrypted) + ":1";
    return URLEncoder.encode(raw, StandardCharsets.UTF_8);
  }

  private static byte[] pidIv() {
    try {
      final byte[] digest =
          MessageDigest.getInstance("MD5").digest(PID_IV_SEED.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of()
          .formatHex(digest)
          .substring(0, 16)
          .getBytes(StandardCharsets.US_ASCII);
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException(ex);
    }
  }

  private static byte[] encrypt(byte[] key, byte[] iv, byte[] plain) {
    try {
      final Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
      cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));
      return cipher.doFinal(plain);
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException(ex);
    }
  }
}
