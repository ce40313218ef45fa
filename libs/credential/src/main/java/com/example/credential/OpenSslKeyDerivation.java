/*
 * どこで: libs/credential
 * 何を: OpenSSL 互換 (EVP_BytesToKey, MD5, 1 回反復) の鍵/IV 導出
 * なぜ: アプリ発行のアクセストークンが "Salted__" 形式の OpenSSL 暗号文で届くため
 */
package com.example.credential;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

public final class OpenSslKeyDerivation {

  private OpenSslKeyDerivation() {}

  public static KeyMaterial derive(byte[] passphrase, byte[] salt, int keyLength, int ivLength) {
    if (keyLength <= 0 || ivLength < 0) {
      throw new IllegalArgumentException("keyLength must be positive and ivLength non-negative");
    }
    final int desiredLength = keyLength + ivLength;
    final byte[] derived = new byte[desiredLength + 16];
    final MessageDigest md5 = newMd5();
    byte[] previous = new byte[0];
    int filled = 0;
    // D_i = MD5(D_{i-1} || passphrase || salt) を必要長まで連結する
    while (filled < desiredLength) {
      md5.update(previous);
      md5.update(passphrase);
      md5.update(salt);
      previous = md5.digest();
      System.arraycopy(previous, 0, derived, filled, previous.length);
      filled += previous.length;
    }
    return new KeyMaterial(
        Arrays.copyOfRange(derived, 0, keyLength),
        Arrays.copyOfRange(derived, keyLength, desiredLength));
  }

  private static MessageDigest newMd5() {
    try {
      return MessageDigest.getInstance("MD5");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("MD5 algorithm not available", ex);
    }
  }

  public record KeyMaterial(byte[] key, byte[] iv) {

    public KeyMaterial {
      key = key.clone();
      iv = iv.clone();
    }

    @Override
    public byte[] key() {
      return key.clone();
    }

    @Override
    public byte[] iv() {
      return iv.clone();
    }
  }
}
