package com.example.credential;

import java.security.GeneralSecurityException;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

final class AesCbc {

  static final int BLOCK_SIZE = 16;

  private AesCbc() {}

  static boolean isValidKeyLength(int length) {
    return length == 16 || length == 24 || length == 32;
  }

  /** パディング除去はしない。呼び出し側が平文の形式に応じて扱う。 */
  static byte[] decrypt(byte[] key, byte[] iv, byte[] cipherText) {
    if (cipherText.length == 0 || cipherText.length % BLOCK_SIZE != 0) {
      throw new CredentialDecodingException(
          CredentialDecodingException.Reason.DECRYPTION_FAILURE,
          "cipher text is not a multiple of the block size");
    }
    try {
      final Cipher cipher = Cipher.getInstance("AES/CBC/NoPadding");
      cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));
      return cipher.doFinal(cipherText);
    } catch (GeneralSecurityException ex) {
      throw new CredentialDecodingException(
          CredentialDecodingException.Reason.DECRYPTION_FAILURE, "could not build AES cipher", ex);
    }
  }
}
