package com.example.credential;

import java.util.Arrays;

public final class Pkcs7Padding {

  private Pkcs7Padding() {}

  /**
   * 末尾の PKCS7 パディングを取り除く。
   *
   * <p>末尾バイト p が {@code 1 <= p <= blockSize} かつ データ長以下で、末尾 p バイトがすべて p であることを要求する。
   *
   * @throws CredentialDecodingException パディングが不正な場合 ({@code DECRYPTION_FAILURE})
   */
  public static byte[] unpad(byte[] data, int blockSize) {
    if (data == null || data.length == 0) {
      throw new CredentialDecodingException(
          CredentialDecodingException.Reason.DECRYPTION_FAILURE, "invalid padding size");
    }
    final int padding = data[data.length - 1] & 0xff;
    if (padding < 1 || padding > blockSize || padding > data.length) {
      throw new CredentialDecodingException(
          CredentialDecodingException.Reason.DECRYPTION_FAILURE, "invalid padding");
    }
    for (int i = data.length - padding; i < data.length; i++) {
      if ((data[i] & 0xff) != padding) {
        throw new CredentialDecodingException(
            CredentialDecodingException.Reason.DECRYPTION_FAILURE, "invalid padding");
      }
    }
    return Arrays.copyOf(data, data.length - padding);
  }
}
