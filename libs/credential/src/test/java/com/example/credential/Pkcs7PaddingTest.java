package com.example.credential;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class Pkcs7PaddingTest {

  @Test
  void stripsExactlyThePaddingBytes() {
    final byte[] padded = {'a', 'b', 'c', 'd', 4, 4, 4, 4};

    assertThat(Pkcs7Padding.unpad(padded, 16)).containsExactly('a', 'b', 'c', 'd');
  }

  @Test
  void stripsAFullBlockOfPadding() {
    final byte[] padded = new byte[16];
    java.util.Arrays.fill(padded, (byte) 16);

    assertThat(Pkcs7Padding.unpad(padded, 16)).isEmpty();
  }

  @Test
  void rejectsZeroPadding() {
    assertThatThrownBy(() -> Pkcs7Padding.unpad(new byte[] {'a', 0}, 16))
        .isInstanceOf(CredentialDecodingException.class);
  }

  @Test
  void rejectsPaddingLargerThanBlockSize() {
    final byte[] padded = new byte[32];
    java.util.Arrays.fill(padded, (byte) 17);

    assertThatThrownBy(() -> Pkcs7Padding.unpad(padded, 16))
        .isInstanceOf(CredentialDecodingException.class);
  }

  @Test
  void rejectsPaddingLongerThanData() {
    assertThatThrownBy(() -> Pkcs7Padding.unpad(new byte[] {3, 3}, 16))
        .isInstanceOf(CredentialDecodingException.class);
  }

  @Test
  void rejectsInconsistentPaddingBytes() {
    assertThatThrownBy(() -> Pkcs7Padding.unpad(new byte[] {'a', 'b', 2, 3, 3}, 16))
        .isInstanceOf(CredentialDecodingException.class)
        .extracting(ex -> ((CredentialDecodingException) ex).reason())
        .isEqualTo(CredentialDecodingException.Reason.DECRYPTION_FAILURE);
  }

  @Test
  void rejectsEmptyInput() {
    assertThatThrownBy(() -> Pkcs7Padding.unpad(new byte[0], 16))
        .isInstanceOf(CredentialDecodingException.class);
  }
}
