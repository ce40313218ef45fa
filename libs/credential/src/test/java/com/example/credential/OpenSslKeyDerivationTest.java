package com.example.credential;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class OpenSslKeyDerivationTest {

  private static final byte[] PASSPHRASE = "secret".getBytes(StandardCharsets.UTF_8);
  private static final byte[] SALT = {1, 2, 3, 4, 5, 6, 7, 8};

  @Test
  void derivesChainedMd5Digests() throws Exception {
    final MessageDigest md5 = MessageDigest.getInstance("MD5");
    final byte[] d1 = md5.digest(concat(PASSPHRASE, SALT));
    final byte[] d2 = md5.digest(concat(d1, PASSPHRASE, SALT));
    final byte[] d3 = md5.digest(concat(d2, PASSPHRASE, SALT));

    final OpenSslKeyDerivation.KeyMaterial material =
        OpenSslKeyDerivation.derive(PASSPHRASE, SALT, 32, 16);

    assertThat(material.key()).isEqualTo(concat(d1, d2));
    assertThat(material.iv()).isEqualTo(d3);
  }

  @Test
  void truncatesToRequestedLengths() {
    final OpenSslKeyDerivation.KeyMaterial material =
        OpenSslKeyDerivation.derive(PASSPHRASE, SALT, 24, 8);
    final OpenSslKeyDerivation.KeyMaterial full =
        OpenSslKeyDerivation.derive(PASSPHRASE, SALT, 32, 16);

    assertThat(material.key()).hasSize(24).isEqualTo(Arrays.copyOf(full.key(), 24));
    assertThat(material.iv()).hasSize(8).isEqualTo(Arrays.copyOfRange(full.key(), 24, 32));
  }

  private static byte[] concat(byte[]... parts) {
    int length = 0;
    for (byte[] part : parts) {
      length += part.length;
    }
    final byte[] joined = new byte[length];
    int offset = 0;
    for (byte[] part : parts) {
      System.arraycopy(part, 0, joined, offset, part.length);
      offset += part.length;
    }
    return joined;
  }
}
