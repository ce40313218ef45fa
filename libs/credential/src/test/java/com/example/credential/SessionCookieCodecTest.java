package com.example.credential;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;
import org.junit.jupiter.api.Test;

class SessionCookieCodecTest {

  private static final String KEY = "0123456789abcdef0123456789abcdef";
  private static final String IV_SEED = "iv-seed";

  private final SessionCookieCodec codec = new SessionCookieCodec(KEY, IV_SEED);

  @Test
  void decodeReadsFieldsByPosition() {
    final SessionCookie cookie = SessionCookieCodec.decode("L%3Aignored%3Apid-1%3A1");

    assertThat(cookie.status()).isEqualTo("L");
    assertThat(cookie.pid()).isEqualTo("pid-1");
    assertThat(cookie.encrypted()).isTrue();
  }

  @Test
  void decodeLeavesMissingFieldsEmpty() {
    final SessionCookie cookie = SessionCookieCodec.decode("L");

    assertThat(cookie.status()).isEqualTo("L");
    assertThat(cookie.pid()).isEmpty();
    assertThat(cookie.encrypted()).isFalse();
    assertThat(cookie.isValid()).isFalse();
  }

  @Test
  void decodeTreatsAnythingButOneAsPlainText() {
    assertThat(SessionCookieCodec.decode("L:x:pid:true").encrypted()).isFalse();
  }

  @Test
  void resolveLoginRejectsInvalidCookie() {
    assertThatThrownBy(() -> codec.resolveLogin(new SessionCookie("", "pid", true)))
        .isInstanceOf(CredentialDecodingException.class)
        .extracting(ex -> ((CredentialDecodingException) ex).reason())
        .isEqualTo(CredentialDecodingException.Reason.INVALID_CREDENTIAL);
    assertThatThrownBy(() -> codec.resolveLogin(new SessionCookie("L", "", true)))
        .isInstanceOf(CredentialDecodingException.class);
  }

  @Test
  void resolveLoginReturnsEmptyForLoggedOutCookie() {
    assertThat(codec.resolveLogin(new SessionCookie("O", "whatever", true))).isEmpty();
  }

  @Test
  void resolveLoginRejectsLegacyPlainTextCookie() {
    assertThatThrownBy(() -> codec.resolveLogin(new SessionCookie("L", "jdoe", false)))
        .isInstanceOf(CredentialDecodingException.class)
        .hasMessageContaining("not implemented")
        .extracting(ex -> ((CredentialDecodingException) ex).reason())
        .isEqualTo(CredentialDecodingException.Reason.UNSUPPORTED_CREDENTIAL);
  }

  @Test
  void resolveLoginDecryptsEncryptedPid() {
    final String pid = CredentialFixtures.encryptPid(KEY, IV_SEED, "jane.doe@example.com");
    final SessionCookie cookie =
        SessionCookieCodec.decode(CredentialFixtures.pidCookieValue("L", pid, true));

    assertThat(codec.resolveLogin(cookie)).isEqualTo("jane.doe@example.com");
  }

  @Test
  void resolveLoginRejectsUnalignedCipherText() {
    final String pid = java.util.Base64.getEncoder().encodeToString(new byte[10]);

    assertThatThrownBy(() -> codec.resolveLogin(new SessionCookie("L", pid, true)))
        .isInstanceOf(CredentialDecodingException.class)
        .extracting(ex -> ((CredentialDecodingException) ex).reason())
        .isEqualTo(CredentialDecodingException.Reason.DECRYPTION_FAILURE);
  }

  @Test
  void resolveLoginRejectsMalformedBase64() {
    assertThatThrownBy(() -> codec.resolveLogin(new SessionCookie("L", "%%%", true)))
        .isInstanceOf(CredentialDecodingException.class)
        .extracting(ex -> ((CredentialDecodingException) ex).reason())
        .isEqualTo(CredentialDecodingException.Reason.MALFORMED_CREDENTIAL);
  }

  @Test
  void deriveIvUsesLeadingHexCharactersOfMd5() throws Exception {
    final byte[] digest =
        MessageDigest.getInstance("MD5").digest(IV_SEED.getBytes(StandardCharsets.UTF_8));
    final String expected = HexFormat.of().formatHex(digest).substring(0, 16);

    assertThat(SessionCookieCodec.deriveIv(IV_SEED))
        .isEqualTo(expected.getBytes(StandardCharsets.US_ASCII));
  }

  @Test
  void constructorRejectsKeyOfUnsupportedLength() {
    assertThatThrownBy(() -> new SessionCookieCodec("short", IV_SEED))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("16, 24 or 32");
  }
}
