package com.example.credential;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

final class CredentialText {

  private CredentialText() {}

  // クエリ文字列と同じ規則でデコードする ("+" は空白になる)
  static String unescape(String raw, String what) {
    try {
      return URLDecoder.decode(raw, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      throw new CredentialDecodingException(
          CredentialDecodingException.Reason.MALFORMED_CREDENTIAL,
          "could not unescape " + what + " value",
          ex);
    }
  }
}
