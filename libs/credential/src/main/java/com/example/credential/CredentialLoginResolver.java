package com.example.credential;

/** 認証情報の種類ごとに対応するコーデックで userLogin を解決する。 */
public class CredentialLoginResolver {

  private final BearerTokenCodec bearerTokenCodec;
  private final SessionCookieCodec sessionCookieCodec;

  public CredentialLoginResolver(
      BearerTokenCodec bearerTokenCodec, SessionCookieCodec sessionCookieCodec) {
    this.bearerTokenCodec = bearerTokenCodec;
    this.sessionCookieCodec = sessionCookieCodec;
  }

  /**
   * @return userLogin。匿名 (未ログインの pid Cookie) の場合は空文字
   * @throws CredentialDecodingException 復号・解析に失敗した場合
   */
  public String resolveLogin(Credential credential) {
    if (credential instanceof BearerToken token) {
      return bearerTokenCodec.resolveLogin(token);
    }
    if (credential instanceof SessionCookie cookie) {
      return sessionCookieCodec.resolveLogin(cookie);
    }
    throw new IllegalArgumentException("unknown credential type: " + credential);
  }
}
