/*
 * どこで: identity-gateway サービス層
 * 何を: HTTP リクエストから認証情報を 1 つだけ取り出す
 * なぜ: 旧クライアントごとに認証情報の置き場所が異なり、優先順位を固定して解釈を一意にするため
 */
package com.example.identity_gateway.service;

import com.example.credential.BearerTokenCodec;
import com.example.credential.Credential;
import com.example.credential.SessionCookieCodec;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class CredentialExtractor {

  public static final String AUTHORIZATION_HEADER = "Authorization";
  public static final String ACCESS_TOKEN_PARAM = "cbs-app-access-token";
  public static final String PID_COOKIE = "pid";
  public static final String APP_TOKEN_COOKIE = "picks-cbs-app-token";

  private static final Logger logger = LoggerFactory.getLogger(CredentialExtractor.class);

  /**
   * 優先順位: Authorization ヘッダ、クエリパラメータ、pid Cookie、アプリトークン Cookie。
   *
   * <p>最初に見つかった置き場所の値が壊れていれば次の置き場所へは進まず例外にする。
   *
   * @return どこにも無ければ empty
   * @throws com.example.credential.CredentialDecodingException 見つかった値を解析できない場合
   */
  public Optional<Credential> extract(HttpServletRequest request) {
    final String authorization = request.getHeader(AUTHORIZATION_HEADER);
    if (!isEmpty(authorization)) {
      logger.debug("found access token in authorization header");
      return Optional.of(BearerTokenCodec.decode(authorization));
    }

    final String accessTokenParam = queryParameter(request, ACCESS_TOKEN_PARAM);
    if (!isEmpty(accessTokenParam)) {
      logger.debug("found access token in query param");
      return Optional.of(BearerTokenCodec.decode(accessTokenParam));
    }

    final Cookie pidCookie = findCookie(request, PID_COOKIE);
    if (pidCookie != null) {
      logger.debug("found pid cookie");
      return Optional.of(SessionCookieCodec.decode(pidCookie.getValue()));
    }

    final Cookie appTokenCookie = findCookie(request, APP_TOKEN_COOKIE);
    if (appTokenCookie != null) {
      logger.debug("found access token in {} cookie", APP_TOKEN_COOKIE);
      return Optional.of(BearerTokenCodec.decode(appTokenCookie.getValue()));
    }

    logger.debug("no credential found in request");
    return Optional.empty();
  }

  // getParameter はフォーム本文を読み込んでしまうため、クエリ文字列だけを見る。
  // 値はエスケープされたまま返し、コーデック側でデコードする。
  private String queryParameter(HttpServletRequest request, String name) {
    final String queryString = request.getQueryString();
    if (isEmpty(queryString)) {
      return null;
    }
    return UriComponentsBuilder.newInstance()
        .query(queryString)
        .build()
        .getQueryParams()
        .getFirst(name);
  }

  private Cookie findCookie(HttpServletRequest request, String name) {
    final Cookie[] cookies = request.getCookies();
    if (cookies == null) {
      return null;
    }
    for (Cookie cookie : cookies) {
      if (name.equals(cookie.getName())) {
        return cookie;
      }
    }
    return null;
  }

  private boolean isEmpty(String value) {
    return value == null || value.isEmpty();
  }
}
