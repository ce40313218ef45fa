package com.example.identity_gateway.config;

import com.example.identity_gateway.model.ResolutionOutcome;
import com.example.identity_gateway.service.IdentityResolutionService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * リクエストごとに本人解決を行い、解決できた userLogin をリクエスト属性とヘッダに載せて下流へ渡す。
 *
 * <p>解決に失敗してもリクエストは拒否せず、元のリクエストのまま次へ進める。
 */
public class UserLoginResolutionFilter extends OncePerRequestFilter {

  public static final String CONTEXT_KEY = "userLogin";
  public static final String USER_LOGIN_HEADER = "x-user-login";
  static final String USER_LOGIN_MDC_KEY = "user_login";

  private static final Logger logger = LoggerFactory.getLogger(UserLoginResolutionFilter.class);

  private final IdentityResolutionService identityResolutionService;
  private final boolean enabled;

  public UserLoginResolutionFilter(
      IdentityResolutionService identityResolutionService, boolean enabled) {
    this.identityResolutionService = identityResolutionService;
    this.enabled = enabled;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !enabled;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final ResolutionOutcome outcome = resolve(request);
    if (!outcome.isResolved()) {
      filterChain.doFilter(request, response);
      return;
    }
    logger.debug("setting request attribute key={}", CONTEXT_KEY);
    request.setAttribute(CONTEXT_KEY, outcome.userLogin());
    MDC.put(USER_LOGIN_MDC_KEY, outcome.userLogin());
    try {
      filterChain.doFilter(
          new HeaderAddingRequestWrapper(request, USER_LOGIN_HEADER, outcome.userLogin()),
          response);
    } finally {
      MDC.remove(USER_LOGIN_MDC_KEY);
    }
  }

  private ResolutionOutcome resolve(HttpServletRequest request) {
    try {
      return identityResolutionService.resolve(request);
    } catch (RuntimeException ex) {
      logger.warn("unexpected error during identity resolution, passing request through", ex);
      return ResolutionOutcome.unauthenticated();
    }
  }
}
