/*
 * どこで: identity-gateway Web 設定
 * 何を: 本人解決フィルタを全リクエストへ登録する
 * なぜ: 下流のハンドラより前に userLogin を確定させるため
 */
package com.example.identity_gateway.config;

import com.example.identity_gateway.service.IdentityResolutionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

@Configuration
@EnableConfigurationProperties(IdentityResolutionProperties.class)
public class IdentityResolutionFilterConfig {

  private static final Logger logger =
      LoggerFactory.getLogger(IdentityResolutionFilterConfig.class);

  @Bean
  FilterRegistrationBean<UserLoginResolutionFilter> userLoginResolutionFilter(
      IdentityResolutionService identityResolutionService,
      IdentityResolutionProperties properties) {
    final boolean enabled = Boolean.TRUE.equals(properties.enabled());
    if (!enabled) {
      logger.warn("identity resolution is disabled, requests pass through without user login");
    }
    final FilterRegistrationBean<UserLoginResolutionFilter> registration =
        new FilterRegistrationBean<>(
            new UserLoginResolutionFilter(identityResolutionService, enabled));
    registration.addUrlPatterns("/*");
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
    return registration;
  }
}
