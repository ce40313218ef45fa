package com.example.identity_gateway.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(ProfileServiceProperties.class)
public class ProfileServiceClientConfig {

  @Bean
  RestClient profileServiceRestClient(
      RestClient.Builder builder, ProfileServiceProperties properties) {
    // profile service 呼び出し専用 RestClient。タイムアウトで失敗させ fail-open に倒す。
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
