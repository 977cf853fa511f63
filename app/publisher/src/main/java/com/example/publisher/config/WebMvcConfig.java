/*
 * どこで: Publisher Web 設定
 * 何を: /v1 配下の API にだけ RequestMdcInterceptor を掛ける
 */
package com.example.publisher.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  static final String API_PATH_PATTERN = "/v1/**";

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    // actuator のプローブはログ量が多いので対象外
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns(API_PATH_PATTERN);
  }
}
