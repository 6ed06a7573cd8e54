/*
 * どこで: Conversion Relay Web 設定
 * 何を: RequestMdcInterceptor を全リクエストへ適用する
 * なぜ: 受信/cron/内部 API のログへ request_id と shop_domain を載せるため
 */
package com.example.conversion.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor);
  }
}
