/*
 * どこで: Conversion Relay 設定
 * 何を: 広告プラットフォーム送信用の RestClient を提供する
 * なぜ: すべての外部呼び出しを同じタイムアウトで打ち切るため
 */
package com.example.conversion.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class DispatchClientConfig {

  @Bean
  RestClient platformRestClient(RestClient.Builder builder, DispatchProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.timeout());
    requestFactory.setReadTimeout(properties.timeout());
    return builder.requestFactory(requestFactory).build();
  }
}
