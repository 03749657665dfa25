/*
 * どこで: iTop 通知アプリ設定
 * 何を: iTop REST 呼び出し専用 RestClient を提供する
 * なぜ: baseUrl/共通ヘッダ/タイムアウトの設定責務をクライアントから分離するため
 */
package com.example.itop_notification.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ItopClientConfig {

  static final String USER_AGENT = "itop-notification";

  @Bean
  RestClient itopRestClient(RestClient.Builder builder, ItopClientProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
        .build();
  }
}
