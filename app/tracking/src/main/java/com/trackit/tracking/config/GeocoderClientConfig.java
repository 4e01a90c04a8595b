/*
 * どこで: Tracking 設定
 * 何を: ジオコーダ呼び出し専用 RestClient を提供する
 * なぜ: User-Agent 必須の外部 API をプロバイダ設定と混ぜないため
 */
package com.trackit.tracking.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class GeocoderClientConfig {

  @Bean
  RestClient geocoderRestClient(RestClient.Builder builder, GeocoderProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.USER_AGENT, properties.userAgent())
        .build();
  }
}
