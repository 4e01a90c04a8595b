/*
 * どこで: Tracking 設定
 * 何を: 追跡プロバイダ呼び出し専用 RestClient を提供する
 * なぜ: 認証ヘッダとタイムアウトを外部サービスごとに分離するため
 */
package com.trackit.tracking.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class TrackingProviderClientConfig {

  @Bean
  RestClient trackingProviderRestClient(
      RestClient.Builder builder, TrackingProviderProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    final RestClient.Builder configured =
        builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory);
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey());
    }
    return configured.build();
  }
}
