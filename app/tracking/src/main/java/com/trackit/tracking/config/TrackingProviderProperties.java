/*
 * どこで: Tracking 設定
 * 何を: 追跡プロバイダ (Ship24) 呼び出し設定を保持する
 * なぜ: URL/パス/API キー/タイムアウトを外部化するため
 */
package com.trackit.tracking.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tracking.provider")
public record TrackingProviderProperties(
    String baseUrl,
    String apiKey,
    String trackPath,
    String resultsPath,
    Duration connectTimeout,
    Duration readTimeout) {

  public TrackingProviderProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.ship24.com" : baseUrl;
    trackPath = trackPath == null || trackPath.isBlank() ? "/public/v1/trackers/track" : trackPath;
    resultsPath =
        resultsPath == null || resultsPath.isBlank()
            ? "/public/v1/trackers/{trackerId}/results"
            : resultsPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
  }
}
