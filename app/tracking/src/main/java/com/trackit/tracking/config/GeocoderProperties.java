/*
 * どこで: Tracking 設定
 * 何を: ジオコーダ (Nominatim) 呼び出し設定を保持する
 * なぜ: 利用規約上の User-Agent と最小リクエスト間隔を運用で調整できるようにするため
 */
package com.trackit.tracking.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "geocoder")
public record GeocoderProperties(
    String baseUrl,
    String searchPath,
    String userAgent,
    Duration connectTimeout,
    Duration readTimeout,
    Duration minInterval) {

  public GeocoderProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://nominatim.openstreetmap.org" : baseUrl;
    searchPath = searchPath == null || searchPath.isBlank() ? "/search" : searchPath;
    userAgent = userAgent == null || userAgent.isBlank() ? "TrackIt Package Tracker" : userAgent;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
    // Nominatim の利用規約は 1 req/s 上限
    minInterval = minInterval == null ? Duration.ofSeconds(1) : minInterval;
  }
}
