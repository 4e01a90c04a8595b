package com.trackit.tracking.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** 定期リフレッシュの設定。enabled=false の間はワーカー自体を生成しない。 */
@ConfigurationProperties(prefix = "tracking.refresh")
public record TrackingRefreshProperties(boolean enabled, Duration interval, int batchSize) {

  public TrackingRefreshProperties {
    interval = interval == null ? Duration.ofMinutes(30) : interval;
    batchSize = batchSize <= 0 ? 50 : batchSize;
  }
}
