/*
 * どこで: Tracking 定期リフレッシュワーカー
 * 何を: 未配達パッケージを定期的に同期する
 * なぜ: 利用者の操作が無くても追跡状況を最新に保つため
 */
package com.trackit.tracking.service;

import com.trackit.common.TraceIds;
import com.trackit.tracking.config.TrackingRefreshProperties;
import com.trackit.tracking.repository.PackageRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "tracking.refresh.enabled", havingValue = "true")
@RequiredArgsConstructor
public class TrackingRefreshWorker {

  private static final Logger logger = LoggerFactory.getLogger(TrackingRefreshWorker.class);

  private final PackageRepository packageRepository;
  private final TrackingSyncService trackingSyncService;
  private final TrackingRefreshProperties properties;

  @Scheduled(fixedDelayString = "${tracking.refresh.interval:30m}")
  public void run() {
    MDC.put("trace_id", TraceIds.newTraceId());
    try {
      final List<String> packageIds = packageRepository.findIdsDueForRefresh(properties.batchSize());
      int succeeded = 0;
      for (String packageId : packageIds) {
        // 1 件の失敗で残りを止めない。再試行は次回の実行に任せる。
        try {
          trackingSyncService.syncPackage(packageId);
          succeeded++;
        } catch (RuntimeException ex) {
          logger.warn("scheduled sync failed packageId={} error={}", packageId, ex.getMessage());
        }
      }
      logger.info("scheduled refresh finished total={} succeeded={}", packageIds.size(), succeeded);
    } finally {
      MDC.remove("trace_id");
    }
  }
}
