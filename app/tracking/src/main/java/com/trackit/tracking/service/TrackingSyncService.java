/*
 * どこで: Tracking サービス層
 * 何を: 1 パッケージ分の取得→マージ→位置解決→永続化を統括する
 * なぜ: 何度実行しても重複を作らず summary が一意に定まる同期を提供するため
 */
package com.trackit.tracking.service;

import com.google.common.annotations.VisibleForTesting;
import com.trackit.common.concurrent.KeyedLocks;
import com.trackit.tracking.api.InvalidTrackingNumberException;
import com.trackit.tracking.api.PackageNotFoundException;
import com.trackit.tracking.api.ProviderUnavailableException;
import com.trackit.tracking.model.MergeResult;
import com.trackit.tracking.model.PackageRecord;
import com.trackit.tracking.model.SyncResult;
import com.trackit.tracking.model.TrackingEventRecord;
import com.trackit.tracking.model.TrackingFetchResult;
import com.trackit.tracking.repository.PackageRepository;
import com.trackit.tracking.repository.TrackingEventRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class TrackingSyncService {

  private static final Logger logger = LoggerFactory.getLogger(TrackingSyncService.class);

  private final PackageRepository packageRepository;
  private final TrackingEventRepository trackingEventRepository;
  private final CourierTrackingProvider trackingProvider;
  private final EventMerger eventMerger;
  private final GeocodingCache geocodingCache;
  private final PackageLockKeyGenerator lockKeyGenerator;
  private final TrackingMetrics metrics;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;
  private final KeyedLocks packageLocks = new KeyedLocks();

  /**
   * パッケージを 1 回同期する。新規イベント 0 件でも成功として返す。
   *
   * @throws PackageNotFoundException パッケージが存在しない
   * @throws InvalidTrackingNumberException プロバイダが追跡番号を認識しない
   * @throws ProviderUnavailableException プロバイダの一時障害
   */
  public SyncResult syncPackage(String packageId) {
    if (packageId == null || packageId.isBlank()) {
      throw new IllegalArgumentException("packageId is required");
    }
    try {
      final SyncResult result = packageLocks.withLock(packageId, () -> doSync(packageId));
      metrics.recordSync("success");
      metrics.recordSyncEvents(result.newEventCount(), result.droppedCount());
      logger.info(
          "package synced packageId={} newEvents={} dropped={} status={}",
          packageId,
          result.newEventCount(),
          result.droppedCount(),
          result.trackedPackage().lastStatus());
      return result;
    } catch (PackageNotFoundException ex) {
      metrics.recordSync("package_not_found");
      throw ex;
    } catch (InvalidTrackingNumberException ex) {
      metrics.recordSync("invalid_tracking_number");
      logger.warn("package sync rejected by provider packageId={}", packageId);
      throw ex;
    } catch (ProviderUnavailableException ex) {
      metrics.recordSync("provider_unavailable");
      logger.warn("package sync deferred packageId={} reason={}", packageId, ex.reason());
      throw ex;
    } catch (RuntimeException ex) {
      metrics.recordSync("error");
      throw ex;
    }
  }

  private SyncResult doSync(String packageId) {
    final PackageRecord trackedPackage =
        packageRepository
            .findById(packageId)
            .orElseThrow(() -> new PackageNotFoundException(packageId));

    // ネットワーク IO はトランザクションの外で行う
    final TrackingFetchResult fetched = fetch(trackedPackage);

    final Instant now = Instant.now(clock);
    final MergeResult preview =
        eventMerger.merge(
            packageId,
            trackingEventRepository.findByPackageIdInIngestOrder(packageId),
            fetched.events(),
            trackedPackage.deliveredAt(),
            now);
    resolveLocations(packageId, preview.newEvents());

    final List<TrackingEventRecord> inserted = new ArrayList<>();
    final MergeResult committed =
        transactionTemplate()
            .execute(
                status -> {
                  packageRepository.lockForSync(lockKeyGenerator.generate(packageId));
                  // ロック取得までに別インスタンスが commit している可能性があるため読み直す
                  final PackageRecord current =
                      packageRepository
                          .findById(packageId)
                          .orElseThrow(() -> new PackageNotFoundException(packageId));
                  final MergeResult merged =
                      eventMerger.merge(
                          packageId,
                          trackingEventRepository.findByPackageIdInIngestOrder(packageId),
                          fetched.events(),
                          current.deliveredAt(),
                          now);
                  for (TrackingEventRecord event : merged.newEvents()) {
                    if (trackingEventRepository.insertIfAbsent(event) == 1) {
                      inserted.add(event);
                    }
                  }
                  packageRepository.updateAfterSync(packageId, merged.summary(), fetched, now);
                  return merged;
                });
    if (committed == null) {
      throw new IllegalStateException("sync transaction returned no result packageId=" + packageId);
    }

    for (TrackingEventRecord event : inserted) {
      geocodingCache.incrementUsage(event.locationKey());
    }

    final PackageRecord updated =
        packageRepository
            .findById(packageId)
            .orElseThrow(() -> new PackageNotFoundException(packageId));
    return new SyncResult(updated, inserted.size(), committed.droppedCount());
  }

  private TrackingFetchResult fetch(PackageRecord trackedPackage) {
    final Instant startedAt = Instant.now(clock);
    try {
      return fetchWithFallback(trackedPackage);
    } catch (CourierTrackingException ex) {
      if (ex.reason() == CourierTrackingException.Reason.NOT_FOUND) {
        throw new InvalidTrackingNumberException(
            "tracking number not recognized: " + trackedPackage.trackingNumber(), ex);
      }
      throw new ProviderUnavailableException(ex);
    } finally {
      metrics.recordFetchDuration(Duration.between(startedAt, Instant.now(clock)));
    }
  }

  private TrackingFetchResult fetchWithFallback(PackageRecord trackedPackage) {
    final String trackerId = trackedPackage.providerTrackerId();
    if (trackerId != null && !trackerId.isBlank()) {
      try {
        return trackingProvider.fetchByTrackerId(trackerId);
      } catch (CourierTrackingException ex) {
        if (ex.reason() != CourierTrackingException.Reason.NOT_FOUND) {
          throw ex;
        }
        logger.info(
            "cached tracker not found, falling back to tracking number packageId={} trackerId={}",
            trackedPackage.packageId(),
            trackerId);
      }
    }
    return trackingProvider.fetch(trackedPackage.trackingNumber(), trackedPackage.courierHint());
  }

  private void resolveLocations(String packageId, List<TrackingEventRecord> newEvents) {
    final Set<String> seenKeys = new LinkedHashSet<>();
    for (TrackingEventRecord event : newEvents) {
      if (event.locationKey() == null || !seenKeys.add(event.locationKey())) {
        continue;
      }
      try {
        geocodingCache.resolve(event.location());
      } catch (RuntimeException ex) {
        // 位置解決の失敗は原因を問わず同期を止めない。表示時に遅延解決される。
        logger.warn(
            "location resolve failed during sync packageId={} key={}",
            packageId,
            event.locationKey(),
            ex);
      }
    }
  }

  @VisibleForTesting
  TransactionTemplate transactionTemplate() {
    return new TransactionTemplate(transactionManager);
  }
}
