/*
 * どこで: TrackingSyncService のユニットテスト
 * 何を: 取得→マージ→永続化の流れ、tracker ID フォールバック、失敗の振り分けを検証する
 * なぜ: 同期が一時障害と恒久エラーを正しく区別し、重複を作らないことを保証するため
 */
package com.trackit.tracking.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.trackit.tracking.api.InvalidTrackingNumberException;
import com.trackit.tracking.api.PackageNotFoundException;
import com.trackit.tracking.api.ProviderUnavailableException;
import com.trackit.tracking.model.PackageRecord;
import com.trackit.tracking.model.PackageSummary;
import com.trackit.tracking.model.RawTrackingEvent;
import com.trackit.tracking.model.SyncResult;
import com.trackit.tracking.model.TrackingFetchResult;
import com.trackit.tracking.model.TrackingStatus;
import com.trackit.tracking.repository.PackageRepository;
import com.trackit.tracking.repository.TrackingEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

@ExtendWith(MockitoExtension.class)
class TrackingSyncServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final String PACKAGE_ID = "pkg-1";
  private static final String TRACKING_NUMBER = "JD014600006281230704";

  @Mock private PackageRepository packageRepository;
  @Mock private TrackingEventRepository trackingEventRepository;
  @Mock private CourierTrackingProvider trackingProvider;
  @Mock private GeocodingCache geocodingCache;

  private SimpleMeterRegistry registry;
  private PackageLockKeyGenerator lockKeyGenerator;
  private TrackingSyncService service;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    lockKeyGenerator = new PackageLockKeyGenerator();
    service =
        new TrackingSyncService(
            packageRepository,
            trackingEventRepository,
            trackingProvider,
            new EventMerger(new LocationNormalizer()),
            geocodingCache,
            lockKeyGenerator,
            new TrackingMetrics(registry),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC),
            new NoOpTransactionManager());
  }

  @Test
  void firstSyncPersistsEventsAndSummary() {
    final PackageRecord trackedPackage = trackedPackage(null);
    when(packageRepository.findById(PACKAGE_ID)).thenReturn(Optional.of(trackedPackage));
    final TrackingFetchResult fetched =
        fetchResult(
            "tracker-1",
            event("info_received", "Leeds DC", "2026-02-27T08:00:00Z", "E1"),
            event("in_transit", "York", "2026-02-28T08:00:00Z", "E2"),
            event("in_transit", "leeds dc", "2026-02-28T09:00:00Z", "E3"));
    when(trackingProvider.fetch(TRACKING_NUMBER, "royal-mail")).thenReturn(fetched);
    when(trackingEventRepository.findByPackageIdInIngestOrder(PACKAGE_ID)).thenReturn(List.of());
    when(trackingEventRepository.insertIfAbsent(any())).thenReturn(1);

    final SyncResult result = service.syncPackage(PACKAGE_ID);

    assertThat(result.newEventCount()).isEqualTo(3);
    assertThat(result.droppedCount()).isZero();
    verify(packageRepository).lockForSync(lockKeyGenerator.generate(PACKAGE_ID));
    final ArgumentCaptor<PackageSummary> summary = ArgumentCaptor.forClass(PackageSummary.class);
    verify(packageRepository)
        .updateAfterSync(eq(PACKAGE_ID), summary.capture(), eq(fetched), eq(FIXED_NOW));
    assertThat(summary.getValue().lastStatus()).isEqualTo(TrackingStatus.IN_TRANSIT);
    assertThat(summary.getValue().lastLocationKey()).isEqualTo("leeds dc");
    assertThat(summary.getValue().lastUpdated()).isEqualTo(Instant.parse("2026-02-28T09:00:00Z"));
    // 同じキーの位置解決は 1 回だけ
    verify(geocodingCache, times(1)).resolve("Leeds DC");
    verify(geocodingCache, times(1)).resolve("York");
    verify(geocodingCache, never()).resolve("leeds dc");
    verify(geocodingCache, times(2)).incrementUsage("leeds dc");
    verify(geocodingCache, times(1)).incrementUsage("york");
    assertThat(registry.get("tracking.sync.total").tag("result", "success").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void cachedTrackerIdIsUsedFirst() {
    when(packageRepository.findById(PACKAGE_ID))
        .thenReturn(Optional.of(trackedPackage("tracker-1")));
    when(trackingProvider.fetchByTrackerId("tracker-1")).thenReturn(fetchResult("tracker-1"));
    when(trackingEventRepository.findByPackageIdInIngestOrder(PACKAGE_ID)).thenReturn(List.of());

    final SyncResult result = service.syncPackage(PACKAGE_ID);

    assertThat(result.newEventCount()).isZero();
    verify(trackingProvider, never()).fetch(any(), any());
  }

  @Test
  void trackerNotFoundFallsBackToTrackingNumber() {
    when(packageRepository.findById(PACKAGE_ID))
        .thenReturn(Optional.of(trackedPackage("stale-tracker")));
    when(trackingProvider.fetchByTrackerId("stale-tracker"))
        .thenThrow(
            new CourierTrackingException(CourierTrackingException.Reason.NOT_FOUND, "gone"));
    final TrackingFetchResult fetched =
        fetchResult("tracker-2", event("in_transit", "York", "2026-02-28T08:00:00Z", "E2"));
    when(trackingProvider.fetch(TRACKING_NUMBER, "royal-mail")).thenReturn(fetched);
    when(trackingEventRepository.findByPackageIdInIngestOrder(PACKAGE_ID)).thenReturn(List.of());
    when(trackingEventRepository.insertIfAbsent(any())).thenReturn(1);

    final SyncResult result = service.syncPackage(PACKAGE_ID);

    assertThat(result.newEventCount()).isEqualTo(1);
    verify(packageRepository).updateAfterSync(eq(PACKAGE_ID), any(), eq(fetched), eq(FIXED_NOW));
  }

  @Test
  void unknownTrackingNumberIsPermanentFailure() {
    when(packageRepository.findById(PACKAGE_ID)).thenReturn(Optional.of(trackedPackage(null)));
    when(trackingProvider.fetch(TRACKING_NUMBER, "royal-mail"))
        .thenThrow(
            new CourierTrackingException(CourierTrackingException.Reason.NOT_FOUND, "unknown"));

    assertThatThrownBy(() -> service.syncPackage(PACKAGE_ID))
        .isInstanceOf(InvalidTrackingNumberException.class);
    verify(packageRepository, never()).updateAfterSync(any(), any(), any(), any());
    assertThat(
            registry
                .get("tracking.sync.total")
                .tag("result", "invalid_tracking_number")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void rateLimitIsTransientFailureAndWritesNothing() {
    when(packageRepository.findById(PACKAGE_ID))
        .thenReturn(Optional.of(trackedPackage("tracker-1")));
    when(trackingProvider.fetchByTrackerId("tracker-1"))
        .thenThrow(
            new CourierTrackingException(CourierTrackingException.Reason.RATE_LIMITED, "slow down"));

    assertThatThrownBy(() -> service.syncPackage(PACKAGE_ID))
        .isInstanceOf(ProviderUnavailableException.class)
        .extracting(ex -> ((ProviderUnavailableException) ex).reason())
        .isEqualTo(CourierTrackingException.Reason.RATE_LIMITED);
    verify(trackingProvider, never()).fetch(any(), any());
    verify(trackingEventRepository, never()).insertIfAbsent(any());
    verify(packageRepository, never()).lockForSync(anyLong());
  }

  @Test
  void unknownPackageIsRejected() {
    when(packageRepository.findById("missing")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.syncPackage("missing"))
        .isInstanceOf(PackageNotFoundException.class);
  }

  @Test
  void eventAlreadyCommittedElsewhereIsNotCounted() {
    when(packageRepository.findById(PACKAGE_ID)).thenReturn(Optional.of(trackedPackage(null)));
    when(trackingProvider.fetch(TRACKING_NUMBER, "royal-mail"))
        .thenReturn(
            fetchResult("tracker-1", event("in_transit", "York", "2026-02-28T08:00:00Z", "E2")));
    when(trackingEventRepository.findByPackageIdInIngestOrder(PACKAGE_ID)).thenReturn(List.of());
    when(trackingEventRepository.insertIfAbsent(any())).thenReturn(0);

    final SyncResult result = service.syncPackage(PACKAGE_ID);

    assertThat(result.newEventCount()).isZero();
    verify(geocodingCache, never()).incrementUsage(any());
  }

  @Test
  void locationResolveFailureDoesNotFailSync() {
    when(packageRepository.findById(PACKAGE_ID)).thenReturn(Optional.of(trackedPackage(null)));
    when(trackingProvider.fetch(TRACKING_NUMBER, "royal-mail"))
        .thenReturn(
            fetchResult("tracker-1", event("in_transit", "York", "2026-02-28T08:00:00Z", "E2")));
    when(trackingEventRepository.findByPackageIdInIngestOrder(PACKAGE_ID)).thenReturn(List.of());
    when(trackingEventRepository.insertIfAbsent(any())).thenReturn(1);
    when(geocodingCache.resolve("York")).thenThrow(new DataAccessResourceFailureException("down"));

    final SyncResult result = service.syncPackage(PACKAGE_ID);

    assertThat(result.newEventCount()).isEqualTo(1);
  }

  @Test
  void unexpectedGeocodingErrorDoesNotFailSync() {
    when(packageRepository.findById(PACKAGE_ID)).thenReturn(Optional.of(trackedPackage(null)));
    when(trackingProvider.fetch(TRACKING_NUMBER, "royal-mail"))
        .thenReturn(
            fetchResult(
                "tracker-1",
                event("in_transit", "York", "2026-02-28T08:00:00Z", "E2"),
                event("in_transit", "Leeds", "2026-02-28T10:00:00Z", "E3")));
    when(trackingEventRepository.findByPackageIdInIngestOrder(PACKAGE_ID)).thenReturn(List.of());
    when(trackingEventRepository.insertIfAbsent(any())).thenReturn(1);
    when(geocodingCache.resolve("York")).thenThrow(new IllegalStateException("unreadable body"));

    final SyncResult result = service.syncPackage(PACKAGE_ID);

    assertThat(result.newEventCount()).isEqualTo(2);
    verify(geocodingCache).resolve("Leeds");
  }

  @Test
  void malformedTimestampsAreReportedAsDropped() {
    when(packageRepository.findById(PACKAGE_ID)).thenReturn(Optional.of(trackedPackage(null)));
    when(trackingProvider.fetch(TRACKING_NUMBER, "royal-mail"))
        .thenReturn(
            fetchResult(
                "tracker-1",
                event("in_transit", null, "yesterday", "E1"),
                event("in_transit", null, "2026-02-28T08:00:00Z", "E2")));
    when(trackingEventRepository.findByPackageIdInIngestOrder(PACKAGE_ID)).thenReturn(List.of());
    when(trackingEventRepository.insertIfAbsent(any())).thenReturn(1);

    final SyncResult result = service.syncPackage(PACKAGE_ID);

    assertThat(result.newEventCount()).isEqualTo(1);
    assertThat(result.droppedCount()).isEqualTo(1);
    verify(geocodingCache, never()).resolve(any());
  }

  private static PackageRecord trackedPackage(String trackerId) {
    return new PackageRecord(
        PACKAGE_ID,
        "user-1",
        TRACKING_NUMBER,
        "royal-mail",
        null,
        trackerId,
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        false,
        null);
  }

  private static TrackingFetchResult fetchResult(String trackerId, RawTrackingEvent... events) {
    return new TrackingFetchResult(List.of(events), "royal-mail", "GB", "GB", null, trackerId);
  }

  private static RawTrackingEvent event(
      String status, String location, String timestamp, String code) {
    return new RawTrackingEvent(status, location, timestamp, status, code, "royal-mail");
  }

  private static final class NoOpTransactionManager implements PlatformTransactionManager {
    @Override
    public TransactionStatus getTransaction(TransactionDefinition definition) {
      return new SimpleTransactionStatus();
    }

    @Override
    public void commit(TransactionStatus status) {}

    @Override
    public void rollback(TransactionStatus status) {}
  }
}
