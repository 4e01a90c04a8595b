/*
 * どこで: Tracking サービス層
 * 何を: 同期とジオコーディングのアプリ固有メトリクス記録を集約する
 * なぜ: プロバイダ障害率やジオコーダ失敗率を運用で継続監視できるようにするため
 */
package com.trackit.tracking.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class TrackingMetrics {

  private static final String METRIC_SYNC_TOTAL = "tracking.sync.total";
  private static final String METRIC_SYNC_NEW_EVENTS = "tracking.sync.new.events";
  private static final String METRIC_SYNC_DROPPED_EVENTS = "tracking.sync.dropped.events";
  private static final String METRIC_PROVIDER_FETCH = "tracking.provider.fetch.duration";
  private static final String METRIC_GEOCODE_TOTAL = "tracking.geocode.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> syncCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> geocodeCounters = new ConcurrentHashMap<>();
  private final DistributionSummary newEventsSummary;
  private final Counter droppedEventsCounter;
  private final Timer fetchTimer;

  public TrackingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.newEventsSummary =
        DistributionSummary.builder(METRIC_SYNC_NEW_EVENTS)
            .description("New tracking events persisted per successful sync")
            .register(meterRegistry);
    this.droppedEventsCounter =
        Counter.builder(METRIC_SYNC_DROPPED_EVENTS)
            .description("Fetched tracking events dropped because of malformed timestamps")
            .register(meterRegistry);
    this.fetchTimer =
        Timer.builder(METRIC_PROVIDER_FETCH)
            .description("Tracking provider fetch latency")
            .register(meterRegistry);
  }

  public void recordSync(String result) {
    syncCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_SYNC_TOTAL)
                    .description("Package sync executions")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordSyncEvents(int newEvents, int droppedEvents) {
    newEventsSummary.record(Math.max(newEvents, 0));
    if (droppedEvents > 0) {
      droppedEventsCounter.increment(droppedEvents);
    }
  }

  public void recordFetchDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    fetchTimer.record(duration);
  }

  public void recordGeocode(String outcome) {
    geocodeCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_GEOCODE_TOTAL)
                    .description("Geocoder lookups by outcome")
                    .tags(Tags.of("outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }
}
