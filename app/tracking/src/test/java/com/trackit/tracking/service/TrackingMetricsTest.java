package com.trackit.tracking.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class TrackingMetricsTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final TrackingMetrics metrics = new TrackingMetrics(registry);

  @Test
  void syncCountersAreTaggedByResult() {
    metrics.recordSync("success");
    metrics.recordSync("success");
    metrics.recordSync("provider_unavailable");

    assertThat(registry.get("tracking.sync.total").tag("result", "success").counter().count())
        .isEqualTo(2.0d);
    assertThat(
            registry
                .get("tracking.sync.total")
                .tag("result", "provider_unavailable")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void droppedEventsOnlyCountedWhenPresent() {
    metrics.recordSyncEvents(3, 0);
    metrics.recordSyncEvents(0, 2);

    assertThat(registry.get("tracking.sync.new.events").summary().count()).isEqualTo(2L);
    assertThat(registry.get("tracking.sync.new.events").summary().totalAmount()).isEqualTo(3.0d);
    assertThat(registry.get("tracking.sync.dropped.events").counter().count()).isEqualTo(2.0d);
  }

  @Test
  void negativeFetchDurationIsIgnored() {
    metrics.recordFetchDuration(Duration.ofMillis(120));
    metrics.recordFetchDuration(Duration.ofMillis(-5));
    metrics.recordFetchDuration(null);

    assertThat(registry.get("tracking.provider.fetch.duration").timer().count()).isEqualTo(1L);
  }

  @Test
  void geocodeOutcomesAreTagged() {
    metrics.recordGeocode("success");
    metrics.recordGeocode("no_match");

    assertThat(registry.get("tracking.geocode.total").tag("outcome", "no_match").counter().count())
        .isEqualTo(1.0d);
  }
}
