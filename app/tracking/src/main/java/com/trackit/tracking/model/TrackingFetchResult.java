/*
 * どこで: Tracking 外部連携モデル
 * 何を: CourierTrackingProvider.fetch の結果を表す
 * なぜ: プロバイダの wire format をサービス層へ漏らさないため
 */
package com.trackit.tracking.model;

import java.time.Instant;
import java.util.List;

public record TrackingFetchResult(
    List<RawTrackingEvent> events,
    String detectedCourier,
    String originCountry,
    String destinationCountry,
    Instant estimatedDelivery,
    String providerTrackerId) {

  public TrackingFetchResult {
    events = events == null ? List.of() : List.copyOf(events);
  }
}
