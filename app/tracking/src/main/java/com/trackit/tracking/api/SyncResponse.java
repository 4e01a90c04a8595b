/*
 * どこで: Tracking API
 * 何を: 同期結果 (パッケージ summary と件数) のレスポンスを表す
 * なぜ: API 仕様に沿った JSON を返すため
 */
package com.trackit.tracking.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.trackit.tracking.model.PackageRecord;
import com.trackit.tracking.model.SyncResult;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SyncResponse(
    String packageId,
    String trackingNumber,
    String lastStatus,
    String lastLocation,
    Instant lastUpdated,
    Instant deliveredAt,
    Instant estimatedDelivery,
    String detectedCourier,
    String originCountry,
    String destinationCountry,
    Instant lastSyncedAt,
    int newEventCount,
    int droppedEventCount) {

  public static SyncResponse from(SyncResult result) {
    final PackageRecord trackedPackage = result.trackedPackage();
    return new SyncResponse(
        trackedPackage.packageId(),
        trackedPackage.trackingNumber(),
        trackedPackage.lastStatus() == null ? null : trackedPackage.lastStatus().name(),
        trackedPackage.lastLocation(),
        trackedPackage.lastUpdated(),
        trackedPackage.deliveredAt(),
        trackedPackage.estimatedDelivery(),
        trackedPackage.detectedCourier(),
        trackedPackage.originCountry(),
        trackedPackage.destinationCountry(),
        trackedPackage.lastSyncedAt(),
        result.newEventCount(),
        result.droppedCount());
  }
}
