/*
 * どこで: Tracking ドメインモデル
 * 何を: tracking_events テーブルの 1 行 (永続化後は不変) を表す
 * なぜ: 重複判定とタイムライン表示で同じ形を使うため
 */
package com.trackit.tracking.model;

import java.time.Instant;
import java.util.UUID;

public record TrackingEventRecord(
    UUID eventId,
    String packageId,
    TrackingStatus status,
    String location,
    String locationKey,
    Instant timestamp,
    String description,
    String courierEventCode,
    String courierCode,
    Instant createdAt) {

  public EventNaturalKey naturalKey() {
    return new EventNaturalKey(timestamp, status, courierEventCode);
  }
}
