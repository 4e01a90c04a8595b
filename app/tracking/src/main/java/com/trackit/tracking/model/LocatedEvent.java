package com.trackit.tracking.model;

import java.time.Instant;

/** タイムライン表示用のイベント。座標はキャッシュに成功エントリがある場合のみ埋まる。 */
public record LocatedEvent(
    TrackingStatus status,
    String location,
    String locationKey,
    Instant timestamp,
    String description,
    Double latitude,
    Double longitude,
    String displayName) {

  public boolean hasCoordinates() {
    return latitude != null && longitude != null;
  }
}
