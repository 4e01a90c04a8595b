package com.trackit.tracking.model;

import java.time.Instant;

/** (timestamp, status, courier_event_code)。イベントコード欠落は空文字として扱う。 */
public record EventNaturalKey(Instant timestamp, TrackingStatus status, String courierEventCode) {

  public EventNaturalKey {
    courierEventCode = courierEventCode == null ? "" : courierEventCode;
  }
}
