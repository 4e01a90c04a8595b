package com.trackit.tracking.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

class TrackingStatusTest {

  @ParameterizedTest
  @CsvSource({
    "delivered, DELIVERED",
    "Delivered to neighbour, DELIVERED",
    "out_for_delivery, OUT_FOR_DELIVERY",
    "Out-For-Delivery, OUT_FOR_DELIVERY",
    "in_transit, IN_TRANSIT",
    "In Transit, IN_TRANSIT",
    "exception, EXCEPTION",
    "failed_attempt, EXCEPTION",
    "Returned to sender, EXCEPTION",
    "pending, PENDING",
    "info_received, PENDING",
    "available_for_pickup, UNKNOWN",
    "something new, UNKNOWN"
  })
  void mapsProviderVocabulary(String providerStatus, TrackingStatus expected) {
    assertThat(TrackingStatus.fromProvider(providerStatus)).isEqualTo(expected);
  }

  @ParameterizedTest
  @NullAndEmptySource
  void blankIsUnknown(String providerStatus) {
    assertThat(TrackingStatus.fromProvider(providerStatus)).isEqualTo(TrackingStatus.UNKNOWN);
  }
}
