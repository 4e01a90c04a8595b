/*
 * どこで: Tracking ドメインモデル
 * 何を: 地図表示向けのパッケージ位置情報一式を表す
 * なぜ: タイムラインと発着国・配達先を 1 回の参照で返すため
 */
package com.trackit.tracking.model;

import java.util.List;

public record PackageLocations(
    String packageId,
    String originCountry,
    String destinationCountry,
    List<LocatedEvent> events,
    DeliveryTarget deliveryTarget) {

  public PackageLocations {
    events = List.copyOf(events);
  }
}
