/*
 * どこで: Tracking API
 * 何を: 地図表示向けの位置タイムラインのレスポンスを表す
 * なぜ: API 仕様に沿った JSON を返すため
 */
package com.trackit.tracking.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.trackit.tracking.model.DeliveryTarget;
import com.trackit.tracking.model.LocatedEvent;
import com.trackit.tracking.model.PackageLocations;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PackageLocationsResponse(
    String packageId,
    String originCountry,
    String destinationCountry,
    List<Event> events,
    DeliveryLocation deliveryLocation) {

  public static PackageLocationsResponse from(PackageLocations locations) {
    return new PackageLocationsResponse(
        locations.packageId(),
        locations.originCountry(),
        locations.destinationCountry(),
        locations.events().stream().map(Event::from).toList(),
        DeliveryLocation.from(locations.deliveryTarget()));
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Event(
      String status,
      String location,
      Instant timestamp,
      String description,
      Double latitude,
      Double longitude,
      String displayName) {

    static Event from(LocatedEvent event) {
      return new Event(
          event.status().name(),
          event.location(),
          event.timestamp(),
          event.description(),
          event.latitude(),
          event.longitude(),
          event.displayName());
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record DeliveryLocation(
      String deliveryLocationId,
      String name,
      String address,
      Double latitude,
      Double longitude,
      Double distanceKm) {

    static DeliveryLocation from(DeliveryTarget target) {
      if (target == null) {
        return null;
      }
      return new DeliveryLocation(
          target.deliveryLocationId(),
          target.name(),
          target.address(),
          target.latitude(),
          target.longitude(),
          target.distanceKm());
    }
  }
}
