/*
 * どこで: Tracking サービス層 DTO (Ship24)
 * 何を: /trackers/track と /trackers/{id}/results 共通のレスポンス形を定義する
 * なぜ: 必要な項目だけを型付きで取り出し、未知の項目の追加に影響されないようにするため
 */
package com.trackit.tracking.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Ship24TrackingResponse(Data data) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Data(List<Tracking> trackings) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Tracking(Tracker tracker, Shipment shipment, List<Event> events) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Tracker(String trackerId, String trackingNumber, List<String> courierCode) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Shipment(
      String statusMilestone,
      String originCountryCode,
      String destinationCountryCode,
      Delivery delivery) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Delivery(String estimatedDeliveryDate) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Event(
      String occurrenceDatetime,
      String location,
      String status,
      String statusMilestone,
      String eventCode,
      String courierCode) {}
}
