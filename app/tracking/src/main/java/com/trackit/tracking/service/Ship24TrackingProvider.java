/*
 * どこで: Tracking サービス層
 * 何を: Ship24 API を呼び出して追跡イベントを取得する
 * なぜ: キャリア個別の差異をプロバイダ側に任せ、正規化済みイベントだけを扱うため
 */
package com.trackit.tracking.service;

import com.trackit.tracking.config.TrackingProviderProperties;
import com.trackit.tracking.model.RawTrackingEvent;
import com.trackit.tracking.model.TrackingFetchResult;
import com.trackit.tracking.service.dto.Ship24TrackRequest;
import com.trackit.tracking.service.dto.Ship24TrackingResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class Ship24TrackingProvider implements CourierTrackingProvider {

  private static final Logger logger = LoggerFactory.getLogger(Ship24TrackingProvider.class);

  private final RestClient trackingProviderRestClient;
  private final TrackingProviderProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public Ship24TrackingProvider(
      RestClient trackingProviderRestClient, TrackingProviderProperties properties) {
    this.trackingProviderRestClient = trackingProviderRestClient;
    this.properties = properties;
  }

  @Override
  public TrackingFetchResult fetch(String trackingNumber, String courierHint) {
    if (isBlank(trackingNumber)) {
      throw new IllegalArgumentException("trackingNumber is required");
    }
    final Ship24TrackRequest request =
        new Ship24TrackRequest(trackingNumber, isBlank(courierHint) ? null : List.of(courierHint));
    return execute(
        "track",
        () ->
            trackingProviderRestClient
                .post()
                .uri(properties.trackPath())
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(Ship24TrackingResponse.class));
  }

  @Override
  public TrackingFetchResult fetchByTrackerId(String trackerId) {
    if (isBlank(trackerId)) {
      throw new IllegalArgumentException("trackerId is required");
    }
    return execute(
        "results",
        () ->
            trackingProviderRestClient
                .get()
                .uri(properties.resultsPath(), trackerId)
                .retrieve()
                .body(Ship24TrackingResponse.class));
  }

  private TrackingFetchResult execute(String operation, ResponseCall call) {
    try {
      return toFetchResult(call.invoke());
    } catch (RestClientResponseException ex) {
      throw mapResponseException(operation, ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(operation, ex);
    } catch (CourierTrackingException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("ship24 {} response parse failed", operation, ex);
      throw new CourierTrackingException(
          CourierTrackingException.Reason.INVALID_RESPONSE, "ship24 response parse failed", ex);
    }
  }

  private TrackingFetchResult toFetchResult(Ship24TrackingResponse response) {
    if (response == null || response.data() == null || response.data().trackings() == null) {
      throw new CourierTrackingException(
          CourierTrackingException.Reason.INVALID_RESPONSE, "ship24 response is invalid");
    }
    if (response.data().trackings().isEmpty()) {
      throw new CourierTrackingException(
          CourierTrackingException.Reason.NOT_FOUND, "ship24 returned no trackings");
    }
    final Ship24TrackingResponse.Tracking tracking = response.data().trackings().get(0);
    final List<RawTrackingEvent> events =
        tracking.events() == null
            ? List.of()
            : tracking.events().stream().map(this::toRawEvent).toList();
    final Ship24TrackingResponse.Tracker tracker = tracking.tracker();
    final Ship24TrackingResponse.Shipment shipment = tracking.shipment();
    return new TrackingFetchResult(
        events,
        tracker == null || tracker.courierCode() == null || tracker.courierCode().isEmpty()
            ? null
            : tracker.courierCode().get(0),
        shipment == null ? null : shipment.originCountryCode(),
        shipment == null ? null : shipment.destinationCountryCode(),
        estimatedDelivery(shipment),
        tracker == null ? null : tracker.trackerId());
  }

  private RawTrackingEvent toRawEvent(Ship24TrackingResponse.Event event) {
    // statusMilestone が正規化済みの語彙。欠けている場合のみ自由文の status で判定させる。
    final String status = isBlank(event.statusMilestone()) ? event.status() : event.statusMilestone();
    return new RawTrackingEvent(
        status,
        event.location(),
        event.occurrenceDatetime(),
        event.status(),
        event.eventCode(),
        event.courierCode());
  }

  private Instant estimatedDelivery(Ship24TrackingResponse.Shipment shipment) {
    if (shipment == null || shipment.delivery() == null) {
      return null;
    }
    return EventMerger.parseTimestamp(shipment.delivery().estimatedDeliveryDate()).orElse(null);
  }

  private CourierTrackingException mapResponseException(
      String operation, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "ship24 {} failed with http status={} statusText={}",
        operation,
        status,
        ex.getStatusText());
    if (status == 429) {
      return new CourierTrackingException(
          CourierTrackingException.Reason.RATE_LIMITED, "ship24 rate limit exceeded", ex);
    }
    if (status == 404 || status == 400) {
      return new CourierTrackingException(
          CourierTrackingException.Reason.NOT_FOUND, "ship24 tracking not found", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new CourierTrackingException(
          CourierTrackingException.Reason.UNAVAILABLE, "ship24 server error", ex);
    }
    return new CourierTrackingException(
        CourierTrackingException.Reason.UNAVAILABLE, "ship24 request failed", ex);
  }

  private CourierTrackingException mapResourceException(
      String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("ship24 {} timed out", operation);
      return new CourierTrackingException(
          CourierTrackingException.Reason.TIMEOUT, "ship24 request timeout", ex);
    }
    logger.warn("ship24 {} connection failed", operation, ex);
    return new CourierTrackingException(
        CourierTrackingException.Reason.UNAVAILABLE, "ship24 connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  @FunctionalInterface
  private interface ResponseCall {
    Ship24TrackingResponse invoke();
  }
}
