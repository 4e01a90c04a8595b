/*
 * どこで: Tracking サービス層
 * 何を: Nominatim (OpenStreetMap) で住所文字列を座標へ変換する
 * なぜ: 利用規約の最小間隔を守りつつジオコーディングキャッシュへ結果を供給するため
 */
package com.trackit.tracking.service;

import com.google.common.util.concurrent.RateLimiter;
import com.trackit.tracking.config.GeocoderProperties;
import com.trackit.tracking.model.GeocodeResult;
import com.trackit.tracking.service.dto.NominatimPlace;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Service
public class NominatimGeocoder implements Geocoder {

  private static final Logger logger = LoggerFactory.getLogger(NominatimGeocoder.class);

  private final RestClient geocoderRestClient;
  private final GeocoderProperties properties;
  // null はスロットリング無効
  private final RateLimiter rateLimiter;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public NominatimGeocoder(RestClient geocoderRestClient, GeocoderProperties properties) {
    this.geocoderRestClient = geocoderRestClient;
    this.properties = properties;
    this.rateLimiter = createRateLimiter(properties.minInterval());
  }

  @Override
  public GeocodeResult geocode(String addressText) {
    if (addressText == null || addressText.isBlank()) {
      throw new GeocodingException(GeocodingException.Reason.NO_MATCH, "address is empty");
    }
    awaitTurn();
    final NominatimPlace[] places;
    try {
      places =
          geocoderRestClient
              .get()
              .uri(
                  uriBuilder ->
                      uriBuilder
                          .path(properties.searchPath())
                          .queryParam("q", addressText)
                          .queryParam("format", "json")
                          .queryParam("limit", 1)
                          .queryParam("addressdetails", 1)
                          .build())
              .retrieve()
              .body(NominatimPlace[].class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "nominatim search failed with http status={} statusText={}",
          ex.getStatusCode().value(),
          ex.getStatusText());
      throw new GeocodingException(
          GeocodingException.Reason.UNAVAILABLE, "nominatim request failed", ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("nominatim search timed out");
        throw new GeocodingException(
            GeocodingException.Reason.TIMEOUT, "nominatim request timeout", ex);
      }
      logger.warn("nominatim search connection failed", ex);
      throw new GeocodingException(
          GeocodingException.Reason.UNAVAILABLE, "nominatim connection failed", ex);
    } catch (RestClientException ex) {
      // 200 でも HTML や壊れた JSON が返ることがある
      logger.warn("nominatim search response unreadable", ex);
      throw new GeocodingException(
          GeocodingException.Reason.UNAVAILABLE, "nominatim response is unreadable", ex);
    }
    if (places == null || places.length == 0) {
      throw new GeocodingException(GeocodingException.Reason.NO_MATCH, "no match: " + addressText);
    }
    return toResult(places[0]);
  }

  private GeocodeResult toResult(NominatimPlace place) {
    if (place == null || place.lat() == null || place.lon() == null) {
      throw new GeocodingException(
          GeocodingException.Reason.UNAVAILABLE, "nominatim response is invalid");
    }
    try {
      final String countryCode =
          place.address() == null || place.address().countryCode() == null
              ? null
              : place.address().countryCode().toUpperCase(Locale.ROOT);
      return new GeocodeResult(
          Double.parseDouble(place.lat()),
          Double.parseDouble(place.lon()),
          place.displayName(),
          countryCode);
    } catch (NumberFormatException ex) {
      throw new GeocodingException(
          GeocodingException.Reason.UNAVAILABLE, "nominatim response is invalid", ex);
    }
  }

  // 全スレッド共通で minInterval あたり 1 リクエストに抑える
  private void awaitTurn() {
    if (rateLimiter != null) {
      rateLimiter.acquire();
    }
  }

  private static RateLimiter createRateLimiter(Duration minInterval) {
    if (minInterval == null || minInterval.isZero() || minInterval.isNegative()) {
      return null;
    }
    return RateLimiter.create(1_000_000_000d / minInterval.toNanos());
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
}
