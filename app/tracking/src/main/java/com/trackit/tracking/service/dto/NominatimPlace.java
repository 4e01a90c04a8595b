package com.trackit.tracking.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Nominatim /search の 1 件分。lat/lon は文字列で返る。 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NominatimPlace(
    String lat, String lon, @JsonProperty("display_name") String displayName, Address address) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Address(@JsonProperty("country_code") String countryCode) {}
}
