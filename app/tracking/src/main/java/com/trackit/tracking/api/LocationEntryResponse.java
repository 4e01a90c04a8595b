package com.trackit.tracking.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.trackit.tracking.model.LocationEntry;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LocationEntryResponse(
    String locationKey,
    String locationString,
    String alias,
    Double latitude,
    Double longitude,
    String displayName,
    String countryCode,
    Instant geocodedAt,
    boolean geocodingFailed,
    long usageCount) {

  public static LocationEntryResponse from(LocationEntry entry) {
    return new LocationEntryResponse(
        entry.locationKey(),
        entry.locationString(),
        entry.alias(),
        entry.latitude(),
        entry.longitude(),
        entry.displayName(),
        entry.countryCode(),
        entry.geocodedAt(),
        entry.geocodingFailed(),
        entry.usageCount());
  }
}
