package com.trackit.tracking.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.trackit.tracking.model.AliasUpdateResult;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AliasUpdateResponse(boolean geocoded, LocationEntryResponse location) {

  public static AliasUpdateResponse from(AliasUpdateResult result) {
    return new AliasUpdateResponse(result.geocoded(), LocationEntryResponse.from(result.entry()));
  }
}
