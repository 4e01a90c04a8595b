package com.trackit.tracking.api;

public class LocationNotFoundException extends RuntimeException {

  public LocationNotFoundException(String locationKey) {
    super("location not found: " + locationKey);
  }
}
