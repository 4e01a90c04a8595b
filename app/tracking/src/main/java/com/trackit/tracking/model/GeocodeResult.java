package com.trackit.tracking.model;

public record GeocodeResult(double latitude, double longitude, String displayName, String countryCode) {}
