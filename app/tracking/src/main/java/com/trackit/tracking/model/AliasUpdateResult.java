package com.trackit.tracking.model;

public record AliasUpdateResult(boolean geocoded, LocationEntry entry) {}
