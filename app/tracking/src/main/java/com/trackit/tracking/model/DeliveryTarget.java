package com.trackit.tracking.model;

public record DeliveryTarget(
    String deliveryLocationId,
    String name,
    String address,
    Double latitude,
    Double longitude,
    Double distanceKm) {}
