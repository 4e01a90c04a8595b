/*
 * どこで: Tracking ドメインモデル
 * 何を: packages テーブルのスナップショットを表す
 * なぜ: 同期エンジンが読む入力と書き戻す summary をひとまとめに扱うため
 */
package com.trackit.tracking.model;

import java.time.Instant;

public record PackageRecord(
    String packageId,
    String userId,
    String trackingNumber,
    String courierHint,
    String deliveryLocationId,
    String providerTrackerId,
    TrackingStatus lastStatus,
    String lastLocation,
    String lastLocationKey,
    Instant lastUpdated,
    Instant deliveredAt,
    String originCountry,
    String destinationCountry,
    Instant estimatedDelivery,
    String detectedCourier,
    boolean archived,
    Instant lastSyncedAt) {}
