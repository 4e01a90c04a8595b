/*
 * どこで: Tracking ドメインモデル
 * 何を: マージ結果から導出される packages の summary 列を表す
 * なぜ: summary は同期エンジンだけが書き換える派生値であるため
 */
package com.trackit.tracking.model;

import java.time.Instant;

public record PackageSummary(
    TrackingStatus lastStatus,
    String lastLocation,
    String lastLocationKey,
    Instant lastUpdated,
    Instant deliveredAt) {}
