/*
 * どこで: Tracking ドメインモデル
 * 何を: locations テーブル (ジオコーディングキャッシュ) の 1 行を表す
 * なぜ: 全パッケージ共通の参照データとしてキー単位で扱うため
 */
package com.trackit.tracking.model;

import java.time.Instant;

public record LocationEntry(
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

  public boolean hasCoordinates() {
    return !geocodingFailed && latitude != null && longitude != null;
  }
}
