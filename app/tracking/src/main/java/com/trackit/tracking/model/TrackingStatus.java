/*
 * どこで: Tracking ドメインモデル
 * 何を: 正規化済みの配送ステータスと、プロバイダ語彙からの変換を定義する
 * なぜ: クーリエごとの表記揺れをマージ処理に持ち込まないため
 */
package com.trackit.tracking.model;

import java.util.Locale;

public enum TrackingStatus {
  PENDING,
  IN_TRANSIT,
  OUT_FOR_DELIVERY,
  DELIVERED,
  EXCEPTION,
  UNKNOWN;

  /**
   * プロバイダのステータス語彙 (statusMilestone 等) を正規ステータスへ変換する。
   *
   * <p>アンダースコア/ハイフンは空白として扱う。判定順は固定で、先に一致したものを採用する。
   */
  public static TrackingStatus fromProvider(String providerStatus) {
    if (providerStatus == null || providerStatus.isBlank()) {
      return UNKNOWN;
    }
    final String value = providerStatus.toLowerCase(Locale.ROOT).replace('_', ' ').replace('-', ' ');
    if (value.contains("delivered")) {
      return DELIVERED;
    }
    if (value.contains("out for delivery")) {
      return OUT_FOR_DELIVERY;
    }
    if (value.contains("in transit")) {
      return IN_TRANSIT;
    }
    if (value.contains("exception") || value.contains("failed") || value.contains("returned")) {
      return EXCEPTION;
    }
    if (value.contains("pending") || value.contains("info received")) {
      return PENDING;
    }
    return UNKNOWN;
  }
}
