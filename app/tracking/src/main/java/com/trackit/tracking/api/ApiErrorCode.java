/*
 * どこで: Tracking API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.trackit.tracking.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  PACKAGE_NOT_FOUND,
  LOCATION_NOT_FOUND,
  TRACKING_NUMBER_INVALID,
  PROVIDER_RATE_LIMITED,
  PROVIDER_UNAVAILABLE,
  INTERNAL_ERROR
}
