/*
 * どこで: Tracking API
 * 何を: プロバイダが追跡番号を認識しない恒久エラー(422)を表す
 * なぜ: 再試行しても解決しない失敗を一時障害と区別するため
 */
package com.trackit.tracking.api;

public class InvalidTrackingNumberException extends RuntimeException {

  public InvalidTrackingNumberException(String message, Throwable cause) {
    super(message, cause);
  }
}
