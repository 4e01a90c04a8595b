/*
 * どこで: Tracking サービス層
 * 何を: 追跡プロバイダ呼び出しの失敗を表現する
 * なぜ: 同期エンジンで恒久エラーと一時エラーを振り分けるため
 */
package com.trackit.tracking.service;

public class CourierTrackingException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    RATE_LIMITED,
    UNAVAILABLE,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public CourierTrackingException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public CourierTrackingException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
