/*
 * どこで: Tracking サービス層
 * 何を: ジオコーダ呼び出しの失敗を表現する
 * なぜ: キャッシュ側で失敗種別を区別してログ/メトリクスに残すため
 */
package com.trackit.tracking.service;

public class GeocodingException extends RuntimeException {

  public enum Reason {
    NO_MATCH,
    UNAVAILABLE,
    TIMEOUT
  }

  private final Reason reason;

  public GeocodingException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public GeocodingException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
