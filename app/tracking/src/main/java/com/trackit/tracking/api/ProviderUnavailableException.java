/*
 * どこで: Tracking API
 * 何を: 追跡プロバイダの一時障害(503/429)を表す
 * なぜ: 呼び出し側に後で再試行すべき失敗であることを伝えるため
 */
package com.trackit.tracking.api;

import com.trackit.tracking.service.CourierTrackingException;

public class ProviderUnavailableException extends RuntimeException {

  private final CourierTrackingException.Reason reason;

  public ProviderUnavailableException(CourierTrackingException cause) {
    super("tracking provider unavailable: " + cause.reason(), cause);
    this.reason = cause.reason();
  }

  public CourierTrackingException.Reason reason() {
    return reason;
  }
}
