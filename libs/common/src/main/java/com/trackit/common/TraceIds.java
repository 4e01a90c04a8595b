package com.trackit.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  /** W3C trace-id と同じ 32 桁 hex。HTTP 以外 (定期実行など) の起点で MDC に載せる。 */
  public static String newTraceId() {
    return UUID.randomUUID().toString().replace("-", "");
  }
}
