package com.trackit.tracking.model;

import java.util.List;

public record MergeResult(List<TrackingEventRecord> newEvents, PackageSummary summary, int droppedCount) {

  public MergeResult {
    newEvents = List.copyOf(newEvents);
  }
}
