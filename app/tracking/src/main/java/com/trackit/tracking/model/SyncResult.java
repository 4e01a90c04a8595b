package com.trackit.tracking.model;

public record SyncResult(PackageRecord trackedPackage, int newEventCount, int droppedCount) {}
