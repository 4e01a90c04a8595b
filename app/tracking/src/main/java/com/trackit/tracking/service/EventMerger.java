/*
 * どこで: Tracking サービス層
 * 何を: 取得したイベントを既存タイムラインと突き合わせ、新規分と summary を算出する
 * なぜ: 重複作成やステータス後退を起こさずに何度でも同期できるようにするため
 */
package com.trackit.tracking.service;

import com.trackit.tracking.model.EventNaturalKey;
import com.trackit.tracking.model.MergeResult;
import com.trackit.tracking.model.PackageSummary;
import com.trackit.tracking.model.RawTrackingEvent;
import com.trackit.tracking.model.TrackingEventRecord;
import com.trackit.tracking.model.TrackingStatus;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EventMerger {

  private static final Logger logger = LoggerFactory.getLogger(EventMerger.class);

  private final LocationNormalizer locationNormalizer;

  /**
   * 取得イベントを既存タイムラインへマージする。
   *
   * @param existingEvents 永続化済みイベント (取得順)
   * @param incomingEvents プロバイダから取得した順のイベント
   * @param currentDeliveredAt 既に記録済みの配達日時。設定済みなら上書きしない
   */
  public MergeResult merge(
      String packageId,
      List<TrackingEventRecord> existingEvents,
      List<RawTrackingEvent> incomingEvents,
      Instant currentDeliveredAt,
      Instant now) {
    final Set<EventNaturalKey> seen = new HashSet<>();
    for (TrackingEventRecord existing : existingEvents) {
      seen.add(existing.naturalKey());
    }

    final List<TrackingEventRecord> newEvents = new ArrayList<>();
    int dropped = 0;
    for (RawTrackingEvent raw : incomingEvents) {
      final Optional<Instant> timestamp = parseTimestamp(raw.timestamp());
      if (timestamp.isEmpty()) {
        logger.warn(
            "tracking event dropped: malformed timestamp packageId={} timestamp={}",
            packageId,
            raw.timestamp());
        dropped++;
        continue;
      }
      final TrackingEventRecord candidate = toRecord(packageId, raw, timestamp.get(), now);
      // 既存分と同一バッチ内の先行分の両方に対して重複を弾く
      if (!seen.add(candidate.naturalKey())) {
        continue;
      }
      newEvents.add(candidate);
    }

    final List<TrackingEventRecord> union = new ArrayList<>(existingEvents.size() + newEvents.size());
    union.addAll(existingEvents);
    union.addAll(newEvents);
    // List.sort は安定ソート。同時刻は既存→新規、各々は取得順のまま残る。
    union.sort(Comparator.comparing(TrackingEventRecord::timestamp));

    return new MergeResult(newEvents, summarize(union, currentDeliveredAt), dropped);
  }

  private PackageSummary summarize(List<TrackingEventRecord> sorted, Instant currentDeliveredAt) {
    final Instant deliveredAt =
        currentDeliveredAt != null ? currentDeliveredAt : latestDeliveredAt(sorted);
    if (sorted.isEmpty()) {
      return new PackageSummary(null, null, null, null, deliveredAt);
    }
    final TrackingEventRecord latest = sorted.get(sorted.size() - 1);
    return new PackageSummary(
        latest.status(), latest.location(), latest.locationKey(), latest.timestamp(), deliveredAt);
  }

  private Instant latestDeliveredAt(List<TrackingEventRecord> sorted) {
    Instant deliveredAt = null;
    for (TrackingEventRecord event : sorted) {
      if (event.status() == TrackingStatus.DELIVERED) {
        deliveredAt = event.timestamp();
      }
    }
    return deliveredAt;
  }

  private TrackingEventRecord toRecord(
      String packageId, RawTrackingEvent raw, Instant timestamp, Instant now) {
    final String location = raw.location() == null || raw.location().isBlank() ? null : raw.location();
    return new TrackingEventRecord(
        UUID.randomUUID(),
        packageId,
        TrackingStatus.fromProvider(raw.status()),
        location,
        locationNormalizer.normalize(location).orElse(null),
        timestamp,
        raw.description(),
        raw.courierEventCode() == null || raw.courierEventCode().isBlank()
            ? null
            : raw.courierEventCode(),
        raw.courierCode(),
        now);
  }

  // オフセット付き ISO-8601 を正とし、オフセット無しは UTC とみなす。
  // TIMESTAMPTZ はマイクロ秒精度のため、自然キーが保存値と一致するよう切り捨てる。
  static Optional<Instant> parseTimestamp(String value) {
    return parseInstant(value).map(parsed -> parsed.truncatedTo(ChronoUnit.MICROS));
  }

  private static Optional<Instant> parseInstant(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    final String trimmed = value.strip();
    try {
      return Optional.of(OffsetDateTime.parse(trimmed).toInstant());
    } catch (DateTimeParseException ex) {
      logger.debug("timestamp has no offset, retry as UTC value={}", trimmed);
    }
    try {
      return Optional.of(LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }
}
