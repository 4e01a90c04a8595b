/*
 * どこで: Tracking イベントリポジトリの統合テスト
 * 何を: 自然キーによる重複排除と 2 種類の並び順を Postgres で検証する
 * なぜ: 同時同期でも重複行が作られないことを DB 制約レベルで保証するため
 */
package com.trackit.tracking.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.trackit.tracking.AbstractPostgresContainerTest;
import com.trackit.tracking.TrackingTestRows;
import com.trackit.tracking.model.TrackingEventRecord;
import com.trackit.tracking.model.TrackingStatus;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class TrackingEventRepositoryTest extends AbstractPostgresContainerTest {

  private static final String PACKAGE_ID = "pkg-1";
  private static final Instant T1 = Instant.parse("2026-03-01T08:00:00Z");
  private static final Instant T2 = Instant.parse("2026-03-01T09:00:00Z");

  @Autowired private TrackingEventRepository trackingEventRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    TrackingTestRows.deleteAll(jdbcTemplate);
    TrackingTestRows.insertPackage(jdbcTemplate, PACKAGE_ID, "TN-1");
  }

  @Test
  void insertIfAbsentIgnoresSameNaturalKey() {
    assertThat(trackingEventRepository.insertIfAbsent(event(T1, TrackingStatus.IN_TRANSIT, "ARR")))
        .isEqualTo(1);
    // event_id が違っても自然キーが同じなら挿入しない
    assertThat(trackingEventRepository.insertIfAbsent(event(T1, TrackingStatus.IN_TRANSIT, "ARR")))
        .isZero();
    assertThat(trackingEventRepository.insertIfAbsent(event(T1, TrackingStatus.IN_TRANSIT, "DEP")))
        .isEqualTo(1);

    assertThat(trackingEventRepository.findByPackageIdInIngestOrder(PACKAGE_ID)).hasSize(2);
  }

  @Test
  void missingEventCodeStillDeduplicatesAndReadsBackAsNull() {
    assertThat(trackingEventRepository.insertIfAbsent(event(T1, TrackingStatus.IN_TRANSIT, null)))
        .isEqualTo(1);
    assertThat(trackingEventRepository.insertIfAbsent(event(T1, TrackingStatus.IN_TRANSIT, null)))
        .isZero();

    final List<TrackingEventRecord> stored =
        trackingEventRepository.findByPackageIdInIngestOrder(PACKAGE_ID);
    assertThat(stored).hasSize(1);
    assertThat(stored.get(0).courierEventCode()).isNull();
  }

  @Test
  void timelineIsChronologicalWhileIngestOrderFollowsInsertion() {
    trackingEventRepository.insertIfAbsent(event(T2, TrackingStatus.OUT_FOR_DELIVERY, "OFD"));
    trackingEventRepository.insertIfAbsent(event(T1, TrackingStatus.IN_TRANSIT, "ARR"));
    trackingEventRepository.insertIfAbsent(event(T2, TrackingStatus.IN_TRANSIT, "SCAN"));

    assertThat(trackingEventRepository.findTimeline(PACKAGE_ID))
        .extracting(TrackingEventRecord::courierEventCode)
        .containsExactly("ARR", "OFD", "SCAN");
    assertThat(trackingEventRepository.findByPackageIdInIngestOrder(PACKAGE_ID))
        .extracting(TrackingEventRecord::courierEventCode)
        .containsExactly("OFD", "ARR", "SCAN");
  }

  @Test
  void longProviderStringsAreStoredAsIs() {
    final String location = "Unit 4, ".repeat(80).strip();
    final String code = "SCAN-".repeat(40);
    final TrackingEventRecord longEvent =
        new TrackingEventRecord(
            UUID.randomUUID(),
            PACKAGE_ID,
            TrackingStatus.IN_TRANSIT,
            location,
            location.toLowerCase(Locale.ROOT),
            T1,
            "scan",
            code,
            "courier-".repeat(20),
            T1);

    assertThat(trackingEventRepository.insertIfAbsent(longEvent)).isEqualTo(1);

    final TrackingEventRecord stored =
        trackingEventRepository.findByPackageIdInIngestOrder(PACKAGE_ID).get(0);
    assertThat(stored.locationKey()).hasSize(location.length());
    assertThat(stored.courierEventCode()).isEqualTo(code);
  }

  private static TrackingEventRecord event(Instant at, TrackingStatus status, String code) {
    return new TrackingEventRecord(
        UUID.randomUUID(),
        PACKAGE_ID,
        status,
        "Leeds DC",
        "leeds dc",
        at,
        "scan",
        code,
        "royal-mail",
        at);
  }
}
