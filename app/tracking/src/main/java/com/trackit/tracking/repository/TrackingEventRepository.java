/*
 * どこで: Tracking データアクセス
 * 何を: tracking_events の追記と時系列参照を担う
 * なぜ: 自然キー制約を最終防衛線として重複挿入を DB で弾くため
 */
package com.trackit.tracking.repository;

import static com.trackit.common.JdbcTimestampUtils.toTimestamp;

import com.trackit.tracking.model.TrackingEventRecord;
import com.trackit.tracking.model.TrackingStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TrackingEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 取得順 (ingest_seq) で返す。マージ時の同時刻タイブレークはこの順序に従う。 */
  public List<TrackingEventRecord> findByPackageIdInIngestOrder(String packageId) {
    final String sql =
        """
        SELECT event_id, package_id, status, location, location_key, event_timestamp,
               description, courier_event_code, courier_code, created_at
        FROM tracking_events
        WHERE package_id = :packageId
        ORDER BY ingest_seq
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("packageId", packageId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<TrackingEventRecord> findTimeline(String packageId) {
    final String sql =
        """
        SELECT event_id, package_id, status, location, location_key, event_timestamp,
               description, courier_event_code, courier_code, created_at
        FROM tracking_events
        WHERE package_id = :packageId
        ORDER BY event_timestamp, ingest_seq
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("packageId", packageId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * 自然キー衝突は挿入しない。
   *
   * @return 1=挿入、0=既存の自然キーと衝突
   */
  public int insertIfAbsent(TrackingEventRecord event) {
    final String sql =
        """
        INSERT INTO tracking_events (
          event_id,
          package_id,
          status,
          location,
          location_key,
          event_timestamp,
          description,
          courier_event_code,
          courier_code,
          created_at
        ) VALUES (
          :eventId,
          :packageId,
          :status,
          :location,
          :locationKey,
          :eventTimestamp,
          :description,
          :courierEventCode,
          :courierCode,
          :createdAt
        )
        ON CONFLICT ON CONSTRAINT uq_tracking_events_natural_key DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", event.eventId())
            .addValue("packageId", event.packageId())
            .addValue("status", event.status().name())
            .addValue("location", event.location())
            .addValue("locationKey", event.locationKey())
            .addValue("eventTimestamp", toTimestamp(event.timestamp()))
            .addValue("description", event.description())
            .addValue("courierEventCode", event.naturalKey().courierEventCode())
            .addValue("courierCode", event.courierCode())
            .addValue("createdAt", toTimestamp(event.createdAt()));
    return jdbcTemplate.update(sql, params);
  }

  private TrackingEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String courierEventCode = rs.getString("courier_event_code");
    return new TrackingEventRecord(
        rs.getObject("event_id", UUID.class),
        rs.getString("package_id"),
        TrackingStatus.valueOf(rs.getString("status")),
        rs.getString("location"),
        rs.getString("location_key"),
        rs.getTimestamp("event_timestamp").toInstant(),
        rs.getString("description"),
        courierEventCode == null || courierEventCode.isEmpty() ? null : courierEventCode,
        rs.getString("courier_code"),
        rs.getTimestamp("created_at").toInstant());
  }
}
