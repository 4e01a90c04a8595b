/*
 * どこで: Tracking データアクセス
 * 何を: packages の参照、summary 更新、同期用 advisory lock を担う
 * なぜ: summary 列の書き込みを同期エンジンの経路に限定するため
 */
package com.trackit.tracking.repository;

import static com.trackit.common.JdbcTimestampUtils.toInstant;
import static com.trackit.common.JdbcTimestampUtils.toTimestamp;

import com.trackit.tracking.model.PackageRecord;
import com.trackit.tracking.model.PackageSummary;
import com.trackit.tracking.model.TrackingFetchResult;
import com.trackit.tracking.model.TrackingStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class PackageRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT package_id, user_id, tracking_number, courier_hint, delivery_location_id,
             provider_tracker_id, last_status, last_location, last_location_key, last_updated,
             delivered_at, origin_country, destination_country, estimated_delivery,
             detected_courier, archived, last_synced_at
      FROM packages
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public void lockForSync(long lockKey) {
    // 同一パッケージの commit をインスタンス間で直列化する。トランザクション終了で自動解放される。
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("lockKey", lockKey);
    jdbcTemplate.query(sql, params, rs -> null);
  }

  public Optional<PackageRecord> findById(String packageId) {
    final String sql = SELECT_COLUMNS + " WHERE package_id = :packageId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("packageId", packageId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<String> findIdsDueForRefresh(int limit) {
    // 未同期のものを先頭に、最後の同期が古い順。配達済み/アーカイブ済みは対象外。
    final String sql =
        """
        SELECT package_id
        FROM packages
        WHERE archived = FALSE
          AND delivered_at IS NULL
        ORDER BY last_synced_at NULLS FIRST, package_id
        LIMIT :limit
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.queryForList(sql, params, String.class);
  }

  public int updateAfterSync(
      String packageId, PackageSummary summary, TrackingFetchResult fetched, Instant syncedAt) {
    // provider 由来のメタデータは null で既存値を消さない。summary は常に再計算値で上書きする。
    final String sql =
        """
        UPDATE packages
        SET last_status = :lastStatus,
            last_location = :lastLocation,
            last_location_key = :lastLocationKey,
            last_updated = :lastUpdated,
            delivered_at = :deliveredAt,
            provider_tracker_id = COALESCE(:providerTrackerId, provider_tracker_id),
            detected_courier = COALESCE(:detectedCourier, detected_courier),
            origin_country = COALESCE(:originCountry, origin_country),
            destination_country = COALESCE(:destinationCountry, destination_country),
            estimated_delivery = COALESCE(:estimatedDelivery, estimated_delivery),
            last_synced_at = :syncedAt,
            updated_at = :syncedAt
        WHERE package_id = :packageId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("packageId", packageId)
            .addValue(
                "lastStatus", summary.lastStatus() == null ? null : summary.lastStatus().name())
            .addValue("lastLocation", summary.lastLocation())
            .addValue("lastLocationKey", summary.lastLocationKey())
            .addValue("lastUpdated", toTimestamp(summary.lastUpdated()))
            .addValue("deliveredAt", toTimestamp(summary.deliveredAt()))
            .addValue("providerTrackerId", blankToNull(fetched.providerTrackerId()))
            .addValue("detectedCourier", blankToNull(fetched.detectedCourier()))
            .addValue("originCountry", blankToNull(fetched.originCountry()))
            .addValue("destinationCountry", blankToNull(fetched.destinationCountry()))
            .addValue("estimatedDelivery", toTimestamp(fetched.estimatedDelivery()))
            .addValue("syncedAt", toTimestamp(syncedAt));
    return jdbcTemplate.update(sql, params);
  }

  private String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }

  private PackageRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String lastStatus = rs.getString("last_status");
    return new PackageRecord(
        rs.getString("package_id"),
        rs.getString("user_id"),
        rs.getString("tracking_number"),
        rs.getString("courier_hint"),
        rs.getString("delivery_location_id"),
        rs.getString("provider_tracker_id"),
        lastStatus == null ? null : TrackingStatus.valueOf(lastStatus),
        rs.getString("last_location"),
        rs.getString("last_location_key"),
        toInstant(rs, "last_updated"),
        toInstant(rs, "delivered_at"),
        rs.getString("origin_country"),
        rs.getString("destination_country"),
        toInstant(rs, "estimated_delivery"),
        rs.getString("detected_courier"),
        rs.getBoolean("archived"),
        toInstant(rs, "last_synced_at"));
  }
}
