/*
 * どこで: Tracking データアクセス
 * 何を: locations (ジオコーディングキャッシュ) の参照と更新を担う
 * なぜ: キャッシュ行の生成/結果反映/利用回数更新を SQL 単位で分離するため
 */
package com.trackit.tracking.repository;

import static com.trackit.common.JdbcTimestampUtils.toInstant;
import static com.trackit.common.JdbcTimestampUtils.toTimestamp;

import com.trackit.tracking.model.GeocodeResult;
import com.trackit.tracking.model.LocationEntry;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class LocationRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT location_key, location_string, alias, latitude, longitude, display_name,
             country_code, geocoded_at, geocoding_failed, usage_count
      FROM locations
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<LocationEntry> findByKey(String locationKey) {
    final String sql = SELECT_COLUMNS + " WHERE location_key = :locationKey";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("locationKey", locationKey);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<LocationEntry> findByKeys(Collection<String> locationKeys) {
    if (locationKeys == null || locationKeys.isEmpty()) {
      return List.of();
    }
    final String sql = SELECT_COLUMNS + " WHERE location_key IN (:locationKeys)";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("locationKeys", locationKeys);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<LocationEntry> findAll(boolean failedOnly) {
    final String sql =
        SELECT_COLUMNS
            + """
             WHERE (:failedOnly = FALSE OR geocoding_failed = TRUE)
             ORDER BY usage_count DESC, location_key
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("failedOnly", failedOnly);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * 初回観測時の行を作る。別インスタンスが先に作っていた場合は何もしない。
   *
   * @return 1=作成、0=既存
   */
  public int insertIfAbsent(LocationEntry entry, Instant now) {
    final String sql =
        """
        INSERT INTO locations (
          location_key,
          location_string,
          alias,
          latitude,
          longitude,
          display_name,
          country_code,
          geocoded_at,
          geocoding_failed,
          usage_count,
          created_at,
          updated_at
        ) VALUES (
          :locationKey,
          :locationString,
          :alias,
          :latitude,
          :longitude,
          :displayName,
          :countryCode,
          :geocodedAt,
          :geocodingFailed,
          :usageCount,
          :now,
          :now
        )
        ON CONFLICT (location_key) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("locationKey", entry.locationKey())
            .addValue("locationString", entry.locationString())
            .addValue("alias", entry.alias())
            .addValue("latitude", entry.latitude())
            .addValue("longitude", entry.longitude())
            .addValue("displayName", entry.displayName())
            .addValue("countryCode", entry.countryCode())
            .addValue("geocodedAt", toTimestamp(entry.geocodedAt()))
            .addValue("geocodingFailed", entry.geocodingFailed())
            .addValue("usageCount", entry.usageCount())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /** ジオコーディング成功を反映する。失敗フラグは必ず下ろす。 */
  public int markGeocoded(String locationKey, GeocodeResult result, Instant now) {
    final String sql =
        """
        UPDATE locations
        SET latitude = :latitude,
            longitude = :longitude,
            display_name = :displayName,
            country_code = :countryCode,
            geocoded_at = :now,
            geocoding_failed = FALSE,
            updated_at = :now
        WHERE location_key = :locationKey
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("locationKey", locationKey)
            .addValue("latitude", result.latitude())
            .addValue("longitude", result.longitude())
            .addValue("displayName", result.displayName())
            .addValue("countryCode", result.countryCode())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /** 失敗を反映する。古い座標を残すと地図に誤った位置が出るため消す。 */
  public int markFailed(String locationKey, Instant now) {
    final String sql =
        """
        UPDATE locations
        SET latitude = NULL,
            longitude = NULL,
            display_name = NULL,
            country_code = NULL,
            geocoded_at = :now,
            geocoding_failed = TRUE,
            updated_at = :now
        WHERE location_key = :locationKey
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("locationKey", locationKey)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int updateAlias(String locationKey, String alias, Instant now) {
    final String sql =
        """
        UPDATE locations
        SET alias = :alias,
            latitude = NULL,
            longitude = NULL,
            display_name = NULL,
            country_code = NULL,
            geocoding_failed = FALSE,
            updated_at = :now
        WHERE location_key = :locationKey
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("locationKey", locationKey)
            .addValue("alias", alias)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int incrementUsage(String locationKey) {
    final String sql =
        """
        UPDATE locations
        SET usage_count = usage_count + 1
        WHERE location_key = :locationKey
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("locationKey", locationKey);
    return jdbcTemplate.update(sql, params);
  }

  private LocationEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new LocationEntry(
        rs.getString("location_key"),
        rs.getString("location_string"),
        rs.getString("alias"),
        rs.getObject("latitude", Double.class),
        rs.getObject("longitude", Double.class),
        rs.getString("display_name"),
        rs.getString("country_code"),
        toInstant(rs, "geocoded_at"),
        rs.getBoolean("geocoding_failed"),
        rs.getLong("usage_count"));
  }
}
