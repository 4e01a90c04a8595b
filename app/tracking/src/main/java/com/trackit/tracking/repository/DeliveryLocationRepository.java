package com.trackit.tracking.repository;

import com.trackit.tracking.model.DeliveryLocationRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeliveryLocationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<DeliveryLocationRecord> findById(String deliveryLocationId) {
    final String sql =
        """
        SELECT delivery_location_id, name, address, latitude, longitude
        FROM delivery_locations
        WHERE delivery_location_id = :deliveryLocationId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("deliveryLocationId", deliveryLocationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private DeliveryLocationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DeliveryLocationRecord(
        rs.getString("delivery_location_id"),
        rs.getString("name"),
        rs.getString("address"),
        rs.getObject("latitude", Double.class),
        rs.getObject("longitude", Double.class));
  }
}
