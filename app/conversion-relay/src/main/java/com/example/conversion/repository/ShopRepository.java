/*
 * どこで: Conversion Relay データアクセス
 * 何を: shops テーブルの参照を担う
 * なぜ: 受信時のショップ解決と定期タスクの対象列挙を支えるため
 */
package com.example.conversion.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;

import com.example.conversion.model.Shop;
import com.example.conversion.model.TrackingMode;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ShopRepository {

  private static final String COLUMNS =
      """
      id, shop_domain, primary_domain, storefront_domains, ingestion_secret,
      previous_ingestion_secret, previous_secret_expires_at, tracking_mode, active
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<Shop> findActiveByDomain(String shopDomain) {
    final String sql =
        "SELECT " + COLUMNS + " FROM shops WHERE shop_domain = :shopDomain AND active = TRUE";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("shopDomain", shopDomain);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<Shop> findById(UUID shopId) {
    final String sql = "SELECT " + COLUMNS + " FROM shops WHERE id = :shopId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("shopId", shopId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<Shop> findAllActive() {
    final String sql =
        "SELECT " + COLUMNS + " FROM shops WHERE active = TRUE ORDER BY shop_domain";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  private Shop mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Shop(
        UUID.fromString(rs.getString("id")),
        rs.getString("shop_domain"),
        rs.getString("primary_domain"),
        toList(rs.getArray("storefront_domains")),
        rs.getString("ingestion_secret"),
        rs.getString("previous_ingestion_secret"),
        toInstant(rs, "previous_secret_expires_at"),
        TrackingMode.fromDb(rs.getString("tracking_mode")),
        rs.getBoolean("active"));
  }

  private List<String> toList(Array array) throws SQLException {
    if (array == null) {
      return List.of();
    }
    return Arrays.asList((String[]) array.getArray());
  }
}
