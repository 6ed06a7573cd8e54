package com.example.conversion.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.conversion.model.OrderSnapshot;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** order_snapshots は外部から投入される。ここでは読み取りのみ。 */
@Repository
@RequiredArgsConstructor
public class OrderSnapshotRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<OrderSnapshot> findByShopAndWindow(UUID shopId, Instant from, Instant to) {
    final String sql =
        """
        SELECT shop_id, order_id, value, currency, created_at
        FROM order_snapshots
        WHERE shop_id = :shopId
          AND created_at >= :from
          AND created_at < :to
        ORDER BY created_at, order_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("shopId", shopId)
            .addValue("from", toTimestamp(from))
            .addValue("to", toTimestamp(to));
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new OrderSnapshot(
                UUID.fromString(rs.getString("shop_id")),
                rs.getString("order_id"),
                rs.getBigDecimal("value"),
                rs.getString("currency"),
                toInstant(rs, "created_at")));
  }
}
