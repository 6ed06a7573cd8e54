/*
 * どこで: Conversion Relay データアクセス
 * 何を: delivery_attempts の追記と参照を担う
 * なぜ: 配信の監査と突合の根拠を残すため（更新・削除はしない）
 */
package com.example.conversion.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.conversion.model.DeliveryAttempt;
import com.example.conversion.model.DeliveryStatus;
import com.example.conversion.model.Platform;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeliveryAttemptRepository {

  private static final String COLUMNS =
      """
      id, receipt_id, shop_id, event_id, platform, status, status_code, error,
      request_json::text AS request_text, order_key, value, currency, attempted_at, completed_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(DeliveryAttempt attempt) {
    final String sql =
        """
        INSERT INTO delivery_attempts (
          id, receipt_id, shop_id, event_id, platform, status, status_code, error, request_json,
          order_key, value, currency, attempted_at, completed_at
        ) VALUES (
          :id, :receiptId, :shopId, :eventId, :platform, :status, :statusCode, :error,
          :requestJson::jsonb, :orderKey, :value, :currency, :attemptedAt, :completedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", attempt.id())
            .addValue("receiptId", attempt.receiptId())
            .addValue("shopId", attempt.shopId())
            .addValue("eventId", attempt.eventId())
            .addValue("platform", attempt.platform().wireName())
            .addValue("status", attempt.status().dbValue())
            .addValue("statusCode", attempt.statusCode())
            .addValue("error", attempt.error())
            .addValue("requestJson", attempt.requestJson())
            .addValue("orderKey", attempt.orderKey())
            .addValue("value", attempt.value())
            .addValue("currency", attempt.currency())
            .addValue("attemptedAt", toTimestamp(attempt.attemptedAt()))
            .addValue("completedAt", toTimestamp(attempt.completedAt()));
    jdbcTemplate.update(sql, params);
  }

  public List<DeliveryAttempt> findByShopAndEvent(UUID shopId, String eventId) {
    final String sql =
        "SELECT " + COLUMNS
            + " FROM delivery_attempts WHERE shop_id = :shopId AND event_id = :eventId"
            + " ORDER BY attempted_at, id";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("shopId", shopId).addValue("eventId", eventId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** 指定注文キーに対する ok の試行をすべて返す（重複検知のため最新 1 件に絞らない）。 */
  public List<DeliveryAttempt> findOkByOrderKeys(UUID shopId, Collection<String> orderKeys) {
    if (orderKeys.isEmpty()) {
      return List.of();
    }
    final String sql =
        "SELECT " + COLUMNS
            + " FROM delivery_attempts"
            + " WHERE shop_id = :shopId AND status = 'ok' AND order_key IN (:orderKeys)"
            + " ORDER BY completed_at, id";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("shopId", shopId).addValue("orderKeys", orderKeys);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private DeliveryAttempt mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String platform = rs.getString("platform");
    final Integer statusCode = rs.getObject("status_code", Integer.class);
    return new DeliveryAttempt(
        UUID.fromString(rs.getString("id")),
        UUID.fromString(rs.getString("receipt_id")),
        UUID.fromString(rs.getString("shop_id")),
        rs.getString("event_id"),
        Platform.fromWire(platform)
            .orElseThrow(() -> new IllegalStateException("unknown platform: " + platform)),
        DeliveryStatus.fromDb(rs.getString("status")),
        statusCode,
        rs.getString("error"),
        rs.getString("request_text"),
        rs.getString("order_key"),
        rs.getBigDecimal("value"),
        rs.getString("currency"),
        toInstant(rs, "attempted_at"),
        toInstant(rs, "completed_at"));
  }
}
