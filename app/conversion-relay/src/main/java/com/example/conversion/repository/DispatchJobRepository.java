/*
 * どこで: Conversion Relay データアクセス
 * 何を: dispatch_jobs（非同期配信キュー）の登録/claim/状態更新を担う
 * なぜ: 複数インスタンスのワーカーが同じジョブを二重に処理しないようにするため
 */
package com.example.conversion.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.conversion.model.DispatchJob;
import com.example.conversion.model.Platform;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DispatchJobRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(
      UUID id, UUID receiptId, UUID shopId, Platform platform, String payloadJson, Instant now) {
    final String sql =
        """
        INSERT INTO dispatch_jobs (
          id, receipt_id, shop_id, platform, payload_json, status, attempt_count,
          next_retry_at, created_at, updated_at
        ) VALUES (
          :id, :receiptId, :shopId, :platform, :payloadJson::jsonb, 'PENDING', 0,
          NULL, :now, :now
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("receiptId", receiptId)
            .addValue("shopId", shopId)
            .addValue("platform", platform.wireName())
            .addValue("payloadJson", payloadJson)
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  public List<DispatchJob> claimDue(int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // PENDING と lease 切れの PROCESSING をまとめて claim し、ワーカー停止時の取り残しを回収する
    final String sql =
        """
        WITH cte AS (
          SELECT id
          FROM dispatch_jobs
          WHERE (
            status = 'PENDING'
            AND (next_retry_at IS NULL OR next_retry_at <= :now)
          )
          OR (
            status = 'PROCESSING'
            AND (lease_until IS NULL OR lease_until <= :now)
          )
          ORDER BY created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE dispatch_jobs j
        SET status = 'PROCESSING',
            locked_by = :lockedBy,
            lease_until = :leaseUntil,
            updated_at = :now
        FROM cte
        WHERE j.id = cte.id
        RETURNING j.id, j.receipt_id, j.shop_id, j.platform, j.payload_json::text AS payload_text,
                  j.status, j.attempt_count, j.next_retry_at, j.locked_by, j.lease_until,
                  j.created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markDone(UUID id, int attemptCount, Instant now, String lockedBy) {
    return finish(id, "DONE", attemptCount, null, now, lockedBy);
  }

  public int markFailed(UUID id, int attemptCount, Instant now, String lockedBy) {
    return finish(id, "FAILED", attemptCount, null, now, lockedBy);
  }

  public int markRetry(
      UUID id, int attemptCount, Instant nextRetryAt, Instant now, String lockedBy) {
    return finish(id, "PENDING", attemptCount, nextRetryAt, now, lockedBy);
  }

  public int countPending() {
    final String sql =
        "SELECT COUNT(*) FROM dispatch_jobs WHERE status IN ('PENDING', 'PROCESSING')";
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  public int deleteFinishedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM dispatch_jobs
        WHERE updated_at < :threshold
          AND status IN ('DONE', 'FAILED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private int finish(
      UUID id, String status, int attemptCount, Instant nextRetryAt, Instant now, String lockedBy) {
    final String sql =
        """
        UPDATE dispatch_jobs
        SET status = :status,
            attempt_count = :attemptCount,
            next_retry_at = :nextRetryAt,
            locked_by = NULL,
            lease_until = NULL,
            updated_at = :now
        WHERE id = :id
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", status)
            .addValue("attemptCount", attemptCount)
            .addValue("nextRetryAt", toTimestamp(nextRetryAt))
            .addValue("now", toTimestamp(now))
            .addValue("id", id)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  private DispatchJob mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String platform = rs.getString("platform");
    return new DispatchJob(
        UUID.fromString(rs.getString("id")),
        UUID.fromString(rs.getString("receipt_id")),
        UUID.fromString(rs.getString("shop_id")),
        Platform.fromWire(platform)
            .orElseThrow(() -> new IllegalStateException("unknown platform: " + platform)),
        rs.getString("payload_text"),
        rs.getString("status"),
        rs.getInt("attempt_count"),
        toInstant(rs, "next_retry_at"),
        rs.getString("locked_by"),
        toInstant(rs, "lease_until"),
        toInstant(rs, "created_at"));
  }
}
