/*
 * どこで: Conversion Relay データアクセス
 * 何を: event_nonces の登録と期限切れ削除を担う
 * なぜ: 共有ストア障害時にも nonce の再利用を検知できるようにするため
 */
package com.example.conversion.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class EventNonceRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 未使用なら true。期限切れの同一キーは上書きして再利用できる。 */
  public boolean insertIfAbsent(UUID shopId, String nonceKey, Instant now, Instant expiresAt) {
    final String sql =
        """
        INSERT INTO event_nonces (shop_id, nonce_key, expires_at)
        VALUES (:shopId, :nonceKey, :expiresAt)
        ON CONFLICT (shop_id, nonce_key) DO UPDATE
          SET expires_at = EXCLUDED.expires_at
          WHERE event_nonces.expires_at <= :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("shopId", shopId)
            .addValue("nonceKey", nonceKey)
            .addValue("expiresAt", toTimestamp(expiresAt))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public void delete(UUID shopId, String nonceKey) {
    final String sql = "DELETE FROM event_nonces WHERE shop_id = :shopId AND nonce_key = :nonceKey";
    jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("shopId", shopId).addValue("nonceKey", nonceKey));
  }

  public int deleteExpired(Instant now, int limit) {
    final String sql =
        """
        DELETE FROM event_nonces
        WHERE ctid IN (
          SELECT ctid FROM event_nonces
          WHERE expires_at <= :now
          LIMIT :limit
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.update(sql, params);
  }
}
