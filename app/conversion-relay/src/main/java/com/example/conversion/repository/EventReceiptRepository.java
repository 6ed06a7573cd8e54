/*
 * どこで: Conversion Relay データアクセス
 * 何を: event_receipts の登録と購入キーの事前重複照会を担う
 * なぜ: 一意制約を最終防衛線にした冪等な受信記録を実現するため
 */
package com.example.conversion.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.conversion.model.EventReceipt;
import com.example.conversion.model.EventTypes;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class EventReceiptRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 新規なら true。同一 (shop_id, event_id) が既にあれば false（競合に負けた側も含む）。 */
  public boolean insertIfAbsent(EventReceipt receipt) {
    final String sql =
        """
        INSERT INTO event_receipts (
          id, shop_id, event_id, event_type, order_key, alt_order_key, origin_host, platforms,
          trust_level, signature_matched, consent_json, value, currency, created_at
        ) VALUES (
          :id, :shopId, :eventId, :eventType, :orderKey, :altOrderKey, :originHost, :platforms,
          :trustLevel, :signatureMatched, :consentJson::jsonb, :value, :currency, :createdAt
        )
        ON CONFLICT (shop_id, event_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", receipt.id())
            .addValue("shopId", receipt.shopId())
            .addValue("eventId", receipt.eventId())
            .addValue("eventType", receipt.eventType())
            .addValue("orderKey", receipt.orderKey())
            .addValue("altOrderKey", receipt.altOrderKey())
            .addValue("originHost", receipt.originHost())
            .addValue("platforms", receipt.platforms())
            .addValue("trustLevel", receipt.trustLevel().name())
            .addValue("signatureMatched", receipt.signatureMatched())
            .addValue("consentJson", receipt.consentJson())
            .addValue("value", receipt.value())
            .addValue("currency", receipt.currency())
            .addValue("createdAt", toTimestamp(receipt.createdAt()));
    // 重複は 0 件更新で返し、呼び出し元のトランザクションを中断させない
    return jdbcTemplate.update(sql, params) > 0;
  }

  /** 指定キーのうち、order_key か alt_order_key として購入レシートが既にあるものを返す。 */
  public Set<String> findRecordedPurchaseKeys(UUID shopId, Collection<String> keys) {
    if (keys.isEmpty()) {
      return Set.of();
    }
    final String sql =
        """
        SELECT order_key, alt_order_key
        FROM event_receipts
        WHERE shop_id = :shopId
          AND event_type = :eventType
          AND (order_key IN (:keys) OR alt_order_key IN (:keys))
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("shopId", shopId)
            .addValue("eventType", EventTypes.PURCHASE)
            .addValue("keys", keys);
    final Set<String> found = new HashSet<>();
    jdbcTemplate.query(
        sql,
        params,
        rs -> {
          addIfRequested(found, keys, rs.getString("order_key"));
          addIfRequested(found, keys, rs.getString("alt_order_key"));
        });
    return found;
  }

  private void addIfRequested(Set<String> found, Collection<String> keys, String value) {
    if (value != null && keys.contains(value)) {
      found.add(value);
    }
  }
}
