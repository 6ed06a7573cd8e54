package com.example.conversion.repository;

import com.example.conversion.model.EventReceipt;
import com.example.conversion.model.TrustLevel;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** リポジトリテスト用の行を直接投入する。 */
final class RepositoryFixtures {

  private RepositoryFixtures() {}

  static void truncateAll(NamedParameterJdbcTemplate jdbcTemplate) {
    final MapSqlParameterSource none = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM delivery_attempts", none);
    jdbcTemplate.update("DELETE FROM dispatch_jobs", none);
    jdbcTemplate.update("DELETE FROM event_receipts", none);
    jdbcTemplate.update("DELETE FROM platform_configs", none);
    jdbcTemplate.update("DELETE FROM event_nonces", none);
    jdbcTemplate.update("DELETE FROM order_snapshots", none);
    jdbcTemplate.update("DELETE FROM shops", none);
  }

  static UUID insertShop(NamedParameterJdbcTemplate jdbcTemplate, String shopDomain) {
    final UUID id = UUID.randomUUID();
    jdbcTemplate.update(
        """
        INSERT INTO shops (id, shop_domain, primary_domain, storefront_domains, ingestion_secret)
        VALUES (:id, :shopDomain, 'shop.example.com', ARRAY['www.example.com'], 'secret')
        """,
        new MapSqlParameterSource().addValue("id", id).addValue("shopDomain", shopDomain));
    return id;
  }

  static EventReceipt purchaseReceipt(
      UUID shopId, String eventId, String orderKey, String altOrderKey, Instant createdAt) {
    return new EventReceipt(
        UUID.randomUUID(),
        shopId,
        eventId,
        "purchase",
        orderKey,
        altOrderKey,
        "demo.myshopify.com",
        "meta,google",
        TrustLevel.TRUSTED,
        true,
        "{\"marketing\":true}",
        new BigDecimal("19.9000"),
        "USD",
        createdAt);
  }
}
