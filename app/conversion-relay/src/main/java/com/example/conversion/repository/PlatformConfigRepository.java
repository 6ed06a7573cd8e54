/*
 * どこで: Conversion Relay データアクセス
 * 何を: platform_configs の参照と楽観ロック付き更新を担う
 * なぜ: 環境切替とロールバックを半端な状態にしないため
 */
package com.example.conversion.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.conversion.model.PixelEnvironment;
import com.example.conversion.model.Platform;
import com.example.conversion.model.PlatformConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class PlatformConfigRepository {

  private static final TypeReference<Map<String, String>> CREDENTIALS_TYPE =
      new TypeReference<>() {};
  private static final String COLUMNS =
      """
      id, shop_id, platform, environment, config_version, server_side_enabled,
      client_side_enabled, treat_as_marketing, region, credentials_json::text AS credentials_text,
      previous_config_json::text AS previous_config_text, rollback_allowed, active, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public PlatformConfigRepository(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  public List<PlatformConfig> findActiveByShop(UUID shopId) {
    final String sql =
        "SELECT " + COLUMNS
            + " FROM platform_configs WHERE shop_id = :shopId AND active = TRUE ORDER BY platform";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("shopId", shopId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<PlatformConfig> findByShopAndPlatform(UUID shopId, Platform platform) {
    final String sql =
        "SELECT " + COLUMNS
            + " FROM platform_configs WHERE shop_id = :shopId AND platform = :platform";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("shopId", shopId)
            .addValue("platform", platform.wireName());
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * 期待バージョンと一致する場合のみ環境/認証情報/スナップショットを書き換え、バージョンを 1 進める。
   *
   * @return 更新件数。0 なら他の更新と競合した
   */
  public int updateEnvironment(
      UUID configId,
      int expectedVersion,
      PixelEnvironment environment,
      Map<String, String> credentials,
      String region,
      String previousConfigJson,
      boolean rollbackAllowed,
      Instant updatedAt) {
    final String sql =
        """
        UPDATE platform_configs
        SET environment = :environment,
            credentials_json = :credentials::jsonb,
            region = :region,
            previous_config_json = :previousConfig::jsonb,
            rollback_allowed = :rollbackAllowed,
            config_version = config_version + 1,
            updated_at = :updatedAt
        WHERE id = :id
          AND config_version = :expectedVersion
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("environment", environment.wireName())
            .addValue("credentials", writeCredentials(credentials))
            .addValue("region", region)
            .addValue("previousConfig", previousConfigJson)
            .addValue("rollbackAllowed", rollbackAllowed)
            .addValue("updatedAt", toTimestamp(updatedAt))
            .addValue("id", configId)
            .addValue("expectedVersion", expectedVersion);
    return jdbcTemplate.update(sql, params);
  }

  private PlatformConfig mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String platform = rs.getString("platform");
    final String environment = rs.getString("environment");
    return new PlatformConfig(
        UUID.fromString(rs.getString("id")),
        UUID.fromString(rs.getString("shop_id")),
        Platform.fromWire(platform)
            .orElseThrow(() -> new IllegalStateException("unknown platform: " + platform)),
        PixelEnvironment.fromWire(environment)
            .orElseThrow(() -> new IllegalStateException("unknown environment: " + environment)),
        rs.getInt("config_version"),
        rs.getBoolean("server_side_enabled"),
        rs.getBoolean("client_side_enabled"),
        rs.getBoolean("treat_as_marketing"),
        rs.getString("region"),
        readCredentials(rs.getString("credentials_text")),
        rs.getString("previous_config_text"),
        rs.getBoolean("rollback_allowed"),
        rs.getBoolean("active"),
        toInstant(rs, "updated_at"));
  }

  private Map<String, String> readCredentials(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, CREDENTIALS_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("credentials_json is not a flat string map", ex);
    }
  }

  private String writeCredentials(Map<String, String> credentials) {
    try {
      return objectMapper.writeValueAsString(credentials == null ? Map.of() : credentials);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize credentials", ex);
    }
  }
}
