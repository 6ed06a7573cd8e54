/*
 * どこで: Conversion Relay 送信先設定
 * 何を: test/live 環境の切替と 1 回限りのロールバックを行う
 * なぜ: 本番切替前に必須認証情報を検証し、誤切替を直前の状態へ戻せるようにするため
 */
package com.example.conversion.service;

import com.example.conversion.model.EnvironmentSwitchResult;
import com.example.conversion.model.PixelEnvironment;
import com.example.conversion.model.Platform;
import com.example.conversion.model.PlatformConfig;
import com.example.conversion.repository.PlatformConfigRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class PlatformEnvironmentService {

  private static final Logger logger = LoggerFactory.getLogger(PlatformEnvironmentService.class);

  private final PlatformConfigRepository platformConfigRepository;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public PlatformEnvironmentService(
      PlatformConfigRepository platformConfigRepository, Clock clock, ObjectMapper objectMapper) {
    this.platformConfigRepository = platformConfigRepository;
    this.clock = clock;
    this.objectMapper = objectMapper;
  }

  public EnvironmentSwitchResult switchEnvironment(
      UUID shopId, Platform platform, PixelEnvironment target) {
    final Optional<PlatformConfig> found = platformConfigRepository.findByShopAndPlatform(shopId, platform);
    if (found.isEmpty()) {
      return EnvironmentSwitchResult.rejected(platform, null, "platform_not_configured", null);
    }
    final PlatformConfig current = found.get();
    if (current.environment() == target) {
      return EnvironmentSwitchResult.rejected(
          platform, current.environment(), "already_" + target.wireName(), null);
    }
    if (target == PixelEnvironment.LIVE) {
      final List<String> missing = current.toCredentials().missing(platform.requiredCredentials());
      if (!missing.isEmpty()) {
        return EnvironmentSwitchResult.rejected(
            platform, current.environment(), "missing_credentials", missing);
      }
    }
    final int updated =
        platformConfigRepository.updateEnvironment(
            current.id(),
            current.configVersion(),
            target,
            current.credentials(),
            current.region(),
            writeSnapshot(current),
            true,
            Instant.now(clock));
    if (updated == 0) {
      return EnvironmentSwitchResult.rejected(
          platform, current.environment(), "concurrent_modification", null);
    }
    logger.info(
        "platform environment switched shopId={} platform={} from={} to={} version={}",
        shopId,
        platform.wireName(),
        current.environment().wireName(),
        target.wireName(),
        current.configVersion() + 1);
    return EnvironmentSwitchResult.switched(
        platform, current.environment(), target, current.configVersion() + 1);
  }

  /** 直前の切替で保存したスナップショットへ戻す。戻した後はスナップショットを破棄する。 */
  public EnvironmentSwitchResult rollback(UUID shopId, Platform platform) {
    final Optional<PlatformConfig> found = platformConfigRepository.findByShopAndPlatform(shopId, platform);
    if (found.isEmpty()) {
      return EnvironmentSwitchResult.rejected(platform, null, "platform_not_configured", null);
    }
    final PlatformConfig current = found.get();
    if (!current.rollbackAllowed() || current.previousConfigJson() == null) {
      return EnvironmentSwitchResult.rejected(
          platform, current.environment(), "rollback_not_available", null);
    }
    final ConfigSnapshot snapshot = readSnapshot(current.previousConfigJson());
    final PixelEnvironment restored =
        PixelEnvironment.fromWire(snapshot.environment())
            .orElseThrow(
                () -> new IllegalStateException("snapshot has unknown environment: " + snapshot.environment()));
    final int updated =
        platformConfigRepository.updateEnvironment(
            current.id(),
            current.configVersion(),
            restored,
            snapshot.credentials(),
            snapshot.region(),
            null,
            false,
            Instant.now(clock));
    if (updated == 0) {
      return EnvironmentSwitchResult.rejected(
          platform, current.environment(), "concurrent_modification", null);
    }
    logger.info(
        "platform environment rolled back shopId={} platform={} from={} to={}",
        shopId,
        platform.wireName(),
        current.environment().wireName(),
        restored.wireName());
    return EnvironmentSwitchResult.switched(
        platform, current.environment(), restored, current.configVersion() + 1);
  }

  private String writeSnapshot(PlatformConfig config) {
    final ConfigSnapshot snapshot =
        new ConfigSnapshot(
            config.environment().wireName(),
            config.credentials(),
            config.region(),
            config.configVersion());
    try {
      return objectMapper.writeValueAsString(snapshot);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize config snapshot", ex);
    }
  }

  private ConfigSnapshot readSnapshot(String json) {
    try {
      return objectMapper.readValue(json, ConfigSnapshot.class);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("previous_config_json is unreadable", ex);
    }
  }

  /** previous_config_json に保存する切替前の状態。 */
  record ConfigSnapshot(
      String environment, Map<String, String> credentials, String region, int configVersion) {}
}
