/*
 * どこで: Conversion Relay 内部 API
 * 何を: 送信先の test/live 切替とロールバック、配信試行の参照を公開する
 * なぜ: 運用者がショップ単位で設定変更と配信状況の確認を行えるようにするため
 */
package com.example.conversion.api;

import com.example.conversion.api.request.EnvironmentSwitchRequest;
import com.example.conversion.api.response.DeliveryAttemptResponse;
import com.example.conversion.model.EnvironmentSwitchResult;
import com.example.conversion.model.PixelEnvironment;
import com.example.conversion.model.Platform;
import com.example.conversion.repository.ShopRepository;
import com.example.conversion.service.DeliveryLedger;
import com.example.conversion.service.PlatformEnvironmentService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/shops/{shopId}")
@RequiredArgsConstructor
public class InternalShopController {

  private final PlatformEnvironmentService environmentService;
  private final DeliveryLedger ledger;
  private final ShopRepository shopRepository;

  @PostMapping("/platforms/{platform}/environment")
  public ResponseEntity<EnvironmentSwitchResult> switchEnvironment(
      @PathVariable("shopId") UUID shopId,
      @PathVariable("platform") String platform,
      @Valid @RequestBody EnvironmentSwitchRequest request) {
    requireShop(shopId);
    final PixelEnvironment target =
        PixelEnvironment.fromWire(request.environment())
            .orElseThrow(() -> new IllegalArgumentException("environment must be test or live"));
    return toResponse(environmentService.switchEnvironment(shopId, parsePlatform(platform), target));
  }

  @PostMapping("/platforms/{platform}/rollback")
  public ResponseEntity<EnvironmentSwitchResult> rollback(
      @PathVariable("shopId") UUID shopId, @PathVariable("platform") String platform) {
    requireShop(shopId);
    return toResponse(environmentService.rollback(shopId, parsePlatform(platform)));
  }

  @GetMapping("/events/{eventId}/attempts")
  public ResponseEntity<List<DeliveryAttemptResponse>> attempts(
      @PathVariable("shopId") UUID shopId, @PathVariable("eventId") String eventId) {
    requireShop(shopId);
    return ResponseEntity.ok(
        ledger.attemptsForEvent(shopId, eventId).stream().map(DeliveryAttemptResponse::from).toList());
  }

  private ResponseEntity<EnvironmentSwitchResult> toResponse(EnvironmentSwitchResult result) {
    if (result.success()) {
      return ResponseEntity.ok(result);
    }
    final HttpStatus status =
        switch (result.error()) {
          case "platform_not_configured" -> HttpStatus.NOT_FOUND;
          case "missing_credentials" -> HttpStatus.UNPROCESSABLE_ENTITY;
          default -> HttpStatus.CONFLICT;
        };
    return ResponseEntity.status(status).body(result);
  }

  private void requireShop(UUID shopId) {
    if (shopRepository.findById(shopId).isEmpty()) {
      throw new ShopNotFoundException(shopId.toString());
    }
  }

  private static Platform parsePlatform(String platform) {
    return Platform.fromWire(platform)
        .orElseThrow(() -> new IllegalArgumentException("unknown platform: " + platform));
  }
}
