/*
 * どこで: Conversion Relay 認証
 * 何を: 形式検査/オリジン判定/署名検証を束ね、信頼度と拒否理由を決める
 * なぜ: strict/lenient ポリシーの分岐を 1 か所に集めるため
 */
package com.example.conversion.service.auth;

import com.example.conversion.config.IngestProperties;
import com.example.conversion.model.EventTypes;
import com.example.conversion.model.IngestOutcome;
import com.example.conversion.model.IngestRequest;
import com.example.conversion.model.InboundEvent;
import com.example.conversion.model.ResolvedShop;
import com.example.conversion.model.TrustLevel;
import com.example.conversion.service.EventBatchParser.ParsedBatch;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RequestAuthenticator {

  private static final Logger logger = LoggerFactory.getLogger(RequestAuthenticator.class);

  private final IngestProperties properties;
  private final OriginValidator originValidator;
  private final SignatureVerifier signatureVerifier;

  /** text/plain（sendBeacon）か application/json のみ受け付ける。 */
  public boolean acceptsContentType(String contentType) {
    if (contentType == null) {
      return false;
    }
    final String mediaType = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
    return "text/plain".equals(mediaType) || "application/json".equals(mediaType);
  }

  /** ショップ解決前に判定できるプロトコル検査。 */
  public Optional<String> precheckOrigin(IngestRequest request) {
    return originValidator.precheck(request.origin(), request.signed());
  }

  public AuthDecision authenticate(
      IngestRequest request, ResolvedShop resolved, ParsedBatch batch, Instant now) {
    final SignatureVerifier.SignatureCheck check =
        signatureVerifier.verify(
            resolved.shop(), request.signature(), request.signatureTimestamp(), request.rawBody(), now);

    final String originHost =
        originValidator.resolveHost(request.origin(), request.referer()).orElse(null);
    if (originHost != null && !originValidator.isAllowedHost(originHost, resolved.shop())) {
      if (check.verified() && !properties.strict()) {
        logger.warn(
            "origin outside shop allowlist accepted for signed request shopDomain={} host={}",
            resolved.shop().shopDomain(),
            originHost);
      } else {
        return AuthDecision.reject(IngestOutcome.Status.FORBIDDEN, "origin_not_allowed");
      }
    }

    if (check.verified()) {
      if (check.usedPreviousSecret()) {
        logger.info(
            "request verified with previous ingestion secret shopDomain={}",
            resolved.shop().shopDomain());
      }
      return AuthDecision.allow(TrustLevel.TRUSTED, true, check.usedPreviousSecret(), originHost);
    }

    final String reason = check.status().name().toLowerCase(Locale.ROOT);
    final boolean unsignedAllowed =
        check.status() == SignatureVerifier.SignatureCheck.Status.MISSING_SIGNATURE
            && properties.allowUnsignedEvents();
    if (properties.strict()) {
      // 購入イベントは検証済み署名なしでは受け付けない
      if (unsignedAllowed && !containsPurchase(batch)) {
        return AuthDecision.allow(TrustLevel.PARTIAL, false, false, originHost);
      }
      logger.warn(
          "request rejected by strict signature policy shopDomain={} reason={}",
          resolved.shop().shopDomain(),
          reason);
      return AuthDecision.reject(IngestOutcome.Status.UNAUTHORIZED, reason);
    }
    logger.warn(
        "unverified request passed through by lenient policy shopDomain={} reason={}",
        resolved.shop().shopDomain(),
        reason);
    return AuthDecision.allow(
        unsignedAllowed ? TrustLevel.PARTIAL : TrustLevel.UNTRUSTED, false, false, originHost);
  }

  private boolean containsPurchase(ParsedBatch batch) {
    for (InboundEvent event : batch.events()) {
      if (EventTypes.isPurchase(event.eventType())) {
        return true;
      }
    }
    return false;
  }
}
