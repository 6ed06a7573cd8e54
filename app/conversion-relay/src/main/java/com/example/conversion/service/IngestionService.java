/*
 * どこで: Conversion Relay 受信パイプライン
 * 何を: 認証 → ショップ解決 → 正規化 → 重複排除 → 同意判定 → 配信 → 台帳記録を順に実行する
 * なぜ: 信頼できない再送可能な入力を、冪等かつ少なくとも 1 回の配信へ変換するため
 */
package com.example.conversion.service;

import com.example.common.Digests;
import com.example.conversion.config.IngestProperties;
import com.example.conversion.model.ConversionEvent;
import com.example.conversion.model.EventReceipt;
import com.example.conversion.model.InboundEvent;
import com.example.conversion.model.IngestOutcome;
import com.example.conversion.model.IngestOutcome.EventDisposition;
import com.example.conversion.model.IngestOutcome.EventResult;
import com.example.conversion.model.IngestRequest;
import com.example.conversion.model.Platform;
import com.example.conversion.model.PlatformConfig;
import com.example.conversion.model.ResolvedShop;
import com.example.conversion.model.TrustLevel;
import com.example.conversion.service.ConsentFilter.ConsentDecision;
import com.example.conversion.service.DedupService.DedupDecision;
import com.example.conversion.service.EventBatchParser.BatchParseResult;
import com.example.conversion.service.EventBatchParser.ParsedBatch;
import com.example.conversion.service.auth.AuthDecision;
import com.example.conversion.service.auth.BatchAbuseDetector;
import com.example.conversion.service.auth.BatchAbuseDetector.AbuseFinding;
import com.example.conversion.service.auth.RequestAuthenticator;
import com.example.conversion.service.dispatch.DispatchService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class IngestionService {

  private static final Logger logger = LoggerFactory.getLogger(IngestionService.class);

  private final IngestProperties properties;
  private final RequestAuthenticator authenticator;
  private final BatchAbuseDetector abuseDetector;
  private final EventBatchParser parser;
  private final RequestRateLimiter rateLimiter;
  private final ShopResolver shopResolver;
  private final NonceGuard nonceGuard;
  private final DedupService dedupService;
  private final ConsentFilter consentFilter;
  private final DeliveryLedger ledger;
  private final DispatchService dispatchService;
  private final ConversionMetrics metrics;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public IngestionService(
      IngestProperties properties,
      RequestAuthenticator authenticator,
      BatchAbuseDetector abuseDetector,
      EventBatchParser parser,
      RequestRateLimiter rateLimiter,
      ShopResolver shopResolver,
      NonceGuard nonceGuard,
      DedupService dedupService,
      ConsentFilter consentFilter,
      DeliveryLedger ledger,
      DispatchService dispatchService,
      ConversionMetrics metrics,
      Clock clock,
      ObjectMapper objectMapper) {
    this.properties = properties;
    this.authenticator = authenticator;
    this.abuseDetector = abuseDetector;
    this.parser = parser;
    this.rateLimiter = rateLimiter;
    this.shopResolver = shopResolver;
    this.nonceGuard = nonceGuard;
    this.dedupService = dedupService;
    this.consentFilter = consentFilter;
    this.ledger = ledger;
    this.dispatchService = dispatchService;
    this.metrics = metrics;
    this.clock = clock;
    this.objectMapper = objectMapper;
  }

  public IngestOutcome ingest(IngestRequest request) {
    final IngestOutcome outcome = process(request);
    metrics.recordIngest(outcome.status().name().toLowerCase(Locale.ROOT));
    if (outcome.reason() != null) {
      metrics.recordRejected(outcome.reason());
    }
    return outcome;
  }

  private IngestOutcome process(IngestRequest request) {
    if (!authenticator.acceptsContentType(request.contentType())) {
      return IngestOutcome.rejected(IngestOutcome.Status.BAD_REQUEST, "unsupported_content_type");
    }
    final String rawBody = request.rawBody() == null ? "" : request.rawBody();
    if (rawBody.getBytes(StandardCharsets.UTF_8).length > properties.maxBodyBytes()) {
      return IngestOutcome.rejected(IngestOutcome.Status.PAYLOAD_TOO_LARGE, "payload_too_large");
    }
    final BatchParseResult parsed = parser.parse(rawBody);
    if (!parsed.succeeded()) {
      return IngestOutcome.rejected(IngestOutcome.Status.BAD_REQUEST, parsed.error());
    }
    final ParsedBatch batch = parsed.batch();
    final Instant now = Instant.now(clock);
    if (!withinWindow(batch.batchTimestamp(), now)) {
      // 古い/未来の本文は副作用なしで捨てる
      logger.info("batch outside timestamp window shopDomain={}", batch.shopDomain());
      return IngestOutcome.rejected(IngestOutcome.Status.IGNORED, "timestamp_out_of_window");
    }
    if (request.shopDomainHeader() != null
        && !request.shopDomainHeader().isBlank()
        && !request.shopDomainHeader().trim().equalsIgnoreCase(batch.shopDomain())) {
      return IngestOutcome.rejected(IngestOutcome.Status.BAD_REQUEST, "shop_domain_mismatch");
    }
    if (!rateLimiter.allow(batch.shopDomain())) {
      return IngestOutcome.rejected(IngestOutcome.Status.RATE_LIMITED, "rate_limited");
    }
    final Optional<String> originProblem = authenticator.precheckOrigin(request);
    if (originProblem.isPresent()) {
      return IngestOutcome.rejected(IngestOutcome.Status.FORBIDDEN, originProblem.get());
    }
    final Optional<ResolvedShop> resolved = shopResolver.resolve(batch.shopDomain());
    if (resolved.isEmpty()) {
      return IngestOutcome.rejected(IngestOutcome.Status.UNAUTHORIZED, "unknown_shop");
    }
    final AuthDecision auth = authenticator.authenticate(request, resolved.get(), batch, now);
    if (!auth.allowed()) {
      return IngestOutcome.rejected(auth.rejectStatus(), auth.reason());
    }
    if (auth.signatureMatched()) {
      final Optional<AbuseFinding> abuse = abuseDetector.inspect(batch.events());
      if (abuse.isPresent()) {
        final AbuseFinding finding = abuse.get();
        logger.warn(
            "abusive batch despite valid signature shopDomain={} events={} reasons={}",
            batch.shopDomain(),
            finding.totalEvents(),
            String.join(",", finding.reasons()));
        finding.kinds().forEach(metrics::recordAnomaly);
        if (properties.strict()) {
          return IngestOutcome.rejected(IngestOutcome.Status.FORBIDDEN, "abusive_batch");
        }
      }
    }
    return processEvents(batch, resolved.get(), auth, now);
  }

  private IngestOutcome processEvents(
      ParsedBatch batch, ResolvedShop resolved, AuthDecision auth, Instant now) {
    final UUID shopId = resolved.shop().id();
    final List<EventResult> results = new ArrayList<>();
    final List<ConversionEvent> candidates = new ArrayList<>();
    final Map<String, String> clientNonces = new HashMap<>();

    for (InboundEvent inbound : batch.events()) {
      final String eventType = inbound.eventType();
      if (!batch.shopDomain().equals(inbound.shopDomain())) {
        logger.warn("event dropped: shop domain differs from batch shopDomain={}", batch.shopDomain());
        results.add(EventResult.of(null, eventType, EventDisposition.DROPPED));
        continue;
      }
      if (!withinWindow(inbound.timestamp(), now)) {
        logger.warn("event dropped: timestamp outside window eventType={}", eventType);
        results.add(EventResult.of(null, eventType, EventDisposition.DROPPED));
        continue;
      }
      if (!resolved.shop().trackingMode().accepts(eventType)) {
        logger.debug("event dropped by tracking mode eventType={}", eventType);
        results.add(EventResult.of(null, eventType, EventDisposition.DROPPED));
        continue;
      }
      final Optional<OrderKeys.OrderKey> orderKey =
          OrderKeys.resolve(
              eventType,
              inbound.orderId(),
              inbound.checkoutToken(),
              inbound.timestamp(),
              inbound.shopDomain());
      if (orderKey.isEmpty()) {
        if (batch.singleEvent()) {
          return IngestOutcome.rejected(
              IngestOutcome.Status.BAD_REQUEST, "missing_order_identifier");
        }
        logger.warn("purchase dropped: no order id or checkout token shopId={}", shopId);
        results.add(EventResult.of(null, eventType, EventDisposition.DROPPED));
        continue;
      }
      final ConversionEvent event = toConversionEvent(inbound, orderKey.get());
      if (event.purchase() && inbound.nonce() != null && !inbound.nonce().isBlank()) {
        clientNonces.putIfAbsent(event.eventId(), inbound.nonce());
      }
      candidates.add(event);
    }

    // 記録済みの注文は nonce を見る前に no-op にする
    final DedupDecision dedup = dedupService.filter(shopId, candidates);
    for (ConversionEvent duplicate : dedup.duplicates()) {
      results.add(EventResult.of(duplicate.eventId(), duplicate.eventType(), EventDisposition.DUPLICATE));
    }

    final List<ConversionEvent> accepted = new ArrayList<>();
    int replays = 0;
    for (ConversionEvent event : dedup.fresh()) {
      final String nonce = clientNonces.get(event.eventId());
      if (nonce != null && !nonceGuard.consume(shopId, event.eventType(), event.orderKey(), nonce)) {
        logger.warn(
            "replayed purchase skipped shopId={} orderKey={}",
            shopId,
            Digests.logSafe(event.orderKey()));
        results.add(EventResult.of(event.eventId(), event.eventType(), EventDisposition.REPLAY));
        replays++;
        continue;
      }
      accepted.add(event);
    }

    for (int i = 0; i < accepted.size(); i++) {
      try {
        results.add(record(resolved, accepted.get(i), auth, now));
      } catch (RuntimeException ex) {
        // 未記録分の nonce を戻し、クライアントの再送で同じイベントを受け付けられるようにする
        releaseNonces(shopId, accepted.subList(i, accepted.size()), clientNonces);
        throw ex;
      }
    }

    logger.info(
        "ingest processed shopId={} events={} recorded={} duplicates={} replays={} trust={}",
        shopId,
        batch.events().size(),
        accepted.size(),
        dedup.duplicates().size(),
        replays,
        auth.trustLevel());
    return new IngestOutcome(
        properties.asyncDispatch() ? IngestOutcome.Status.ACCEPTED : IngestOutcome.Status.PROCESSED,
        null,
        results);
  }

  private void releaseNonces(
      UUID shopId, List<ConversionEvent> unrecorded, Map<String, String> clientNonces) {
    for (ConversionEvent event : unrecorded) {
      final String nonce = clientNonces.get(event.eventId());
      if (nonce != null) {
        nonceGuard.release(shopId, event.eventType(), event.orderKey(), nonce);
      }
    }
  }

  private EventResult record(
      ResolvedShop resolved, ConversionEvent event, AuthDecision auth, Instant now) {
    final UUID shopId = resolved.shop().id();
    final ConsentDecision consent = consentFilter.evaluate(event.consent(), resolved.platformConfigs());
    final List<String> platformNames =
        consent.included().stream().map(config -> config.platform().wireName()).toList();
    final Map<String, String> skipped = new LinkedHashMap<>();
    for (Map.Entry<Platform, String> entry : consent.skipped().entrySet()) {
      skipped.put(entry.getKey().wireName(), entry.getValue());
    }

    // 購入でトークンが無い場合は署名済みでも PARTIAL に落とす
    final TrustLevel trust =
        event.purchase() && event.checkoutToken() == null && auth.trustLevel() == TrustLevel.TRUSTED
            ? TrustLevel.PARTIAL
            : auth.trustLevel();
    final EventReceipt receipt =
        new EventReceipt(
            UUID.randomUUID(),
            shopId,
            event.eventId(),
            event.eventType(),
            event.orderKey(),
            event.altOrderKey(),
            auth.originHost(),
            String.join(",", platformNames),
            trust,
            auth.signatureMatched(),
            writeConsent(event),
            event.value(),
            event.currency(),
            now);
    final List<PlatformConfig> included = consent.included();
    if (!included.isEmpty() && properties.asyncDispatch()) {
      final Optional<Map<String, String>> queued =
          dispatchService.enqueueWithReceipt(receipt, event, included);
      if (queued.isEmpty()) {
        return EventResult.of(event.eventId(), event.eventType(), EventDisposition.DUPLICATE);
      }
      return new EventResult(
          event.eventId(),
          event.eventType(),
          EventDisposition.QUEUED,
          platformNames,
          skipped,
          queued.get());
    }
    if (!ledger.recordReceipt(receipt)) {
      return EventResult.of(event.eventId(), event.eventType(), EventDisposition.DUPLICATE);
    }
    if (included.isEmpty()) {
      return new EventResult(
          event.eventId(), event.eventType(), EventDisposition.RECORDED, List.of(), skipped, null);
    }
    final Map<String, String> deliveries =
        dispatchService.dispatchNow(receipt.id(), shopId, event, included);
    return new EventResult(
        event.eventId(), event.eventType(), EventDisposition.RECORDED, platformNames, skipped, deliveries);
  }

  private ConversionEvent toConversionEvent(InboundEvent inbound, OrderKeys.OrderKey key) {
    final String nonce =
        key.hasIdentifier()
            ? ""
            : inbound.nonce() != null ? inbound.nonce() : String.valueOf(inbound.timestamp());
    final String eventId =
        EventIds.compute(
            inbound.shopDomain(), key.orderKey(), inbound.eventType(), inbound.items(), nonce);
    final String token =
        inbound.checkoutToken() == null || inbound.checkoutToken().isBlank()
            ? null
            : inbound.checkoutToken();
    return new ConversionEvent(
        eventId,
        inbound.eventType(),
        inbound.shopDomain(),
        key.orderKey(),
        key.altOrderKey(),
        key.orderId(),
        token,
        Instant.ofEpochMilli(inbound.timestamp()),
        inbound.value(),
        inbound.currency(),
        inbound.items(),
        inbound.consent());
  }

  private String writeConsent(ConversionEvent event) {
    final Map<String, Boolean> consent = new LinkedHashMap<>();
    consent.put("marketing", event.consent().marketing());
    consent.put("analytics", event.consent().analytics());
    consent.put("saleOfData", event.consent().saleOfData());
    try {
      return objectMapper.writeValueAsString(consent);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize consent", ex);
    }
  }

  private boolean withinWindow(long timestampMillis, Instant now) {
    final Duration skew = Duration.between(Instant.ofEpochMilli(timestampMillis), now).abs();
    return skew.compareTo(properties.timestampWindow()) <= 0;
  }
}
