/*
 * どこで: Conversion Relay 受信パイプライン
 * 何を: 単一イベント/バッチ形式の本文を InboundEvent の列へ変換する
 * なぜ: 以降の処理を 1 種類の内部表現だけで書けるようにするため
 */
package com.example.conversion.service;

import com.example.conversion.config.IngestProperties;
import com.example.conversion.model.ConsentState;
import com.example.conversion.model.InboundEvent;
import com.example.conversion.model.LineItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class EventBatchParser {

  private static final Logger logger = LoggerFactory.getLogger(EventBatchParser.class);
  private static final Pattern SHOP_DOMAIN = Pattern.compile("^[a-z0-9][a-z0-9-]*\\.myshopify\\.com$");
  private static final List<String> ITEM_ID_FIELDS =
      List.of("variantId", "variant_id", "productId", "product_id", "id");

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final IngestProperties properties;

  public EventBatchParser(ObjectMapper objectMapper, IngestProperties properties) {
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  public BatchParseResult parse(String rawBody) {
    final JsonNode root;
    try {
      root = objectMapper.readTree(rawBody);
    } catch (JsonProcessingException ex) {
      return BatchParseResult.error("invalid_json");
    }
    if (root == null || !root.isObject()) {
      return BatchParseResult.error("invalid_body");
    }
    final boolean batch = root.has("events");
    final List<JsonNode> nodes = new ArrayList<>();
    if (batch) {
      final JsonNode events = root.get("events");
      if (!events.isArray()) {
        return BatchParseResult.error("invalid_body");
      }
      events.forEach(nodes::add);
      if (nodes.isEmpty()) {
        return BatchParseResult.error("empty_batch");
      }
      if (nodes.size() > properties.maxBatchSize()) {
        return BatchParseResult.error("batch_too_large");
      }
    } else {
      nodes.add(root);
    }

    final List<InboundEvent> events = new ArrayList<>();
    int dropped = 0;
    for (int i = 0; i < nodes.size(); i++) {
      final Optional<InboundEvent> event = parseEvent(nodes.get(i));
      if (event.isPresent()) {
        events.add(event.get());
        continue;
      }
      if (i == 0) {
        // 先頭イベントはショップ解決と時刻窓判定の基準なので、不正なら全体を拒否する
        return BatchParseResult.error("invalid_event");
      }
      logger.warn("batch event dropped by schema validation index={}", i);
      dropped++;
    }

    final InboundEvent first = events.get(0);
    final JsonNode batchTimestamp = batch ? root.get("timestamp") : null;
    final long timestamp =
        batchTimestamp != null && batchTimestamp.isNumber()
            ? batchTimestamp.asLong()
            : first.timestamp();
    return BatchParseResult.ok(
        new ParsedBatch(events, timestamp, first.shopDomain(), dropped, !batch));
  }

  private Optional<InboundEvent> parseEvent(JsonNode node) {
    if (node == null || !node.isObject()) {
      return Optional.empty();
    }
    final String eventName = text(node.get("eventName"));
    final JsonNode timestamp = node.get("timestamp");
    final String shopDomain = text(node.get("shopDomain"));
    if (eventName == null
        || timestamp == null
        || !timestamp.isNumber()
        || shopDomain == null
        || !SHOP_DOMAIN.matcher(shopDomain).matches()) {
      return Optional.empty();
    }
    final Optional<ConsentState> consent = parseConsent(node.get("consent"));
    if (consent.isEmpty()) {
      return Optional.empty();
    }
    final JsonNode data = node.get("data");
    if (data != null && !data.isNull() && !data.isObject()) {
      return Optional.empty();
    }
    final JsonNode safeData = data == null ? objectMapper.createObjectNode() : data;
    return Optional.of(
        new InboundEvent(
            eventName,
            timestamp.asLong(),
            shopDomain,
            consent.get(),
            text(node.get("nonce")),
            scalarText(safeData.get("orderId")),
            text(safeData.get("checkoutToken")),
            parseItems(safeData.get("items")),
            decimal(safeData.get("value")),
            text(safeData.get("currency"))));
  }

  private Optional<ConsentState> parseConsent(JsonNode node) {
    if (node == null || node.isNull()) {
      return Optional.of(ConsentState.NONE);
    }
    if (!node.isObject()) {
      return Optional.empty();
    }
    final JsonNode marketing = node.get("marketing");
    final JsonNode analytics = node.get("analytics");
    final JsonNode saleOfData = node.get("saleOfData");
    if (!booleanOrAbsent(marketing) || !booleanOrAbsent(analytics) || !booleanOrAbsent(saleOfData)) {
      return Optional.empty();
    }
    return Optional.of(new ConsentState(bool(marketing), bool(analytics), bool(saleOfData)));
  }

  private List<LineItem> parseItems(JsonNode node) {
    if (node == null || !node.isArray()) {
      return List.of();
    }
    final List<LineItem> items = new ArrayList<>();
    for (JsonNode item : node) {
      if (!item.isObject()) {
        continue;
      }
      String id = null;
      for (String field : ITEM_ID_FIELDS) {
        id = scalarText(item.get(field));
        if (id != null) {
          break;
        }
      }
      if (id == null) {
        continue;
      }
      final JsonNode quantity = item.get("quantity");
      final int normalized =
          quantity != null && quantity.isNumber()
              ? (int)
                  Math.min(
                      Integer.MAX_VALUE, Math.max(1L, (long) Math.floor(quantity.asDouble())))
              : 1;
      items.add(new LineItem(id, normalized));
    }
    return items;
  }

  private boolean booleanOrAbsent(JsonNode node) {
    return node == null || node.isNull() || node.isBoolean();
  }

  private Boolean bool(JsonNode node) {
    return node == null || node.isNull() ? null : node.asBoolean();
  }

  private String text(JsonNode node) {
    if (node == null || !node.isTextual() || node.asText().isBlank()) {
      return null;
    }
    return node.asText().trim();
  }

  // ID は数値で送られてくることもある
  private String scalarText(JsonNode node) {
    if (node != null && node.isIntegralNumber()) {
      return node.asText();
    }
    return text(node);
  }

  private BigDecimal decimal(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      return node.decimalValue();
    }
    final String text = text(node);
    if (text == null) {
      return null;
    }
    try {
      return new BigDecimal(text);
    } catch (NumberFormatException ex) {
      logger.debug("non-numeric value ignored");
      return null;
    }
  }

  /** 受信本文のうち、スキーマ検証を通ったイベント群。 */
  public record ParsedBatch(
      List<InboundEvent> events,
      long batchTimestamp,
      String shopDomain,
      int droppedInvalid,
      boolean singleEvent) {

    public ParsedBatch {
      events = List.copyOf(events);
    }
  }

  /** batch と error のどちらか一方だけが non-null。 */
  public record BatchParseResult(ParsedBatch batch, String error) {

    static BatchParseResult ok(ParsedBatch batch) {
      return new BatchParseResult(batch, null);
    }

    static BatchParseResult error(String error) {
      return new BatchParseResult(null, error);
    }

    public boolean succeeded() {
      return batch != null;
    }
  }
}
