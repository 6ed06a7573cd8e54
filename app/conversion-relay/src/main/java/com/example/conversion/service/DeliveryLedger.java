/*
 * どこで: Conversion Relay 配信台帳
 * 何を: 受信レシートと配信試行の記録/参照をまとめる
 * なぜ: 重複排除と突合が同じ記録を根拠にできるようにするため
 */
package com.example.conversion.service;

import com.example.common.Digests;
import com.example.conversion.model.ConversionEvent;
import com.example.conversion.model.DeliveryAttempt;
import com.example.conversion.model.DeliveryResult;
import com.example.conversion.model.DeliveryStatus;
import com.example.conversion.model.EventReceipt;
import com.example.conversion.model.Platform;
import com.example.conversion.repository.DeliveryAttemptRepository;
import com.example.conversion.repository.EventReceiptRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeliveryLedger {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryLedger.class);

  private final EventReceiptRepository eventReceiptRepository;
  private final DeliveryAttemptRepository deliveryAttemptRepository;
  private final Clock clock;

  /**
   * レシートを記録する。
   *
   * @return 新規に記録できた場合 true。一意制約に負けた場合は重複として false
   */
  public boolean recordReceipt(EventReceipt receipt) {
    final boolean inserted = eventReceiptRepository.insertIfAbsent(receipt);
    if (!inserted) {
      logger.info(
          "receipt already recorded shopId={} eventId={} orderKey={}",
          receipt.shopId(),
          receipt.eventId(),
          Digests.logSafe(receipt.orderKey()));
    }
    return inserted;
  }

  /** 1 回の送信結果を追記する。status は呼び出し側がリトライ可否から決める。 */
  public DeliveryAttempt recordAttempt(
      UUID receiptId,
      UUID shopId,
      ConversionEvent event,
      Platform platform,
      DeliveryStatus status,
      DeliveryResult result,
      Instant attemptedAt) {
    final DeliveryAttempt attempt =
        new DeliveryAttempt(
            UUID.randomUUID(),
            receiptId,
            shopId,
            event.eventId(),
            platform,
            status,
            result.statusCode(),
            result.error(),
            result.requestJson(),
            event.orderKey(),
            event.value(),
            event.currency(),
            attemptedAt,
            Instant.now(clock));
    deliveryAttemptRepository.insert(attempt);
    if (status != DeliveryStatus.OK) {
      logger.warn(
          "delivery attempt not ok shopId={} eventId={} platform={} status={} statusCode={} error={}",
          shopId,
          event.eventId(),
          platform.wireName(),
          status.dbValue(),
          result.statusCode(),
          result.error());
    }
    return attempt;
  }

  public List<DeliveryAttempt> attemptsForEvent(UUID shopId, String eventId) {
    return deliveryAttemptRepository.findByShopAndEvent(shopId, eventId);
  }

  /** 注文キーごとの ok 試行をすべて返す。最新を正とする判断は呼び出し側で行う。 */
  public List<DeliveryAttempt> okAttemptsForOrders(UUID shopId, Collection<String> orderKeys) {
    return deliveryAttemptRepository.findOkByOrderKeys(shopId, orderKeys);
  }
}
