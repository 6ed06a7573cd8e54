/*
 * どこで: Conversion Relay ドメインモデル
 * 何を: 受信リクエスト 1 件の処理結果を表す
 * なぜ: 認証失敗や重複を例外でなく値で返し、HTTP ステータスへの写像を 1 か所にするため
 */
package com.example.conversion.model;

import java.util.List;
import java.util.Map;

public record IngestOutcome(Status status, String reason, List<EventResult> events) {

  public enum Status {
    PROCESSED,
    ACCEPTED,
    IGNORED,
    BAD_REQUEST,
    UNAUTHORIZED,
    FORBIDDEN,
    PAYLOAD_TOO_LARGE,
    RATE_LIMITED
  }

  public IngestOutcome {
    events = events == null ? List.of() : List.copyOf(events);
  }

  public static IngestOutcome rejected(Status status, String reason) {
    return new IngestOutcome(status, reason, List.of());
  }

  /** イベント単位の処理結果。 */
  public record EventResult(
      String eventId,
      String eventType,
      EventDisposition disposition,
      List<String> platforms,
      Map<String, String> skipped,
      Map<String, String> deliveries) {

    public EventResult {
      platforms = platforms == null ? List.of() : List.copyOf(platforms);
      skipped = skipped == null ? Map.of() : Map.copyOf(skipped);
      deliveries = deliveries == null ? Map.of() : Map.copyOf(deliveries);
    }

    public static EventResult of(String eventId, String eventType, EventDisposition disposition) {
      return new EventResult(eventId, eventType, disposition, null, null, null);
    }
  }

  public enum EventDisposition {
    RECORDED,
    QUEUED,
    DUPLICATE,
    REPLAY,
    DROPPED
  }
}
