/*
 * どこで: Conversion Relay 受信 API
 * 何を: POST /ingest の生本文を上限付きで読み、受信パイプラインの結果を HTTP ステータスへ写す
 * なぜ: 署名検証に加工前の本文が必要で、巨大な本文を読み切る前に打ち切るため
 */
package com.example.conversion.api;

import com.example.conversion.api.response.IngestResponse;
import com.example.conversion.config.IngestProperties;
import com.example.conversion.config.RequestMdcInterceptor;
import com.example.conversion.model.IngestOutcome;
import com.example.conversion.model.IngestRequest;
import com.example.conversion.service.IngestionService;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class IngestController {

  private final IngestionService ingestionService;
  private final IngestProperties properties;

  @PostMapping("/ingest")
  public ResponseEntity<Object> ingest(HttpServletRequest request) throws IOException {
    final String requestId = RequestMdcInterceptor.requestIdOf(request);
    final int maxBodyBytes = properties.maxBodyBytes();
    if (request.getContentLengthLong() > maxBodyBytes) {
      return error(HttpStatus.PAYLOAD_TOO_LARGE, ApiErrorCode.PAYLOAD_TOO_LARGE, "payload_too_large");
    }
    final byte[] body;
    try (InputStream in = request.getInputStream()) {
      // Content-Length を偽った本文も上限 + 1 バイトで打ち切る
      body = in.readNBytes(maxBodyBytes + 1);
    }
    if (body.length > maxBodyBytes) {
      return error(HttpStatus.PAYLOAD_TOO_LARGE, ApiErrorCode.PAYLOAD_TOO_LARGE, "payload_too_large");
    }
    final IngestRequest ingestRequest =
        new IngestRequest(
            request.getContentType(),
            new String(body, StandardCharsets.UTF_8),
            request.getHeader(HttpHeaders.ORIGIN),
            request.getHeader(HttpHeaders.REFERER),
            request.getHeader(properties.signatureHeader()),
            request.getHeader(properties.timestampHeader()),
            request.getHeader(properties.shopDomainHeader()),
            requestId);
    return toResponse(requestId, ingestionService.ingest(ingestRequest));
  }

  private ResponseEntity<Object> toResponse(String requestId, IngestOutcome outcome) {
    return switch (outcome.status()) {
      case PROCESSED -> ResponseEntity.ok(IngestResponse.from(requestId, outcome));
      case ACCEPTED ->
          ResponseEntity.status(HttpStatus.ACCEPTED).body(IngestResponse.from(requestId, outcome));
      case IGNORED -> ResponseEntity.noContent().build();
      case BAD_REQUEST -> error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, outcome.reason());
      case UNAUTHORIZED ->
          error(HttpStatus.UNAUTHORIZED, ApiErrorCode.UNAUTHORIZED, outcome.reason());
      case FORBIDDEN -> error(HttpStatus.FORBIDDEN, ApiErrorCode.FORBIDDEN, outcome.reason());
      case PAYLOAD_TOO_LARGE ->
          error(HttpStatus.PAYLOAD_TOO_LARGE, ApiErrorCode.PAYLOAD_TOO_LARGE, outcome.reason());
      case RATE_LIMITED ->
          error(HttpStatus.TOO_MANY_REQUESTS, ApiErrorCode.RATE_LIMITED, outcome.reason());
    };
  }

  private static ResponseEntity<Object> error(HttpStatus status, ApiErrorCode code, String reason) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, reason));
  }
}
