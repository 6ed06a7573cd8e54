package com.example.conversion.model;

/** 受信エンドポイントに届いた生の入力。rawBody は署名検証のため加工しない。 */
public record IngestRequest(
    String contentType,
    String rawBody,
    String origin,
    String referer,
    String signature,
    String signatureTimestamp,
    String shopDomainHeader,
    String requestId) {

  public boolean signed() {
    return signature != null && !signature.isBlank();
  }
}
