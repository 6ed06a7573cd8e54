/*
 * どこで: Conversion Relay 送信アダプタ共通
 * 何を: JSON POST の実行と失敗分類（HTTP エラー/タイムアウト/接続失敗/エラー本文）を行う
 * なぜ: どのアダプタでも失敗を握りつぶさず同じ形の結果へ落とすため
 */
package com.example.conversion.service.dispatch;

import com.example.conversion.config.DispatchProperties;
import com.example.conversion.model.DeliveryResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
public class PlatformHttpClient {

  private static final Logger logger = LoggerFactory.getLogger(PlatformHttpClient.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient platformRestClient;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final DispatchProperties properties;

  public PlatformHttpClient(
      RestClient platformRestClient, ObjectMapper objectMapper, DispatchProperties properties) {
    this.platformRestClient = platformRestClient;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /** 2xx 応答本文からエラー文言を取り出す。エラーでなければ null。 */
  @FunctionalInterface
  public interface ResponseInspector {
    String errorIn(JsonNode body);
  }

  public DeliveryResult postJson(
      String platform,
      URI uri,
      Map<String, String> headers,
      Object body,
      ResponseInspector inspector) {
    final String requestJson;
    try {
      requestJson = objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException ex) {
      logger.warn("{} request serialization failed", platform, ex);
      return DeliveryResult.failure(null, "serialization_failed", null);
    }
    try {
      final ResponseEntity<String> response =
          platformRestClient
              .post()
              .uri(uri)
              .headers(httpHeaders -> headers.forEach(httpHeaders::set))
              .contentType(MediaType.APPLICATION_JSON)
              .body(requestJson)
              .retrieve()
              .toEntity(String.class);
      final int status = response.getStatusCode().value();
      final String error = inspect(response.getBody(), inspector);
      if (error != null) {
        logger.warn("{} reported error in 2xx response status={}", platform, status);
        return DeliveryResult.failure(status, truncate(error), requestJson);
      }
      return DeliveryResult.success(status, requestJson);
    } catch (RestClientResponseException ex) {
      final int status = ex.getStatusCode().value();
      logger.warn("{} delivery failed with http status={}", platform, status);
      return DeliveryResult.failure(
          status, truncate("http_" + status + ": " + ex.getResponseBodyAsString()), requestJson);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("{} delivery timed out", platform);
        return DeliveryResult.failure(null, "timeout", requestJson);
      }
      logger.warn("{} delivery connection failed", platform, ex);
      return DeliveryResult.failure(null, truncate("connection_failed: " + ex.getMessage()), requestJson);
    } catch (RuntimeException ex) {
      logger.warn("{} delivery failed unexpectedly", platform, ex);
      return DeliveryResult.failure(
          null, truncate("unexpected_error: " + ex.getClass().getSimpleName()), requestJson);
    }
  }

  private String inspect(String responseBody, ResponseInspector inspector) {
    if (inspector == null || responseBody == null || responseBody.isBlank()) {
      return null;
    }
    try {
      return inspector.errorIn(objectMapper.readTree(responseBody));
    } catch (JsonProcessingException ex) {
      // 2xx で JSON 以外が返るのは成功扱い
      return null;
    }
  }

  private String truncate(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
