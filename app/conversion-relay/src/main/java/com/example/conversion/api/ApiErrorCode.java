/*
 * どこで: Conversion Relay API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.conversion.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  UNAUTHORIZED,
  FORBIDDEN,
  NOT_FOUND,
  PAYLOAD_TOO_LARGE,
  RATE_LIMITED,
  METHOD_NOT_ALLOWED,
  CONFIG_INVALID,
  SERVICE_UNAVAILABLE
}
