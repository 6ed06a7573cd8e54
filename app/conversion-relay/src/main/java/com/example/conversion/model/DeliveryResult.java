package com.example.conversion.model;

/** アダプタ 1 回の呼び出し結果。失敗も例外ではなく値で返す。 */
public record DeliveryResult(boolean ok, Integer statusCode, String error, String requestJson) {

  public static DeliveryResult success(Integer statusCode, String requestJson) {
    return new DeliveryResult(true, statusCode, null, requestJson);
  }

  public static DeliveryResult failure(Integer statusCode, String error, String requestJson) {
    return new DeliveryResult(false, statusCode, error, requestJson);
  }
}
