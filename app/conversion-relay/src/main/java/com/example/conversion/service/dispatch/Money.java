package com.example.conversion.service.dispatch;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class Money {

  private Money() {}

  static double asFloat(BigDecimal value) {
    return value == null ? 0.0d : value.doubleValue();
  }

  /** 小数 2 桁の文字列（Pinterest は value を文字列で受け取る）。 */
  static String asDecimalString(BigDecimal value) {
    final BigDecimal safe = value == null ? BigDecimal.ZERO : value;
    return safe.setScale(2, RoundingMode.HALF_UP).toPlainString();
  }
}
