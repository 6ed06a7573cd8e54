package com.example.conversion.model;

public enum Severity {
  INFO,
  WARNING,
  CRITICAL;

  /** 欠落率 10% 超で CRITICAL、5% 超で WARNING。 */
  public static Severity forMissingRate(double missingRate) {
    if (missingRate > 0.10d) {
      return CRITICAL;
    }
    if (missingRate > 0.05d) {
      return WARNING;
    }
    return INFO;
  }
}
