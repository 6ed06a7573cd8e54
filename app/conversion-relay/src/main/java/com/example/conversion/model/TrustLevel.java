package com.example.conversion.model;

/** 受信イベントの真正性をどこまで確認できたか。 */
public enum TrustLevel {
  TRUSTED,
  PARTIAL,
  UNTRUSTED
}
