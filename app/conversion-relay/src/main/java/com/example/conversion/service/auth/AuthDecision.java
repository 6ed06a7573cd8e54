package com.example.conversion.service.auth;

import com.example.conversion.model.IngestOutcome;
import com.example.conversion.model.TrustLevel;

/** 受信リクエストの認証結果。拒否時は rejectStatus と reason を持つ。 */
public record AuthDecision(
    boolean allowed,
    IngestOutcome.Status rejectStatus,
    String reason,
    TrustLevel trustLevel,
    boolean signatureMatched,
    boolean usedPreviousSecret,
    String originHost) {

  static AuthDecision reject(IngestOutcome.Status status, String reason) {
    return new AuthDecision(false, status, reason, TrustLevel.UNTRUSTED, false, false, null);
  }

  static AuthDecision allow(
      TrustLevel trustLevel, boolean signatureMatched, boolean usedPreviousSecret, String originHost) {
    return new AuthDecision(true, null, null, trustLevel, signatureMatched, usedPreviousSecret, originHost);
  }
}
