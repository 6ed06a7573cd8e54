package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class DigestsTest {

  @Test
  void sha256HexMatchesKnownVector() {
    assertThat(Digests.sha256Hex("abc"))
        .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
  }

  @Test
  void hmacSha256HexMatchesRfc4231Vector() {
    // RFC 4231 test case 2
    assertThat(Digests.hmacSha256Hex("Jefe", "what do ya want for nothing?"))
        .isEqualTo("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
  }

  @Test
  void constantTimeEqualsRejectsNullAndDifferentLength() {
    assertThat(Digests.constantTimeEquals("abc", "abc")).isTrue();
    assertThat(Digests.constantTimeEquals("abc", "abcd")).isFalse();
    assertThat(Digests.constantTimeEquals(null, "abc")).isFalse();
  }

  @Test
  void logSafeKeepsOnlyHashPrefix() {
    assertThat(Digests.logSafe("abc")).isEqualTo("ba7816bf8f01");
    assertThat(Digests.logSafe(null)).isEqualTo("-");
  }
}
