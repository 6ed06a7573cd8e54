package com.example.conversion.service.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.common.Digests;
import com.example.conversion.config.TaskProperties;
import com.example.conversion.service.InMemorySharedStore;
import com.example.conversion.service.SharedStore;
import com.example.conversion.service.auth.TaskTriggerAuthenticator.TaskAuthResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

class TaskTriggerAuthenticatorTest {

  private static final Instant NOW = Instant.parse("2026-10-19T03:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
  private static final String SECRET = "s".repeat(32);
  private static final String PREVIOUS = "p".repeat(32);

  @Test
  void notConfiguredWhenSecretMissingOrShort() {
    assertThat(authenticator(properties("", false)).authenticate("Bearer x", null, null).status())
        .isEqualTo(TaskAuthResult.Status.NOT_CONFIGURED);
    assertThat(
            authenticator(properties("short", false))
                .authenticate("Bearer short", null, null)
                .reason())
        .isEqualTo("cron_secret_too_short");
  }

  @Test
  void rejectsMissingOrWrongBearer() {
    final TaskTriggerAuthenticator authenticator = authenticator(properties(SECRET, false));

    assertThat(authenticator.authenticate(null, null, null).reason()).isEqualTo("missing_bearer");
    assertThat(authenticator.authenticate("Bearer nope", null, null).reason())
        .isEqualTo("invalid_secret");
  }

  @Test
  void acceptsPreviousSecretDuringRotation() {
    final TaskAuthResult result =
        authenticator(properties(SECRET, false)).authenticate("Bearer " + PREVIOUS, null, null);

    assertThat(result.authenticated()).isTrue();
    assertThat(result.usedPreviousSecret()).isTrue();
  }

  @Test
  void strictReplayRequiresTimestampAndSignature() {
    final TaskAuthResult result =
        authenticator(properties(SECRET, true)).authenticate("Bearer " + SECRET, null, null);

    assertThat(result.status()).isEqualTo(TaskAuthResult.Status.UNAUTHORIZED);
    assertThat(result.reason()).isEqualTo("missing_replay_headers");
  }

  @Test
  void signedRequestIsAcceptedOnceThenReportedAsReplay() {
    final TaskTriggerAuthenticator authenticator = authenticator(properties(SECRET, true));
    final String ts = Long.toString(NOW.getEpochSecond());
    final String signature = Digests.hmacSha256Hex(SECRET, ts);

    final TaskAuthResult first = authenticator.authenticate("Bearer " + SECRET, ts, signature);
    final TaskAuthResult second = authenticator.authenticate("Bearer " + SECRET, ts, signature);

    assertThat(first.authenticated()).isTrue();
    assertThat(second.reason()).isEqualTo("replay_detected");
  }

  @Test
  void staleTimestampIsRejected() {
    final String ts = Long.toString(NOW.minus(Duration.ofMinutes(10)).getEpochSecond());

    final TaskAuthResult result =
        authenticator(properties(SECRET, true))
            .authenticate("Bearer " + SECRET, ts, Digests.hmacSha256Hex(SECRET, ts));

    assertThat(result.reason()).isEqualTo("stale_timestamp");
  }

  @Test
  void extremeTimestampsAreStaleInsteadOfFailing() {
    final TaskTriggerAuthenticator authenticator = authenticator(properties(SECRET, true));

    for (long extreme : new long[] {Long.MAX_VALUE, Long.MIN_VALUE}) {
      final String ts = Long.toString(extreme);
      final TaskAuthResult result =
          authenticator.authenticate("Bearer " + SECRET, ts, Digests.hmacSha256Hex(SECRET, ts));

      assertThat(result.status()).isEqualTo(TaskAuthResult.Status.UNAUTHORIZED);
      assertThat(result.reason()).isEqualTo("stale_timestamp");
    }
  }

  @Test
  void signatureMustBeMadeWithTheMatchedSecret() {
    final String ts = Long.toString(NOW.getEpochSecond());

    final TaskAuthResult result =
        authenticator(properties(SECRET, true))
            .authenticate("Bearer " + SECRET, ts, Digests.hmacSha256Hex(PREVIOUS, ts));

    assertThat(result.reason()).isEqualTo("invalid_signature");
  }

  @Test
  void replayStoreFailureFailsClosed() {
    final SharedStore store = mock(SharedStore.class);
    when(store.setIfAbsent(anyString(), anyString(), any(Duration.class)))
        .thenThrow(new QueryTimeoutException("redis down"));
    final TaskTriggerAuthenticator authenticator =
        new TaskTriggerAuthenticator(properties(SECRET, true), store, CLOCK);
    final String ts = Long.toString(NOW.getEpochSecond());

    final TaskAuthResult result =
        authenticator.authenticate("Bearer " + SECRET, ts, Digests.hmacSha256Hex(SECRET, ts));

    assertThat(result.status()).isEqualTo(TaskAuthResult.Status.STORE_ERROR);
  }

  private static TaskTriggerAuthenticator authenticator(TaskProperties properties) {
    return new TaskTriggerAuthenticator(properties, new InMemorySharedStore(CLOCK), CLOCK);
  }

  private static TaskProperties properties(String secret, boolean strictReplay) {
    return new TaskProperties(
        secret, PREVIOUS, strictReplay, Duration.ofMinutes(5), null, 32, null, null, null, 0, null, null);
  }
}
