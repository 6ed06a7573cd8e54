package com.example.conversion.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.conversion.config.TaskProperties;
import com.example.conversion.repository.DispatchJobRepository;
import com.example.conversion.repository.EventNonceRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CleanupServiceTest {

  private static final Instant NOW = Instant.parse("2026-10-19T00:00:00Z");

  @Mock private EventNonceRepository eventNonceRepository;
  @Mock private DispatchJobRepository dispatchJobRepository;

  @Test
  void deletesNoncesInBatchesUntilShortBatch() {
    final TaskProperties properties =
        new TaskProperties(
            null, null, false, null, null, 0, null, null, null, 100, Duration.ofDays(7), null);
    when(eventNonceRepository.deleteExpired(NOW, 100)).thenReturn(100, 100, 42);
    when(dispatchJobRepository.deleteFinishedOlderThan(NOW.minus(Duration.ofDays(7)))).thenReturn(5);

    final Map<String, Object> result =
        new CleanupService(
                eventNonceRepository,
                dispatchJobRepository,
                properties,
                Clock.fixed(NOW, ZoneOffset.UTC))
            .cleanup();

    assertThat(result).containsEntry("deleted_nonces", 242).containsEntry("deleted_dispatch_jobs", 5);
    verify(eventNonceRepository, times(3)).deleteExpired(NOW, 100);
  }
}
