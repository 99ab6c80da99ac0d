package com.relaybox.application.service;

import com.relaybox.application.port.out.ConsumerCursorRepository;
import com.relaybox.application.port.out.MetricsPort;
import com.relaybox.application.port.out.OutboxRepository;
import com.relaybox.infrastructure.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RetentionWorker")
class RetentionWorkerTest {

    private static final Instant NOW = Instant.parse("2026-04-10T00:00:00Z");
    private static final Instant CUTOFF = NOW.minus(168, ChronoUnit.HOURS);

    @Mock
    private OutboxRepository outboxRepository;

    @Mock
    private ConsumerCursorRepository cursorRepository;

    @Mock
    private MetricsPort metrics;

    private AppProperties appProperties;
    private RetentionWorker worker;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        appProperties.getRetention().setConsumerIds(List.of("queue-relay", "search-indexer"));
        appProperties.getRetention().setBatchSize(100);
        appProperties.getRetention().setMaxBatchesPerRun(3);
        worker = new RetentionWorker(outboxRepository, cursorRepository, metrics,
            Clock.fixed(NOW, ZoneOffset.UTC), appProperties);
    }

    @Test
    @DisplayName("Should not delete anything while a configured consumer has no cursor")
    void shouldAbortWithoutWatermark() {
        // Given
        when(cursorRepository.findRetentionWatermark(List.of("queue-relay", "search-indexer"))).thenReturn(OptionalLong.empty());

        // When
        int deleted = worker.runOnce();

        // Then
        assertEquals(0, deleted);
        verifyNoInteractions(outboxRepository);
    }

    @Test
    @DisplayName("Should delete up to the watermark and stop at the first short batch")
    void shouldStopAtShortBatch() {
        // Given
        when(cursorRepository.findRetentionWatermark(any())).thenReturn(OptionalLong.of(500));
        when(outboxRepository.deleteRetained(500, CUTOFF, 100)).thenReturn(100, 40);

        // When
        int deleted = worker.runOnce();

        // Then
        assertEquals(140, deleted);
        verify(outboxRepository, times(2)).deleteRetained(500, CUTOFF, 100);
        verify(metrics).incrementRetentionDeleted(140);
    }

    @Test
    @DisplayName("Should bound the number of batches per run")
    void shouldBoundBatches() {
        // Given
        when(cursorRepository.findRetentionWatermark(any())).thenReturn(OptionalLong.of(10_000));
        when(outboxRepository.deleteRetained(anyLong(), any(), anyInt())).thenReturn(100);

        // When
        int deleted = worker.runOnce();

        // Then
        assertEquals(300, deleted);
        verify(outboxRepository, times(3)).deleteRetained(10_000, CUTOFF, 100);
    }

    @Test
    @DisplayName("Should do nothing without configured consumers")
    void shouldSkipWithoutConsumers() {
        appProperties.getRetention().setConsumerIds(List.of());

        assertEquals(0, worker.runOnce());
        verifyNoInteractions(cursorRepository, outboxRepository);
    }

    @Test
    @DisplayName("Should swallow storage failures in the scheduled run")
    void shouldSurviveStorageFailure() {
        when(cursorRepository.findRetentionWatermark(any())).thenThrow(new DataAccessResourceFailureException("down"));

        assertDoesNotThrow(worker::scheduledRun);
    }
}
