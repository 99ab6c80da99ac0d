package com.relaybox.adapter.in.web;

import com.relaybox.application.port.in.InspectRelayUseCase;
import com.relaybox.domain.cursor.ConsumerCursor;
import com.relaybox.domain.cursor.DeadLetter;
import com.relaybox.domain.queue.CronSchedule;
import com.relaybox.domain.queue.MessageStatus;
import com.relaybox.domain.queue.QueueMessage;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/ops")
@Tag(name = "Operations", description = "Inspection and repair of consumers, queues and schedules")
public class OpsController {

    private static final int DEFAULT_LIMIT = 50;

    private final InspectRelayUseCase inspectRelayUseCase;
    private final Clock clock;

    public OpsController(InspectRelayUseCase inspectRelayUseCase, Clock clock) {
        this.inspectRelayUseCase = inspectRelayUseCase;
        this.clock = clock;
    }

    @GetMapping("/consumers")
    @Operation(summary = "List consumer cursors", description = "Cursor, pending ids, retry and lock state of every registered consumer")
    public List<ConsumerResponse> listConsumers() {
        Instant now = clock.instant();
        return inspectRelayUseCase.listConsumers().stream()
            .map(c -> ConsumerResponse.from(c, now))
            .toList();
    }

    @GetMapping("/consumers/{consumerId}")
    @Operation(summary = "Get a consumer cursor")
    public ConsumerResponse getConsumer(
            @Parameter(description = "Consumer ID", example = "queue-relay")
            @PathVariable String consumerId) {
        return ConsumerResponse.from(inspectRelayUseCase.getConsumer(consumerId), clock.instant());
    }

    @GetMapping("/consumers/{consumerId}/dead-letters")
    @Operation(summary = "List a consumer's dead letters", description = "Events the consumer skipped after exhausting retries, newest first")
    public List<DeadLetter> listConsumerDeadLetters(
            @Parameter(description = "Consumer ID", example = "queue-relay")
            @PathVariable String consumerId,
            @Parameter(description = "Maximum number of entries (max 500)")
            @RequestParam(required = false) Integer limit) {
        return inspectRelayUseCase.listConsumerDeadLetters(consumerId, limit != null ? limit : DEFAULT_LIMIT);
    }

    @GetMapping("/queues/dead-letters")
    @Operation(summary = "List dead-lettered queue messages", description = "Optionally filtered by queue name, newest first")
    public List<MessageResponse> listQueueDeadLetters(
            @Parameter(description = "Queue name filter")
            @RequestParam(required = false) String queue,
            @Parameter(description = "Maximum number of entries (max 500)")
            @RequestParam(required = false) Integer limit) {
        Instant now = clock.instant();
        return inspectRelayUseCase.listQueueDeadLetters(queue, limit != null ? limit : DEFAULT_LIMIT).stream()
            .map(m -> MessageResponse.from(m, now))
            .toList();
    }

    @GetMapping("/queues/messages/{messageId}")
    @Operation(summary = "Get a queue message")
    public MessageResponse getMessage(@PathVariable UUID messageId) {
        return MessageResponse.from(inspectRelayUseCase.getMessage(messageId), clock.instant());
    }

    @PostMapping("/queues/messages/{messageId}/redrive")
    @Operation(summary = "Redrive a dead-lettered message", description = "Clears the dead-letter state, resets failures and makes the message due now")
    public ResponseEntity<Void> redrive(@PathVariable UUID messageId) {
        inspectRelayUseCase.redrive(messageId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/schedules")
    @Operation(summary = "List cron schedules")
    public List<CronSchedule> listSchedules() {
        return inspectRelayUseCase.listSchedules();
    }

    @PostMapping("/schedules/{scheduleId}/disable")
    @Operation(summary = "Disable a cron schedule")
    public ResponseEntity<Void> disableSchedule(@PathVariable UUID scheduleId) {
        inspectRelayUseCase.disableSchedule(scheduleId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/schedules/{scheduleId}/enable")
    @Operation(summary = "Enable a cron schedule", description = "The next tick becomes due immediately")
    public ResponseEntity<Void> enableSchedule(@PathVariable UUID scheduleId) {
        inspectRelayUseCase.enableSchedule(scheduleId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/schedules/{scheduleId}")
    @Operation(summary = "Delete a cron schedule", description = "Unleased future ticks are deleted with it")
    public ResponseEntity<Void> deleteSchedule(@PathVariable UUID scheduleId) {
        inspectRelayUseCase.deleteSchedule(scheduleId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/dispatcher")
    @Operation(summary = "Dispatcher status", description = "State of the LISTEN connection that wakes consumers")
    public DispatcherResponse dispatcher() {
        return new DispatcherResponse(inspectRelayUseCase.dispatcherState().name());
    }

    public record ConsumerResponse(
        String consumerId,
        long cursor,
        List<Long> pendingIds,
        int retryCount,
        Instant retryAfter,
        String lastError,
        boolean locked,
        Instant lockedUntil,
        Instant lastProcessedAt,
        Instant updatedAt
    ) {
        public static ConsumerResponse from(ConsumerCursor cursor, Instant now) {
            return new ConsumerResponse(
                cursor.consumerId(),
                cursor.cursor(),
                List.copyOf(cursor.processedIds().ids()),
                cursor.retryCount(),
                cursor.retryAfter(),
                cursor.lastError(),
                cursor.isLocked(now),
                cursor.lockedUntil(),
                cursor.lastProcessedAt(),
                cursor.updatedAt()
            );
        }
    }

    public record MessageResponse(
        UUID id,
        String queueName,
        String workspaceId,
        MessageStatus status,
        String dedupeKey,
        Instant processAfter,
        Instant insertedAt,
        int claimedCount,
        int failedCount,
        String lastError,
        Instant completedAt,
        Instant deadLetteredAt
    ) {
        public static MessageResponse from(QueueMessage message, Instant now) {
            return new MessageResponse(
                message.id(),
                message.queueName(),
                message.workspaceId(),
                message.status(now),
                message.dedupeKey(),
                message.processAfter(),
                message.insertedAt(),
                message.claimedCount(),
                message.failedCount(),
                message.lastError(),
                message.completedAt(),
                message.deadLetteredAt()
            );
        }
    }

    public record DispatcherResponse(String state) {}
}
