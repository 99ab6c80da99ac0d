package com.relaybox.application.service;

import com.relaybox.application.port.in.InspectRelayUseCase;
import com.relaybox.application.port.out.ConsumerCursorRepository;
import com.relaybox.application.port.out.CronRepository;
import com.relaybox.application.port.out.NotificationSource;
import com.relaybox.application.port.out.QueueRepository;
import com.relaybox.domain.cursor.ConsumerCursor;
import com.relaybox.domain.cursor.DeadLetter;
import com.relaybox.domain.queue.CronSchedule;
import com.relaybox.domain.queue.QueueMessage;
import com.relaybox.infrastructure.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Service
public class RelayOpsService implements InspectRelayUseCase {

    private static final Logger log = LoggerFactory.getLogger(RelayOpsService.class);

    static final int MAX_LIMIT = 500;

    private final ConsumerCursorRepository cursorRepository;
    private final QueueRepository queueRepository;
    private final CronRepository cronRepository;
    private final OutboxDispatcher dispatcher;
    private final Clock clock;

    public RelayOpsService(
            ConsumerCursorRepository cursorRepository,
            QueueRepository queueRepository,
            CronRepository cronRepository,
            OutboxDispatcher dispatcher,
            Clock clock) {
        this.cursorRepository = cursorRepository;
        this.queueRepository = queueRepository;
        this.cronRepository = cronRepository;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @Override
    public List<ConsumerCursor> listConsumers() {
        return cursorRepository.findAll();
    }

    @Override
    public ConsumerCursor getConsumer(String consumerId) {
        return cursorRepository.findById(consumerId)
            .orElseThrow(() -> new NotFoundException("Consumer", consumerId));
    }

    @Override
    public List<DeadLetter> listConsumerDeadLetters(String consumerId, int limit) {
        getConsumer(consumerId);
        return cursorRepository.findDeadLetters(consumerId, checkLimit(limit));
    }

    @Override
    public List<QueueMessage> listQueueDeadLetters(String queueName, int limit) {
        return queueRepository.findDeadLettered(queueName, checkLimit(limit));
    }

    @Override
    public QueueMessage getMessage(UUID messageId) {
        return queueRepository.findById(messageId)
            .orElseThrow(() -> new NotFoundException("Message", messageId));
    }

    @Override
    public void redrive(UUID messageId) {
        queueRepository.redrive(messageId, clock.instant());
        log.info("Message redriven from dead letters: messageId={}", messageId);
    }

    @Override
    public List<CronSchedule> listSchedules() {
        return cronRepository.findAll();
    }

    @Override
    public void disableSchedule(UUID scheduleId) {
        cronRepository.disable(scheduleId, clock.instant());
        log.info("Cron schedule disabled: scheduleId={}", scheduleId);
    }

    @Override
    public void enableSchedule(UUID scheduleId) {
        cronRepository.enable(scheduleId, clock.instant());
        log.info("Cron schedule enabled: scheduleId={}", scheduleId);
    }

    @Override
    public void deleteSchedule(UUID scheduleId) {
        cronRepository.delete(scheduleId);
        log.info("Cron schedule deleted: scheduleId={}", scheduleId);
    }

    @Override
    public NotificationSource.State dispatcherState() {
        return dispatcher.state();
    }

    private static int checkLimit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return limit;
    }
}
