package com.relaybox.application.port.in;

import com.relaybox.application.port.out.NotificationSource;
import com.relaybox.domain.cursor.ConsumerCursor;
import com.relaybox.domain.cursor.DeadLetter;
import com.relaybox.domain.queue.CronSchedule;
import com.relaybox.domain.queue.QueueMessage;

import java.util.List;
import java.util.UUID;

/**
 * Read-only and repair operations over the relay's state, for operators.
 */
public interface InspectRelayUseCase {

    List<ConsumerCursor> listConsumers();

    ConsumerCursor getConsumer(String consumerId);

    List<DeadLetter> listConsumerDeadLetters(String consumerId, int limit);

    List<QueueMessage> listQueueDeadLetters(String queueName, int limit);

    QueueMessage getMessage(UUID messageId);

    void redrive(UUID messageId);

    List<CronSchedule> listSchedules();

    void disableSchedule(UUID scheduleId);

    void enableSchedule(UUID scheduleId);

    void deleteSchedule(UUID scheduleId);

    NotificationSource.State dispatcherState();
}
