package com.relaybox.infrastructure.lifecycle;

import com.relaybox.application.port.in.JobHandlerRegistration;
import com.relaybox.application.port.in.OutboxConsumer;
import com.relaybox.application.service.OutboxDispatcher;
import com.relaybox.application.service.QueueManager;
import com.relaybox.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Wires consumer and job handler beans into the engines once the context is ready,
 * and stops the engines before the connection pool goes away.
 */
@Component
public class RelayLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RelayLifecycle.class);

    private final OutboxDispatcher dispatcher;
    private final QueueManager queueManager;
    private final ObjectProvider<OutboxConsumer> consumers;
    private final ObjectProvider<JobHandlerRegistration> jobHandlers;
    private final AppProperties appProperties;

    private volatile boolean running;

    public RelayLifecycle(
            OutboxDispatcher dispatcher,
            QueueManager queueManager,
            ObjectProvider<OutboxConsumer> consumers,
            ObjectProvider<JobHandlerRegistration> jobHandlers,
            AppProperties appProperties) {
        this.dispatcher = dispatcher;
        this.queueManager = queueManager;
        this.consumers = consumers;
        this.jobHandlers = jobHandlers;
        this.appProperties = appProperties;
    }

    @Override
    public void start() {
        for (JobHandlerRegistration registration : jobHandlers.orderedStream().toList()) {
            queueManager.registerHandler(registration.queueName(), registration.handler(), registration.onDeadLetter());
        }
        if (appProperties.getQueue().isEnabled()) {
            queueManager.start();
        } else {
            log.info("Queue manager disabled");
        }

        if (appProperties.getDispatcher().isEnabled()) {
            consumers.orderedStream().forEach(dispatcher::register);
            dispatcher.start();
        } else {
            log.info("Outbox dispatcher disabled");
        }
        running = true;
    }

    @Override
    public void stop() {
        running = false;
        if (dispatcher.isStarted()) {
            dispatcher.stop();
        }
        if (queueManager.isStarted()) {
            queueManager.stop();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
