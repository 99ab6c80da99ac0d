package com.relaybox.application.port.in;

/**
 * Executes one job. Throwing schedules a retry, or a dead letter once retries run out.
 * Handlers may keep running after their claim expired and must be idempotent.
 */
@FunctionalInterface
public interface JobHandler {

    void handle(Job job) throws Exception;
}
