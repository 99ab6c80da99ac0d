package com.relaybox.domain.queue;

public record ScheduleResult(CronSchedule schedule, boolean created) {
}
