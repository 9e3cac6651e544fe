package com.len.directory.api.health.dto;

import com.len.directory.application.health.HealthCheckScheduler;

import java.time.Instant;

public record ScheduleStatusResponse(
        boolean enabled,
        long intervalSeconds,
        String state,
        Instant lastTickAt,
        BatchSummaryResponse lastSummary
) {

    public static ScheduleStatusResponse from(HealthCheckScheduler.ScheduleStatus s) {
        return new ScheduleStatusResponse(
                s.enabled(),
                s.intervalSeconds(),
                s.state().name().toLowerCase(),
                s.lastTickAt(),
                s.lastSummary() != null ? BatchSummaryResponse.from(s.lastSummary()) : null
        );
    }
}
