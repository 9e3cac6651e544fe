package com.len.directory.api.health.dto;

import com.len.directory.application.health.RecordedCheck;
import com.len.directory.domain.health.HealthCheckResult;

import java.time.Instant;

public record HealthCheckResponse(
        String id,
        String appId,
        String appName,
        String checkedUrl,
        String status,
        Integer statusCode,
        long responseTimeMs,
        String errorMessage,
        Instant checkedAt,
        Double uptimePct
) {

    public static HealthCheckResponse from(RecordedCheck check) {
        HealthCheckResult r = check.result();
        return new HealthCheckResponse(
                check.id(),
                r.listingId(),
                check.listingName(),
                r.checkedUrl(),
                r.status().value(),
                r.httpCode(),
                r.latencyMs(),
                r.errorMessage(),
                r.checkedAt(),
                check.uptimePct()
        );
    }
}
