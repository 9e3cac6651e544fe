package com.len.directory.api.health.dto;

import com.len.directory.application.health.HealthHistory;
import com.len.directory.domain.health.HealthCheckResult;

import java.time.Instant;
import java.util.List;

public record HealthHistoryResponse(
        String appId,
        Double uptimePct,
        List<Check> checks
) {

    public static HealthHistoryResponse from(HealthHistory history) {
        return new HealthHistoryResponse(
                history.listingId(),
                history.uptimePct(),
                history.checks().stream().map(Check::from).toList()
        );
    }

    public record Check(
            String status,
            Integer statusCode,
            long responseTimeMs,
            String errorMessage,
            String checkedUrl,
            Instant checkedAt,
            boolean scheduled
    ) {
        static Check from(HealthCheckResult r) {
            return new Check(r.status().value(), r.httpCode(), r.latencyMs(), r.errorMessage(),
                    r.checkedUrl(), r.checkedAt(), r.scheduled());
        }
    }
}
