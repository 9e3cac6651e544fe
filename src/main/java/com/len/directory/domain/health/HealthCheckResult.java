package com.len.directory.domain.health;

import java.time.Instant;

/**
 * health_results 컬렉션 문서 (append only)
 */
public record HealthCheckResult(
        String listingId,
        HealthStatus status,
        Integer httpCode,   // unreachable 이면 null
        long latencyMs,
        String errorMessage,
        String checkedUrl,
        Instant checkedAt,
        boolean scheduled
) {}
