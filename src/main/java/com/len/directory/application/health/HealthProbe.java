package com.len.directory.application.health;

import com.len.directory.domain.health.HealthStatus;

/**
 * 프로브 1회 결과 (아직 저장 전)
 */
public record HealthProbe(
        HealthStatus status,
        Integer httpCode,
        long latencyMs,
        String errorMessage,
        String checkedUrl
) {

    public static HealthProbe of(int httpCode, long latencyMs, String checkedUrl) {
        boolean ok = httpCode >= 200 && httpCode < 300;
        return new HealthProbe(ok ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY,
                httpCode, latencyMs, ok ? null : "HTTP " + httpCode, checkedUrl);
    }

    public static HealthProbe unreachable(long latencyMs, String errorMessage, String checkedUrl) {
        return new HealthProbe(HealthStatus.UNREACHABLE, null, latencyMs, errorMessage, checkedUrl);
    }
}
