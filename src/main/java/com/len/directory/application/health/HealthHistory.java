package com.len.directory.application.health;

import com.len.directory.domain.health.HealthCheckResult;

import java.util.List;

public record HealthHistory(
        String listingId,
        Double uptimePct,
        List<HealthCheckResult> checks
) {}
