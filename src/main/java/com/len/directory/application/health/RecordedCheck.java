package com.len.directory.application.health;

import com.len.directory.domain.health.HealthCheckResult;

public record RecordedCheck(
        String id,
        String listingName,
        HealthCheckResult result,
        Double uptimePct
) {}
