package com.len.directory.api.health.dto;

import com.len.directory.application.health.BatchSummary;

import java.util.List;

public record BatchSummaryResponse(
        int total,
        int healthy,
        int unhealthy,
        int unreachable,
        List<HealthCheckResponse> results
) {

    public static BatchSummaryResponse from(BatchSummary summary) {
        return new BatchSummaryResponse(
                summary.total(),
                summary.healthy(),
                summary.unhealthy(),
                summary.unreachable(),
                summary.results().stream().map(HealthCheckResponse::from).toList()
        );
    }
}
