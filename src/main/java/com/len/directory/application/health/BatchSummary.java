package com.len.directory.application.health;

import java.util.List;

public record BatchSummary(
        int total,
        int healthy,
        int unhealthy,
        int unreachable,
        List<RecordedCheck> results
) {}
