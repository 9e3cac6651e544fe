package com.len.directory.application.health;

import com.len.directory.domain.health.HealthStatus;

import java.util.List;

public final class UptimeCalculator {

    private UptimeCalculator() {}

    /**
     * 최신순 결과 중 앞에서 window 개만 본다.
     * uptime = healthy / min(n, window) * 100
     * @return 결과가 없으면 null
     */
    public static Double uptimePercent(List<HealthStatus> newestFirst, int window) {
        int n = Math.min(newestFirst.size(), window);
        if (n == 0) return null;

        long healthy = newestFirst.subList(0, n).stream()
                .filter(s -> s == HealthStatus.HEALTHY)
                .count();
        return healthy * 100.0 / n;
    }
}
