package com.len.directory.api.health;

import com.len.directory.api.health.dto.BatchSummaryResponse;
import com.len.directory.api.health.dto.HealthCheckResponse;
import com.len.directory.api.health.dto.HealthHistoryResponse;
import com.len.directory.api.health.dto.ScheduleStatusResponse;
import com.len.directory.application.credential.AccessGuard;
import com.len.directory.application.credential.ResolvedIdentity;
import com.len.directory.application.health.HealthCheckScheduler;
import com.len.directory.application.health.HealthCheckService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1")
public class HealthCheckController {

    private final HealthCheckService healthCheckService;
    private final HealthCheckScheduler healthCheckScheduler;

    // 관리자 수동 체크
    @PostMapping("/apps/{appId}/health-check")
    public HealthCheckResponse check(
            @PathVariable String appId,
            @RequestAttribute(ResolvedIdentity.ATTRIBUTE) ResolvedIdentity identity
    ) {
        AccessGuard.requireAdmin(identity);
        return HealthCheckResponse.from(healthCheckService.checkNow(appId));
    }

    @PostMapping("/apps/health-check/batch")
    public BatchSummaryResponse batch(@RequestAttribute(ResolvedIdentity.ATTRIBUTE) ResolvedIdentity identity) {
        AccessGuard.requireAdmin(identity);
        return BatchSummaryResponse.from(healthCheckService.checkAllNow());
    }

    @GetMapping("/apps/{appId}/health")
    public HealthHistoryResponse history(
            @PathVariable String appId,
            @RequestParam(defaultValue = "20") int limit
    ) {
        return HealthHistoryResponse.from(healthCheckService.history(appId, limit));
    }

    @GetMapping("/health-check/schedule")
    public ScheduleStatusResponse schedule(@RequestAttribute(ResolvedIdentity.ATTRIBUTE) ResolvedIdentity identity) {
        AccessGuard.requireAdmin(identity);
        return ScheduleStatusResponse.from(healthCheckScheduler.status());
    }
}
