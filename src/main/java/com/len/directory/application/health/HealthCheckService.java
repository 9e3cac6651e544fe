package com.len.directory.application.health;

import com.len.directory.application.event.DirectoryEvent;
import com.len.directory.application.event.EventBus;
import com.len.directory.application.event.EventTypes;
import com.len.directory.common.exception.BusinessException;
import com.len.directory.common.exception.ErrorCode;
import com.len.directory.domain.health.HealthCheckResult;
import com.len.directory.domain.health.HealthStatus;
import com.len.directory.domain.listing.Listing;
import com.len.directory.domain.store.RecordQuery;
import com.len.directory.domain.store.RecordStore;
import com.len.directory.domain.store.StoreCollection;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 프로브 -> 결과 저장 -> uptime 재계산 -> 앱 상태 갱신 -> health.checked 발행
 *
 * 저장소 핸들은 호출자가 넘긴다 (요청 처리 = 기본 핸들, 스케줄러 = 스케줄러 전용 핸들)
 */
@Slf4j
@Service
public class HealthCheckService {

    private final RecordStore recordStore;
    private final HealthChecker healthChecker;
    private final EventBus eventBus;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int uptimeWindow;

    public HealthCheckService(RecordStore recordStore,
                              HealthChecker healthChecker,
                              EventBus eventBus,
                              MeterRegistry meterRegistry,
                              Clock clock,
                              @Value("${directory.health.uptime-window:100}") int uptimeWindow) {
        this.recordStore = recordStore;
        this.healthChecker = healthChecker;
        this.eventBus = eventBus;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.uptimeWindow = uptimeWindow;
    }

    /**
     * 관리자 수동 체크 (승인 여부와 무관, URL 만 있으면 된다)
     */
    public RecordedCheck checkNow(String listingId) {
        Listing listing = recordStore.get(StoreCollection.LISTINGS, listingId, Listing.class)
                .orElseThrow(() -> new BusinessException(ErrorCode.LISTING_NOT_FOUND));
        return probeAndRecord(recordStore, listing, false);
    }

    public BatchSummary checkAllNow() {
        return runBatch(recordStore, false);
    }

    public RecordedCheck probeAndRecord(RecordStore store, Listing listing, boolean scheduled) {
        String url = listing.probeUrl()
                .orElseThrow(() -> new BusinessException(ErrorCode.NO_PROBE_URL));

        HealthProbe probe = healthChecker.check(url);
        Instant checkedAt = clock.instant();

        HealthCheckResult result = new HealthCheckResult(
                listing.getId(),
                probe.status(),
                probe.httpCode(),
                probe.latencyMs(),
                probe.errorMessage(),
                probe.checkedUrl(),
                checkedAt,
                scheduled
        );
        String resultId = store.append(StoreCollection.HEALTH_RESULTS, listing.getId(), result);

        List<HealthStatus> recent = store.list(StoreCollection.HEALTH_RESULTS, HealthCheckResult.class,
                        RecordQuery.<HealthCheckResult>byIndexKey(listing.getId()).latestFirst().limit(uptimeWindow))
                .stream()
                .map(HealthCheckResult::status)
                .toList();
        Double uptime = UptimeCalculator.uptimePercent(recent, uptimeWindow);

        store.update(StoreCollection.LISTINGS, listing.getId(), Listing.class, l -> {
            l.recordHealth(probe.status(), checkedAt, uptime);
            return l;
        });

        meterRegistry.counter("directory.health.check",
                "source", scheduled ? "scheduled" : "manual",
                "status", probe.status().value()).increment();

        eventBus.publish(DirectoryEvent.of(EventTypes.HEALTH_CHECKED, eventPayload(listing, probe, scheduled)));

        log.debug("Health checked. listingId={}, status={}, code={}, latencyMs={}, scheduled={}",
                listing.getId(), probe.status().value(), probe.httpCode(), probe.latencyMs(), scheduled);
        return new RecordedCheck(resultId, listing.getName(), result, uptime);
    }

    /**
     * 승인 상태 + 프로브 URL 있는 앱
     */
    public List<Listing> eligibleListings(RecordStore store) {
        return store.list(StoreCollection.LISTINGS, Listing.class, RecordQuery.where(Listing::eligibleForProbe));
    }

    /**
     * 대상 앱을 순차로 하나씩 체크한다. 앱 하나의 실패는 로그만 남기고 다음 앱으로 넘어간다.
     */
    public BatchSummary runBatch(RecordStore store, boolean scheduled) {
        List<Listing> targets = eligibleListings(store);

        List<RecordedCheck> results = new ArrayList<>();
        int healthy = 0;
        int unhealthy = 0;
        int unreachable = 0;

        for (Listing listing : targets) {
            try {
                RecordedCheck check = probeAndRecord(store, listing, scheduled);
                results.add(check);
                switch (check.result().status()) {
                    case HEALTHY -> healthy++;
                    case UNHEALTHY -> unhealthy++;
                    case UNREACHABLE -> unreachable++;
                }
            } catch (RuntimeException e) {
                log.error("[HealthCheck] listing check failed. listingId={}", listing.getId(), e);
            }
        }

        return new BatchSummary(targets.size(), healthy, unhealthy, unreachable, results);
    }

    public HealthHistory history(String listingId, int limit) {
        Listing listing = recordStore.get(StoreCollection.LISTINGS, listingId, Listing.class)
                .orElseThrow(() -> new BusinessException(ErrorCode.LISTING_NOT_FOUND));

        int size = Math.max(1, Math.min(limit, 100));
        List<HealthCheckResult> checks = recordStore.list(StoreCollection.HEALTH_RESULTS, HealthCheckResult.class,
                RecordQuery.<HealthCheckResult>byIndexKey(listingId).latestFirst().limit(size));

        return new HealthHistory(listing.getId(), listing.getUptimePct(), checks);
    }

    private static Map<String, Object> eventPayload(Listing listing, HealthProbe probe, boolean scheduled) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("app_id", listing.getId());
        payload.put("app_name", listing.getName());
        payload.put("status", probe.status().value());
        payload.put("status_code", probe.httpCode());
        payload.put("response_time_ms", probe.latencyMs());
        payload.put("scheduled", scheduled);
        return payload;
    }
}
