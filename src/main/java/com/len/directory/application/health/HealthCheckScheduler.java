package com.len.directory.application.health;

import com.len.directory.domain.store.RecordStore;
import com.len.directory.infra.store.RecordStoreConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 주기 헬스체크 드라이버 (단일 스레드)
 *
 * ✅ 규칙
 * - interval 0 이면 스레드도 만들지 않는다
 * - 첫 tick 은 시작 후 interval 한 번을 기다린 뒤
 * - 종료 신호는 tick 사이 대기 중에만 확인 (프로브 도중에는 끊지 않음)
 * - tick 안의 예외는 로그만 남기고 루프는 계속
 * - 요청 처리와 락 경쟁하지 않도록 스케줄러 전용 저장소 핸들 사용
 */
@Slf4j
@Component
public class HealthCheckScheduler implements SmartLifecycle {

    public enum State { IDLE, RUNNING_TICK, STOPPED }

    private final HealthCheckService healthCheckService;
    private final RecordStore schedulerStore;
    private final Duration interval;
    private final Clock clock;
    private final Timer tickTimer;

    private volatile State state = State.IDLE;
    private volatile boolean running;
    private volatile CountDownLatch shutdownSignal;
    private volatile Thread worker;

    private volatile Instant lastTickAt;
    private volatile BatchSummary lastSummary;

    @Autowired
    public HealthCheckScheduler(HealthCheckService healthCheckService,
                                @Qualifier(RecordStoreConfig.SCHEDULER_STORE) RecordStore schedulerStore,
                                @Value("${directory.health.schedule.interval-seconds:300}") long intervalSeconds,
                                Clock clock,
                                MeterRegistry meterRegistry) {
        this(healthCheckService, schedulerStore, Duration.ofSeconds(intervalSeconds), clock, meterRegistry);
    }

    HealthCheckScheduler(HealthCheckService healthCheckService,
                         RecordStore schedulerStore,
                         Duration interval,
                         Clock clock,
                         MeterRegistry meterRegistry) {
        this.healthCheckService = healthCheckService;
        this.schedulerStore = schedulerStore;
        this.interval = interval;
        this.clock = clock;
        this.tickTimer = Timer.builder("directory.health.scheduler.tick").register(meterRegistry);
    }

    @Override
    public synchronized void start() {
        if (running) return;
        if (interval.isZero() || interval.isNegative()) {
            log.info("[HealthScheduler] disabled (interval={}s)", interval.toSeconds());
            return;
        }

        shutdownSignal = new CountDownLatch(1);
        worker = new Thread(this::loop, "health-scheduler");
        worker.setDaemon(true);
        running = true;
        state = State.IDLE;
        worker.start();
        log.info("[HealthScheduler] started. interval={}s", interval.toSeconds());
    }

    /**
     * 진행 중인 tick 이 끝날 때까지 기다린다.
     */
    @Override
    public synchronized void stop() {
        if (!running) return;
        shutdownSignal.countDown();
        try {
            worker.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[HealthScheduler] interrupted while waiting for tick to finish");
        }
        running = false;
        state = State.STOPPED;
        log.info("[HealthScheduler] stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void loop() {
        try {
            while (!shutdownSignal.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                tick();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            state = State.STOPPED;
        }
    }

    void tick() {
        state = State.RUNNING_TICK;
        try {
            BatchSummary summary = tickTimer.record(() -> healthCheckService.runBatch(schedulerStore, true));
            lastSummary = summary;
            log.info("[HealthScheduler] tick done. total={}, healthy={}, unhealthy={}, unreachable={}",
                    summary.total(), summary.healthy(), summary.unhealthy(), summary.unreachable());
        } catch (RuntimeException e) {
            log.error("[HealthScheduler] tick failed", e);
        } finally {
            lastTickAt = clock.instant();
            state = State.IDLE;
        }
    }

    public ScheduleStatus status() {
        boolean enabled = !(interval.isZero() || interval.isNegative());
        return new ScheduleStatus(enabled, interval.toSeconds(), state, lastTickAt, lastSummary);
    }

    public record ScheduleStatus(
            boolean enabled,
            long intervalSeconds,
            State state,
            Instant lastTickAt,
            BatchSummary lastSummary
    ) {}
}
