package com.len.directory.application.ratelimit;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * bucket 별 고정 윈도우 카운터 (프로세스 메모리 only, 재시작 시 초기화)
 *
 * ✅ compute 안에서 "윈도우 리셋 -> 증가 -> 비교" 를 한 번에 처리해서
 * 같은 bucket 에 대한 동시 요청끼리 카운트가 유실되지 않는다.
 * 거절된 요청도 카운트에 포함된다.
 *
 * 윈도우 길이마다 한 번씩, 이미 끝난 윈도우는 맵에서 지운다 (ip bucket 이 계속 쌓이지 않도록).
 */
@Component
public class FixedWindowRateLimiter {

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final AtomicLong lastSweepMs;

    public FixedWindowRateLimiter(Clock clock) {
        this.clock = clock;
        this.lastSweepMs = new AtomicLong(clock.millis());
    }

    public Admission admit(String bucket, long limit, long windowSeconds) {
        long nowMs = clock.millis();
        long windowMs = windowSeconds * 1000L;

        Admission[] result = new Admission[1];
        windows.compute(bucket, (key, window) -> {
            Window w = (window == null) ? new Window(nowMs) : window;
            if (nowMs - w.start >= windowMs) {
                w.start = nowMs;
                w.count = 0;
            }
            w.count++;

            long elapsedSeconds = (nowMs - w.start) / 1000L;
            result[0] = new Admission(
                    w.count <= limit,
                    limit,
                    Math.max(0, limit - w.count),
                    windowSeconds - elapsedSeconds
            );
            return w;
        });

        sweepExpired(nowMs, windowMs);
        return result[0];
    }

    private void sweepExpired(long nowMs, long windowMs) {
        long last = lastSweepMs.get();
        if (nowMs - last < windowMs || !lastSweepMs.compareAndSet(last, nowMs)) {
            return;
        }
        // bucket 단위로 원자적으로 제거해서 동시에 들어온 admit 의 카운트를 잃지 않는다
        for (String bucket : windows.keySet()) {
            windows.computeIfPresent(bucket, (key, w) -> nowMs - w.start >= windowMs ? null : w);
        }
    }

    int trackedBuckets() {
        return windows.size();
    }

    private static final class Window {
        private long start;
        private long count;

        private Window(long start) {
            this.start = start;
        }
    }
}
