package com.len.directory.infra.sse;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@RequiredArgsConstructor
@Component
public class EventStreamPingScheduler {

    private final EventStreamHub hub;

    @Scheduled(fixedRateString = "${directory.events.heartbeat-interval-ms:15000}") // 기본 15초
    public void ping() {
        hub.pingAll();
    }
}
