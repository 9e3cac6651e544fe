package com.len.directory.infra.sse;

import com.len.directory.application.event.DirectoryEvent;
import com.len.directory.application.event.EventBus;
import com.len.directory.application.event.EventSubscription;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EventStreamHubTest {

    EventBus eventBus;
    EventStreamHub hub;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus(List.of(), 256, new SimpleMeterRegistry());
        hub = new EventStreamHub(eventBus, new SimpleAsyncTaskExecutor("test-stream-"));
    }

    @AfterEach
    void tearDown() {
        hub.closeAll();
    }

    @Test
    @DisplayName("연결마다 EventBus 구독이 하나씩 생긴다")
    void subscribeRegistersOneSubscriptionPerConnection() {
        hub.subscribe("k1");
        hub.subscribe("k2");

        assertThat(hub.connectionCount()).isEqualTo(2);
        assertThat(eventBus.subscriberCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("closeAll: 연결과 구독 모두 정리")
    void closeAllReleasesSubscriptions() {
        hub.subscribe("k1");

        hub.closeAll();

        assertThat(hub.connectionCount()).isZero();
        assertThat(eventBus.subscriberCount()).isZero();
    }

    @Test
    @DisplayName("pump 는 구독이 닫히면 종료된다")
    void pumpStopsWhenSubscriptionCloses() throws Exception {
        EventSubscription subscription = eventBus.subscribe();
        SseEmitter emitter = new SseEmitter(0L);
        Thread pump = new Thread(() -> hub.pump(emitter, subscription));
        pump.start();

        eventBus.publish(DirectoryEvent.of("app.updated", Map.of("app_id", "a")));
        subscription.close();
        pump.join(Duration.ofSeconds(5).toMillis());

        assertThat(pump.isAlive()).isFalse();
        assertThat(eventBus.subscriberCount()).isZero();
    }

    @Test
    @DisplayName("heartbeat 는 연결이 없어도, 있어도 예외 없이 돈다")
    void pingAllIsSafe() {
        hub.pingAll();
        hub.subscribe("k1");
        hub.pingAll();

        assertThat(hub.connectionCount()).isEqualTo(1);
    }
}
