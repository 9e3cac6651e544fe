package com.len.directory.application.event;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class EventBusTest {

    static final Duration NO_WAIT = Duration.ZERO;

    List<DirectoryEvent> heardByListener;
    EventBus eventBus;

    @BeforeEach
    void setUp() {
        heardByListener = new ArrayList<>();
        DirectoryEventListener recording = heardByListener::add;
        DirectoryEventListener failing = event -> {
            throw new IllegalStateException("boom");
        };
        eventBus = new EventBus(List.of(failing, recording), 256, new SimpleMeterRegistry());
    }

    @Test
    @DisplayName("publish 가 끝나면 모든 구독자 버퍼에 들어가 있다")
    void publishReachesEverySubscriberBeforeReturning() throws Exception {
        EventSubscription a = eventBus.subscribe();
        EventSubscription b = eventBus.subscribe();

        eventBus.publish(event(1));

        assertThat(a.buffered()).isEqualTo(1);
        assertThat(b.buffered()).isEqualTo(1);
        assertThat(a.poll(NO_WAIT)).get().extracting(DirectoryEvent::payload).isEqualTo(Map.of("seq", 1));
    }

    @Test
    @DisplayName("리스너 예외는 발행자에게 올라오지 않고 다음 리스너도 호출된다")
    void failingListenerDoesNotBreakPublish() {
        eventBus.publish(event(1));

        assertThat(heardByListener).hasSize(1);
    }

    @Test
    @DisplayName("300건 밀리면: warning(missed=44) 1건 -> 남은 256건 -> 이후 실시간 이벤트")
    void slowSubscriberGetsSingleWarningThenBufferedThenLive() throws Exception {
        EventSubscription slow = eventBus.subscribe();

        for (int i = 0; i < 300; i++) {
            eventBus.publish(event(i));
        }

        DirectoryEvent warning = slow.poll(NO_WAIT).orElseThrow();
        assertThat(warning.type()).isEqualTo(EventTypes.WARNING);
        assertThat(warning.payload()).containsEntry("missed", 44L);

        for (int i = 44; i < 300; i++) {
            DirectoryEvent e = slow.poll(NO_WAIT).orElseThrow();
            assertThat(e.payload()).containsEntry("seq", i);
        }
        assertThat(slow.poll(NO_WAIT)).isEmpty();

        eventBus.publish(event(300));
        assertThat(slow.poll(NO_WAIT)).get().extracting(DirectoryEvent::type).isEqualTo("app.updated");
    }

    @Test
    @DisplayName("느린 구독자는 다른 구독자에게 영향 없음")
    void slowSubscriberDoesNotAffectOthers() throws Exception {
        EventSubscription slow = eventBus.subscribe();
        EventSubscription fast = eventBus.subscribe();

        for (int i = 0; i < 300; i++) {
            eventBus.publish(event(i));
            assertThat(fast.poll(NO_WAIT)).get().extracting(e -> e.payload().get("seq")).isEqualTo(i);
        }

        assertThat(slow.buffered()).isEqualTo(256);
        assertThat(fast.buffered()).isZero();
    }

    @Test
    @DisplayName("close 하면 구독 목록에서 빠지고 다른 구독자는 그대로")
    void closeDeregistersOnlyThatSubscriber() throws Exception {
        EventSubscription a = eventBus.subscribe();
        EventSubscription b = eventBus.subscribe();

        a.close();
        eventBus.publish(event(1));

        assertThat(eventBus.subscriberCount()).isEqualTo(1);
        assertThat(a.isClosed()).isTrue();
        assertThat(a.poll(NO_WAIT)).isEmpty();
        assertThat(b.poll(NO_WAIT)).isPresent();
    }

    @Test
    @DisplayName("poll 은 이벤트가 올 때까지 기다렸다가 받는다")
    void pollWaitsForNextEvent() throws Exception {
        EventSubscription sub = eventBus.subscribe();

        Thread publisher = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            eventBus.publish(event(7));
        });
        publisher.start();

        Optional<DirectoryEvent> received = sub.poll(Duration.ofSeconds(5));
        publisher.join();

        assertThat(received).get().extracting(e -> e.payload().get("seq")).isEqualTo(7);
    }

    private static DirectoryEvent event(int seq) {
        return DirectoryEvent.of("app.updated", Map.of("seq", seq));
    }
}
