package com.len.directory.infra.sse;

import com.len.directory.application.event.DirectoryEvent;
import com.len.directory.application.event.EventBus;
import com.len.directory.application.event.EventSubscription;
import com.len.directory.infra.http.HttpClientConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SSE 연결(SseEmitter) 하나 = EventBus 구독 하나.
 * 연결마다 pump 태스크가 구독 버퍼에서 꺼내 event: <type> 으로 내보낸다.
 *
 * ✅ 중요
 * - 클라이언트가 끊기는 건 정상 상황 -> send 에서 IOException
 * - 끊긴 연결은 구독까지 닫아야 EventBus 에 죽은 버퍼가 남지 않는다
 */
@Slf4j
@Component
public class EventStreamHub {

    // pump 가 종료 여부를 확인하는 주기
    private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

    private final EventBus eventBus;
    private final TaskExecutor streamExecutor;

    // emitter -> 구독
    private final Map<SseEmitter, EventSubscription> connections = new ConcurrentHashMap<>();

    public EventStreamHub(EventBus eventBus,
                          @Qualifier(HttpClientConfig.EVENT_STREAM_EXECUTOR) TaskExecutor streamExecutor) {
        this.eventBus = eventBus;
        this.streamExecutor = streamExecutor;
    }

    public SseEmitter subscribe(String keyId) {
        // timeout 0 = 무제한
        SseEmitter emitter = new SseEmitter(0L);
        EventSubscription subscription = eventBus.subscribe();
        connections.put(emitter, subscription);

        Runnable cleanup = () -> remove(emitter);
        emitter.onCompletion(cleanup);
        emitter.onTimeout(cleanup);
        emitter.onError(ex -> cleanup.run());

        // ✅ 연결 확인용 hello
        try {
            emitter.send(SseEmitter.event()
                    .name("hello")
                    .data(Map.of("ok", true)));
        } catch (IOException | IllegalStateException e) {
            cleanup.run();
            return emitter;
        }

        streamExecutor.execute(() -> pump(emitter, subscription));
        log.debug("Event stream opened. keyId={}, connections={}", keyId, connections.size());
        return emitter;
    }

    /**
     * 구독이 닫히거나 전송이 실패할 때까지 돈다.
     */
    void pump(SseEmitter emitter, EventSubscription subscription) {
        try {
            while (!subscription.isClosed()) {
                Optional<DirectoryEvent> next = subscription.poll(POLL_INTERVAL);
                if (next.isEmpty()) continue;

                DirectoryEvent event = next.get();
                emitter.send(SseEmitter.event()
                        .name(event.type())
                        .data(envelope(event), MediaType.APPLICATION_JSON));
            }
        } catch (IOException | IllegalStateException e) {
            // ✅ 끊긴 연결은 정리 (정상 상황)
            remove(emitter);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            remove(emitter);
        }
    }

    /**
     * keep-alive (내용 없는 comment 라인). 끊긴 연결은 여기서도 걸러진다.
     */
    public void pingAll() {
        for (SseEmitter emitter : List.copyOf(connections.keySet())) {
            try {
                emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                remove(emitter);
            }
        }
    }

    public int connectionCount() {
        return connections.size();
    }

    @PreDestroy
    public void closeAll() {
        for (SseEmitter emitter : List.copyOf(connections.keySet())) {
            remove(emitter);
        }
    }

    /**
     * 구독 해제 + emitter 종료
     */
    private void remove(SseEmitter emitter) {
        EventSubscription subscription = connections.remove(emitter);
        if (subscription == null) return;

        subscription.close();
        try {
            emitter.complete();
        } catch (IllegalStateException e) {
            log.debug("Emitter already completed: {}", e.getMessage());
        }
        log.debug("Event stream closed. connections={}", connections.size());
    }

    private static Map<String, Object> envelope(DirectoryEvent event) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event", event.type());
        body.put("data", event.payload());
        body.put("timestamp", event.timestamp().toString());
        return body;
    }
}
