package com.len.directory.application.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.len.directory.application.event.DirectoryEvent;
import com.len.directory.application.event.DirectoryEventListener;
import com.len.directory.application.event.EventTypes;
import com.len.directory.domain.store.RecordQuery;
import com.len.directory.domain.store.RecordStore;
import com.len.directory.domain.store.StoreCollection;
import com.len.directory.domain.webhook.Webhook;
import com.len.directory.infra.http.HttpClientConfig;
import com.len.directory.infra.store.RecordStoreConfig;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 발행된 이벤트를 등록된 웹훅으로 전송 (fire-and-forget, at-most-once)
 *
 * - publish 스레드에서는 fan-out 태스크를 넘기기만 한다
 * - fan-out 태스크가 웹훅 전용 저장소 핸들로 대상 목록을 읽고, 웹훅마다 전송 태스크를 하나씩 띄운다
 * - 재시도 없음. 결과는 consecutiveFailureCount 에만 반영
 */
@Slf4j
@Component
public class WebhookDispatcher implements DirectoryEventListener {

    private final RecordStore webhookStore;
    private final RestClient restClient;
    private final TaskExecutor deliveryExecutor;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int failureThreshold;

    public WebhookDispatcher(@Qualifier(RecordStoreConfig.WEBHOOK_STORE) RecordStore webhookStore,
                             @Qualifier(HttpClientConfig.WEBHOOK_CLIENT) RestClient restClient,
                             @Qualifier(HttpClientConfig.WEBHOOK_EXECUTOR) TaskExecutor deliveryExecutor,
                             ObjectMapper objectMapper,
                             MeterRegistry meterRegistry,
                             Clock clock,
                             @Value("${directory.webhooks.failure-threshold:10}") int failureThreshold) {
        this.webhookStore = webhookStore;
        this.restClient = restClient;
        this.deliveryExecutor = deliveryExecutor;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.failureThreshold = failureThreshold;
    }

    @Override
    public void onEvent(DirectoryEvent event) {
        if (!EventTypes.WEBHOOK_EVENTS.contains(event.type())) {
            return;
        }
        try {
            deliveryExecutor.execute(() -> fanOut(event));
        } catch (TaskRejectedException e) {
            meterRegistry.counter("directory.webhook.delivery", "result", "rejected").increment();
            log.warn("[WebhookDispatcher] fan-out rejected (executor saturated). event={}", event.type());
        }
    }

    void fanOut(DirectoryEvent event) {
        List<Webhook> targets;
        try {
            targets = webhookStore.list(StoreCollection.WEBHOOKS, Webhook.class,
                    RecordQuery.<Webhook>where(w -> w.accepts(event.type())));
        } catch (RuntimeException e) {
            log.error("[WebhookDispatcher] target lookup failed. event={}", event.type(), e);
            return;
        }
        if (targets.isEmpty()) return;

        byte[] body = serialize(event);
        for (Webhook target : targets) {
            try {
                deliveryExecutor.execute(() -> deliver(target, event.type(), body));
            } catch (TaskRejectedException e) {
                meterRegistry.counter("directory.webhook.delivery", "result", "rejected").increment();
                log.warn("[WebhookDispatcher] delivery rejected (executor saturated). webhookId={}, event={}",
                        target.getId(), event.type());
            }
        }
    }

    /**
     * 한 번만 보낸다.
     * @return 2xx 였으면 true
     */
    boolean deliver(Webhook target, String eventType, byte[] body) {
        String signature = WebhookSigner.sign(target.getSecret(), body);

        boolean success;
        String failure = null;
        try {
            HttpStatusCode status = restClient.post()
                    .uri(URI.create(target.getUrl()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(WebhookSigner.SIGNATURE_HEADER, signature)
                    .header(WebhookSigner.EVENT_HEADER, eventType)
                    .body(body)
                    .exchange((request, response) -> response.getStatusCode());
            success = status.is2xxSuccessful();
            if (!success) {
                failure = "HTTP " + status.value();
            }
        } catch (RuntimeException e) {
            // 타임아웃, 연결 실패, DNS 실패, 잘못된 URL
            success = false;
            failure = e.getClass().getSimpleName() + ": " + e.getMessage();
        }

        recordOutcome(target, eventType, success, failure);
        return success;
    }

    private void recordOutcome(Webhook target, String eventType, boolean success, String failure) {
        meterRegistry.counter("directory.webhook.delivery", "result", success ? "success" : "failure").increment();

        Instant now = clock.instant();
        boolean[] disabled = new boolean[1];
        try {
            webhookStore.update(StoreCollection.WEBHOOKS, target.getId(), Webhook.class, w -> {
                if (success) {
                    w.markDelivered(now);
                } else {
                    disabled[0] = w.markFailed(failureThreshold, now);
                }
                return w;
            });
        } catch (RuntimeException e) {
            log.error("[WebhookDispatcher] outcome record failed. webhookId={}, success={}", target.getId(), success, e);
            return;
        }

        if (!success) {
            log.warn("Webhook delivery failed. webhookId={}, url={}, event={}, err={}",
                    target.getId(), target.getUrl(), eventType, failure);
        }
        if (disabled[0]) {
            meterRegistry.counter("directory.webhook.disabled").increment();
            log.warn("Webhook auto-disabled after {} consecutive failures. webhookId={}, url={}",
                    failureThreshold, target.getId(), target.getUrl());
        }
    }

    private byte[] serialize(DirectoryEvent event) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("event", event.type());
        envelope.put("data", event.payload());
        envelope.put("timestamp", event.timestamp().toString());
        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Webhook payload serialize failed. event=" + event.type(), e);
        }
    }
}
