package com.len.directory.domain.webhook;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Webhook {

    private String id;
    private String url;
    private String secret;

    // 비어 있으면 모든 이벤트
    private List<String> events = new ArrayList<>();

    private boolean active;
    private int consecutiveFailureCount;
    private Instant lastTriggeredAt;
    private String createdBy;
    private Instant createdAt;

    public static Webhook register(String id, String url, String secret, List<String> events,
                                   String createdBy, Instant now) {
        Webhook w = new Webhook();
        w.id = id;
        w.url = url;
        w.secret = secret;
        w.events = new ArrayList<>(events);
        w.active = true;
        w.consecutiveFailureCount = 0;
        w.createdBy = createdBy;
        w.createdAt = now;
        return w;
    }

    public boolean accepts(String eventType) {
        return active && (events.isEmpty() || events.contains(eventType));
    }

    /**
     * 2xx 응답. 연속 실패 카운트만 초기화하고 active 는 건드리지 않는다.
     */
    public void markDelivered(Instant now) {
        this.consecutiveFailureCount = 0;
        this.lastTriggeredAt = now;
    }

    /**
     * 2xx 외 응답 또는 전송 실패.
     * - 카운트 +1
     * - threshold 에 도달하면 비활성화 (재활성화 전까지 유지)
     * @return 이번 실패로 비활성화 되었으면 true
     */
    public boolean markFailed(int threshold, Instant now) {
        this.consecutiveFailureCount += 1;
        this.lastTriggeredAt = now;
        if (active && this.consecutiveFailureCount >= threshold) {
            this.active = false;
            return true;
        }
        return false;
    }

    public void reactivate() {
        this.active = true;
        this.consecutiveFailureCount = 0;
    }

    public void pause() {
        this.active = false;
    }

    public void changeTarget(String url) {
        this.url = url;
    }

    public void changeEvents(List<String> events) {
        this.events = new ArrayList<>(events);
    }
}
