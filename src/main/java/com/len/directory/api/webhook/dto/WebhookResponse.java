package com.len.directory.api.webhook.dto;

import com.len.directory.domain.webhook.Webhook;

import java.time.Instant;
import java.util.List;

/**
 * secret 은 등록 직후 응답에서만 채워진다.
 */
public record WebhookResponse(
        String id,
        String url,
        List<String> events,
        boolean active,
        int consecutiveFailureCount,
        Instant lastTriggeredAt,
        Instant createdAt,
        String secret
) {

    public static WebhookResponse from(Webhook w) {
        return of(w, null);
    }

    public static WebhookResponse registered(Webhook w) {
        return of(w, w.getSecret());
    }

    private static WebhookResponse of(Webhook w, String secret) {
        return new WebhookResponse(
                w.getId(),
                w.getUrl(),
                w.getEvents(),
                w.isActive(),
                w.getConsecutiveFailureCount(),
                w.getLastTriggeredAt(),
                w.getCreatedAt(),
                secret
        );
    }
}
