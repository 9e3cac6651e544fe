package com.len.directory.application.webhook;

import com.len.directory.application.credential.SecretHasher;
import com.len.directory.application.event.EventTypes;
import com.len.directory.common.exception.BusinessException;
import com.len.directory.common.exception.ErrorCode;
import com.len.directory.common.util.HttpUrls;
import com.len.directory.domain.store.RecordQuery;
import com.len.directory.domain.store.RecordStore;
import com.len.directory.domain.store.StoreCollection;
import com.len.directory.domain.webhook.Webhook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 웹훅 등록/조회/수정/삭제 (관리자 전용. 권한 체크는 컨트롤러에서)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookService {

    // 이벤트 필터에 이 값이 있으면 전체 구독
    private static final String ALL_EVENTS = "all";

    private final RecordStore recordStore;
    private final Clock clock;

    public Webhook register(String url, List<String> events, String adminKeyId) {
        String target = requireHttpUrl(url);
        List<String> filter = normalizeEvents(events);
        String secret = SecretHasher.newSecret(SecretHasher.WEBHOOK_SECRET_PREFIX);

        Webhook webhook = Webhook.register(UUID.randomUUID().toString(), target, secret, filter,
                adminKeyId, clock.instant());
        recordStore.upsert(StoreCollection.WEBHOOKS, webhook.getId(), webhook);

        log.info("Webhook registered. webhookId={}, url={}, events={}", webhook.getId(), target,
                filter.isEmpty() ? ALL_EVENTS : filter);
        return webhook;
    }

    public List<Webhook> list() {
        return recordStore.list(StoreCollection.WEBHOOKS, Webhook.class, RecordQuery.all());
    }

    public Webhook get(String webhookId) {
        return recordStore.get(StoreCollection.WEBHOOKS, webhookId, Webhook.class)
                .orElseThrow(() -> new BusinessException(ErrorCode.WEBHOOK_NOT_FOUND));
    }

    /**
     * null 인 항목은 그대로 둔다.
     * - active=true  : 재활성화 (연속 실패 카운트 0)
     * - active=false : 수동 일시정지
     */
    public Webhook update(String webhookId, String url, List<String> events, Boolean active) {
        if (url == null && events == null && active == null) {
            throw new BusinessException(ErrorCode.NO_CHANGES);
        }
        String target = url != null ? requireHttpUrl(url) : null;
        List<String> filter = events != null ? normalizeEvents(events) : null;

        Webhook updated = recordStore.update(StoreCollection.WEBHOOKS, webhookId, Webhook.class, w -> {
                    if (target != null) w.changeTarget(target);
                    if (filter != null) w.changeEvents(filter);
                    if (Boolean.TRUE.equals(active)) w.reactivate();
                    if (Boolean.FALSE.equals(active)) w.pause();
                    return w;
                })
                .orElseThrow(() -> new BusinessException(ErrorCode.WEBHOOK_NOT_FOUND));

        log.info("Webhook updated. webhookId={}, active={}", webhookId, updated.isActive());
        return updated;
    }

    public void delete(String webhookId) {
        if (!recordStore.delete(StoreCollection.WEBHOOKS, webhookId)) {
            throw new BusinessException(ErrorCode.WEBHOOK_NOT_FOUND);
        }
        log.info("Webhook deleted. webhookId={}", webhookId);
    }

    private static String requireHttpUrl(String url) {
        if (!HttpUrls.isHttpUrl(url)) {
            throw new BusinessException(ErrorCode.INVALID_URL);
        }
        return url.trim();
    }

    /**
     * 비어 있거나 "all" 이 있으면 빈 목록(=전체). 모르는 타입이면 400.
     */
    static List<String> normalizeEvents(List<String> events) {
        if (events == null || events.isEmpty()) return List.of();

        List<String> filter = new ArrayList<>();
        for (String raw : events) {
            if (raw == null || raw.isBlank()) continue;
            String type = raw.trim();
            if (ALL_EVENTS.equalsIgnoreCase(type)) {
                return List.of();
            }
            if (!EventTypes.WEBHOOK_EVENTS.contains(type)) {
                throw new BusinessException(ErrorCode.INVALID_EVENT, "지원하지 않는 이벤트 타입입니다: " + type);
            }
            if (!filter.contains(type)) {
                filter.add(type);
            }
        }
        return filter;
    }
}
