package com.len.directory.api.webhook.dto;

import java.util.List;

public record UpdateWebhookRequest(
        String url,
        List<String> events,
        Boolean active        // true = 재활성화(실패 카운트 초기화), false = 일시정지
) {}
