package com.len.directory.api.webhook.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record CreateWebhookRequest(
        @NotBlank(message = "url은 필수입니다.")
        String url,

        List<String> events   // 비우거나 "all" 이면 전체 이벤트
) {}
