package com.len.directory.api.key.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record CreateKeyRequest(
        @NotBlank(message = "name은 필수입니다.")
        @Size(max = 100, message = "name은 100자 이하입니다.")
        String name,

        Boolean admin,    // true 는 관리자만 발급 가능

        @Positive(message = "rate_limit 은 1 이상이어야 합니다.")
        Integer rateLimit // null 이면 기본 한도
) {}
