package com.len.directory.api.ratelimit.dto;

import jakarta.validation.constraints.Size;

public record ExemptionRequest(
        @Size(max = 500, message = "reason은 500자 이하입니다.")
        String reason
) {}
