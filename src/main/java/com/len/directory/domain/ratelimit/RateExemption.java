package com.len.directory.domain.ratelimit;

import java.time.Instant;

/**
 * rate_exemptions 컬렉션 문서. record id = bucket
 */
public record RateExemption(
        String bucket,
        String reason,
        String createdBy,
        Instant createdAt
) {}
