package com.len.directory.application.ratelimit;

import com.len.directory.common.exception.BusinessException;
import com.len.directory.common.exception.ErrorCode;
import com.len.directory.domain.ratelimit.RateExemption;
import com.len.directory.domain.store.RecordQuery;
import com.len.directory.domain.store.RecordStore;
import com.len.directory.domain.store.StoreCollection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RateExemptionService {

    private final RecordStore recordStore;
    private final Clock clock;

    public RateExemption exempt(String bucket, String reason, String adminKeyId) {
        if (bucket == null || bucket.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "bucket 은 필수입니다.");
        }
        RateExemption exemption = new RateExemption(bucket.trim(), reason, adminKeyId, clock.instant());
        recordStore.upsert(StoreCollection.RATE_EXEMPTIONS, exemption.bucket(), exemption);
        log.info("Rate limit exemption added. bucket={}, by={}", exemption.bucket(), adminKeyId);
        return exemption;
    }

    public List<RateExemption> list() {
        return recordStore.list(StoreCollection.RATE_EXEMPTIONS, RateExemption.class, RecordQuery.all());
    }

    public boolean remove(String bucket) {
        boolean removed = recordStore.delete(StoreCollection.RATE_EXEMPTIONS, bucket);
        if (removed) {
            log.info("Rate limit exemption removed. bucket={}", bucket);
        }
        return removed;
    }
}
