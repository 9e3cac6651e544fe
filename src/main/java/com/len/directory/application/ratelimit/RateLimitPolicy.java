package com.len.directory.application.ratelimit;

import com.len.directory.application.credential.ResolvedIdentity;
import com.len.directory.domain.ratelimit.RateExemption;
import com.len.directory.domain.store.RecordStore;
import com.len.directory.domain.store.StoreCollection;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 신원 -> (bucket, limit) 결정 후 FixedWindowRateLimiter 에 위임
 */
@Component
public class RateLimitPolicy {

    private final FixedWindowRateLimiter rateLimiter;
    private final RecordStore recordStore;
    private final long windowSeconds;
    private final long defaultLimit;
    private final long adminLimit;

    public RateLimitPolicy(FixedWindowRateLimiter rateLimiter,
                           RecordStore recordStore,
                           @Value("${directory.rate-limit.window-seconds:60}") long windowSeconds,
                           @Value("${directory.rate-limit.default-limit:100}") long defaultLimit,
                           @Value("${directory.rate-limit.admin-limit:10000}") long adminLimit) {
        this.rateLimiter = rateLimiter;
        this.recordStore = recordStore;
        this.windowSeconds = windowSeconds;
        this.defaultLimit = defaultLimit;
        this.adminLimit = adminLimit;
    }

    public Admission admit(ResolvedIdentity identity) {
        String bucket = bucketOf(identity);
        long limit = limitOf(identity);

        if (recordStore.get(StoreCollection.RATE_EXEMPTIONS, bucket, RateExemption.class).isPresent()) {
            return Admission.exempt(limit, windowSeconds);
        }
        return rateLimiter.admit(bucket, limit, windowSeconds);
    }

    public static String bucketOf(ResolvedIdentity identity) {
        if (identity instanceof ResolvedIdentity.Admin admin) {
            return "key:" + admin.keyId();
        }
        if (identity instanceof ResolvedIdentity.Regular regular) {
            return "key:" + regular.keyId();
        }
        if (identity instanceof ResolvedIdentity.EditToken token) {
            return "listing:" + token.listingId();
        }
        if (identity instanceof ResolvedIdentity.Anonymous anonymous) {
            return "ip:" + anonymous.clientAddress();
        }
        throw new IllegalStateException("Unhandled identity: " + identity);
    }

    private long limitOf(ResolvedIdentity identity) {
        if (identity instanceof ResolvedIdentity.Admin admin) {
            return admin.rateLimit() != null ? admin.rateLimit() : adminLimit;
        }
        if (identity instanceof ResolvedIdentity.Regular regular) {
            return regular.rateLimit() != null ? regular.rateLimit() : defaultLimit;
        }
        return defaultLimit;
    }
}
