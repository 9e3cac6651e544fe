package com.len.directory.domain.listing;

import com.len.directory.domain.health.HealthStatus;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Optional;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Listing {

    private String id;
    private String name;
    private String description;
    private String homepageUrl;
    private String apiUrl;
    private ListingStatus status;
    private boolean featured;
    private boolean verified;

    // 익명 제출이면 null
    private String submittedByKeyId;
    private String editTokenHash;

    private HealthStatus lastHealthStatus;
    private Instant lastCheckedAt;
    private Double uptimePct;

    private Instant createdAt;
    private Instant updatedAt;

    public static Listing submit(String id, String name, String description, String homepageUrl, String apiUrl,
                                 ListingStatus status, String submittedByKeyId, String editTokenHash, Instant now) {
        Listing l = new Listing();
        l.id = id;
        l.name = name;
        l.description = description;
        l.homepageUrl = blankToNull(homepageUrl);
        l.apiUrl = blankToNull(apiUrl);
        l.status = status;
        l.submittedByKeyId = submittedByKeyId;
        l.editTokenHash = editTokenHash;
        l.createdAt = now;
        l.updatedAt = now;
        return l;
    }

    /**
     * 헬스체크 대상 URL: api_url 우선, 없으면 homepage_url
     */
    public Optional<String> probeUrl() {
        if (apiUrl != null) return Optional.of(apiUrl);
        return Optional.ofNullable(homepageUrl);
    }

    public boolean eligibleForProbe() {
        return status == ListingStatus.APPROVED && probeUrl().isPresent();
    }

    public void editDetails(String name, String description, String homepageUrl, String apiUrl, Instant now) {
        if (name != null) this.name = name;
        if (description != null) this.description = description;
        if (homepageUrl != null) this.homepageUrl = blankToNull(homepageUrl);
        if (apiUrl != null) this.apiUrl = blankToNull(apiUrl);
        this.updatedAt = now;
    }

    // ===== 관리자 전용 필드 =====

    public void changeStatus(ListingStatus status, Instant now) {
        this.status = status;
        this.updatedAt = now;
    }

    public void markBadges(Boolean featured, Boolean verified, Instant now) {
        if (featured != null) this.featured = featured;
        if (verified != null) this.verified = verified;
        this.updatedAt = now;
    }

    public void recordHealth(HealthStatus status, Instant checkedAt, Double uptimePct) {
        this.lastHealthStatus = status;
        this.lastCheckedAt = checkedAt;
        this.uptimePct = uptimePct;
        this.updatedAt = checkedAt;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
