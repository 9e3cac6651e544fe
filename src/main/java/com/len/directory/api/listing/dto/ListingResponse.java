package com.len.directory.api.listing.dto;

import com.len.directory.domain.listing.Listing;

import java.time.Instant;

public record ListingResponse(
        String id,
        String name,
        String description,
        String homepageUrl,
        String apiUrl,
        String status,
        boolean featured,
        boolean verified,
        String healthStatus,
        Instant lastCheckedAt,
        Double uptimePct,
        Instant createdAt,
        Instant updatedAt
) {

    public static ListingResponse from(Listing l) {
        return new ListingResponse(
                l.getId(),
                l.getName(),
                l.getDescription(),
                l.getHomepageUrl(),
                l.getApiUrl(),
                l.getStatus().value(),
                l.isFeatured(),
                l.isVerified(),
                l.getLastHealthStatus() != null ? l.getLastHealthStatus().value() : null,
                l.getLastCheckedAt(),
                l.getUptimePct(),
                l.getCreatedAt(),
                l.getUpdatedAt()
        );
    }
}
