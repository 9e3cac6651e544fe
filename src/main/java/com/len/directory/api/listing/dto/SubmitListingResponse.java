package com.len.directory.api.listing.dto;

import com.len.directory.application.listing.SubmittedListing;

public record SubmitListingResponse(
        String appId,
        String status,
        String editToken,
        String editUrl
) {

    public static SubmitListingResponse from(SubmittedListing submitted) {
        String appId = submitted.listing().getId();
        return new SubmitListingResponse(
                appId,
                submitted.listing().getStatus().value(),
                submitted.editToken(),
                "/api/v1/apps/" + appId + "?token=" + submitted.editToken()
        );
    }
}
