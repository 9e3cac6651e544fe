package com.len.directory.api.listing.dto;

import com.len.directory.application.listing.ListingPatch;
import jakarta.validation.constraints.Size;

public record UpdateListingRequest(
        @Size(min = 1, max = 200, message = "name은 1~200자입니다.")
        String name,

        @Size(max = 5000, message = "description은 5000자 이하입니다.")
        String description,

        String homepageUrl,
        String apiUrl,

        // 관리자 전용
        String status,
        Boolean featured,
        Boolean verified
) {

    public ListingPatch toPatch() {
        return new ListingPatch(name, description, homepageUrl, apiUrl, status, featured, verified);
    }
}
