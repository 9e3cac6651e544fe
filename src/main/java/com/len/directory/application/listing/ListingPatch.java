package com.len.directory.application.listing;

/**
 * PATCH 요청 내용. null 인 항목은 변경하지 않는다.
 * status / featured / verified 는 관리자 전용.
 */
public record ListingPatch(
        String name,
        String description,
        String homepageUrl,
        String apiUrl,
        String status,
        Boolean featured,
        Boolean verified
) {

    public boolean isEmpty() {
        return name == null && description == null && homepageUrl == null && apiUrl == null
                && !touchesAdminFields();
    }

    public boolean touchesAdminFields() {
        return status != null || featured != null || verified != null;
    }
}
