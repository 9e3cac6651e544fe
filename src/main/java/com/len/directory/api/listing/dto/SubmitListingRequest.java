package com.len.directory.api.listing.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SubmitListingRequest(
        @NotBlank(message = "name은 필수입니다.")
        @Size(max = 200, message = "name은 200자 이하입니다.")
        String name,

        @Size(max = 5000, message = "description은 5000자 이하입니다.")
        String description,

        String homepageUrl,

        String apiUrl     // 헬스체크는 api_url 우선
) {}
