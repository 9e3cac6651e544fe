package com.len.directory.application.listing;

import com.len.directory.domain.listing.Listing;

/**
 * 제출 결과. editToken 원문은 이때 한 번만 돌려준다.
 */
public record SubmittedListing(Listing listing, String editToken) {}
