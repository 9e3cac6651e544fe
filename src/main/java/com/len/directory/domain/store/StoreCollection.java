package com.len.directory.domain.store;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum StoreCollection {

    CREDENTIALS("credentials"),
    LISTINGS("listings"),
    WEBHOOKS("webhooks"),
    HEALTH_RESULTS("health_results"),
    RATE_EXEMPTIONS("rate_exemptions");

    private final String tableValue;
}
