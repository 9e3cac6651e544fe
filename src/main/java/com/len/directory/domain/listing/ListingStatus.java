package com.len.directory.domain.listing;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum ListingStatus {
    PENDING,
    APPROVED,
    REJECTED,
    DEPRECATED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    public static Optional<ListingStatus> parse(String raw) {
        if (raw == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(s -> s.value().equalsIgnoreCase(raw.trim()))
                .findFirst();
    }
}
