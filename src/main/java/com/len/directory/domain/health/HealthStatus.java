package com.len.directory.domain.health;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthStatus {
    HEALTHY,
    UNHEALTHY,
    UNREACHABLE;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
