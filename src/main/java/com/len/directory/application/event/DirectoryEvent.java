package com.len.directory.application.event;

import java.time.Instant;
import java.util.Map;

/**
 * publish 호출 동안만 존재하는 이벤트 (저장하지 않음)
 */
public record DirectoryEvent(
        String type,
        Map<String, Object> payload,
        Instant timestamp
) {

    public static DirectoryEvent of(String type, Map<String, Object> payload) {
        return new DirectoryEvent(type, payload, Instant.now());
    }

    public static DirectoryEvent missed(long missedCount) {
        return of(EventTypes.WARNING, Map.of("missed", missedCount));
    }
}
