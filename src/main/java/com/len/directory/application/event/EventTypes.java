package com.len.directory.application.event;

import java.util.Set;

public final class EventTypes {

    public static final String APP_SUBMITTED = "app.submitted";
    public static final String APP_APPROVED = "app.approved";
    public static final String APP_REJECTED = "app.rejected";
    public static final String APP_DEPRECATED = "app.deprecated";
    public static final String APP_UPDATED = "app.updated";
    public static final String APP_DELETED = "app.deleted";
    public static final String HEALTH_CHECKED = "health.checked";

    // 구독자가 버퍼를 넘겨 이벤트를 잃었을 때만 생기는 합성 이벤트 (웹훅 대상 아님)
    public static final String WARNING = "warning";

    public static final Set<String> WEBHOOK_EVENTS = Set.of(
            APP_SUBMITTED,
            APP_APPROVED,
            APP_REJECTED,
            APP_DEPRECATED,
            APP_UPDATED,
            APP_DELETED,
            HEALTH_CHECKED
    );

    private EventTypes() {}
}
