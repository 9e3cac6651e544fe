package com.len.directory.domain.webhook;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookTest {

    static final int THRESHOLD = 10;

    @Test
    @DisplayName("연속 9번 실패까지는 active, 10번째에 비활성화")
    void disablesExactlyAtTenthConsecutiveFailure() {
        Webhook w = webhook(List.of());

        for (int i = 1; i <= 9; i++) {
            assertThat(w.markFailed(THRESHOLD, Instant.now())).isFalse();
            assertThat(w.isActive()).isTrue();
        }

        assertThat(w.markFailed(THRESHOLD, Instant.now())).isTrue();
        assertThat(w.isActive()).isFalse();
        assertThat(w.getConsecutiveFailureCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("중간에 성공하면 카운트가 0 으로 돌아간다")
    void successResetsCounter() {
        Webhook w = webhook(List.of());
        for (int i = 0; i < 9; i++) {
            w.markFailed(THRESHOLD, Instant.now());
        }

        w.markDelivered(Instant.now());

        assertThat(w.getConsecutiveFailureCount()).isZero();
        assertThat(w.markFailed(THRESHOLD, Instant.now())).isFalse();
        assertThat(w.isActive()).isTrue();
    }

    @Test
    @DisplayName("재활성화 = active + 카운트 0")
    void reactivateResetsCounter() {
        Webhook w = webhook(List.of());
        for (int i = 0; i < 10; i++) {
            w.markFailed(THRESHOLD, Instant.now());
        }

        w.reactivate();

        assertThat(w.isActive()).isTrue();
        assertThat(w.getConsecutiveFailureCount()).isZero();
    }

    @Test
    @DisplayName("이벤트 필터: 비어 있으면 전부, 있으면 목록만, 비활성이면 아무것도")
    void acceptsFollowsFilterAndActiveFlag() {
        assertThat(webhook(List.of()).accepts("app.deleted")).isTrue();

        Webhook filtered = webhook(List.of("app.submitted"));
        assertThat(filtered.accepts("app.submitted")).isTrue();
        assertThat(filtered.accepts("health.checked")).isFalse();

        filtered.pause();
        assertThat(filtered.accepts("app.submitted")).isFalse();
    }

    private static Webhook webhook(List<String> events) {
        return Webhook.register("w1", "https://hooks.example.com", "whsec_abc", events, "admin", Instant.now());
    }
}
