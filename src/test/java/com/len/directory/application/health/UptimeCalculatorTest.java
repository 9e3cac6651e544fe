package com.len.directory.application.health;

import com.len.directory.domain.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UptimeCalculatorTest {

    @Test
    @DisplayName("결과 101개 중 가장 오래된 1개만 unhealthy -> 최근 100개 기준 100%")
    void onlyNewestWindowCounts() {
        List<HealthStatus> newestFirst = new ArrayList<>(Collections.nCopies(100, HealthStatus.HEALTHY));
        newestFirst.add(HealthStatus.UNHEALTHY);

        assertThat(UptimeCalculator.uptimePercent(newestFirst, 100)).isEqualTo(100.0);
    }

    @Test
    @DisplayName("100개 미만이면 있는 만큼으로 나눈다")
    void fewerThanWindow() {
        List<HealthStatus> newestFirst = List.of(
                HealthStatus.HEALTHY, HealthStatus.UNREACHABLE, HealthStatus.HEALTHY, HealthStatus.UNHEALTHY);

        assertThat(UptimeCalculator.uptimePercent(newestFirst, 100)).isEqualTo(50.0);
    }

    @Test
    @DisplayName("결과가 없으면 null")
    void noResults() {
        assertThat(UptimeCalculator.uptimePercent(List.of(), 100)).isNull();
    }
}
