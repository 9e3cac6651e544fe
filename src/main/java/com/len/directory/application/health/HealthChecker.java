package com.len.directory.application.health;

import com.len.directory.infra.http.HttpClientConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeUnit;

/**
 * URL 하나에 GET 1회 (리다이렉트는 최대 maxRedirects 번까지 직접 따라간다)
 *
 * - 최종 2xx          : healthy
 * - 그 외 최종 상태코드 : unhealthy (코드 기록)
 * - 연결/타임아웃/DNS/URL 오류, 리다이렉트 초과 : unreachable (코드 없음)
 *
 * timeoutSeconds 는 리다이렉트를 포함한 시도 전체의 상한이다.
 *
 * 예외를 밖으로 던지지 않는다. 실패도 결과값이다.
 */
@Slf4j
@Component
public class HealthChecker {

    static final String TIMEOUT_MESSAGE = "Connection timed out (%ds)";
    static final String CONNECT_MESSAGE = "Connection refused or DNS failure";

    private final RestClient restClient;
    private final int maxRedirects;
    private final long timeoutSeconds;

    public HealthChecker(@Qualifier(HttpClientConfig.PROBE_CLIENT) RestClient restClient,
                         @Value("${directory.health.probe.max-redirects:5}") int maxRedirects,
                         @Value("${directory.health.probe.timeout-seconds:10}") long timeoutSeconds) {
        this.restClient = restClient;
        this.maxRedirects = maxRedirects;
        this.timeoutSeconds = timeoutSeconds;
    }

    public HealthProbe check(String probeUrl) {
        long started = System.nanoTime();
        long deadline = started + TimeUnit.SECONDS.toNanos(timeoutSeconds);

        URI current;
        try {
            current = URI.create(probeUrl.trim());
        } catch (IllegalArgumentException e) {
            return HealthProbe.unreachable(elapsedMs(started), "Invalid URL: " + probeUrl, probeUrl);
        }

        try {
            int redirects = 0;
            while (true) {
                Hop hop = restClient.get()
                        .uri(current)
                        .exchange((request, response) ->
                                new Hop(response.getStatusCode(), response.getHeaders().getLocation()));

                if (System.nanoTime() - deadline >= 0) {
                    log.debug("Probe exceeded overall timeout. url={}, hops={}", probeUrl, redirects + 1);
                    return HealthProbe.unreachable(elapsedMs(started),
                            String.format(TIMEOUT_MESSAGE, timeoutSeconds), probeUrl);
                }

                if (hop.status().is3xxRedirection() && hop.location() != null) {
                    if (redirects >= maxRedirects) {
                        return HealthProbe.unreachable(elapsedMs(started),
                                "Too many redirects (max " + maxRedirects + ")", probeUrl);
                    }
                    redirects++;
                    current = current.resolve(hop.location());
                    continue;
                }
                return HealthProbe.of(hop.status().value(), elapsedMs(started), probeUrl);
            }
        } catch (ResourceAccessException e) {
            String message = isTimeout(e) ? String.format(TIMEOUT_MESSAGE, timeoutSeconds) : CONNECT_MESSAGE;
            log.debug("Probe unreachable. url={}, cause={}", probeUrl, e.getMessage());
            return HealthProbe.unreachable(elapsedMs(started), message, probeUrl);
        } catch (IllegalArgumentException e) {
            // 지원하지 않는 scheme, host 없는 URL 등
            return HealthProbe.unreachable(elapsedMs(started), "Invalid URL: " + probeUrl, probeUrl);
        } catch (RuntimeException e) {
            log.warn("Probe failed. url={}", probeUrl, e);
            return HealthProbe.unreachable(elapsedMs(started), e.getMessage(), probeUrl);
        }
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof HttpTimeoutException || t instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }

    private record Hop(HttpStatusCode status, URI location) {}
}
