package com.len.directory.infra.http;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * 외부로 나가는 HTTP 호출 + 그 호출을 돌리는 실행기
 * - probe   : 헬스체크 GET (리다이렉트는 HealthChecker 가 직접 따라간다)
 * - webhook : 웹훅 POST (리다이렉트 안 따라감)
 */
@Configuration
public class HttpClientConfig {

    public static final String PROBE_CLIENT = "probeRestClient";
    public static final String WEBHOOK_CLIENT = "webhookRestClient";
    public static final String WEBHOOK_EXECUTOR = "webhookDeliveryExecutor";
    public static final String EVENT_STREAM_EXECUTOR = "eventStreamExecutor";

    @Bean(PROBE_CLIENT)
    public RestClient probeRestClient(@Value("${directory.health.probe.timeout-seconds:10}") long timeoutSeconds) {
        return restClient(Duration.ofSeconds(timeoutSeconds));
    }

    @Bean(WEBHOOK_CLIENT)
    public RestClient webhookRestClient(@Value("${directory.webhooks.timeout-seconds:10}") long timeoutSeconds) {
        return restClient(Duration.ofSeconds(timeoutSeconds));
    }

    @Bean(WEBHOOK_EXECUTOR)
    public ThreadPoolTaskExecutor webhookDeliveryExecutor(
            @Value("${directory.webhooks.executor.core-pool-size:4}") int corePoolSize,
            @Value("${directory.webhooks.executor.max-pool-size:16}") int maxPoolSize,
            @Value("${directory.webhooks.executor.queue-capacity:1000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("webhook-");
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        // 진행 중인 전송은 끝까지 보내고 종료
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(15);
        executor.initialize();
        return executor;
    }

    /**
     * SSE 연결 하나당 스레드 하나 (연결 수명 = 태스크 수명)
     */
    @Bean(EVENT_STREAM_EXECUTOR)
    public TaskExecutor eventStreamExecutor() {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("event-stream-");
        executor.setDaemon(true);
        return executor;
    }

    private static RestClient restClient(Duration timeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);

        return RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }
}
