package com.len.directory.api.auth;

import com.len.directory.application.credential.CredentialResolver;
import com.len.directory.application.credential.PresentedSecrets;
import com.len.directory.application.credential.ResolvedIdentity;
import com.len.directory.application.ratelimit.Admission;
import com.len.directory.application.ratelimit.RateLimitPolicy;
import com.len.directory.common.exception.BusinessException;
import com.len.directory.common.exception.ErrorCode;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * /api/** 앞단
 * 1) 비밀값 -> 신원 확정, 요청 속성에 저장 (컨트롤러는 @RequestAttribute 로 받음)
 * 2) 신원별 버킷으로 요청 수 제한. 초과하면 429 (카운트는 그래도 올라간다)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitInterceptor implements HandlerInterceptor {

    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RESET_HEADER = "X-RateLimit-Reset";

    private final CredentialResolver credentialResolver;
    private final RateLimitPolicy rateLimitPolicy;
    private final MeterRegistry meterRegistry;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        // SSE 등 비동기 요청이 끝날 때의 재디스패치는 같은 요청이다
        if (request.getDispatcherType() == DispatcherType.ASYNC) {
            return true;
        }

        ResolvedIdentity identity = credentialResolver.resolve(PresentedSecrets.from(request));
        request.setAttribute(ResolvedIdentity.ATTRIBUTE, identity);

        Admission admission = rateLimitPolicy.admit(identity);
        response.setHeader(LIMIT_HEADER, String.valueOf(admission.limit()));
        response.setHeader(REMAINING_HEADER, String.valueOf(admission.remaining()));
        response.setHeader(RESET_HEADER, String.valueOf(admission.resetSeconds()));

        if (!admission.allowed()) {
            response.setHeader("Retry-After", String.valueOf(admission.resetSeconds()));
            meterRegistry.counter("directory.ratelimit.rejected").increment();
            log.debug("Rate limited. bucket={}, limit={}", RateLimitPolicy.bucketOf(identity), admission.limit());
            throw new BusinessException(ErrorCode.RATE_LIMITED);
        }
        return true;
    }
}
