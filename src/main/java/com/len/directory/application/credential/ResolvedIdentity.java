package com.len.directory.application.credential;

/**
 * 요청 한 건의 확정된 신원. 네 가지 중 정확히 하나.
 * 호출부에서는 instanceof 로 분기하고 마지막에 예외로 막는다.
 */
public sealed interface ResolvedIdentity {

    String ATTRIBUTE = "com.len.directory.identity";

    record Admin(String keyId, Integer rateLimit) implements ResolvedIdentity {}

    record Regular(String keyId, Integer rateLimit) implements ResolvedIdentity {}

    record EditToken(String listingId) implements ResolvedIdentity {}

    record Anonymous(String clientAddress) implements ResolvedIdentity {}
}
