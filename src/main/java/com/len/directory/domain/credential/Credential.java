package com.len.directory.domain.credential;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * credentials 컬렉션 문서. record id 는 secretHash (원문 키는 저장하지 않는다).
 * - ADMIN / REGULAR : API 키. rateLimit 이 null 이면 기본 한도 사용
 * - EDIT_TOKEN      : 앱 하나(listingId)에만 묶인 수정 토큰
 */
public record Credential(
        String id,
        String secretHash,
        CredentialKind kind,
        String name,
        String listingId,
        Integer rateLimit,
        Instant createdAt
) {

    public static Credential apiKey(String id, String secretHash, String name, boolean admin,
                                    Integer rateLimit, Instant now) {
        return new Credential(id, secretHash, admin ? CredentialKind.ADMIN : CredentialKind.REGULAR,
                name, null, rateLimit, now);
    }

    public static Credential editToken(String secretHash, String listingId, Instant now) {
        return new Credential(secretHash, secretHash, CredentialKind.EDIT_TOKEN,
                null, listingId, null, now);
    }

    @JsonIgnore
    public boolean isApiKey() {
        return kind == CredentialKind.ADMIN || kind == CredentialKind.REGULAR;
    }
}
