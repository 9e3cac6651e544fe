package com.len.directory.api.key.dto;

import com.len.directory.application.credential.ApiKeyService;
import com.len.directory.domain.credential.Credential;
import com.len.directory.domain.credential.CredentialKind;

import java.time.Instant;

/**
 * key 는 발급 직후 응답에서만 채워진다.
 */
public record KeyResponse(
        String id,
        String key,
        String name,
        boolean admin,
        Integer rateLimit,
        Instant createdAt
) {

    public static KeyResponse from(Credential c) {
        return new KeyResponse(c.id(), null, c.name(), c.kind() == CredentialKind.ADMIN, c.rateLimit(), c.createdAt());
    }

    public static KeyResponse issued(ApiKeyService.IssuedKey issued) {
        Credential c = issued.credential();
        return new KeyResponse(c.id(), issued.rawKey(), c.name(), c.kind() == CredentialKind.ADMIN,
                c.rateLimit(), c.createdAt());
    }
}
