package com.len.directory.application.credential;

import com.len.directory.domain.credential.Credential;
import com.len.directory.domain.credential.CredentialKind;
import com.len.directory.domain.store.RecordStore;
import com.len.directory.domain.store.StoreCollection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 제시된 비밀값 -> ResolvedIdentity
 *
 * 우선순위 (고정)
 * 1) 수정 토큰 슬롯(X-Edit-Token / ?token=) 이 유효하면 EditToken. API 키가 같이 와도 무시한다.
 * 2) API 키 슬롯(Authorization: Bearer / X-API-Key) 이 유효하면 Admin / Regular
 * 3) 나머지(없음, 모르는 값, 형식 오류) 는 Anonymous
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialResolver {

    private final RecordStore recordStore;

    public ResolvedIdentity resolve(PresentedSecrets secrets) {
        if (secrets.editToken() != null) {
            Optional<Credential> token = lookup(secrets.editToken());
            if (token.isPresent() && token.get().kind() == CredentialKind.EDIT_TOKEN) {
                return new ResolvedIdentity.EditToken(token.get().listingId());
            }
            log.debug("Unknown edit token presented. client={}", secrets.clientAddress());
        }

        if (secrets.apiKey() != null) {
            Optional<Credential> key = lookup(secrets.apiKey());
            if (key.isPresent()) {
                Credential c = key.get();
                switch (c.kind()) {
                    case ADMIN:
                        return new ResolvedIdentity.Admin(c.id(), c.rateLimit());
                    case REGULAR:
                        return new ResolvedIdentity.Regular(c.id(), c.rateLimit());
                    case EDIT_TOKEN:
                        // API 키 자리에 수정 토큰이 온 경우에도 해당 앱 범위로만 인정
                        return new ResolvedIdentity.EditToken(c.listingId());
                    default:
                        throw new IllegalStateException("Unhandled credential kind: " + c.kind());
                }
            }
            log.debug("Unknown API key presented. client={}", secrets.clientAddress());
        }

        return new ResolvedIdentity.Anonymous(secrets.clientAddress());
    }

    private Optional<Credential> lookup(String rawSecret) {
        return recordStore.get(StoreCollection.CREDENTIALS, SecretHasher.hash(rawSecret), Credential.class);
    }
}
