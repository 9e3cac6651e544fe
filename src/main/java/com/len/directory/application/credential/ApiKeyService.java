package com.len.directory.application.credential;

import com.len.directory.common.exception.BusinessException;
import com.len.directory.common.exception.ErrorCode;
import com.len.directory.domain.credential.Credential;
import com.len.directory.domain.credential.CredentialKind;
import com.len.directory.domain.store.RecordQuery;
import com.len.directory.domain.store.RecordStore;
import com.len.directory.domain.store.StoreCollection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyService {

    private final RecordStore recordStore;
    private final Clock clock;

    /**
     * 일반 키는 누구나, 관리자 키는 관리자만 발급
     */
    public IssuedKey issue(ResolvedIdentity requester, String name, boolean admin, Integer rateLimit) {
        if (admin) {
            AccessGuard.requireAdmin(requester);
        }
        if (rateLimit != null && rateLimit <= 0) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "rate_limit 은 1 이상이어야 합니다.");
        }
        return create(name, admin, rateLimit);
    }

    public IssuedKey create(String name, boolean admin, Integer rateLimit) {
        String rawKey = SecretHasher.newSecret(SecretHasher.API_KEY_PREFIX);
        Credential credential = register(rawKey, name, admin, rateLimit);
        return new IssuedKey(credential, rawKey);
    }

    /**
     * 이미 알고 있는 원문 키를 등록 (ADMIN_API_KEY 시드용). 있으면 그대로 둔다.
     */
    public boolean registerIfAbsent(String rawKey, String name, boolean admin) {
        String hash = SecretHasher.hash(rawKey);
        if (recordStore.get(StoreCollection.CREDENTIALS, hash, Credential.class).isPresent()) {
            return false;
        }
        register(rawKey, name, admin, null);
        return true;
    }

    public List<Credential> listKeys() {
        return recordStore.list(StoreCollection.CREDENTIALS, Credential.class,
                RecordQuery.where(Credential::isApiKey));
    }

    public boolean hasAdminKey() {
        return !recordStore.list(StoreCollection.CREDENTIALS, Credential.class,
                RecordQuery.<Credential>where(c -> c.kind() == CredentialKind.ADMIN).limit(1)).isEmpty();
    }

    /**
     * 저장소에서 지우는 것 = 폐기
     */
    public void revoke(String keyId) {
        Credential target = recordStore.list(StoreCollection.CREDENTIALS, Credential.class,
                        RecordQuery.<Credential>where(c -> c.isApiKey() && c.id().equals(keyId)).limit(1))
                .stream()
                .findFirst()
                .orElseThrow(() -> new BusinessException(ErrorCode.KEY_NOT_FOUND));

        recordStore.delete(StoreCollection.CREDENTIALS, target.secretHash());
        log.info("API key revoked. keyId={}, kind={}", target.id(), target.kind());
    }

    private Credential register(String rawKey, String name, boolean admin, Integer rateLimit) {
        String hash = SecretHasher.hash(rawKey);
        Credential credential = Credential.apiKey(UUID.randomUUID().toString(), hash, name, admin, rateLimit, clock.instant());
        recordStore.upsert(StoreCollection.CREDENTIALS, hash, credential);
        return credential;
    }

    public record IssuedKey(Credential credential, String rawKey) {}
}
