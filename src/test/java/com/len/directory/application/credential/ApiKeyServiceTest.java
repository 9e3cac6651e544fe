package com.len.directory.application.credential;

import com.len.directory.common.exception.BusinessException;
import com.len.directory.common.exception.ErrorCode;
import com.len.directory.domain.credential.CredentialKind;
import com.len.directory.support.TestRecordStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApiKeyServiceTest {

    ApiKeyService apiKeyService;
    CredentialResolver resolver;

    @BeforeEach
    void setUp() {
        var store = TestRecordStores.store(Clock.systemUTC());
        apiKeyService = new ApiKeyService(store, Clock.systemUTC());
        resolver = new CredentialResolver(store);
    }

    @Test
    @DisplayName("익명도 일반 키 발급 가능, 원문은 ad_ 로 시작하고 해시로만 저장된다")
    void anonymousCanIssueRegularKey() {
        var issued = apiKeyService.issue(new ResolvedIdentity.Anonymous("1.1.1.1"), "my-bot", false, null);

        assertThat(issued.rawKey()).startsWith(SecretHasher.API_KEY_PREFIX);
        assertThat(issued.credential().kind()).isEqualTo(CredentialKind.REGULAR);
        assertThat(issued.credential().secretHash()).isEqualTo(SecretHasher.hash(issued.rawKey()));
        assertThat(resolver.resolve(new PresentedSecrets(issued.rawKey(), null, "1.1.1.1")))
                .isInstanceOf(ResolvedIdentity.Regular.class);
    }

    @Test
    @DisplayName("관리자 키 발급은 관리자만")
    void adminKeyRequiresAdmin() {
        assertThatThrownBy(() -> apiKeyService.issue(new ResolvedIdentity.Regular("k", null), "x", true, null))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.ADMIN_REQUIRED);

        var issued = apiKeyService.issue(new ResolvedIdentity.Admin("root", null), "ops", true, null);
        assertThat(issued.credential().kind()).isEqualTo(CredentialKind.ADMIN);
    }

    @Test
    @DisplayName("revoke 후에는 그 키로 인증되지 않는다")
    void revokeRemovesKey() {
        var issued = apiKeyService.create("tmp", false, null);

        apiKeyService.revoke(issued.credential().id());

        assertThat(resolver.resolve(new PresentedSecrets(issued.rawKey(), null, "1.1.1.1")))
                .isInstanceOf(ResolvedIdentity.Anonymous.class);
        assertThatThrownBy(() -> apiKeyService.revoke(issued.credential().id()))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.KEY_NOT_FOUND);
    }

    @Test
    @DisplayName("registerIfAbsent: 같은 원문 키는 한 번만 등록")
    void registerIfAbsentIsIdempotent() {
        assertThat(apiKeyService.hasAdminKey()).isFalse();

        assertThat(apiKeyService.registerIfAbsent("ad_seed", "env-admin", true)).isTrue();
        assertThat(apiKeyService.registerIfAbsent("ad_seed", "env-admin", true)).isFalse();

        assertThat(apiKeyService.hasAdminKey()).isTrue();
        assertThat(apiKeyService.listKeys()).hasSize(1);
    }
}
