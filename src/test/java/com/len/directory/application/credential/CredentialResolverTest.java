package com.len.directory.application.credential;

import com.len.directory.domain.credential.Credential;
import com.len.directory.domain.store.RecordStore;
import com.len.directory.domain.store.StoreCollection;
import com.len.directory.support.TestRecordStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialResolverTest {

    static final String ADMIN_KEY = "ad_admin";
    static final String REGULAR_KEY = "ad_regular";
    static final String EDIT_TOKEN = "ed_token_for_app_a";

    RecordStore store;
    CredentialResolver resolver;

    @BeforeEach
    void setUp() {
        store = TestRecordStores.store(Clock.systemUTC());
        resolver = new CredentialResolver(store);

        save(Credential.apiKey("admin-id", SecretHasher.hash(ADMIN_KEY), "admin", true, null, Instant.now()));
        save(Credential.apiKey("regular-id", SecretHasher.hash(REGULAR_KEY), "regular", false, 500, Instant.now()));
        save(Credential.editToken(SecretHasher.hash(EDIT_TOKEN), "app-a", Instant.now()));
    }

    @Test
    @DisplayName("관리자 키 -> Admin")
    void adminKey() {
        ResolvedIdentity identity = resolver.resolve(new PresentedSecrets(ADMIN_KEY, null, "10.0.0.1"));

        assertThat(identity).isEqualTo(new ResolvedIdentity.Admin("admin-id", null));
    }

    @Test
    @DisplayName("일반 키 -> Regular (키별 한도 포함)")
    void regularKey() {
        ResolvedIdentity identity = resolver.resolve(new PresentedSecrets(REGULAR_KEY, null, "10.0.0.1"));

        assertThat(identity).isEqualTo(new ResolvedIdentity.Regular("regular-id", 500));
    }

    @Test
    @DisplayName("유효한 수정 토큰은 API 키보다 우선")
    void validEditTokenWinsOverApiKey() {
        ResolvedIdentity identity = resolver.resolve(new PresentedSecrets(ADMIN_KEY, EDIT_TOKEN, "10.0.0.1"));

        assertThat(identity).isEqualTo(new ResolvedIdentity.EditToken("app-a"));
    }

    @Test
    @DisplayName("모르는 수정 토큰이면 API 키로 넘어간다")
    void unknownEditTokenFallsThroughToApiKey() {
        ResolvedIdentity identity = resolver.resolve(new PresentedSecrets(REGULAR_KEY, "ed_unknown", "10.0.0.1"));

        assertThat(identity).isInstanceOf(ResolvedIdentity.Regular.class);
    }

    @Test
    @DisplayName("모르는 키 / 아무것도 없음 -> Anonymous(ip)")
    void unknownOrMissingSecretsAreAnonymous() {
        assertThat(resolver.resolve(new PresentedSecrets("ad_nope", null, "10.0.0.9")))
                .isEqualTo(new ResolvedIdentity.Anonymous("10.0.0.9"));
        assertThat(resolver.resolve(PresentedSecrets.none("10.0.0.9")))
                .isEqualTo(new ResolvedIdentity.Anonymous("10.0.0.9"));
    }

    @Test
    @DisplayName("API 키 자리에 수정 토큰이 오면 해당 앱 범위로만 인정")
    void editTokenInApiKeySlotIsScopedToItsListing() {
        ResolvedIdentity identity = resolver.resolve(new PresentedSecrets(EDIT_TOKEN, null, "10.0.0.1"));

        assertThat(identity).isEqualTo(new ResolvedIdentity.EditToken("app-a"));
    }

    @Test
    @DisplayName("폐기된(삭제된) 키는 Anonymous")
    void revokedKeyIsAnonymous() {
        store.delete(StoreCollection.CREDENTIALS, SecretHasher.hash(REGULAR_KEY));

        assertThat(resolver.resolve(new PresentedSecrets(REGULAR_KEY, null, "10.0.0.1")))
                .isInstanceOf(ResolvedIdentity.Anonymous.class);
    }

    private void save(Credential c) {
        store.upsert(StoreCollection.CREDENTIALS, c.secretHash(), c);
    }
}
