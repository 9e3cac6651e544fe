package com.len.directory.application.credential;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 기동 시 관리자 키 보장
 * - directory.admin-api-key 가 있으면 그 값을 관리자 키로 등록 (복구/자동화용)
 * - 관리자 키가 하나도 없으면 새로 만들고 로그로 한 번만 보여준다
 */
@Slf4j
@Component
public class AdminKeyBootstrap implements ApplicationRunner {

    private final ApiKeyService apiKeyService;
    private final String seededAdminKey;

    public AdminKeyBootstrap(ApiKeyService apiKeyService,
                             @Value("${directory.admin-api-key:}") String seededAdminKey) {
        this.apiKeyService = apiKeyService;
        this.seededAdminKey = seededAdminKey;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (seededAdminKey != null && !seededAdminKey.isBlank()) {
            if (apiKeyService.registerIfAbsent(seededAdminKey.trim(), "env-admin", true)) {
                log.info("Admin key from directory.admin-api-key registered");
            }
        }

        if (!apiKeyService.hasAdminKey()) {
            var issued = apiKeyService.create("default-admin", true, null);
            log.warn("=== ADMIN API KEY (save this!) === {}", issued.rawKey());
        }
    }
}
