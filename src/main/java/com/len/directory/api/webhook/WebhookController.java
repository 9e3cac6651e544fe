package com.len.directory.api.webhook;

import com.len.directory.api.webhook.dto.CreateWebhookRequest;
import com.len.directory.api.webhook.dto.UpdateWebhookRequest;
import com.len.directory.api.webhook.dto.WebhookResponse;
import com.len.directory.application.credential.AccessGuard;
import com.len.directory.application.credential.ResolvedIdentity;
import com.len.directory.application.webhook.WebhookService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 전부 관리자 전용
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/webhooks")
public class WebhookController {

    private final WebhookService webhookService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public WebhookResponse register(
            @Valid @RequestBody CreateWebhookRequest request,
            @RequestAttribute(ResolvedIdentity.ATTRIBUTE) ResolvedIdentity identity
    ) {
        ResolvedIdentity.Admin admin = AccessGuard.requireAdmin(identity);
        return WebhookResponse.registered(webhookService.register(request.url(), request.events(), admin.keyId()));
    }

    @GetMapping
    public List<WebhookResponse> list(@RequestAttribute(ResolvedIdentity.ATTRIBUTE) ResolvedIdentity identity) {
        AccessGuard.requireAdmin(identity);
        return webhookService.list().stream()
                .map(WebhookResponse::from)
                .toList();
    }

    @PatchMapping("/{webhookId}")
    public WebhookResponse update(
            @PathVariable String webhookId,
            @RequestBody UpdateWebhookRequest request,
            @RequestAttribute(ResolvedIdentity.ATTRIBUTE) ResolvedIdentity identity
    ) {
        AccessGuard.requireAdmin(identity);
        return WebhookResponse.from(
                webhookService.update(webhookId, request.url(), request.events(), request.active()));
    }

    @DeleteMapping("/{webhookId}")
    public ResponseEntity<Void> delete(
            @PathVariable String webhookId,
            @RequestAttribute(ResolvedIdentity.ATTRIBUTE) ResolvedIdentity identity
    ) {
        AccessGuard.requireAdmin(identity);
        webhookService.delete(webhookId);
        return ResponseEntity.noContent().build();
    }
}
