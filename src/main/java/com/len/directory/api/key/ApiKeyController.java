package com.len.directory.api.key;

import com.len.directory.api.key.dto.CreateKeyRequest;
import com.len.directory.api.key.dto.KeyResponse;
import com.len.directory.application.credential.AccessGuard;
import com.len.directory.application.credential.ApiKeyService;
import com.len.directory.application.credential.ResolvedIdentity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/keys")
public class ApiKeyController {

    private final ApiKeyService apiKeyService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public KeyResponse create(
            @Valid @RequestBody CreateKeyRequest request,
            @RequestAttribute(ResolvedIdentity.ATTRIBUTE) ResolvedIdentity identity
    ) {
        boolean admin = Boolean.TRUE.equals(request.admin());
        return KeyResponse.issued(apiKeyService.issue(identity, request.name(), admin, request.rateLimit()));
    }

    @GetMapping
    public List<KeyResponse> list(@RequestAttribute(ResolvedIdentity.ATTRIBUTE) ResolvedIdentity identity) {
        AccessGuard.requireAdmin(identity);
        return apiKeyService.listKeys().stream()
                .map(KeyResponse::from)
                .toList();
    }

    @DeleteMapping("/{keyId}")
    public ResponseEntity<Void> revoke(
            @PathVariable String keyId,
            @RequestAttribute(ResolvedIdentity.ATTRIBUTE) ResolvedIdentity identity
    ) {
        AccessGuard.requireAdmin(identity);
        apiKeyService.revoke(keyId);
        return ResponseEntity.noContent().build();
    }
}
