package com.len.directory.api.ratelimit;

import com.len.directory.api.ratelimit.dto.ExemptionRequest;
import com.len.directory.application.credential.AccessGuard;
import com.len.directory.application.credential.ResolvedIdentity;
import com.len.directory.application.ratelimit.RateExemptionService;
import com.len.directory.common.exception.BusinessException;
import com.len.directory.common.exception.ErrorCode;
import com.len.directory.domain.ratelimit.RateExemption;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * bucket 예: key:{keyId}, listing:{appId}, ip:{addr}
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/rate-exemptions")
public class RateExemptionController {

    private final RateExemptionService rateExemptionService;

    @GetMapping
    public List<RateExemption> list(@RequestAttribute(ResolvedIdentity.ATTRIBUTE) ResolvedIdentity identity) {
        AccessGuard.requireAdmin(identity);
        return rateExemptionService.list();
    }

    @PutMapping("/{bucket}")
    public RateExemption exempt(
            @PathVariable String bucket,
            @Valid @RequestBody(required = false) ExemptionRequest request,
            @RequestAttribute(ResolvedIdentity.ATTRIBUTE) ResolvedIdentity identity
    ) {
        ResolvedIdentity.Admin admin = AccessGuard.requireAdmin(identity);
        String reason = request != null ? request.reason() : null;
        return rateExemptionService.exempt(bucket, reason, admin.keyId());
    }

    @DeleteMapping("/{bucket}")
    public ResponseEntity<Void> remove(
            @PathVariable String bucket,
            @RequestAttribute(ResolvedIdentity.ATTRIBUTE) ResolvedIdentity identity
    ) {
        AccessGuard.requireAdmin(identity);
        if (!rateExemptionService.remove(bucket)) {
            throw new BusinessException(ErrorCode.EXEMPTION_NOT_FOUND);
        }
        return ResponseEntity.noContent().build();
    }
}
