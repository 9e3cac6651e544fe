package com.len.directory.api.listing;

import com.len.directory.api.listing.dto.ListingResponse;
import com.len.directory.api.listing.dto.SubmitListingRequest;
import com.len.directory.api.listing.dto.SubmitListingResponse;
import com.len.directory.api.listing.dto.UpdateListingRequest;
import com.len.directory.application.credential.ResolvedIdentity;
import com.len.directory.application.listing.ListingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/apps")
public class ListingController {

    private final ListingService listingService;

    // 익명 제출 허용
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SubmitListingResponse submit(
            @Valid @RequestBody SubmitListingRequest request,
            @RequestAttribute(ResolvedIdentity.ATTRIBUTE) ResolvedIdentity identity
    ) {
        var submitted = listingService.submit(
                identity,
                request.name(),
                request.description(),
                request.homepageUrl(),
                request.apiUrl()
        );
        return SubmitListingResponse.from(submitted);
    }

    @GetMapping("/{appId}")
    public ListingResponse get(@PathVariable String appId) {
        return ListingResponse.from(listingService.get(appId));
    }

    @PatchMapping("/{appId}")
    public ListingResponse update(
            @PathVariable String appId,
            @Valid @RequestBody UpdateListingRequest request,
            @RequestAttribute(ResolvedIdentity.ATTRIBUTE) ResolvedIdentity identity
    ) {
        return ListingResponse.from(listingService.update(identity, appId, request.toPatch()));
    }

    @DeleteMapping("/{appId}")
    public ResponseEntity<Void> delete(
            @PathVariable String appId,
            @RequestAttribute(ResolvedIdentity.ATTRIBUTE) ResolvedIdentity identity
    ) {
        listingService.delete(identity, appId);
        return ResponseEntity.noContent().build();
    }
}
