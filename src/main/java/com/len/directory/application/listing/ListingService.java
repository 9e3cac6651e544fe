package com.len.directory.application.listing;

import com.len.directory.application.credential.ResolvedIdentity;
import com.len.directory.application.credential.SecretHasher;
import com.len.directory.application.event.DirectoryEvent;
import com.len.directory.application.event.EventBus;
import com.len.directory.application.event.EventTypes;
import com.len.directory.common.exception.BusinessException;
import com.len.directory.common.exception.ErrorCode;
import com.len.directory.common.util.HttpUrls;
import com.len.directory.domain.credential.Credential;
import com.len.directory.domain.listing.Listing;
import com.len.directory.domain.listing.ListingStatus;
import com.len.directory.domain.store.RecordStore;
import com.len.directory.domain.store.StoreCollection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
public class ListingService {

    private final RecordStore recordStore;
    private final EventBus eventBus;
    private final Clock clock;
    private final boolean autoApprove;

    public ListingService(RecordStore recordStore,
                          EventBus eventBus,
                          Clock clock,
                          @Value("${directory.listings.auto-approve:true}") boolean autoApprove) {
        this.recordStore = recordStore;
        this.eventBus = eventBus;
        this.clock = clock;
        this.autoApprove = autoApprove;
    }

    /**
     * 누구나 제출 가능. 제출할 때마다 이 앱 전용 수정 토큰을 새로 발급한다.
     */
    public SubmittedListing submit(ResolvedIdentity requester, String name, String description,
                                   String homepageUrl, String apiUrl) {
        requireOptionalHttpUrl(homepageUrl);
        requireOptionalHttpUrl(apiUrl);

        Instant now = clock.instant();
        String listingId = UUID.randomUUID().toString();
        String editToken = SecretHasher.newSecret(SecretHasher.EDIT_TOKEN_PREFIX);
        String tokenHash = SecretHasher.hash(editToken);

        Listing listing = Listing.submit(
                listingId,
                name.trim(),
                description,
                homepageUrl,
                apiUrl,
                autoApprove ? ListingStatus.APPROVED : ListingStatus.PENDING,
                submitterKeyId(requester),
                tokenHash,
                now
        );

        recordStore.upsert(StoreCollection.LISTINGS, listingId, listing);
        recordStore.upsert(StoreCollection.CREDENTIALS, tokenHash, Credential.editToken(tokenHash, listingId, now));

        eventBus.publish(DirectoryEvent.of(EventTypes.APP_SUBMITTED, eventPayload(listing)));
        log.info("Listing submitted. listingId={}, status={}, byKey={}",
                listingId, listing.getStatus().value(), listing.getSubmittedByKeyId());
        return new SubmittedListing(listing, editToken);
    }

    public Listing get(String listingId) {
        return recordStore.get(StoreCollection.LISTINGS, listingId, Listing.class)
                .orElseThrow(() -> new BusinessException(ErrorCode.LISTING_NOT_FOUND));
    }

    public Listing update(ResolvedIdentity requester, String listingId, ListingPatch patch) {
        Listing current = get(listingId);
        authorize(requester, current);

        if (patch.isEmpty()) {
            throw new BusinessException(ErrorCode.NO_CHANGES);
        }
        if (patch.touchesAdminFields() && !(requester instanceof ResolvedIdentity.Admin)) {
            throw new BusinessException(ErrorCode.ADMIN_FIELD);
        }

        ListingStatus newStatus = null;
        if (patch.status() != null) {
            newStatus = ListingStatus.parse(patch.status())
                    .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_STATUS));
        }
        requireOptionalHttpUrl(patch.homepageUrl());
        requireOptionalHttpUrl(patch.apiUrl());

        Instant now = clock.instant();
        ListingStatus targetStatus = newStatus;
        ListingStatus before = current.getStatus();

        Listing updated = recordStore.update(StoreCollection.LISTINGS, listingId, Listing.class, l -> {
                    l.editDetails(patch.name(), patch.description(), patch.homepageUrl(), patch.apiUrl(), now);
                    if (targetStatus != null) l.changeStatus(targetStatus, now);
                    if (patch.featured() != null || patch.verified() != null) {
                        l.markBadges(patch.featured(), patch.verified(), now);
                    }
                    return l;
                })
                .orElseThrow(() -> new BusinessException(ErrorCode.LISTING_NOT_FOUND));

        String eventType = eventTypeFor(before, updated.getStatus());
        eventBus.publish(DirectoryEvent.of(eventType, eventPayload(updated)));
        log.info("Listing updated. listingId={}, event={}", listingId, eventType);
        return updated;
    }

    public void delete(ResolvedIdentity requester, String listingId) {
        Listing current = get(listingId);
        authorize(requester, current);

        recordStore.delete(StoreCollection.LISTINGS, listingId);
        if (current.getEditTokenHash() != null) {
            recordStore.delete(StoreCollection.CREDENTIALS, current.getEditTokenHash());
        }

        eventBus.publish(DirectoryEvent.of(EventTypes.APP_DELETED, eventPayload(current)));
        log.info("Listing deleted. listingId={}", listingId);
    }

    /**
     * 수정/삭제 권한
     * - 관리자 키       : 전부
     * - 일반 키         : 자기가 제출한 앱만
     * - 수정 토큰       : 토큰이 묶인 앱만
     * - 익명            : 401
     */
    static void authorize(ResolvedIdentity requester, Listing listing) {
        if (requester instanceof ResolvedIdentity.Admin) {
            return;
        }
        if (requester instanceof ResolvedIdentity.Regular regular) {
            if (regular.keyId().equals(listing.getSubmittedByKeyId())) return;
            throw new BusinessException(ErrorCode.FORBIDDEN);
        }
        if (requester instanceof ResolvedIdentity.EditToken token) {
            if (token.listingId().equals(listing.getId())) return;
            throw new BusinessException(ErrorCode.FORBIDDEN);
        }
        throw new BusinessException(ErrorCode.UNAUTHORIZED);
    }

    private static String eventTypeFor(ListingStatus before, ListingStatus after) {
        if (before == after) {
            return EventTypes.APP_UPDATED;
        }
        switch (after) {
            case APPROVED:
                return EventTypes.APP_APPROVED;
            case REJECTED:
                return EventTypes.APP_REJECTED;
            case DEPRECATED:
                return EventTypes.APP_DEPRECATED;
            default:
                return EventTypes.APP_UPDATED;
        }
    }

    private static String submitterKeyId(ResolvedIdentity requester) {
        if (requester instanceof ResolvedIdentity.Admin admin) return admin.keyId();
        if (requester instanceof ResolvedIdentity.Regular regular) return regular.keyId();
        return null;
    }

    private static void requireOptionalHttpUrl(String url) {
        if (url != null && !url.isBlank() && !HttpUrls.isHttpUrl(url)) {
            throw new BusinessException(ErrorCode.INVALID_URL);
        }
    }

    private static Map<String, Object> eventPayload(Listing listing) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("app_id", listing.getId());
        payload.put("app_name", listing.getName());
        payload.put("status", listing.getStatus().value());
        return payload;
    }
}
