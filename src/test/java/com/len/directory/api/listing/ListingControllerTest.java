package com.len.directory.api.listing;

import com.len.directory.application.credential.CredentialResolver;
import com.len.directory.application.credential.ResolvedIdentity;
import com.len.directory.application.listing.ListingPatch;
import com.len.directory.application.listing.ListingService;
import com.len.directory.application.listing.SubmittedListing;
import com.len.directory.application.ratelimit.Admission;
import com.len.directory.application.ratelimit.RateLimitPolicy;
import com.len.directory.common.exception.BusinessException;
import com.len.directory.common.exception.ErrorCode;
import com.len.directory.domain.listing.Listing;
import com.len.directory.domain.listing.ListingStatus;
import com.len.directory.support.TestMetricsConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ListingController.class)
@Import(TestMetricsConfig.class)
class ListingControllerTest {

    static final ResolvedIdentity ANONYMOUS = new ResolvedIdentity.Anonymous("127.0.0.1");

    @Autowired
    MockMvc mockMvc;

    @MockBean
    ListingService listingService;

    @MockBean
    CredentialResolver credentialResolver;

    @MockBean
    RateLimitPolicy rateLimitPolicy;

    @BeforeEach
    void setUp() {
        given(credentialResolver.resolve(any())).willReturn(ANONYMOUS);
        given(rateLimitPolicy.admit(any())).willReturn(new Admission(true, 100, 99, 60));
    }

    @Test
    @DisplayName("submit: 익명 제출 201 + edit_token, 요청 제한 헤더")
    void submit_anonymous_created() throws Exception {
        Listing listing = Listing.submit("app-1", "Weather", null, "https://w.example.com", null,
                ListingStatus.APPROVED, null, "hash", Instant.now());
        given(listingService.submit(eq(ANONYMOUS), eq("Weather"), isNull(), eq("https://w.example.com"), isNull()))
                .willReturn(new SubmittedListing(listing, "ed_abc"));

        String body = """
                {
                  "name": "Weather",
                  "homepage_url": "https://w.example.com"
                }
                """;

        mockMvc.perform(post("/api/v1/apps")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(header().string("X-RateLimit-Limit", "100"))
                .andExpect(header().string("X-RateLimit-Remaining", "99"))
                .andExpect(header().string("X-RateLimit-Reset", "60"))
                .andExpect(jsonPath("$.app_id").value("app-1"))
                .andExpect(jsonPath("$.status").value("approved"))
                .andExpect(jsonPath("$.edit_token").value("ed_abc"))
                .andExpect(jsonPath("$.edit_url").value("/api/v1/apps/app-1?token=ed_abc"));
    }

    @Test
    @DisplayName("submit: name 없으면 400")
    void submit_withoutName_should400() throws Exception {
        mockMvc.perform(post("/api/v1/apps")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        verify(listingService, never()).submit(any(), anyString(), any(), any(), any());
    }

    @Test
    @DisplayName("한도 초과: 429 + Retry-After, 컨트롤러까지 가지 않는다")
    void rateLimited_should429() throws Exception {
        given(rateLimitPolicy.admit(any())).willReturn(new Admission(false, 100, 0, 42));

        mockMvc.perform(get("/api/v1/apps/app-1"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "42"))
                .andExpect(header().string("X-RateLimit-Remaining", "0"))
                .andExpect(jsonPath("$.code").value("RATE_LIMITED"));

        verify(listingService, never()).get(anyString());
    }

    @Test
    @DisplayName("patch: 익명은 401, 권한 없는 토큰은 403")
    void patch_errorsMapToStatus() throws Exception {
        given(listingService.update(eq(ANONYMOUS), eq("app-1"), any(ListingPatch.class)))
                .willThrow(new BusinessException(ErrorCode.UNAUTHORIZED));

        mockMvc.perform(patch("/api/v1/apps/app-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"new\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.path").value("/api/v1/apps/app-1"));

        ResolvedIdentity otherToken = new ResolvedIdentity.EditToken("app-2");
        given(credentialResolver.resolve(any())).willReturn(otherToken);
        given(listingService.update(eq(otherToken), eq("app-1"), any(ListingPatch.class)))
                .willThrow(new BusinessException(ErrorCode.FORBIDDEN));

        mockMvc.perform(patch("/api/v1/apps/app-1")
                        .header("X-Edit-Token", "ed_for_app_2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"new\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    @DisplayName("get: 없는 앱은 404")
    void get_notFound() throws Exception {
        given(listingService.get("nope")).willThrow(new BusinessException(ErrorCode.LISTING_NOT_FOUND));

        mockMvc.perform(get("/api/v1/apps/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }
}
