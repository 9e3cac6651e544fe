package com.len.directory.application.credential;

import jakarta.servlet.http.HttpServletRequest;

/**
 * 요청에 실려 온 비밀값들 (검증 전)
 */
public record PresentedSecrets(
        String apiKey,
        String editToken,
        String clientAddress
) {

    public static final String EDIT_TOKEN_HEADER = "X-Edit-Token";
    public static final String EDIT_TOKEN_PARAM = "token";
    public static final String API_KEY_HEADER = "X-API-Key";

    public static PresentedSecrets from(HttpServletRequest request) {
        String apiKey = null;
        String authorization = request.getHeader("Authorization");
        if (authorization != null && authorization.startsWith("Bearer ")) {
            apiKey = authorization.substring("Bearer ".length()).trim();
        }
        if (isBlank(apiKey)) {
            apiKey = request.getHeader(API_KEY_HEADER);
        }

        String editToken = request.getHeader(EDIT_TOKEN_HEADER);
        if (isBlank(editToken)) {
            editToken = request.getParameter(EDIT_TOKEN_PARAM);
        }

        return new PresentedSecrets(blankToNull(apiKey), blankToNull(editToken), request.getRemoteAddr());
    }

    public static PresentedSecrets none(String clientAddress) {
        return new PresentedSecrets(null, null, clientAddress);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String blankToNull(String s) {
        return isBlank(s) ? null : s.trim();
    }
}
