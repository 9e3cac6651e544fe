package com.len.directory.common.util;

import java.net.URI;
import java.net.URISyntaxException;

public final class HttpUrls {

    private HttpUrls() {}

    /**
     * http:// 또는 https:// 이고 host 가 있는 절대 URL 인지
     */
    public static boolean isHttpUrl(String raw) {
        if (raw == null || raw.isBlank()) return false;
        try {
            URI uri = new URI(raw.trim());
            String scheme = uri.getScheme();
            return ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
                    && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
