package com.len.directory.application.credential;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

public final class SecretHasher {

    public static final String API_KEY_PREFIX = "ad_";
    public static final String EDIT_TOKEN_PREFIX = "ed_";
    public static final String WEBHOOK_SECRET_PREFIX = "whsec_";

    private SecretHasher() {}

    public static String hash(String rawSecret) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(rawSecret.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String newSecret(String prefix) {
        return prefix + UUID.randomUUID().toString().replace("-", "");
    }
}
