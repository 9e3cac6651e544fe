package com.len.directory.application.webhook;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

/**
 * 수신측 검증용 서명: hex(HMAC-SHA256(secret, body bytes))
 */
public final class WebhookSigner {

    public static final String SIGNATURE_HEADER = "X-Directory-Signature";
    public static final String EVENT_HEADER = "X-Directory-Event";

    private static final String ALGORITHM = "HmacSHA256";

    private WebhookSigner() {}

    public static String sign(String secret, byte[] payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Webhook signing failed", e);
        }
    }
}
