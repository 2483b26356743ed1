package dev.issuehook.infrastructure.github;

import dev.issuehook.config.GitHubProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 verification for GitHub webhooks.
 * Uses constant-time comparison to prevent timing attacks.
 */
@Component
public class WebhookSignatureVerifier {
    private static final Logger log = LoggerFactory.getLogger(WebhookSignatureVerifier.class);
    private static final String PREFIX = "sha256=";
    private final GitHubProperties properties;

    public WebhookSignatureVerifier(GitHubProperties properties) { this.properties = properties; }

    public boolean isValid(byte[] payload, String signature) {
        if (signature == null || !signature.startsWith(PREFIX)) return false;
        String secret = properties.webhookSecret();
        if (secret == null || secret.isBlank()) {
            log.warn("Webhook secret not configured, rejecting delivery");
            return false;
        }
        try {
            String expected = PREFIX + sign(secret, payload);
            return MessageDigest.isEqual(
                    expected.getBytes(StandardCharsets.UTF_8),
                    signature.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) { log.error("HMAC failed", e); return false; }
    }

    static String sign(String secret, byte[] payload) throws GeneralSecurityException {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return HexFormat.of().formatHex(mac.doFinal(payload));
    }
}
