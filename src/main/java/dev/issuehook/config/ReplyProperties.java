package dev.issuehook.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Reply settings. {@code label} is the reply-trigger label name.
 */
@ConfigurationProperties(prefix = "issuehook.reply")
public record ReplyProperties(String label, boolean commentWhenNoMatches, int maxListed) {
    public ReplyProperties {
        if (label == null || label.isBlank()) label = "needs-reply";
        if (maxListed <= 0) maxListed = 5;
    }
}
