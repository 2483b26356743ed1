package dev.issuehook.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * GitHub credentials. App credentials (appId + privateKey) take precedence;
 * {@code token} is a personal access token used when no App is configured.
 */
@ConfigurationProperties(prefix = "issuehook.github")
public record GitHubProperties(long appId, String privateKey, String token,
                               String webhookSecret, String apiBaseUrl) {
    public GitHubProperties {
        if (apiBaseUrl == null || apiBaseUrl.isBlank()) apiBaseUrl = "https://api.github.com";
    }

    public boolean hasAppCredentials() {
        return appId > 0 && privateKey != null && !privateKey.isBlank();
    }
}
