package dev.issuehook.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Upper bound for one reconciliation transaction (lookup, diff and write).
 */
@ConfigurationProperties(prefix = "issuehook.persistence")
public record PersistenceProperties(Duration timeout) {
    public PersistenceProperties {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) timeout = Duration.ofSeconds(5);
    }
}
