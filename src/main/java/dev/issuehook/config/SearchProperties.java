package dev.issuehook.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "issuehook.search")
public record SearchProperties(int limitPerField, Duration timeout, double minScore) {
    public SearchProperties {
        if (limitPerField <= 0) limitPerField = 10;
        if (timeout == null || timeout.isZero() || timeout.isNegative()) timeout = Duration.ofSeconds(10);
        if (minScore < 0) minScore = 0;
    }
}
