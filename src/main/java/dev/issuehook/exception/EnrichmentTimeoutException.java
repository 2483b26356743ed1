package dev.issuehook.exception;

import java.time.Duration;

public class EnrichmentTimeoutException extends EnrichmentException {

    public EnrichmentTimeoutException(Duration timeout, Throwable cause) {
        super("Similarity search did not finish within " + timeout.toMillis() + "ms", cause);
    }
}
