package dev.issuehook.exception;

/**
 * Similarity search failed. Recovered locally: the event continues without matches.
 */
public class EnrichmentException extends IssueHookException {

    public EnrichmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
