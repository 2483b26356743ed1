package dev.issuehook.exception;

/**
 * Base of the errors raised while processing an issue event.
 */
public abstract class IssueHookException extends RuntimeException {

    protected IssueHookException(String message) {
        super(message);
    }

    protected IssueHookException(String message, Throwable cause) {
        super(message, cause);
    }
}
