package dev.issuehook.exception;

/**
 * Reading or writing the issue table failed or timed out. The transaction was
 * rolled back; the caller decides whether to retry.
 */
public class IssuePersistenceException extends IssueHookException {

    public IssuePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
