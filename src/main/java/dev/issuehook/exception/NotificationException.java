package dev.issuehook.exception;

/**
 * Posting the reply comment failed. Recovered locally: persistence already succeeded.
 */
public class NotificationException extends IssueHookException {

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
