package dev.issuehook.exception;

/**
 * The webhook payload lacks a required field or has it in the wrong shape.
 * Not retryable: redelivering the same payload fails the same way.
 */
public class MalformedPayloadException extends IssueHookException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
