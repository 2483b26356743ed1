package dev.issuehook.dto.response;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Result of handling one webhook event. Transport-agnostic; the controller
 * maps {@link Status} to an HTTP status.
 */
public record EventOutcome(Status status, String message) {

    public enum Status {
        SUCCESS, SKIPPED, ERROR;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static EventOutcome success(String message) {
        return new EventOutcome(Status.SUCCESS, message);
    }

    public static EventOutcome skipped(String message) {
        return new EventOutcome(Status.SKIPPED, message);
    }

    public static EventOutcome error(String message) {
        return new EventOutcome(Status.ERROR, message);
    }
}
