package dev.issuehook.domain.enums;

import java.util.Locale;
import java.util.Optional;

public enum IssueState {
    OPEN, CLOSED;

    public static Optional<IssueState> fromWire(String state) {
        if (state == null) return Optional.empty();
        return switch (state.trim().toLowerCase(Locale.ROOT)) {
            case "open" -> Optional.of(OPEN);
            case "closed" -> Optional.of(CLOSED);
            default -> Optional.empty();
        };
    }
}
