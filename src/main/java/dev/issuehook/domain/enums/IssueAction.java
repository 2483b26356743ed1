package dev.issuehook.domain.enums;

import java.util.Locale;

/**
 * The {@code action} of a GitHub {@code issues} webhook event.
 * Actions this service does not know map to {@link #UNKNOWN} and take the update path.
 */
public enum IssueAction {
    OPENED, EDITED, CLOSED, REOPENED, LABELED, UNLABELED, ASSIGNED, UNASSIGNED,
    LOCKED, UNLOCKED, PINNED, UNPINNED, MILESTONED, DEMILESTONED, TRANSFERRED, DELETED, UNKNOWN;

    public static IssueAction fromWire(String action) {
        if (action == null || action.isBlank()) return UNKNOWN;
        try {
            return valueOf(action.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    public boolean isCreation() {
        return this == OPENED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
