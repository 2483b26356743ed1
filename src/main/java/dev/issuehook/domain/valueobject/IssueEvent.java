package dev.issuehook.domain.valueobject;

import dev.issuehook.domain.enums.IssueAction;

/**
 * One inbound {@code issues} webhook delivery after mapping.
 */
public record IssueEvent(IssueAction action, IssueRecord issue) {
    public IssueEvent {
        if (action == null) action = IssueAction.UNKNOWN;
        if (issue == null) throw new IllegalArgumentException("issue required");
    }
}
