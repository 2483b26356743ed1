package dev.issuehook.reconcile;

import dev.issuehook.domain.enums.IssueField;
import dev.issuehook.domain.valueobject.IssueRecord;

import java.util.Map;

/**
 * Result of reconciling one event against the table.
 *
 * @param changes the fields written by an update; empty for inserts and no-ops
 */
public record Reconciliation(IssueRecord issue, Write write, Map<IssueField, Object> changes, boolean shouldReply) {

    public enum Write { INSERTED, UPDATED, UNCHANGED }

    public Reconciliation {
        changes = changes == null ? Map.of() : changes;
    }
}
