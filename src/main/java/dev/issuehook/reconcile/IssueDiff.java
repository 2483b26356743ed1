package dev.issuehook.reconcile;

import dev.issuehook.domain.enums.IssueField;
import dev.issuehook.domain.valueobject.IssueRecord;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Field-level diff between a stored issue and an incoming one.
 *
 * <p>Protected fields are never part of a diff. List fields compare
 * structurally, so a relabel with the same labels in the same order is no change.
 */
public final class IssueDiff {

    private IssueDiff() {
    }

    /**
     * Returns the non-protected fields whose incoming value differs from the
     * stored one, mapped to the incoming value. Empty when nothing changed.
     */
    public static Map<IssueField, Object> diff(IssueRecord previous, IssueRecord incoming) {
        Map<IssueField, Object> changes = new EnumMap<>(IssueField.class);
        for (IssueField field : IssueField.updatable()) {
            Object incomingValue = field.read(incoming);
            if (!Objects.equals(field.read(previous), incomingValue)) {
                changes.put(field, incomingValue);
            }
        }
        return Collections.unmodifiableMap(changes);
    }

    /**
     * Applies a change map to {@code previous}. Protected keys are ignored.
     */
    public static IssueRecord apply(IssueRecord previous, Map<IssueField, Object> changes) {
        IssueRecord.Builder builder = previous.toBuilder();
        changes.forEach((field, value) -> {
            if (!field.isProtected()) builder.set(field, value);
        });
        return builder.build();
    }
}
