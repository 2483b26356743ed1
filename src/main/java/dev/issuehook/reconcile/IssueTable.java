package dev.issuehook.reconcile;

import dev.issuehook.domain.enums.IssueField;
import dev.issuehook.domain.valueobject.IssueRecord;

import java.util.Map;
import java.util.Optional;

/**
 * Keyed issue store used by {@link IssueReconciler}.
 *
 * <p>Implementations report every I/O failure as
 * {@link dev.issuehook.exception.IssuePersistenceException}. Within one
 * transaction, {@link #get} must hold the row so that a later {@link #update}
 * for the same id cannot interleave with another event.
 */
public interface IssueTable {

    Optional<IssueRecord> get(long issueId);

    void insert(IssueRecord issue);

    /**
     * Applies {@code changes} to the record with {@code issueId} as one update.
     * Keys are non-protected fields; values have the record's types.
     */
    void update(Map<IssueField, Object> changes, long issueId);
}
