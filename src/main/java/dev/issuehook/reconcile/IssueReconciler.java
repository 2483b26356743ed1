package dev.issuehook.reconcile;

import dev.issuehook.domain.enums.IssueField;
import dev.issuehook.domain.valueobject.IssueEvent;
import dev.issuehook.domain.valueobject.IssueRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Sequences lookup → diff → write → reply decision for one event.
 *
 * <p>Every action looks the issue up first:
 * <ul>
 *   <li>found: diff against the stored record and write only the changed fields,
 *       or nothing. A repeated {@code opened} for a known id takes this path too.</li>
 *   <li>not found: insert. For anything but {@code opened} this is a
 *       late-arriving creation (the service missed or predates the original event).</li>
 * </ul>
 * The reply decision uses the stored labels when there was a stored record and
 * the action is not {@code opened}; an {@code opened} event or an insert is decided
 * as a creation, from the incoming labels alone.
 *
 * <p>Callers run this inside one transaction; table failures propagate.
 */
@Component
public class IssueReconciler {
    private static final Logger log = LoggerFactory.getLogger(IssueReconciler.class);

    private final IssueTable table;
    private final ReplyDecision replyDecision;

    public IssueReconciler(IssueTable table, ReplyDecision replyDecision) {
        this.table = table;
        this.replyDecision = replyDecision;
    }

    public Reconciliation reconcile(IssueEvent event) {
        IssueRecord incoming = event.issue();
        log.info("Saving issue {} #{} (action: {})", incoming.issueId(), incoming.issueNumber(), event.action().wireName());

        Optional<IssueRecord> existing = table.get(incoming.issueId());
        Set<String> previousLabels;
        Reconciliation.Write write;
        Map<IssueField, Object> changes = Map.of();

        if (existing.isPresent()) {
            IssueRecord stored = existing.get();
            if (event.action().isCreation()) {
                log.warn("Duplicate opened event for existing issue #{}, applying as update", incoming.issueNumber());
                previousLabels = null;
            } else {
                previousLabels = stored.labelNames();
            }
            changes = IssueDiff.diff(stored, incoming);
            if (changes.isEmpty()) {
                log.info("No changes detected for issue #{}, skipping update", incoming.issueNumber());
                write = Reconciliation.Write.UNCHANGED;
            } else {
                log.debug("Changed fields for issue #{}: {}", incoming.issueNumber(), changes.keySet());
                table.update(changes, incoming.issueId());
                log.info("Updated {} changed fields for issue #{}", changes.size(), incoming.issueNumber());
                write = Reconciliation.Write.UPDATED;
            }
        } else {
            previousLabels = null;
            table.insert(incoming);
            if (event.action().isCreation()) {
                log.info("Inserted new issue #{}", incoming.issueNumber());
            } else {
                log.info("Inserted new issue #{} (not found for {})", incoming.issueNumber(), event.action().wireName());
            }
            write = Reconciliation.Write.INSERTED;
        }

        boolean shouldReply = replyDecision.shouldReply(event.action(), previousLabels, incoming.labelNames());
        return new Reconciliation(incoming, write, changes, shouldReply);
    }
}
