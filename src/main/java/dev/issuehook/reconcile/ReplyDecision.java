package dev.issuehook.reconcile;

import dev.issuehook.config.ReplyProperties;
import dev.issuehook.domain.enums.IssueAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Decides whether an event should produce an automated reply.
 *
 * <p>On creation the reply label only has to be present. On update it has to
 * go from absent to present: a label that stays, or one that is removed,
 * never triggers.
 */
@Component
public class ReplyDecision {
    private static final Logger log = LoggerFactory.getLogger(ReplyDecision.class);
    private final String replyLabel;

    public ReplyDecision(ReplyProperties properties) {
        this.replyLabel = properties.label();
    }

    /**
     * @param previousLabels label names of the stored record, or {@code null} when
     *                       there was no stored record
     */
    public boolean shouldReply(IssueAction action, Set<String> previousLabels, Set<String> incomingLabels) {
        boolean present = incomingLabels.contains(replyLabel);
        if (previousLabels == null) {
            log.debug("Reply decision on {} (new record): label '{}' present={}", action, replyLabel, present);
            return present;
        }
        boolean wasPresent = previousLabels.contains(replyLabel);
        log.debug("Reply decision on {}: label '{}' before={} after={}", action, replyLabel, wasPresent, present);
        return present && !wasPresent;
    }

    public String replyLabel() {
        return replyLabel;
    }
}
