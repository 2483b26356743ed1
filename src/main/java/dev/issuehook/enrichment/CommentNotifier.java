package dev.issuehook.enrichment;

import dev.issuehook.domain.enums.IssueAction;
import dev.issuehook.domain.valueobject.IssueRecord;
import dev.issuehook.domain.valueobject.SimilarIssue;

import java.util.List;

/**
 * Posts the automated reply on an issue.
 */
public interface CommentNotifier {

    boolean shouldSendComment(IssueAction action, IssueRecord issue, List<SimilarIssue> similar);

    /**
     * @throws dev.issuehook.exception.NotificationException when the comment could not be posted
     */
    void sendComment(IssueRecord issue, List<SimilarIssue> similar);
}
