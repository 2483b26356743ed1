package dev.issuehook.enrichment;

import dev.issuehook.config.ReplyProperties;
import dev.issuehook.domain.enums.IssueAction;
import dev.issuehook.domain.enums.IssueState;
import dev.issuehook.domain.valueobject.IssueRecord;
import dev.issuehook.domain.valueobject.SimilarIssue;
import dev.issuehook.exception.NotificationException;
import dev.issuehook.infrastructure.github.GitHubApiClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Replies on the issue with a list of possibly related issues.
 *
 * <p>No comment on closed, deleted or transferred issues. Without matches the
 * comment is only sent when {@code issuehook.reply.comment-when-no-matches} is set.
 */
@Component
public class SimilarIssueCommentNotifier implements CommentNotifier {
    private static final Logger log = LoggerFactory.getLogger(SimilarIssueCommentNotifier.class);

    private final GitHubApiClient gitHubClient;
    private final ReplyProperties properties;

    public SimilarIssueCommentNotifier(GitHubApiClient gitHubClient, ReplyProperties properties) {
        this.gitHubClient = gitHubClient;
        this.properties = properties;
    }

    @Override
    public boolean shouldSendComment(IssueAction action, IssueRecord issue, List<SimilarIssue> similar) {
        if (action == IssueAction.DELETED || action == IssueAction.TRANSFERRED) return false;
        if (issue.state() == IssueState.CLOSED) {
            log.info("Issue #{} is closed, not commenting", issue.issueNumber());
            return false;
        }
        if (similar.isEmpty() && !properties.commentWhenNoMatches()) {
            log.info("No similar issues for #{}, not commenting", issue.issueNumber());
            return false;
        }
        return true;
    }

    @Override
    public void sendComment(IssueRecord issue, List<SimilarIssue> similar) {
        String body = buildComment(issue, similar);
        try {
            gitHubClient.createIssueComment(issue.repositoryName(), issue.issueNumber(), body);
        } catch (RuntimeException e) {
            throw new NotificationException("Could not comment on %s#%d".formatted(
                    issue.repositoryName(), issue.issueNumber()), e);
        }
    }

    String buildComment(IssueRecord issue, List<SimilarIssue> similar) {
        StringBuilder sb = new StringBuilder();
        if (similar.isEmpty()) {
            sb.append("Thanks for the report! I could not find any related issues in this repository yet.\n");
            return sb.toString();
        }

        sb.append("Thanks for the report! These existing issues look related:\n\n");
        similar.stream().limit(properties.maxListed()).forEach(s -> {
            sb.append("- #%d %s".formatted(s.issueNumber(), s.title() == null ? "" : s.title()));
            if (s.state() != null && !"OPEN".equals(s.state())) {
                sb.append(" (%s)".formatted(s.state().toLowerCase(Locale.ROOT)));
            }
            sb.append('\n');
        });
        sb.append("\nIf one of them covers #%d, please follow up there.\n".formatted(issue.issueNumber()));
        return sb.toString();
    }
}
