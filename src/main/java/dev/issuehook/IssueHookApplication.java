package dev.issuehook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * IssueHook: GitHub issue webhook ingestion with label-driven replies.
 *
 * <p>Architecture overview:
 * <pre>
 * GitHub Webhook → WebhookController → IssueEventHandler
 *   → IssueEventMapper (payload → IssueRecord)
 *   → IssueReconciler (lookup → diff → write → reply decision)
 *   → SimilarIssueSearch → CommentNotifier → GitHubApiClient (post comment)
 * </pre>
 *
 * <p>Persistence runs first and is the only step that can fail an event.
 * Search and commenting are best-effort and run only when the reply label
 * has just appeared on the issue.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class IssueHookApplication {

    public static void main(String[] args) {
        SpringApplication.run(IssueHookApplication.class, args);
    }
}
