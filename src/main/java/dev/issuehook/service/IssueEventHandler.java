package dev.issuehook.service;

import dev.issuehook.config.SearchProperties;
import dev.issuehook.domain.valueobject.IssueEvent;
import dev.issuehook.domain.valueobject.IssueRecord;
import dev.issuehook.domain.valueobject.SimilarIssue;
import dev.issuehook.dto.response.EventOutcome;
import dev.issuehook.enrichment.CommentNotifier;
import dev.issuehook.enrichment.SimilarIssueSearch;
import dev.issuehook.exception.EnrichmentException;
import dev.issuehook.exception.EnrichmentTimeoutException;
import dev.issuehook.exception.IssuePersistenceException;
import dev.issuehook.reconcile.IssueEventMapper;
import dev.issuehook.reconcile.IssueReconciler;
import dev.issuehook.reconcile.Reconciliation;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionOperations;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for one {@code issues} webhook event.
 *
 * <pre>
 *  1. Map the payload to an IssueRecord
 *  2. Reconcile it against the table in one transaction
 *  3. Stop with "skipped" unless the reply label just appeared
 *  4. Search similar issues (bounded, best-effort)
 *  5. Post the reply comment (best-effort)
 * </pre>
 *
 * <p>Only steps 1 and 2 can produce an error outcome. Once the record is
 * persisted the event counts as processed, whatever happens to search or
 * commenting.
 */
@Service
public class IssueEventHandler {
    private static final Logger log = LoggerFactory.getLogger(IssueEventHandler.class);

    private final IssueEventMapper mapper;
    private final IssueReconciler reconciler;
    private final TransactionOperations transactions;
    private final SimilarIssueSearch search;
    private final CommentNotifier notifier;
    private final Executor enrichmentExecutor;
    private final SearchProperties searchProperties;
    private final MeterRegistry meterRegistry;
    private final Timer eventTimer;

    public IssueEventHandler(IssueEventMapper mapper,
                             IssueReconciler reconciler,
                             @Qualifier("reconcileTransaction") TransactionOperations transactions,
                             SimilarIssueSearch search,
                             CommentNotifier notifier,
                             @Qualifier("enrichmentExecutor") Executor enrichmentExecutor,
                             SearchProperties searchProperties,
                             MeterRegistry meterRegistry) {
        this.mapper = mapper;
        this.reconciler = reconciler;
        this.transactions = transactions;
        this.search = search;
        this.notifier = notifier;
        this.enrichmentExecutor = enrichmentExecutor;
        this.searchProperties = searchProperties;
        this.meterRegistry = meterRegistry;
        this.eventTimer = Timer.builder("issuehook.event.duration")
                .description("Time to handle one issues webhook event")
                .register(meterRegistry);
    }

    public EventOutcome handle(String rawPayload) {
        Timer.Sample sample = Timer.start();
        try {
            EventOutcome outcome = process(rawPayload);
            meterRegistry.counter("issuehook.event.outcome", "status", outcome.status().wireName()).increment();
            return outcome;
        } finally {
            sample.stop(eventTimer);
            MDC.remove("issueNumber");
        }
    }

    private EventOutcome process(String rawPayload) {
        IssueEvent event;
        Reconciliation reconciliation;
        try {
            event = mapper.map(rawPayload);
            IssueRecord issue = event.issue();
            MDC.put("issueNumber", String.valueOf(issue.issueNumber()));
            log.info("Issue {}: #{} - {}", event.action().wireName(), issue.issueNumber(), issue.title());
            log.info("Repository: {}, author: {}, state: {}, labels: {}", issue.repositoryName(),
                    issue.authorLogin(), issue.state(), issue.labelNames());

            reconciliation = reconcileInTransaction(event);
        } catch (RuntimeException e) {
            log.error("Error processing issues webhook: {}", e.getMessage(), e);
            return EventOutcome.error(e.getMessage());
        }

        IssueRecord issue = event.issue();
        if (!reconciliation.shouldReply()) {
            log.info("Skipping reply for issue #{}", issue.issueNumber());
            return EventOutcome.skipped("Issue skipped (not marked for reply)");
        }

        List<SimilarIssue> similar = List.of();
        boolean searchFailed = false;
        try {
            similar = findSimilar(issue);
            log.info("Found {} similar issues for #{}", similar.size(), issue.issueNumber());
        } catch (EnrichmentException e) {
            searchFailed = true;
            log.error("Error during similarity search for issue #{}: {}", issue.issueNumber(), e.getMessage());
        }

        try {
            if (notifier.shouldSendComment(event.action(), issue, similar)) {
                notifier.sendComment(issue, similar);
            }
        } catch (RuntimeException e) {
            log.error("Error sending comment for issue #{}: {}", issue.issueNumber(), e.getMessage(), e);
        }

        log.info("Successfully processed {} event for issue #{}", event.action().wireName(), issue.issueNumber());
        return EventOutcome.success(searchFailed
                ? "Issues webhook processed without similarity search"
                : "Issues webhook processed");
    }

    private Reconciliation reconcileInTransaction(IssueEvent event) {
        try {
            return transactions.execute(status -> reconciler.reconcile(event));
        } catch (TransactionException | DataAccessException e) {
            throw new IssuePersistenceException("Could not save issue #" + event.issue().issueNumber(), e);
        }
    }

    /**
     * Runs the search on the enrichment executor and waits at most
     * {@code issuehook.search.timeout} for it.
     */
    private List<SimilarIssue> findSimilar(IssueRecord issue) {
        CompletableFuture<List<SimilarIssue>> future;
        try {
            future = CompletableFuture.supplyAsync(
                    () -> search.search(issue, searchProperties.limitPerField()), enrichmentExecutor);
        } catch (RejectedExecutionException e) {
            throw new EnrichmentException("Similarity search rejected, enrichment executor is saturated", e);
        }
        try {
            List<SimilarIssue> result = future.get(searchProperties.timeout().toMillis(), TimeUnit.MILLISECONDS);
            return result == null ? List.of() : result;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new EnrichmentTimeoutException(searchProperties.timeout(), e);
        } catch (ExecutionException e) {
            throw new EnrichmentException("Similarity search failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EnrichmentException("Interrupted while waiting for similarity search", e);
        }
    }
}
