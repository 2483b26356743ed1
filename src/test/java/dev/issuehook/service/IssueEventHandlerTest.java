package dev.issuehook.service;

import dev.issuehook.config.ReplyProperties;
import dev.issuehook.config.SearchProperties;
import dev.issuehook.domain.enums.IssueAction;
import dev.issuehook.domain.valueobject.IssueRecord;
import dev.issuehook.domain.valueobject.SimilarIssue;
import dev.issuehook.dto.response.EventOutcome;
import dev.issuehook.enrichment.CommentNotifier;
import dev.issuehook.enrichment.SimilarIssueSearch;
import dev.issuehook.exception.NotificationException;
import dev.issuehook.reconcile.InMemoryIssueTable;
import dev.issuehook.reconcile.IssueEventMapper;
import dev.issuehook.reconcile.IssueReconciler;
import dev.issuehook.reconcile.ReplyDecision;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.support.TransactionOperations;
import tools.jackson.databind.json.JsonMapper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static dev.issuehook.reconcile.IssuePayloads.issueEvent;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IssueEventHandlerTest {

    @Mock
    private SimilarIssueSearch search;

    @Mock
    private CommentNotifier notifier;

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private InMemoryIssueTable table;
    private IssueEventHandler handler;

    private static final SimilarIssue MATCH = new SimilarIssue(9L, 7, "Crash on start (old)",
            "https://github.com/octocat/hello-world/issues/7", "CLOSED", 0.4, "title");

    @BeforeEach
    void setUp() {
        table = new InMemoryIssueTable();
        handler = newHandler(TransactionOperations.withoutTransaction(), Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private IssueEventHandler newHandler(TransactionOperations transactions, Duration searchTimeout) {
        return newHandler(transactions, searchTimeout, executor);
    }

    private IssueEventHandler newHandler(TransactionOperations transactions, Duration searchTimeout,
                                         Executor searchExecutor) {
        IssueReconciler reconciler = new IssueReconciler(table,
                new ReplyDecision(new ReplyProperties("needs-reply", false, 5)));
        return new IssueEventHandler(new IssueEventMapper(JsonMapper.builder().build()), reconciler,
                transactions, search, notifier, searchExecutor,
                new SearchProperties(10, searchTimeout, 0), meterRegistry);
    }

    @Test
    @DisplayName("no reply label: skipped, persisted, no search or comment")
    void skippedWithoutLabel() {
        EventOutcome outcome = handler.handle(issueEvent("opened", 42, "Crash", List.of()));

        assertThat(outcome.status()).isEqualTo(EventOutcome.Status.SKIPPED);
        assertThat(table.size()).isEqualTo(1);
        verifyNoInteractions(search, notifier);
        assertThat(meterRegistry.counter("issuehook.event.outcome", "status", "skipped").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("reply label added: search then comment with the matches")
    void repliesWithMatches() {
        when(search.search(any(IssueRecord.class), eq(10))).thenReturn(List.of(MATCH));
        when(notifier.shouldSendComment(eq(IssueAction.OPENED), any(), eq(List.of(MATCH)))).thenReturn(true);

        EventOutcome outcome = handler.handle(issueEvent("opened", 42, "Crash", List.of("needs-reply")));

        assertThat(outcome).isEqualTo(EventOutcome.success("Issues webhook processed"));
        verify(notifier).sendComment(any(IssueRecord.class), eq(List.of(MATCH)));
    }

    @Test
    @DisplayName("notifier declining means no comment is sent")
    void notifierDeclines() {
        when(search.search(any(), anyInt())).thenReturn(List.of());
        when(notifier.shouldSendComment(any(), any(), any())).thenReturn(false);

        EventOutcome outcome = handler.handle(issueEvent("opened", 42, "Crash", List.of("needs-reply")));

        assertThat(outcome.status()).isEqualTo(EventOutcome.Status.SUCCESS);
        verify(notifier, never()).sendComment(any(), any());
    }

    @Nested
    @DisplayName("failures before persistence completes")
    class PersistenceFailures {

        @Test
        @DisplayName("malformed payload: error outcome and no table mutation")
        void malformedPayload() {
            EventOutcome outcome = handler.handle("""
                    { "action": "opened", "issue": { "number": 42, "state": "open" },
                      "repository": { "full_name": "o/r" } }
                    """);

            assertThat(outcome.status()).isEqualTo(EventOutcome.Status.ERROR);
            assertThat(outcome.message()).contains("issue.id");
            assertThat(table.writes()).isEmpty();
            verifyNoInteractions(search, notifier);
        }

        @Test
        @DisplayName("transaction failure: error outcome, no reply attempted")
        void transactionFailure() {
            TransactionOperations failing = mock(TransactionOperations.class);
            when(failing.execute(any())).thenThrow(new QueryTimeoutException("lock wait timeout"));
            IssueEventHandler failingHandler = newHandler(failing, Duration.ofSeconds(2));

            EventOutcome outcome = failingHandler.handle(issueEvent("opened", 42, "Crash", List.of("needs-reply")));

            assertThat(outcome.status()).isEqualTo(EventOutcome.Status.ERROR);
            assertThat(outcome.message()).contains("Could not save issue #42");
            verifyNoInteractions(search, notifier);
        }
    }

    @Nested
    @DisplayName("failures after persistence")
    class EnrichmentFailures {

        @Test
        @DisplayName("search failure still succeeds and comments with no matches")
        void searchFails() {
            when(search.search(any(), anyInt())).thenThrow(new IllegalStateException("index offline"));
            when(notifier.shouldSendComment(any(), any(), eq(List.of()))).thenReturn(true);

            EventOutcome outcome = handler.handle(issueEvent("opened", 42, "Crash", List.of("needs-reply")));

            assertThat(outcome.status()).isEqualTo(EventOutcome.Status.SUCCESS);
            assertThat(outcome.message()).contains("without similarity search");
            assertThat(table.size()).isEqualTo(1);
            verify(notifier).sendComment(any(), eq(List.of()));
        }

        @Test
        @DisplayName("search timeout is treated like a search failure")
        void searchTimesOut() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            when(search.search(any(), anyInt())).thenAnswer(inv -> {
                release.await();
                return List.of(MATCH);
            });
            IssueEventHandler impatient = newHandler(TransactionOperations.withoutTransaction(), Duration.ofMillis(50));

            EventOutcome outcome = impatient.handle(issueEvent("opened", 42, "Crash", List.of("needs-reply")));
            release.countDown();

            assertThat(outcome.status()).isEqualTo(EventOutcome.Status.SUCCESS);
            verify(notifier).shouldSendComment(eq(IssueAction.OPENED), any(), eq(List.of()));
        }

        @Test
        @DisplayName("saturated search executor is treated like a search failure")
        void searchExecutorRejects() {
            Executor saturated = task -> {
                throw new TaskRejectedException("queue full");
            };
            when(notifier.shouldSendComment(any(), any(), eq(List.of()))).thenReturn(true);
            IssueEventHandler busy = newHandler(TransactionOperations.withoutTransaction(), Duration.ofSeconds(2),
                    saturated);

            EventOutcome outcome = busy.handle(issueEvent("opened", 42, "Crash", List.of("needs-reply")));

            assertThat(outcome).isEqualTo(
                    EventOutcome.success("Issues webhook processed without similarity search"));
            assertThat(table.size()).isEqualTo(1);
            verifyNoInteractions(search);
            verify(notifier).sendComment(any(), eq(List.of()));
            assertThat(meterRegistry.counter("issuehook.event.outcome", "status", "success").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("comment failure still succeeds")
        void commentFails() {
            when(search.search(any(), anyInt())).thenReturn(List.of(MATCH));
            when(notifier.shouldSendComment(any(), any(), any())).thenReturn(true);
            doThrow(new NotificationException("GitHub 502", new RuntimeException()))
                    .when(notifier).sendComment(any(), any());

            EventOutcome outcome = handler.handle(issueEvent("opened", 42, "Crash", List.of("needs-reply")));

            assertThat(outcome).isEqualTo(EventOutcome.success("Issues webhook processed"));
        }
    }
}
