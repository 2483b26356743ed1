package dev.issuehook.reconcile;

import dev.issuehook.domain.enums.IssueField;
import dev.issuehook.domain.enums.IssueState;
import dev.issuehook.domain.valueobject.IssueRecord;
import dev.issuehook.domain.valueobject.LabelDescriptor;
import dev.issuehook.domain.valueobject.UserDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IssueDiffTest {

    private static IssueRecord base() {
        return IssueRecord.builder()
                .issueId(100L).issueNumber(42).repositoryName("octocat/hello-world")
                .title("Crash on start").body("It crashes.").authorLogin("octocat")
                .state(IssueState.OPEN).labels(List.of(LabelDescriptor.named("bug")))
                .assignees(List.of(UserDescriptor.login("hubot")))
                .htmlUrl("https://github.com/octocat/hello-world/issues/42")
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .updatedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("identical records diff to an empty map")
    void identical() {
        assertThat(IssueDiff.diff(base(), base())).isEmpty();
    }

    @Test
    @DisplayName("records differing only in protected fields diff to an empty map")
    void protectedOnly() {
        IssueRecord incoming = base().toBuilder()
                .issueNumber(99).repositoryName("someone/else")
                .createdAt(Instant.parse("2030-01-01T00:00:00Z"))
                .build();
        assertThat(IssueDiff.diff(base(), incoming)).isEmpty();
    }

    @Test
    @DisplayName("changed fields map to the incoming value")
    void changedFields() {
        IssueRecord incoming = base().toBuilder()
                .title("Crash on start (Android)")
                .state(IssueState.CLOSED).stateReason("completed")
                .build();

        Map<IssueField, Object> diff = IssueDiff.diff(base(), incoming);

        assertThat(diff).containsOnlyKeys(IssueField.TITLE, IssueField.STATE, IssueField.STATE_REASON);
        assertThat(diff.get(IssueField.TITLE)).isEqualTo("Crash on start (Android)");
        assertThat(diff.get(IssueField.STATE)).isEqualTo(IssueState.CLOSED);
    }

    @Test
    @DisplayName("lists compare structurally, not by reference")
    void structuralListEquality() {
        IssueRecord incoming = base().toBuilder()
                .labels(new ArrayList<>(List.of(new LabelDescriptor(null, "bug", null, null))))
                .build();
        assertThat(IssueDiff.diff(base(), incoming)).isEmpty();

        IssueRecord relabeled = base().toBuilder()
                .labels(List.of(LabelDescriptor.named("bug"), LabelDescriptor.named("needs-reply")))
                .build();
        assertThat(IssueDiff.diff(base(), relabeled)).containsOnlyKeys(IssueField.LABELS);
    }

    @Test
    @DisplayName("applying the diff yields the incoming record except for protected fields")
    void applyRoundTrip() {
        IssueRecord previous = base();
        IssueRecord incoming = previous.toBuilder()
                .issueNumber(7)
                .title("New title").body(null).locked(true).commentCount(3)
                .labels(List.of()).assignees(List.of(UserDescriptor.login("monalisa")))
                .closedAt(Instant.parse("2024-06-01T00:00:00Z"))
                .build();

        IssueRecord applied = IssueDiff.apply(previous, IssueDiff.diff(previous, incoming));

        for (IssueField field : IssueField.values()) {
            Object expected = field.isProtected() ? field.read(previous) : field.read(incoming);
            assertThat(field.read(applied)).as(field.name()).isEqualTo(expected);
        }
    }

    @Test
    @DisplayName("apply ignores protected keys")
    void applyIgnoresProtected() {
        IssueRecord applied = IssueDiff.apply(base(), Map.of(IssueField.ISSUE_NUMBER, 1, IssueField.TITLE, "x"));
        assertThat(applied.issueNumber()).isEqualTo(42);
        assertThat(applied.title()).isEqualTo("x");
    }
}
