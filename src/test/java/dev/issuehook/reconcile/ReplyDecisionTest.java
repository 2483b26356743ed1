package dev.issuehook.reconcile;

import dev.issuehook.config.ReplyProperties;
import dev.issuehook.domain.enums.IssueAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ReplyDecisionTest {

    private final ReplyDecision decision = new ReplyDecision(new ReplyProperties("needs-reply", false, 5));

    @Test
    @DisplayName("creation replies iff the label is present")
    void creation() {
        assertThat(decision.shouldReply(IssueAction.OPENED, null, Set.of("needs-reply", "bug"))).isTrue();
        assertThat(decision.shouldReply(IssueAction.OPENED, null, Set.of("bug"))).isFalse();
        assertThat(decision.shouldReply(IssueAction.OPENED, null, Set.of())).isFalse();
    }

    @Test
    @DisplayName("absent to present triggers")
    void absentToPresent() {
        assertThat(decision.shouldReply(IssueAction.LABELED, Set.of(), Set.of("needs-reply"))).isTrue();
    }

    @Test
    @DisplayName("present to present does not retrigger")
    void presentToPresent() {
        assertThat(decision.shouldReply(IssueAction.EDITED, Set.of("needs-reply"), Set.of("needs-reply"))).isFalse();
    }

    @Test
    @DisplayName("removal never triggers")
    void presentToAbsent() {
        assertThat(decision.shouldReply(IssueAction.UNLABELED, Set.of("needs-reply"), Set.of())).isFalse();
    }

    @ParameterizedTest
    @EnumSource(IssueAction.class)
    @DisplayName("the rule does not depend on the action")
    void actionIndependent(IssueAction action) {
        assertThat(decision.shouldReply(action, Set.of("bug"), Set.of("bug", "needs-reply"))).isTrue();
        assertThat(decision.shouldReply(action, Set.of("needs-reply"), Set.of("needs-reply", "bug"))).isFalse();
    }

    @Test
    @DisplayName("label name comparison is exact")
    void exactMatch() {
        assertThat(decision.shouldReply(IssueAction.OPENED, null, Set.of("Needs-Reply", "needs-reply-later"))).isFalse();
    }

    @Test
    @DisplayName("blank configured label falls back to needs-reply")
    void defaultLabel() {
        ReplyDecision defaulted = new ReplyDecision(new ReplyProperties(" ", false, 0));
        assertThat(defaulted.replyLabel()).isEqualTo("needs-reply");
    }
}
