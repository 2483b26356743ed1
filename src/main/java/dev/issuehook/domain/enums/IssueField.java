package dev.issuehook.domain.enums;

import dev.issuehook.domain.valueobject.IssueRecord;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Fields of {@link IssueRecord} as seen by the diff and the table.
 *
 * <p>Protected fields identify the issue or record when it was created. They are
 * written once on insert and never by an update.
 */
public enum IssueField {
    ISSUE_ID(true, IssueRecord::issueId),
    ISSUE_NUMBER(true, IssueRecord::issueNumber),
    REPOSITORY_NAME(true, IssueRecord::repositoryName),
    TITLE(false, IssueRecord::title),
    BODY(false, IssueRecord::body),
    AUTHOR_LOGIN(false, IssueRecord::authorLogin),
    STATE(false, IssueRecord::state),
    STATE_REASON(false, IssueRecord::stateReason),
    LOCKED(false, IssueRecord::locked),
    LABELS(false, IssueRecord::labels),
    ASSIGNEES(false, IssueRecord::assignees),
    HTML_URL(false, IssueRecord::htmlUrl),
    COMMENT_COUNT(false, IssueRecord::commentCount),
    CREATED_AT(true, IssueRecord::createdAt),
    UPDATED_AT(false, IssueRecord::updatedAt),
    CLOSED_AT(false, IssueRecord::closedAt);

    private final boolean protectedField;
    private final Function<IssueRecord, Object> accessor;

    IssueField(boolean protectedField, Function<IssueRecord, Object> accessor) {
        this.protectedField = protectedField;
        this.accessor = accessor;
    }

    public boolean isProtected() {
        return protectedField;
    }

    public Object read(IssueRecord issue) {
        return accessor.apply(issue);
    }

    public static List<IssueField> updatable() {
        return Arrays.stream(values()).filter(f -> !f.protectedField).toList();
    }
}
