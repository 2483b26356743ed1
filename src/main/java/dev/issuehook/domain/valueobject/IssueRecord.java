package dev.issuehook.domain.valueobject;

import dev.issuehook.domain.enums.IssueField;
import dev.issuehook.domain.enums.IssueState;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Canonical issue record: the normalized form used for storage and comparison.
 *
 * <p>Equality is structural, including the label and assignee lists, which is
 * what the diff relies on. Lists are copied on construction and never null.
 */
public record IssueRecord(
        long issueId,
        int issueNumber,
        String repositoryName,
        String title,
        String body,
        String authorLogin,
        IssueState state,
        String stateReason,
        boolean locked,
        List<LabelDescriptor> labels,
        List<UserDescriptor> assignees,
        String htmlUrl,
        int commentCount,
        Instant createdAt,
        Instant updatedAt,
        Instant closedAt
) {
    public IssueRecord {
        if (repositoryName == null || repositoryName.isBlank())
            throw new IllegalArgumentException("repositoryName required");
        if (state == null) throw new IllegalArgumentException("state required");
        labels = labels == null ? List.of() : List.copyOf(labels);
        assignees = assignees == null ? List.of() : List.copyOf(assignees);
    }

    /** Label names in payload order; the reply decision treats labels as a set. */
    public Set<String> labelNames() {
        Set<String> names = new LinkedHashSet<>();
        labels.forEach(label -> names.add(label.name()));
        return names;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        for (IssueField field : IssueField.values()) {
            b.set(field, field.read(this));
        }
        return b;
    }

    public static final class Builder {
        private long issueId;
        private int issueNumber;
        private String repositoryName;
        private String title;
        private String body;
        private String authorLogin;
        private IssueState state;
        private String stateReason;
        private boolean locked;
        private List<LabelDescriptor> labels = List.of();
        private List<UserDescriptor> assignees = List.of();
        private String htmlUrl;
        private int commentCount;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant closedAt;

        private Builder() {
        }

        public Builder issueId(long issueId) { this.issueId = issueId; return this; }
        public Builder issueNumber(int issueNumber) { this.issueNumber = issueNumber; return this; }
        public Builder repositoryName(String repositoryName) { this.repositoryName = repositoryName; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder authorLogin(String authorLogin) { this.authorLogin = authorLogin; return this; }
        public Builder state(IssueState state) { this.state = state; return this; }
        public Builder stateReason(String stateReason) { this.stateReason = stateReason; return this; }
        public Builder locked(boolean locked) { this.locked = locked; return this; }
        public Builder labels(List<LabelDescriptor> labels) { this.labels = labels; return this; }
        public Builder assignees(List<UserDescriptor> assignees) { this.assignees = assignees; return this; }
        public Builder htmlUrl(String htmlUrl) { this.htmlUrl = htmlUrl; return this; }
        public Builder commentCount(int commentCount) { this.commentCount = commentCount; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder closedAt(Instant closedAt) { this.closedAt = closedAt; return this; }

        /**
         * Sets one field by its {@link IssueField} key. The value must have the
         * type the record component has.
         */
        @SuppressWarnings("unchecked")
        public Builder set(IssueField field, Object value) {
            switch (field) {
                case ISSUE_ID -> issueId = (Long) value;
                case ISSUE_NUMBER -> issueNumber = (Integer) value;
                case REPOSITORY_NAME -> repositoryName = (String) value;
                case TITLE -> title = (String) value;
                case BODY -> body = (String) value;
                case AUTHOR_LOGIN -> authorLogin = (String) value;
                case STATE -> state = (IssueState) value;
                case STATE_REASON -> stateReason = (String) value;
                case LOCKED -> locked = (Boolean) value;
                case LABELS -> labels = (List<LabelDescriptor>) value;
                case ASSIGNEES -> assignees = (List<UserDescriptor>) value;
                case HTML_URL -> htmlUrl = (String) value;
                case COMMENT_COUNT -> commentCount = (Integer) value;
                case CREATED_AT -> createdAt = (Instant) value;
                case UPDATED_AT -> updatedAt = (Instant) value;
                case CLOSED_AT -> closedAt = (Instant) value;
            }
            return this;
        }

        public IssueRecord build() {
            return new IssueRecord(issueId, issueNumber, repositoryName, title, body, authorLogin,
                    state, stateReason, locked, labels, assignees, htmlUrl, commentCount,
                    createdAt, updatedAt, closedAt);
        }
    }
}
