package dev.issuehook.domain.entity;

import dev.issuehook.domain.enums.IssueField;
import dev.issuehook.domain.enums.IssueState;
import jakarta.persistence.*;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Stored issue row.
 *
 * Design: GitHub's issue id is the assigned PK (no generated key, so
 * {@link Persistable} tells Spring Data whether to persist or merge),
 * protected columns are {@code updatable = false}, and {@link DynamicUpdate}
 * makes a partial update write only the columns that changed.
 * Labels and assignees are kept as the JSON arrays they are decoded from.
 */
@Entity
@DynamicUpdate
@Table(name = "issues", indexes = {
        @Index(name = "idx_issue_repo_number", columnList = "repository_name, issue_number", unique = true),
        @Index(name = "idx_issue_state", columnList = "state")
})
public class IssueEntity implements Persistable<Long> {

    @Id
    @Column(name = "issue_id")
    private Long issueId;

    @Column(name = "issue_number", nullable = false, updatable = false)
    private Integer issueNumber;

    @Column(name = "repository_name", nullable = false, updatable = false)
    private String repositoryName;

    @Column(name = "title", length = 1024)
    private String title;

    @Column(name = "body", columnDefinition = "text")
    private String body;

    @Column(name = "author_login")
    private String authorLogin;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private IssueState state;

    @Column(name = "state_reason", length = 20)
    private String stateReason;

    @Column(name = "locked", nullable = false)
    private boolean locked;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "labels", columnDefinition = "jsonb", nullable = false)
    private String labels;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "assignees", columnDefinition = "jsonb", nullable = false)
    private String assignees;

    @Column(name = "html_url")
    private String htmlUrl;

    @Column(name = "comment_count", nullable = false)
    private int commentCount;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "first_seen_at", nullable = false, updatable = false)
    private Instant firstSeenAt;

    @Column(name = "synced_at", nullable = false)
    private Instant syncedAt;

    @Transient
    private boolean isNew = true;

    protected IssueEntity() {
    }

    public static IssueEntity create(long issueId, int issueNumber, String repositoryName, Instant createdAt) {
        IssueEntity e = new IssueEntity();
        e.issueId = issueId;
        e.issueNumber = issueNumber;
        e.repositoryName = repositoryName;
        e.createdAt = createdAt;
        e.state = IssueState.OPEN;
        e.labels = "[]";
        e.assignees = "[]";
        e.firstSeenAt = Instant.now();
        e.syncedAt = e.firstSeenAt;
        return e;
    }

    /**
     * Writes one non-protected column. {@code value} is already in column form:
     * labels and assignees as JSON text, everything else as the record value.
     */
    public void apply(IssueField field, Object value) {
        switch (field) {
            case TITLE -> title = (String) value;
            case BODY -> body = (String) value;
            case AUTHOR_LOGIN -> authorLogin = (String) value;
            case STATE -> state = (IssueState) value;
            case STATE_REASON -> stateReason = (String) value;
            case LOCKED -> locked = (Boolean) value;
            case LABELS -> labels = (String) value;
            case ASSIGNEES -> assignees = (String) value;
            case HTML_URL -> htmlUrl = (String) value;
            case COMMENT_COUNT -> commentCount = (Integer) value;
            case UPDATED_AT -> updatedAt = (Instant) value;
            case CLOSED_AT -> closedAt = (Instant) value;
            case ISSUE_ID, ISSUE_NUMBER, REPOSITORY_NAME, CREATED_AT ->
                    throw new IllegalArgumentException("Protected field %s cannot be updated".formatted(field));
        }
    }

    public void touch() {
        this.syncedAt = Instant.now();
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    @Override
    public Long getId() {
        return issueId;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    // Getters
    public Long getIssueId() {
        return issueId;
    }

    public Integer getIssueNumber() {
        return issueNumber;
    }

    public String getRepositoryName() {
        return repositoryName;
    }

    public String getTitle() {
        return title;
    }

    public String getBody() {
        return body;
    }

    public String getAuthorLogin() {
        return authorLogin;
    }

    public IssueState getState() {
        return state;
    }

    public String getStateReason() {
        return stateReason;
    }

    public boolean isLocked() {
        return locked;
    }

    public String getLabels() {
        return labels;
    }

    public String getAssignees() {
        return assignees;
    }

    public String getHtmlUrl() {
        return htmlUrl;
    }

    public int getCommentCount() {
        return commentCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getClosedAt() {
        return closedAt;
    }

    public Instant getFirstSeenAt() {
        return firstSeenAt;
    }

    public Instant getSyncedAt() {
        return syncedAt;
    }
}
