package dev.issuehook.repository;

import dev.issuehook.domain.entity.IssueEntity;
import dev.issuehook.domain.enums.IssueField;
import dev.issuehook.domain.valueobject.IssueRecord;
import dev.issuehook.domain.valueobject.LabelDescriptor;
import dev.issuehook.domain.valueobject.UserDescriptor;
import dev.issuehook.exception.IssuePersistenceException;
import dev.issuehook.reconcile.IssueTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link IssueTable} over the {@code issues} table.
 *
 * <p>Must run inside a transaction: {@link #get} locks the row
 * ({@code SELECT ... FOR UPDATE}) and {@link #update} mutates the locked,
 * managed entity, which Hibernate flushes as one UPDATE of the dirty columns.
 */
@Component
public class JpaIssueTable implements IssueTable {
    private static final Logger log = LoggerFactory.getLogger(JpaIssueTable.class);
    private static final TypeReference<List<LabelDescriptor>> LABELS = new TypeReference<>() {};
    private static final TypeReference<List<UserDescriptor>> USERS = new TypeReference<>() {};

    private final IssueRepository repository;
    private final ObjectMapper objectMapper;

    public JpaIssueTable(IssueRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<IssueRecord> get(long issueId) {
        try {
            return repository.findByIdForUpdate(issueId).map(this::toRecord);
        } catch (DataAccessException e) {
            throw new IssuePersistenceException("Lookup of issue " + issueId + " failed", e);
        }
    }

    @Override
    public void insert(IssueRecord issue) {
        IssueEntity entity = IssueEntity.create(issue.issueId(), issue.issueNumber(),
                issue.repositoryName(), issue.createdAt());
        for (IssueField field : IssueField.updatable()) {
            entity.apply(field, toColumn(field, field.read(issue)));
        }
        try {
            repository.saveAndFlush(entity);
        } catch (DataAccessException e) {
            throw new IssuePersistenceException("Insert of issue " + issue.issueId() + " failed", e);
        }
    }

    @Override
    public void update(Map<IssueField, Object> changes, long issueId) {
        try {
            IssueEntity entity = repository.findByIdForUpdate(issueId)
                    .orElseThrow(() -> new IllegalStateException("Issue %d vanished before update".formatted(issueId)));
            changes.forEach((field, value) -> entity.apply(field, toColumn(field, value)));
            entity.touch();
            repository.flush();
            log.debug("Flushed {} columns for issue {}", changes.size(), issueId);
        } catch (DataAccessException | IllegalStateException e) {
            throw new IssuePersistenceException("Update of issue " + issueId + " failed", e);
        }
    }

    private Object toColumn(IssueField field, Object value) {
        return switch (field) {
            case LABELS, ASSIGNEES -> objectMapper.writeValueAsString(value);
            default -> value;
        };
    }

    public IssueRecord toRecord(IssueEntity e) {
        return IssueRecord.builder()
                .issueId(e.getIssueId())
                .issueNumber(e.getIssueNumber())
                .repositoryName(e.getRepositoryName())
                .title(e.getTitle())
                .body(e.getBody())
                .authorLogin(e.getAuthorLogin())
                .state(e.getState())
                .stateReason(e.getStateReason())
                .locked(e.isLocked())
                .labels(readList(e.getLabels(), LABELS, e.getIssueId()))
                .assignees(readList(e.getAssignees(), USERS, e.getIssueId()))
                .htmlUrl(e.getHtmlUrl())
                .commentCount(e.getCommentCount())
                .createdAt(e.getCreatedAt())
                .updatedAt(e.getUpdatedAt())
                .closedAt(e.getClosedAt())
                .build();
    }

    private <T> List<T> readList(String json, TypeReference<List<T>> type, Long issueId) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, type);
        } catch (JacksonException e) {
            log.warn("Stored list for issue {} is unreadable, treating as empty: {}", issueId, e.getMessage());
            return List.of();
        }
    }
}
