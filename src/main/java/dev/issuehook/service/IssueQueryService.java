package dev.issuehook.service;

import dev.issuehook.domain.valueobject.IssueRecord;
import dev.issuehook.domain.valueobject.LabelDescriptor;
import dev.issuehook.domain.valueobject.UserDescriptor;
import dev.issuehook.dto.response.IssueResponse;
import dev.issuehook.repository.IssueRepository;
import dev.issuehook.repository.JpaIssueTable;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import java.util.Optional;

/** Read-side service with read-only transactions. */
@Service
@Transactional(readOnly = true)
public class IssueQueryService {
    private final IssueRepository repository;
    private final JpaIssueTable table;

    public IssueQueryService(IssueRepository repository, JpaIssueTable table) {
        this.repository = repository;
        this.table = table;
    }

    public Optional<IssueResponse> findById(long issueId) {
        return repository.findById(issueId).map(table::toRecord).map(this::toResponse);
    }

    public Page<IssueResponse> findByRepository(String repo, int page, int size) {
        return repository.findByRepositoryNameOrderByIssueNumberDesc(repo, PageRequest.of(page, size))
                .map(table::toRecord).map(this::toResponse);
    }

    private IssueResponse toResponse(IssueRecord r) {
        return new IssueResponse(r.issueId(), r.issueNumber(), r.repositoryName(), r.title(), r.authorLogin(),
                r.state().name(), r.stateReason(), r.locked(),
                r.labels().stream().map(LabelDescriptor::name).toList(),
                r.assignees().stream().map(UserDescriptor::login).toList(),
                r.htmlUrl(), r.commentCount(), r.createdAt(), r.updatedAt(), r.closedAt());
    }
}
