package dev.issuehook.repository;

import dev.issuehook.domain.entity.IssueEntity;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface IssueRepository extends JpaRepository<IssueEntity, Long> {

    /**
     * Statement timeout for the full-text queries, in milliseconds. Matches the default
     * {@code issuehook.search.timeout} so a search the handler gave up on is also
     * cancelled in the database.
     */
    String SEARCH_QUERY_TIMEOUT_MS = "10000";

    Page<IssueEntity> findByRepositoryNameOrderByIssueNumberDesc(String repositoryName, Pageable pageable);

    /** Row-locked lookup; serializes reconciliation of the same issue. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select i from IssueEntity i where i.issueId = :issueId")
    Optional<IssueEntity> findByIdForUpdate(@Param("issueId") Long issueId);

    /**
     * Full-text match of {@code text} against other issues' titles in the same repository.
     * Query words are OR-ed so a partial overlap still ranks.
     */
    @Query(value = """
            WITH q AS (
              SELECT cast(nullif(replace(cast(plainto_tsquery('english', :text) AS text), ' & ', ' | '), '') AS tsquery) AS query
            )
            SELECT i.issue_id AS issueId, i.issue_number AS issueNumber, i.title AS title,
                   i.html_url AS htmlUrl, i.state AS state,
                   cast(ts_rank(to_tsvector('english', coalesce(i.title, '')), q.query) AS double precision) AS score
            FROM issues i, q
            WHERE i.repository_name = :repository
              AND i.issue_id <> :excludeId
              AND to_tsvector('english', coalesce(i.title, '')) @@ q.query
            ORDER BY score DESC, i.issue_number DESC
            LIMIT :limit
            """, nativeQuery = true)
    @QueryHints(@QueryHint(name = "jakarta.persistence.query.timeout", value = SEARCH_QUERY_TIMEOUT_MS))
    List<SimilarIssueRow> searchTitles(@Param("repository") String repository,
                                       @Param("excludeId") long excludeId,
                                       @Param("text") String text,
                                       @Param("limit") int limit);

    /** Same as {@link #searchTitles} against issue bodies. */
    @Query(value = """
            WITH q AS (
              SELECT cast(nullif(replace(cast(plainto_tsquery('english', :text) AS text), ' & ', ' | '), '') AS tsquery) AS query
            )
            SELECT i.issue_id AS issueId, i.issue_number AS issueNumber, i.title AS title,
                   i.html_url AS htmlUrl, i.state AS state,
                   cast(ts_rank(to_tsvector('english', coalesce(i.body, '')), q.query) AS double precision) AS score
            FROM issues i, q
            WHERE i.repository_name = :repository
              AND i.issue_id <> :excludeId
              AND to_tsvector('english', coalesce(i.body, '')) @@ q.query
            ORDER BY score DESC, i.issue_number DESC
            LIMIT :limit
            """, nativeQuery = true)
    @QueryHints(@QueryHint(name = "jakarta.persistence.query.timeout", value = SEARCH_QUERY_TIMEOUT_MS))
    List<SimilarIssueRow> searchBodies(@Param("repository") String repository,
                                       @Param("excludeId") long excludeId,
                                       @Param("text") String text,
                                       @Param("limit") int limit);

    /** Projection for the full-text queries. */
    interface SimilarIssueRow {
        Long getIssueId();
        Integer getIssueNumber();
        String getTitle();
        String getHtmlUrl();
        String getState();
        Double getScore();
    }
}
