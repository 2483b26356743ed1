package dev.issuehook.enrichment;

import dev.issuehook.config.SearchProperties;
import dev.issuehook.domain.valueobject.IssueRecord;
import dev.issuehook.domain.valueobject.SimilarIssue;
import dev.issuehook.exception.EnrichmentException;
import dev.issuehook.repository.IssueRepository;
import dev.issuehook.repository.IssueRepository.SimilarIssueRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Similarity search over the stored issues of the same repository using
 * Postgres full-text ranking.
 *
 * <p>Titles are matched against the issue's title, bodies against title plus
 * body. Each field contributes up to {@code limitPerField} rows; an issue found
 * by both keeps its higher score. Scores below {@code issuehook.search.min-score}
 * are dropped.
 */
@Component
public class FullTextSimilarIssueSearch implements SimilarIssueSearch {
    private static final Logger log = LoggerFactory.getLogger(FullTextSimilarIssueSearch.class);
    private static final int MAX_QUERY_CHARS = 2000;

    private final IssueRepository repository;
    private final SearchProperties properties;

    public FullTextSimilarIssueSearch(IssueRepository repository, SearchProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    @Override
    public List<SimilarIssue> search(IssueRecord issue, int limitPerField) {
        String title = issue.title() == null ? "" : issue.title();
        String fullText = truncate(issue.body() == null ? title : title + "\n" + issue.body());
        if (fullText.isBlank()) {
            log.debug("Issue #{} has no text to search with", issue.issueNumber());
            return List.of();
        }

        Map<Long, SimilarIssue> best = new LinkedHashMap<>();
        try {
            if (!title.isBlank()) {
                repository.searchTitles(issue.repositoryName(), issue.issueId(), title, limitPerField)
                        .forEach(row -> merge(best, row, "title"));
            }
            repository.searchBodies(issue.repositoryName(), issue.issueId(), fullText, limitPerField)
                    .forEach(row -> merge(best, row, "body"));
        } catch (DataAccessException e) {
            throw new EnrichmentException("Full-text search failed for issue #" + issue.issueNumber(), e);
        }

        return best.values().stream()
                .filter(s -> s.score() >= properties.minScore())
                .sorted(Comparator.comparingDouble(SimilarIssue::score).reversed()
                        .thenComparing(Comparator.comparingInt(SimilarIssue::issueNumber).reversed()))
                .toList();
    }

    private static void merge(Map<Long, SimilarIssue> best, SimilarIssueRow row, String field) {
        double score = row.getScore() == null ? 0 : row.getScore();
        SimilarIssue candidate = new SimilarIssue(row.getIssueId(),
                row.getIssueNumber() == null ? 0 : row.getIssueNumber(),
                row.getTitle(), row.getHtmlUrl(), row.getState(), score, field);
        best.merge(candidate.issueId(), candidate, (a, b) -> b.score() > a.score() ? b : a);
    }

    private static String truncate(String text) {
        return text.length() <= MAX_QUERY_CHARS ? text : text.substring(0, MAX_QUERY_CHARS);
    }
}
