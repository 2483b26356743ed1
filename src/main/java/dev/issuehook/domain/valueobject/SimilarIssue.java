package dev.issuehook.domain.valueobject;

/**
 * A stored issue that resembles the one being replied to.
 *
 * @param matchedField which field produced {@code score} ("title" or "body")
 */
public record SimilarIssue(long issueId, int issueNumber, String title, String htmlUrl,
                           String state, double score, String matchedField) {}
