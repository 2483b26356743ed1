package dev.issuehook.enrichment;

import dev.issuehook.domain.valueobject.IssueRecord;
import dev.issuehook.domain.valueobject.SimilarIssue;

import java.util.List;

/**
 * Finds stored issues that resemble {@code issue}. Fallible and possibly slow;
 * callers bound it with a timeout and treat failure as "no matches".
 */
public interface SimilarIssueSearch {

    /**
     * @param limitPerField maximum matches taken from each searched field before merging
     * @return matches ordered by descending score, never including {@code issue} itself
     */
    List<SimilarIssue> search(IssueRecord issue, int limitPerField);
}
