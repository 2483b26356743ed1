package dev.issuehook.dto.response;

import java.time.Instant;
import java.util.List;

public record IssueResponse(
        long issueId, int issueNumber, String repository, String title, String author,
        String state, String stateReason, boolean locked, List<String> labels, List<String> assignees,
        String htmlUrl, int commentCount, Instant createdAt, Instant updatedAt, Instant closedAt
) {}
