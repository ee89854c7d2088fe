package io.verity.model;

public record IssueTransition(
        IssueStatus from,
        IssueStatus to,
        String note,
        String actor,
        long atMs
) {
}
