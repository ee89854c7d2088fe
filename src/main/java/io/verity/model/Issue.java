package io.verity.model;

import java.util.ArrayList;
import java.util.List;

public record Issue(
        String id,
        long createdAtMs,
        String reporter,
        String command,
        Integer exitCode,
        String itemId,
        String description,
        DiagnosticsSnapshot diagnostics,
        IssueStatus status,
        String remediationNote,
        List<IssueTransition> history
) {
    public Issue {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("issue id cannot be empty");
        }
        status = status == null ? IssueStatus.OPEN : status;
        history = history == null ? List.of() : List.copyOf(history);
    }

    public boolean blocking() {
        return status.blocking();
    }

    public Issue transitioned(IssueStatus next, String note, String actor, long atMs) {
        List<IssueTransition> nextHistory = new ArrayList<>(history);
        nextHistory.add(new IssueTransition(status, next, note, actor, atMs));
        String remediation = next.requiresNote() ? note : remediationNote;
        return new Issue(id, createdAtMs, reporter, command, exitCode, itemId, description, diagnostics,
                next, remediation, nextHistory);
    }
}
