package io.verity.errors;

import java.util.List;

public final class BlockedByIssuesException extends VerityException {
    private final String itemId;
    private final List<String> blockingIssueIds;

    public BlockedByIssuesException(String itemId, List<String> blockingIssueIds) {
        super(ErrorKind.BLOCKED_BY_ISSUE,
                "Item " + itemId + " is blocked by open issues: " + String.join(", ", blockingIssueIds));
        this.itemId = itemId;
        this.blockingIssueIds = List.copyOf(blockingIssueIds);
    }

    public String itemId() {
        return itemId;
    }

    public List<String> blockingIssueIds() {
        return blockingIssueIds;
    }
}
