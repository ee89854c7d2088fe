package io.verity.verify;

import java.util.List;

/**
 * Result of matching one command line against the trigger table. Blocked items
 * matched but were not logged because they have blocking issues.
 */
public record AutoLogOutcome(
        List<String> matchedItems,
        List<String> logged,
        List<String> blocked,
        boolean consented
) {
    public AutoLogOutcome {
        matchedItems = List.copyOf(matchedItems);
        logged = List.copyOf(logged);
        blocked = List.copyOf(blocked);
    }
}
