package io.verity.verify;

public record OpportunisticResult(String itemId, OpportunisticOutcome outcome, String issueId, String reason) {
    static OpportunisticResult of(String itemId, OpportunisticOutcome outcome, String reason) {
        return new OpportunisticResult(itemId, outcome, null, reason);
    }
}
