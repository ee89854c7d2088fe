package io.verity.model;

public record ScenarioRecord(
        String id,
        ScenarioStatus status,
        long durationMs,
        int confidence,
        int stepsPassed,
        int stepsTotal,
        long completedAtMs
) {
}
