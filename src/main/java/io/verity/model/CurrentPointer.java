package io.verity.model;

public record CurrentPointer(String scenarioId, int step, String stepName) {
    public static CurrentPointer idle() {
        return new CurrentPointer(null, 0, null);
    }
}
