package io.verity.model;

public record Finding(String scenarioId, int step, FindingType type, String message, long atMs) {
}
