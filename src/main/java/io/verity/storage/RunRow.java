package io.verity.storage;

public record RunRow(
        String runId,
        String kind,
        long startedAtMs,
        long finishedAtMs,
        int exitCode,
        int passed,
        int failed,
        int skipped,
        int blocked,
        double machineCoverage,
        double humanCoverage,
        double fullCoverage
) {
}
