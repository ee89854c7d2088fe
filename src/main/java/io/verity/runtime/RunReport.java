package io.verity.runtime;

import io.verity.stats.Badge;

import java.util.List;

/**
 * Summary printed at the end of every {@code verify run}, also under partial
 * failure. {@code statisticsError} is set when coverage could not be derived
 * and no badges were written.
 */
public record RunReport(
        String runId,
        String depth,
        long startedAtMs,
        long finishedAtMs,
        int passed,
        int failed,
        int skipped,
        int blocked,
        List<ItemResult> items,
        List<String> conflicts,
        List<String> configurationGaps,
        List<String> errors,
        List<String> inconsistencies,
        boolean corruptionRestored,
        Double machineCoverage,
        Double humanCoverage,
        Double fullCoverage,
        String statisticsError,
        List<Badge> badges,
        List<String> newPeaks,
        int exitCode
) {
    public RunReport {
        items = List.copyOf(items);
        conflicts = List.copyOf(conflicts);
        configurationGaps = List.copyOf(configurationGaps);
        errors = List.copyOf(errors);
        inconsistencies = List.copyOf(inconsistencies);
        badges = badges == null ? List.of() : List.copyOf(badges);
        newPeaks = newPeaks == null ? List.of() : List.copyOf(newPeaks);
    }

    public record ItemResult(String itemId, String featureId, String outcome, long durationMs, String reason) {
    }
}
