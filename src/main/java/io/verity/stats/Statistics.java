package io.verity.stats;

import io.verity.model.FeatureSummary;

import java.util.List;
import java.util.Map;

/**
 * Coverage derived from one registry snapshot. Percentages are 0..100 with
 * one decimal. Machine coverage is measured over automatable items only;
 * human and full coverage over every item.
 */
public record Statistics(
        int totalItems,
        int featureCount,
        ClassStats automatable,
        ClassStats environmentDependent,
        ClassStats manualOnly,
        double machineCoverage,
        double humanCoverage,
        double fullCoverage,
        double environmentDependentRatio,
        double manualOnlyRatio,
        int invalidatedItems,
        int itemsWithBlockingIssues,
        double blockingIssueRatio,
        Map<String, FeatureSummary> features,
        List<String> inconsistencies
) {
    public Statistics {
        features = features == null ? Map.of() : features;
        inconsistencies = inconsistencies == null ? List.of() : List.copyOf(inconsistencies);
    }

    /**
     * Denominator of the machine coverage badge.
     */
    public int machineDenominator() {
        return automatable.total();
    }
}
