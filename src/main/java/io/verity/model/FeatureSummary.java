package io.verity.model;

/**
 * Cached per-feature counts. Never a source of truth: always re-derivable
 * from the items.
 */
public record FeatureSummary(int total, int machineVerified, int humanVerified, int fullyVerified) {
    public static FeatureSummary empty() {
        return new FeatureSummary(0, 0, 0, 0);
    }
}
