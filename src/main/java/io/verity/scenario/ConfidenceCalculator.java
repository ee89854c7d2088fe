package io.verity.scenario;

import java.util.List;

/**
 * Step function from step results to a 0..100 confidence score.
 */
public final class ConfidenceCalculator {
    private static final int FULL = 100;
    private static final int PARTIAL_CAP = 90;

    private final List<ConfidenceBand> bands;

    public ConfidenceCalculator(List<ConfidenceBand> bands) {
        if (bands == null || bands.isEmpty()) {
            throw new IllegalArgumentException("confidence bands cannot be empty");
        }
        this.bands = bands.stream()
                .sorted((a, b) -> Double.compare(b.minFraction(), a.minFraction()))
                .toList();
    }

    /**
     * @param exitMatched steps whose exit code matched the expectation
     * @param fullyPassed steps that also passed every output and baseline assertion
     */
    public int score(int exitMatched, int fullyPassed, int total) {
        if (total <= 0 || fullyPassed >= total) {
            return FULL;
        }
        double fraction = (double) exitMatched / total;
        for (ConfidenceBand band : bands) {
            if (fraction >= band.minFraction()) {
                return Math.min(PARTIAL_CAP, band.score());
            }
        }
        return 0;
    }
}
