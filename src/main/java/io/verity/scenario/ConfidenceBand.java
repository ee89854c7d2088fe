package io.verity.scenario;

/**
 * One step of the confidence function: a scenario whose fraction of steps with
 * a matching exit code is at least {@code minFraction} scores {@code score}.
 */
public record ConfidenceBand(double minFraction, int score) {
    public ConfidenceBand {
        if (minFraction < 0.0 || minFraction > 1.0) {
            throw new IllegalArgumentException("minFraction must be within [0,1]: " + minFraction);
        }
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be within [0,100]: " + score);
        }
    }
}
