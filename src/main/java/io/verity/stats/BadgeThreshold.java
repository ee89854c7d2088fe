package io.verity.stats;

/**
 * Color bands of one badge type. For a regular badge a value below {@code low}
 * is red, below {@code mid} orange, below {@code high} yellow, otherwise
 * brightgreen. An inverted badge (lower is better) is red above {@code high},
 * orange above {@code mid}, yellow above {@code low}.
 */
public record BadgeThreshold(double low, double mid, double high, boolean inverted) {
    public BadgeThreshold {
        if (low > mid || mid > high) {
            throw new IllegalArgumentException("badge thresholds must be ordered: " + low + "/" + mid + "/" + high);
        }
    }

    public BadgeColor colorFor(double value) {
        if (inverted) {
            if (value > high) return BadgeColor.RED;
            if (value > mid) return BadgeColor.ORANGE;
            if (value > low) return BadgeColor.YELLOW;
            return BadgeColor.BRIGHTGREEN;
        }
        if (value < low) return BadgeColor.RED;
        if (value < mid) return BadgeColor.ORANGE;
        if (value < high) return BadgeColor.YELLOW;
        return BadgeColor.BRIGHTGREEN;
    }
}
