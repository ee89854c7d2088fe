package io.verity.stats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inputs of the extended badge set that do not come from the registry.
 * Null values are omitted from the output.
 *
 * @param scenarioCoverage percent of items exercised by passed scenarios
 * @param averageConfidence mean confidence of the last scenario run
 * @param peaks best-ever value per history metric
 */
public record BadgeExtras(Double scenarioCoverage, Double averageConfidence, Map<String, Double> peaks) {
    public BadgeExtras {
        peaks = peaks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(peaks));
    }

    public static BadgeExtras none() {
        return new BadgeExtras(null, null, Map.of());
    }
}
