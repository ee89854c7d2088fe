package io.verity.observability;

import io.verity.model.FeatureSummary;
import io.verity.stats.ClassStats;
import io.verity.stats.Statistics;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class PrometheusFormatterTest {

    @Test
    void rendersGaugesWithSingleHeaderPerMetric() {
        Statistics stats = new Statistics(3, 1, new ClassStats(2, 1, 0, 0), ClassStats.empty(), new ClassStats(1, 0, 1, 1),
                50.0, 33.3, 33.3, 0.0, 33.3, 1, 0, 0.0,
                Map.of("back\"up", new FeatureSummary(3, 1, 1, 1)), List.of());

        String text = PrometheusFormatter.format(stats);
        Assertions.assertTrue(text.contains("verity_items_total 3\n"));
        Assertions.assertTrue(text.contains("verity_class_items{class=\"automatable\",state=\"total\"} 2\n"));
        Assertions.assertTrue(text.contains("verity_coverage_percent{kind=\"machine\"} 50.0\n"));
        Assertions.assertTrue(text.contains("verity_feature_fully_verified{feature=\"back\\\"up\"} 1\n"));
        Assertions.assertEquals(1, occurrences(text, "# TYPE verity_coverage_percent gauge"));
        Assertions.assertEquals(1, occurrences(text, "# TYPE verity_class_items gauge"));
    }

    private static int occurrences(String text, String needle) {
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(needle, from)) >= 0) {
            count++;
            from += needle.length();
        }
        return count;
    }
}
