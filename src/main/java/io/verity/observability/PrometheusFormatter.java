package io.verity.observability;

import io.verity.model.FeatureSummary;
import io.verity.stats.ClassStats;
import io.verity.stats.Statistics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders coverage statistics in the Prometheus text exposition format.
 */
public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(Statistics stats) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "verity_items_total", "Registry items", null, null, stats.totalItems());
        appendGauge(sb, "verity_features_total", "Registry features", null, null, stats.featureCount());
        appendClass(sb, "automatable", stats.automatable());
        appendClass(sb, "environment_dependent", stats.environmentDependent());
        appendClass(sb, "manual_only", stats.manualOnly());
        appendDouble(sb, "verity_coverage_percent", "Coverage percentage by kind", "kind", "machine", stats.machineCoverage());
        appendDouble(sb, "verity_coverage_percent", "Coverage percentage by kind", "kind", "human", stats.humanCoverage());
        appendDouble(sb, "verity_coverage_percent", "Coverage percentage by kind", "kind", "full", stats.fullCoverage());
        appendGauge(sb, "verity_invalidated_items", "Items invalidated by source changes", null, null, stats.invalidatedItems());
        appendGauge(sb, "verity_blocked_items", "Items with at least one blocking issue", null, null, stats.itemsWithBlockingIssues());
        appendGauge(sb, "verity_inconsistencies", "Soft registry inconsistencies", null, null, stats.inconsistencies().size());
        Map<String, Integer> fullByFeature = new LinkedHashMap<>();
        for (Map.Entry<String, FeatureSummary> e : stats.features().entrySet()) {
            fullByFeature.put(e.getKey(), e.getValue().fullyVerified());
        }
        appendMapGauge(sb, "verity_feature_fully_verified", "Fully verified items per feature", "feature", fullByFeature);
        return sb.toString();
    }

    private static void appendClass(StringBuilder sb, String klass, ClassStats stats) {
        String help = "Items per automatability class and verification state";
        appendGauge(sb, "verity_class_items", help, "class", klass, stats.total(), "state", "total");
        appendGauge(sb, "verity_class_items", help, "class", klass, stats.machineVerified(), "state", "machine");
        appendGauge(sb, "verity_class_items", help, "class", klass, stats.humanVerified(), "state", "human");
        appendGauge(sb, "verity_class_items", help, "class", klass, stats.fullyVerified(), "state", "full");
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Integer> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Integer> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        appendHeader(sb, metric, help);
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue,
                                    long value, String label2, String labelValue2) {
        appendHeader(sb, metric, help);
        sb.append(metric).append('{')
                .append(label).append("=\"").append(escapeLabel(labelValue)).append("\",")
                .append(label2).append("=\"").append(escapeLabel(labelValue2)).append("\"}")
                .append(' ').append(value).append('\n');
    }

    private static void appendDouble(StringBuilder sb, String metric, String help, String label, String labelValue, double value) {
        appendHeader(sb, metric, help);
        sb.append(metric).append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}")
                .append(' ').append(value).append('\n');
    }

    private static void appendHeader(StringBuilder sb, String metric, String help) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
