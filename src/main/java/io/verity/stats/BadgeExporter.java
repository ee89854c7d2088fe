package io.verity.stats;

import io.verity.config.EngineSettings;
import io.verity.util.AtomicFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns statistics into coverage badges colored on a four-step scale.
 */
public final class BadgeExporter {
    public static final String PEAK_MACHINE = "machine_coverage";
    public static final String PEAK_HUMAN = "human_coverage";
    public static final String PEAK_FULL = "full_coverage";
    public static final String PEAK_SCENARIOS = "scenario_coverage";
    public static final String PEAK_CONFIDENCE = "average_confidence";

    private final EngineSettings settings;

    public BadgeExporter(EngineSettings settings) {
        this.settings = settings;
    }

    public List<Badge> exportBadges(Statistics statistics) {
        List<Badge> out = new ArrayList<>();
        out.add(percentBadge(EngineSettings.BADGE_MACHINE, "Machine", statistics.machineCoverage()));
        out.add(percentBadge(EngineSettings.BADGE_HUMAN, "Human", statistics.humanCoverage()));
        out.add(percentBadge(EngineSettings.BADGE_FULL, "Fully verified", statistics.fullCoverage()));
        out.add(new Badge(
                EngineSettings.BADGE_ISSUES,
                "Issues",
                statistics.itemsWithBlockingIssues() + " blocking",
                settings.thresholdFor(EngineSettings.BADGE_ISSUES).colorFor(statistics.blockingIssueRatio())
        ));
        return out;
    }

    public List<Badge> exportBadges(Statistics statistics, BadgeExtras extras) {
        List<Badge> out = exportBadges(statistics);
        if (extras.scenarioCoverage() != null) {
            out.add(percentBadge(EngineSettings.BADGE_SCENARIOS, "Scenarios", extras.scenarioCoverage()));
        }
        if (extras.averageConfidence() != null) {
            out.add(percentBadge(EngineSettings.BADGE_CONFIDENCE, "Confidence", extras.averageConfidence()));
        }
        out.add(percentBadge(EngineSettings.BADGE_ENVIRONMENT, "Env-dependent", statistics.environmentDependentRatio()));
        out.add(percentBadge(EngineSettings.BADGE_MANUAL, "Manual-only", statistics.manualOnlyRatio()));
        for (Map.Entry<String, Double> peak : extras.peaks().entrySet()) {
            String type = badgeTypeOfPeak(peak.getKey());
            if (type == null) {
                continue;
            }
            out.add(new Badge(
                    type + "_peak",
                    labelOfPeak(peak.getKey()),
                    format(peak.getValue()),
                    settings.thresholdFor(type).colorFor(peak.getValue())
            ));
        }
        return out;
    }

    public void write(Path file, List<Badge> badges) {
        try {
            AtomicFiles.writeJson(file, new BadgeDocument(System.currentTimeMillis(), badges));
        } catch (IOException e) {
            throw new RuntimeException("Failed to write badges: " + file, e);
        }
    }

    private Badge percentBadge(String type, String label, double value) {
        return new Badge(type, label, format(value), settings.thresholdFor(type).colorFor(value));
    }

    private static String format(double value) {
        if (value == Math.rint(value)) {
            return String.format(Locale.ROOT, "%d%%", (long) value);
        }
        return String.format(Locale.ROOT, "%.1f%%", value);
    }

    private static String badgeTypeOfPeak(String metric) {
        return switch (metric) {
            case PEAK_MACHINE -> EngineSettings.BADGE_MACHINE;
            case PEAK_HUMAN -> EngineSettings.BADGE_HUMAN;
            case PEAK_FULL -> EngineSettings.BADGE_FULL;
            case PEAK_SCENARIOS -> EngineSettings.BADGE_SCENARIOS;
            case PEAK_CONFIDENCE -> EngineSettings.BADGE_CONFIDENCE;
            default -> null;
        };
    }

    private static String labelOfPeak(String metric) {
        return switch (metric) {
            case PEAK_MACHINE -> "Machine peak";
            case PEAK_HUMAN -> "Human peak";
            case PEAK_FULL -> "Fully verified peak";
            case PEAK_SCENARIOS -> "Scenarios peak";
            case PEAK_CONFIDENCE -> "Confidence peak";
            default -> metric;
        };
    }

    record BadgeDocument(long generatedAtMs, List<Badge> badges) {
    }
}
