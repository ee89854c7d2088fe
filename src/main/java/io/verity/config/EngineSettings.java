package io.verity.config;

import io.verity.scenario.ConfidenceBand;
import io.verity.stats.BadgeThreshold;
import io.verity.util.Jsons;
import io.verity.verify.PromptMode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine tunables resolved from {@code verity-settings.json}. Every field falls
 * back to its default when missing or out of range.
 */
public record EngineSettings(
        int defaultTimeoutSec,
        int outputTailLines,
        int outputTailBytes,
        int maxItemShrink,
        int workerPoolSize,
        int scenarioParallelism,
        int promptTimeoutSec,
        PromptMode promptMode,
        List<String> testers,
        boolean autoFixEnabled,
        boolean preserveOnFailure,
        boolean archiveOnSuccess,
        List<String> shell,
        String defaultTarget,
        List<ConfidenceBand> confidenceBands,
        Map<String, BadgeThreshold> badgeThresholds,
        String auditSigningSecret
) {
    public static final String BADGE_MACHINE = "machine";
    public static final String BADGE_HUMAN = "human";
    public static final String BADGE_FULL = "full";
    public static final String BADGE_ISSUES = "issues";
    public static final String BADGE_SCENARIOS = "scenarios";
    public static final String BADGE_CONFIDENCE = "confidence";
    public static final String BADGE_ENVIRONMENT = "environment";
    public static final String BADGE_MANUAL = "manual";

    public EngineSettings {
        testers = testers == null ? List.of() : List.copyOf(testers);
        shell = shell == null ? List.of() : List.copyOf(shell);
        confidenceBands = confidenceBands == null ? List.of() : List.copyOf(confidenceBands);
        badgeThresholds = badgeThresholds == null ? Map.of() : Map.copyOf(badgeThresholds);
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
                VerityConfig.DEFAULT_TIMEOUT_SEC,
                VerityConfig.DEFAULT_OUTPUT_TAIL_LINES,
                VerityConfig.DEFAULT_OUTPUT_TAIL_BYTES,
                0,
                VerityConfig.DEFAULT_WORKER_POOL,
                VerityConfig.DEFAULT_SCENARIO_PARALLELISM,
                VerityConfig.DEFAULT_PROMPT_TIMEOUT_SEC,
                PromptMode.UNVERIFIED,
                List.of(),
                true,
                true,
                true,
                List.of("/bin/sh", "-c"),
                "",
                defaultConfidenceBands(),
                defaultBadgeThresholds(),
                ""
        );
    }

    public static List<ConfidenceBand> defaultConfidenceBands() {
        return List.of(
                new ConfidenceBand(0.9, 90),
                new ConfidenceBand(0.75, 75),
                new ConfidenceBand(0.5, 50),
                new ConfidenceBand(0.0, 0)
        );
    }

    public static Map<String, BadgeThreshold> defaultBadgeThresholds() {
        Map<String, BadgeThreshold> out = new LinkedHashMap<>();
        out.put(BADGE_MACHINE, new BadgeThreshold(50, 65, 80, false));
        out.put(BADGE_HUMAN, new BadgeThreshold(25, 40, 60, false));
        out.put(BADGE_FULL, new BadgeThreshold(25, 40, 60, false));
        out.put(BADGE_ISSUES, new BadgeThreshold(0, 5, 10, true));
        out.put(BADGE_SCENARIOS, new BadgeThreshold(50, 65, 80, false));
        out.put(BADGE_CONFIDENCE, new BadgeThreshold(50, 75, 90, false));
        out.put(BADGE_ENVIRONMENT, new BadgeThreshold(25, 40, 60, true));
        out.put(BADGE_MANUAL, new BadgeThreshold(25, 40, 60, true));
        return out;
    }

    public BadgeThreshold thresholdFor(String badgeType) {
        BadgeThreshold threshold = badgeThresholds.get(badgeType);
        if (threshold != null) {
            return threshold;
        }
        return defaultBadgeThresholds().getOrDefault(badgeType, new BadgeThreshold(25, 40, 60, false));
    }

    public static EngineSettings load(Path file) {
        EngineSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.read(file, SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load engine settings: " + file, e);
        }
    }

    static EngineSettings fromFile(SettingsFile file, EngineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int timeout = sanitizeInt(file.defaultTimeoutSec(), defaults.defaultTimeoutSec(), 1);
        int tailLines = sanitizeInt(file.outputTailLines(), defaults.outputTailLines(), 1);
        int tailBytes = sanitizeInt(file.outputTailBytes(), defaults.outputTailBytes(), 256);
        int maxShrink = sanitizeInt(file.maxItemShrink(), defaults.maxItemShrink(), 0);
        int pool = sanitizeInt(file.workerPoolSize(), defaults.workerPoolSize(), 1);
        int scenarioParallelism = sanitizeInt(file.scenarioParallelism(), defaults.scenarioParallelism(), 1);
        int promptTimeout = sanitizeInt(file.promptTimeoutSec(), defaults.promptTimeoutSec(), 1);
        PromptMode mode = file.promptMode() == null || file.promptMode().isBlank()
                ? defaults.promptMode()
                : PromptMode.fromString(file.promptMode());
        List<String> testers = file.testers() == null ? defaults.testers() : sanitizeList(file.testers());
        List<String> shell = file.shell() == null || sanitizeList(file.shell()).isEmpty()
                ? defaults.shell()
                : sanitizeList(file.shell());
        String target = file.defaultTarget() == null ? defaults.defaultTarget() : file.defaultTarget().trim();
        List<ConfidenceBand> bands = file.confidenceBands() == null || file.confidenceBands().isEmpty()
                ? defaults.confidenceBands()
                : sortedBands(file.confidenceBands());
        Map<String, BadgeThreshold> thresholds = new LinkedHashMap<>(defaults.badgeThresholds());
        if (file.badgeThresholds() != null) {
            thresholds.putAll(file.badgeThresholds());
        }
        String secret = file.auditSigningSecret() == null ? defaults.auditSigningSecret() : file.auditSigningSecret().trim();
        return new EngineSettings(
                timeout,
                tailLines,
                tailBytes,
                maxShrink,
                pool,
                scenarioParallelism,
                promptTimeout,
                mode,
                testers,
                sanitizeBoolean(file.autoFixEnabled(), defaults.autoFixEnabled()),
                sanitizeBoolean(file.preserveOnFailure(), defaults.preserveOnFailure()),
                sanitizeBoolean(file.archiveOnSuccess(), defaults.archiveOnSuccess()),
                shell,
                target,
                bands,
                thresholds,
                secret
        );
    }

    private static List<ConfidenceBand> sortedBands(List<ConfidenceBand> raw) {
        List<ConfidenceBand> bands = new ArrayList<>(raw);
        bands.sort(Comparator.comparingDouble(ConfidenceBand::minFraction).reversed());
        if (bands.get(bands.size() - 1).minFraction() > 0.0) {
            bands.add(new ConfidenceBand(0.0, 0));
        }
        return bands;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static boolean sanitizeBoolean(Boolean value, boolean fallback) {
        return value == null ? fallback : value;
    }

    private static List<String> sanitizeList(List<String> raw) {
        List<String> out = new ArrayList<>();
        for (String value : raw) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return out;
    }

    record SettingsFile(
            Integer defaultTimeoutSec,
            Integer outputTailLines,
            Integer outputTailBytes,
            Integer maxItemShrink,
            Integer workerPoolSize,
            Integer scenarioParallelism,
            Integer promptTimeoutSec,
            String promptMode,
            List<String> testers,
            Boolean autoFixEnabled,
            Boolean preserveOnFailure,
            Boolean archiveOnSuccess,
            List<String> shell,
            String defaultTarget,
            List<ConfidenceBand> confidenceBands,
            Map<String, BadgeThreshold> badgeThresholds,
            String auditSigningSecret
    ) {
    }
}
