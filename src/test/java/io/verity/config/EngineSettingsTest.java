package io.verity.config;

import io.verity.scenario.ConfidenceBand;
import io.verity.stats.BadgeColor;
import io.verity.verify.PromptMode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class EngineSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("verity-test-settings-missing-");
        try {
            EngineSettings settings = EngineSettings.load(root.resolve("verity-settings.json"));
            Assertions.assertEquals(EngineSettings.defaults(), settings);
            Assertions.assertEquals(VerityConfig.DEFAULT_TIMEOUT_SEC, settings.defaultTimeoutSec());
            Assertions.assertEquals(PromptMode.UNVERIFIED, settings.promptMode());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void outOfRangeValuesFallBackAndOverridesMerge() throws Exception {
        Path root = Files.createTempDirectory("verity-test-settings-file-");
        try {
            Path file = root.resolve("verity-settings.json");
            Files.writeString(file, """
                    {
                      "defaultTimeoutSec": 0,
                      "outputTailBytes": 12,
                      "workerPoolSize": 8,
                      "promptMode": "all",
                      "testers": ["alice", " ", "bob "],
                      "shell": [],
                      "autoFixEnabled": false,
                      "defaultTarget": " staging ",
                      "confidenceBands": [{"minFraction": 0.5, "score": 60}, {"minFraction": 0.8, "score": 85}],
                      "badgeThresholds": {"machine": {"low": 10, "mid": 20, "high": 30, "inverted": false}},
                      "unknownKey": true
                    }
                    """, StandardCharsets.UTF_8);

            EngineSettings settings = EngineSettings.load(file);
            Assertions.assertEquals(VerityConfig.DEFAULT_TIMEOUT_SEC, settings.defaultTimeoutSec());
            Assertions.assertEquals(VerityConfig.DEFAULT_OUTPUT_TAIL_BYTES, settings.outputTailBytes());
            Assertions.assertEquals(8, settings.workerPoolSize());
            Assertions.assertEquals(PromptMode.ALL, settings.promptMode());
            Assertions.assertEquals(List.of("alice", "bob"), settings.testers());
            Assertions.assertEquals(List.of("/bin/sh", "-c"), settings.shell());
            Assertions.assertFalse(settings.autoFixEnabled());
            Assertions.assertTrue(settings.preserveOnFailure());
            Assertions.assertEquals("staging", settings.defaultTarget());
            Assertions.assertEquals(List.of(new ConfidenceBand(0.8, 85), new ConfidenceBand(0.5, 60), new ConfidenceBand(0.0, 0)),
                    settings.confidenceBands());
            Assertions.assertEquals(BadgeColor.BRIGHTGREEN, settings.thresholdFor(EngineSettings.BADGE_MACHINE).colorFor(35));
            Assertions.assertEquals(BadgeColor.RED, settings.thresholdFor(EngineSettings.BADGE_HUMAN).colorFor(20));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownPromptModeIsRejected() throws Exception {
        Path root = Files.createTempDirectory("verity-test-settings-mode-");
        try {
            Path file = root.resolve("verity-settings.json");
            Files.writeString(file, "{\"promptMode\": \"sometimes\"}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> EngineSettings.load(file));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
