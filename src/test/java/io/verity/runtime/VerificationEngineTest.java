package io.verity.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.verity.config.VerityConfig;
import io.verity.model.Automatability;
import io.verity.model.CheckSpec;
import io.verity.model.Depth;
import io.verity.model.DepthChecks;
import io.verity.model.Feature;
import io.verity.model.Item;
import io.verity.model.Scenario;
import io.verity.model.ScenarioStep;
import io.verity.model.SourceRef;
import io.verity.registry.RegistryStore;
import io.verity.scenario.ScenarioRunRequest;
import io.verity.stats.Badge;
import io.verity.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class VerificationEngineTest {

    @Test
    void sweepRunsAutomatableItemsAndRecordsHistory() throws Exception {
        Path root = Files.createTempDirectory("verity-test-engine-sweep-");
        try {
            VerificationEngine engine = engine(root);

            RunReport report = engine.run(RunRequest.sweep(Depth.BASIC));
            Assertions.assertEquals(1, report.passed());
            Assertions.assertEquals(1, report.failed());
            Assertions.assertEquals(2, report.items().size());
            Assertions.assertTrue(report.items().stream().noneMatch(r -> r.itemId().equals("dns-1")));
            Assertions.assertEquals(ExitCodes.FAILURES, report.exitCode());
            Assertions.assertEquals(50.0, report.machineCoverage());
            Assertions.assertEquals(4, report.badges().size());
            Assertions.assertTrue(Files.exists(root.resolve(".verification").resolve(".badges.json")));

            Path reports = root.resolve(".verification").resolve("reports");
            JsonNode persisted = Jsons.mapper().readTree(reports.resolve(report.runId() + ".json").toFile());
            Assertions.assertEquals(report.runId(), persisted.path("runId").asText());
            Assertions.assertEquals(1, persisted.path("failed").asInt());
            String junit = Files.readString(reports.resolve(report.runId() + ".junit.xml"), StandardCharsets.UTF_8);
            Assertions.assertTrue(junit.contains("<testsuite name=\"install\" tests=\"2\" failures=\"1\""));
            Assertions.assertTrue(Files.readString(reports.resolve(report.runId() + ".md"), StandardCharsets.UTF_8)
                    .contains("| Machine coverage | 50.0% |"));

            VerificationEngine.HistoryView history = engine.history(10);
            Assertions.assertEquals(report.runId(), history.runs().get(0).runId());
            Assertions.assertEquals(ExitCodes.FAILURES, history.runs().get(0).exitCode());
            Assertions.assertTrue(report.newPeaks().contains("machine_coverage"));
            Assertions.assertTrue(engine.run(RunRequest.sweep(Depth.BASIC)).newPeaks().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void singleItemProblemsMapToConfigurationExit() throws Exception {
        Path root = Files.createTempDirectory("verity-test-engine-single-");
        try {
            VerificationEngine engine = engine(root);

            RunReport conflict = engine.run(RunRequest.item("dns-1", Depth.BASIC));
            Assertions.assertEquals(1, conflict.conflicts().size());
            Assertions.assertEquals(ExitCodes.CONFIGURATION, conflict.exitCode());

            RunReport gap = engine.run(RunRequest.item("install-1", Depth.THOROUGH));
            Assertions.assertEquals(1, gap.skipped());
            Assertions.assertEquals(ExitCodes.CONFIGURATION, gap.exitCode());

            RunReport sweepGap = engine.run(RunRequest.feature("install", Depth.THOROUGH));
            Assertions.assertEquals(2, sweepGap.skipped());
            Assertions.assertEquals(ExitCodes.OK, sweepGap.exitCode());

            Assertions.assertThrows(IllegalArgumentException.class, () -> engine.run(RunRequest.item("nope", Depth.BASIC)));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void affectedRunReverifiesOnlyChangedFeatures() throws Exception {
        Path root = Files.createTempDirectory("verity-test-engine-affected-");
        try {
            VerificationEngine engine = engine(root);
            Assertions.assertTrue(engine.check().changes().isEmpty());
            engine.run(RunRequest.sweep(Depth.BASIC));

            Files.writeString(root.resolve("install.sh"), "echo v2\n", StandardCharsets.UTF_8);
            RunReport affected = engine.run(new RunRequest(Depth.BASIC, null, null, true));
            Assertions.assertEquals(List.of("install-1", "install-2"),
                    affected.items().stream().map(RunReport.ItemResult::itemId).sorted().toList());
            Item reverified = engine.registry().findItem("install-1").orElseThrow();
            Assertions.assertTrue(reverified.machine().verified());
            Assertions.assertFalse(reverified.invalidated());

            RunReport nothing = engine.run(new RunRequest(Depth.BASIC, null, null, true));
            Assertions.assertTrue(nothing.items().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void scenarioRunFeedsCoverageAndExtendedBadges() throws Exception {
        Path root = Files.createTempDirectory("verity-test-engine-scenario-");
        try {
            VerificationEngine engine = engine(root);
            Path scenarios = root.resolve(".verification").resolve("scenarios");
            Jsons.mapper().writeValue(scenarios.resolve("01-install.json").toFile(), new Scenario("install", "Install",
                    null, List.of(), 2, false, List.of("install-1"), List.of(ScenarioStep.of("run", "true")), List.of()));
            Jsons.mapper().writeValue(scenarios.resolve("02-deploy.json").toFile(), new Scenario("deploy", "Deploy",
                    null, List.of("install"), 5, false, List.of("install-2"), List.of(ScenarioStep.of("run", "exit 3")), List.of()));

            Assertions.assertEquals(List.of("pending", "pending"),
                    engine.listScenarios().stream().map(VerificationEngine.ScenarioView::status).toList());

            VerificationEngine.ScenarioRunOutcome outcome = engine.runScenarios(ScenarioRunRequest.all());
            Assertions.assertEquals(25.0, outcome.scenarioCoverage());
            Assertions.assertEquals(ExitCodes.FAILURES, outcome.exitCode());
            Assertions.assertEquals(List.of("passed", "failed"),
                    engine.listScenarios().stream().map(VerificationEngine.ScenarioView::status).toList());

            List<Badge> badges = engine.badges(true, false).badges();
            Assertions.assertEquals("25%", badges.stream().filter(b -> b.key().equals("scenarios")).findFirst().orElseThrow().value());
            Assertions.assertEquals("50%", badges.stream().filter(b -> b.key().equals("confidence")).findFirst().orElseThrow().value());
            Assertions.assertEquals("scenario", engine.history(1).runs().get(0).kind());
            String runId = outcome.report().runId();
            String junit = Files.readString(root.resolve(".verification").resolve("reports").resolve(runId + ".junit.xml"),
                    StandardCharsets.UTF_8);
            Assertions.assertTrue(junit.contains("name=\"deploy\""));
            Assertions.assertTrue(junit.contains("<failure message=\"0 of 1 steps passed, confidence 0\"/>"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static VerificationEngine engine(Path root) throws IOException {
        Files.writeString(root.resolve("install.sh"), "echo v1\n", StandardCharsets.UTF_8);
        VerityConfig config = new VerityConfig(root.resolve(".verification"), root);
        DepthChecks passing = DepthChecks.basicOnly(List.of(CheckSpec.of("echo installed")));
        DepthChecks failing = DepthChecks.basicOnly(List.of(CheckSpec.of("echo missing; exit 1")));
        Item dns = new Item("dns-1", "install", "DNS record is created", Automatability.ENVIRONMENT_DEPENDENT,
                "needs a live DNS provider", passing, null, null, List.of(), false);
        Item approve = new Item("approve-1", "install", "Installer asks for approval", Automatability.MANUAL_ONLY,
                "interactive confirmation", DepthChecks.none(), null, null, List.of(), false);
        new RegistryStore(config, 0).atomicUpdate(r -> r.withFeature(new Feature("install", "Install", null,
                List.of(new SourceRef("install.sh", null, null, null)), null,
                List.of(Item.automatable("install-1", "install", "Install creates the config", passing),
                        Item.automatable("install-2", "install", "Install enables the service", failing),
                        dns, approve))));
        VerificationEngine engine = new VerificationEngine(config);
        engine.init();
        return engine;
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
