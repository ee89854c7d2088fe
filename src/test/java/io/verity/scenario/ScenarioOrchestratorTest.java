package io.verity.scenario;

import io.verity.config.EngineSettings;
import io.verity.config.VerityConfig;
import io.verity.errors.DependencyUnmetException;
import io.verity.exec.CheckExecutor;
import io.verity.exec.Placeholders;
import io.verity.model.BaselineComparison;
import io.verity.model.Checkpoint;
import io.verity.model.FindingType;
import io.verity.model.Scenario;
import io.verity.model.ScenarioRecord;
import io.verity.model.ScenarioStatus;
import io.verity.model.ScenarioStep;
import io.verity.observability.AuditLogger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class ScenarioOrchestratorTest {

    @Test
    void singleScenarioWithUnmetDependencyIsNeverStarted() throws Exception {
        Path root = Files.createTempDirectory("verity-test-scenario-deps-");
        try {
            Scenario s1 = scenario("S1", List.of(), ScenarioStep.of("prepare", "true"));
            Scenario s2 = scenario("S2", List.of("S1"), ScenarioStep.of("mark", "touch s2-ran"));
            Fixture fx = new Fixture(root, List.of(s1, s2), FixPatternTable.empty());

            DependencyUnmetException error = Assertions.assertThrows(DependencyUnmetException.class,
                    () -> fx.orchestrator.run(ScenarioRunRequest.single("S2")));
            Assertions.assertEquals(List.of("S1"), error.unmet());
            Assertions.assertFalse(Files.exists(root.resolve("s2-ran")));
            Checkpoint checkpoint = fx.checkpoints.load().orElseThrow();
            Assertions.assertEquals(ScenarioStatus.SKIPPED, checkpoint.recordOf("S2").orElseThrow().status());

            Assertions.assertEquals(1, fx.orchestrator.run(ScenarioRunRequest.single("S1")).passed());
            Assertions.assertEquals(1, fx.orchestrator.run(ScenarioRunRequest.single("S2")).passed());
            Assertions.assertTrue(Files.exists(root.resolve("s2-ran")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void resumeNeverRerunsPassedScenarios() throws Exception {
        Path root = Files.createTempDirectory("verity-test-scenario-resume-");
        try {
            Scenario s1 = scenario("S1", List.of(), ScenarioStep.of("count", "echo run >> s1.count"));
            Scenario s2 = scenario("S2", List.of("S1"), ScenarioStep.of("needs-flag", "test -f s2.ok"));
            Fixture fx = new Fixture(root, List.of(s1, s2), FixPatternTable.empty());

            ScenarioRunReport first = fx.orchestrator.run(ScenarioRunRequest.all());
            Assertions.assertEquals(1, first.passed());
            Assertions.assertEquals(1, first.failed());
            Assertions.assertFalse(first.archived());
            Assertions.assertTrue(Files.exists(fx.config.checkpointFile()));

            Files.writeString(root.resolve("s2.ok"), "", StandardCharsets.UTF_8);
            ScenarioRunReport resumed = fx.orchestrator.run(ScenarioRunRequest.resumeRun());
            Assertions.assertEquals(first.runId(), resumed.runId());
            Assertions.assertEquals(List.of("S2"), resumed.records().stream().map(ScenarioRecord::id).toList());
            Assertions.assertEquals(1, Files.readAllLines(root.resolve("s1.count")).size());

            Assertions.assertTrue(resumed.archived());
            Assertions.assertFalse(Files.exists(fx.config.checkpointFile()));
            Assertions.assertTrue(Files.exists(fx.config.checkpointArchiveDir().resolve(first.runId() + ".json")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void keptCheckpointIsNotArchived() throws Exception {
        Path root = Files.createTempDirectory("verity-test-scenario-keep-");
        try {
            Fixture fx = new Fixture(root, List.of(scenario("S1", List.of(), ScenarioStep.of("ok", "true"))),
                    FixPatternTable.empty());
            ScenarioRunReport report = fx.orchestrator.run(new ScenarioRunRequest(null, null, false, true));
            Assertions.assertEquals(1, report.passed());
            Assertions.assertFalse(report.archived());
            Assertions.assertTrue(fx.checkpoints.load().orElseThrow().keep());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedGateSkipsLaterWaves() throws Exception {
        Path root = Files.createTempDirectory("verity-test-scenario-gate-");
        try {
            Scenario gate = new Scenario("G", "Gate", null, List.of(), 1, true, List.of(),
                    List.of(ScenarioStep.of("preflight", "exit 1")), List.of());
            Scenario base = scenario("B", List.of(), ScenarioStep.of("ok", "true"));
            Scenario later = scenario("L", List.of("B"), ScenarioStep.of("mark", "touch later-ran"));
            Fixture fx = new Fixture(root, List.of(gate, base, later), FixPatternTable.empty());

            ScenarioRunReport report = fx.orchestrator.run(ScenarioRunRequest.all());
            Assertions.assertTrue(report.gateFailed());
            Assertions.assertEquals(ScenarioStatus.SKIPPED, report.checkpoint().recordOf("L").orElseThrow().status());
            Assertions.assertFalse(Files.exists(root.resolve("later-ran")));
            Assertions.assertTrue(report.findings().stream()
                    .anyMatch(f -> f.type() == FindingType.SKIPPED && f.message().contains("gate")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void baselineToleranceDecidesFullPass() throws Exception {
        Path root = Files.createTempDirectory("verity-test-scenario-baseline-");
        try {
            Scenario within = scenario("within", List.of(),
                    baselineStep("capture", "echo 100", "size", null),
                    baselineStep("compare", "echo 104", null, new BaselineComparison("size", "5%")));
            Scenario outside = scenario("outside", List.of(),
                    baselineStep("capture", "echo 100", "size", null),
                    baselineStep("compare", "echo 120", null, new BaselineComparison("size", "5%")));
            Fixture fx = new Fixture(root, List.of(within, outside), FixPatternTable.empty());

            ScenarioRunReport report = fx.orchestrator.run(ScenarioRunRequest.all());
            ScenarioRecord passed = report.checkpoint().recordOf("within").orElseThrow();
            ScenarioRecord failed = report.checkpoint().recordOf("outside").orElseThrow();
            Assertions.assertEquals(ScenarioStatus.PASSED, passed.status());
            Assertions.assertEquals(100, passed.confidence());
            Assertions.assertEquals(ScenarioStatus.FAILED, failed.status());
            Assertions.assertEquals(90, failed.confidence());
            Assertions.assertEquals(1, failed.stepsPassed());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void matchingFixPatternRepairsAndRetriesStep() throws Exception {
        Path root = Files.createTempDirectory("verity-test-scenario-fix-");
        try {
            Scenario flaky = scenario("flaky", List.of(), ScenarioStep.of("connect",
                    "test -f fixed.flag || { echo 'Error: Connection REFUSED'; exit 1; }"));
            FixPatternTable fixes = new FixPatternTable(List.of(
                    new FixPattern("disk-full", "no space left", List.of("true"), null, "high"),
                    new FixPattern("conn-refused", "connection refused", List.of("touch fixed.flag"), "test -f fixed.flag", null)
            ));
            Fixture fx = new Fixture(root, List.of(flaky), fixes);

            ScenarioRunReport report = fx.orchestrator.run(ScenarioRunRequest.all());
            Assertions.assertEquals(1, report.passed());
            Assertions.assertTrue(report.findings().stream()
                    .anyMatch(f -> f.type() == FindingType.FIXED && f.message().contains("conn-refused")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void resourcesOfFailedScenarioArePreservedAndReused() throws Exception {
        Path root = Files.createTempDirectory("verity-test-scenario-preserve-");
        try {
            ScenarioStep create = new ScenarioStep("create-db", "echo made >> db.count", 0, null,
                    null, null, null, null, "db");
            Scenario scenario = scenario("S", List.of(), create, ScenarioStep.of("use-db", "test -f db.ready"));
            Fixture fx = new Fixture(root, List.of(scenario), FixPatternTable.empty());

            ScenarioRunReport failed = fx.orchestrator.run(ScenarioRunRequest.all());
            Assertions.assertEquals(1, failed.failed());
            Assertions.assertTrue(failed.checkpoint().preservedResource("db").isPresent());

            Files.writeString(root.resolve("db.ready"), "", StandardCharsets.UTF_8);
            ScenarioRunReport resumed = fx.orchestrator.run(ScenarioRunRequest.resumeRun());
            Assertions.assertEquals(1, resumed.passed());
            Assertions.assertEquals(1, Files.readAllLines(root.resolve("db.count")).size());
            Assertions.assertFalse(resumed.archived());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void scenarioWithoutStepsPassesWithFullConfidence() throws Exception {
        Path root = Files.createTempDirectory("verity-test-scenario-empty-");
        try {
            Fixture fx = new Fixture(root, List.of(scenario("empty", List.of())), FixPatternTable.empty());
            ScenarioRecord record = fx.orchestrator.run(ScenarioRunRequest.all()).records().get(0);
            Assertions.assertEquals(ScenarioStatus.PASSED, record.status());
            Assertions.assertEquals(100, record.confidence());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Scenario scenario(String id, List<String> dependsOn, ScenarioStep... steps) {
        return new Scenario(id, id, null, dependsOn, 1, false, List.of(), List.of(steps), List.of());
    }

    private static ScenarioStep baselineStep(String name, String command, String capture, BaselineComparison compare) {
        return new ScenarioStep(name, command, 0, null, null, null, capture, compare, null);
    }

    private static final class Fixture {
        final VerityConfig config;
        final CheckpointStore checkpoints;
        final ScenarioOrchestrator orchestrator;

        Fixture(Path root, List<Scenario> scenarios, FixPatternTable fixes) {
            this.config = new VerityConfig(root.resolve(".verification"), root);
            this.checkpoints = new CheckpointStore(config.checkpointFile(), config.checkpointArchiveDir());
            this.orchestrator = new ScenarioOrchestrator(
                    ScenarioGraph.of(scenarios),
                    new CheckExecutor(List.of("/bin/sh", "-c"), 30, 50, 8192, root),
                    checkpoints,
                    fixes,
                    new ConfidenceCalculator(EngineSettings.defaultConfidenceBands()),
                    new AuditLogger(config.auditFile(), ""),
                    Placeholders.none(),
                    new ScenarioOrchestrator.Options(1, true, true, true)
            );
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
