package io.verity.scenario;

import io.verity.errors.DependencyUnmetException;
import io.verity.exec.CheckExecutor;
import io.verity.exec.CheckResult;
import io.verity.exec.Placeholders;
import io.verity.model.Checkpoint;
import io.verity.model.CurrentPointer;
import io.verity.model.Finding;
import io.verity.model.FindingType;
import io.verity.model.PreservedResource;
import io.verity.model.Scenario;
import io.verity.model.ScenarioRecord;
import io.verity.model.ScenarioStatus;
import io.verity.model.ScenarioStep;
import io.verity.observability.AuditLogger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.UnaryOperator;

/**
 * Runs integration scenarios in dependency order against a durable checkpoint.
 */
public final class ScenarioOrchestrator {
    private final ScenarioGraph graph;
    private final CheckExecutor executor;
    private final CheckpointStore checkpointStore;
    private final FixPatternTable fixPatterns;
    private final ConfidenceCalculator confidence;
    private final AuditLogger auditLogger;
    private final Placeholders placeholders;
    private final Options options;

    private final Object checkpointLock = new Object();
    private Checkpoint checkpoint;

    public ScenarioOrchestrator(
            ScenarioGraph graph,
            CheckExecutor executor,
            CheckpointStore checkpointStore,
            FixPatternTable fixPatterns,
            ConfidenceCalculator confidence,
            AuditLogger auditLogger,
            Placeholders placeholders,
            Options options
    ) {
        this.graph = graph;
        this.executor = executor;
        this.checkpointStore = checkpointStore;
        this.fixPatterns = fixPatterns == null ? FixPatternTable.empty() : fixPatterns;
        this.confidence = confidence;
        this.auditLogger = auditLogger;
        this.placeholders = placeholders == null ? Placeholders.none() : placeholders;
        this.options = options;
    }

    /**
     * @throws DependencyUnmetException when the single requested scenario has
     *                                  dependencies that have not passed
     */
    public ScenarioRunReport run(ScenarioRunRequest request) {
        List<Scenario> selection = select(request);
        Checkpoint start = openCheckpoint(request);
        int findingsBefore = start.findings().size();
        List<ScenarioRecord> records = new ArrayList<>();
        String runId = start.runId();

        if (request.scenarioId() != null) {
            Scenario only = selection.get(0);
            List<String> unmet = unmetDependencies(only);
            if (!unmet.isEmpty()) {
                records.add(skip(only, "dependencies not passed: " + String.join(", ", unmet)));
                throw new DependencyUnmetException(only.id(), unmet);
            }
        }

        Set<String> selected = new HashSet<>();
        for (Scenario scenario : selection) {
            selected.add(scenario.id());
        }
        boolean gateFailed = false;
        ExecutorService pool = options.scenarioParallelism() > 1
                ? Executors.newFixedThreadPool(options.scenarioParallelism())
                : null;
        try {
            for (List<Scenario> wave : graph.waves()) {
                List<Scenario> ready = new ArrayList<>();
                for (Scenario scenario : wave) {
                    if (!selected.contains(scenario.id())) {
                        continue;
                    }
                    if (request.resume() && current().passed(scenario.id())) {
                        continue;
                    }
                    if (gateFailed) {
                        records.add(skip(scenario, "a gate scenario failed"));
                        continue;
                    }
                    List<String> unmet = unmetDependencies(scenario);
                    if (!unmet.isEmpty()) {
                        records.add(skip(scenario, "dependencies not passed: " + String.join(", ", unmet)));
                        continue;
                    }
                    ready.add(scenario);
                }
                List<ScenarioRecord> waveRecords = runWave(ready, runId, pool);
                records.addAll(waveRecords);
                for (int i = 0; i < ready.size(); i++) {
                    if (ready.get(i).gate() && waveRecords.get(i).status() == ScenarioStatus.FAILED) {
                        gateFailed = true;
                    }
                }
            }
        } finally {
            if (pool != null) {
                pool.shutdownNow();
            }
        }

        Checkpoint end = current();
        boolean allPassed = selection.stream().allMatch(s -> end.passed(s.id()));
        // Partial selections keep the checkpoint so later --id runs see their dependencies.
        boolean catalogPassed = graph.scenarios().stream().allMatch(s -> end.passed(s.id()));
        boolean preserved = end.resources().stream().anyMatch(PreservedResource::preserve);
        boolean archived = false;
        if (catalogPassed && options.archiveOnSuccess() && !end.keep() && !preserved) {
            checkpointStore.archive(end);
            archived = true;
        }
        List<Finding> findings = end.findings().subList(findingsBefore, end.findings().size());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("scenarios", records.size());
        details.put("gate_failed", gateFailed);
        details.put("archived", archived);
        auditLogger.log(AuditLogger.AuditEvent.ofRun(
                "scenario.run", "engine", "checkpoint/" + runId, allPassed ? "passed" : "failed", runId, details));
        return new ScenarioRunReport(runId, records, findings, gateFailed, archived, end);
    }

    private List<Scenario> select(ScenarioRunRequest request) {
        if (request.scenarioId() != null) {
            return List.of(graph.get(request.scenarioId()));
        }
        if (request.fromId() != null) {
            return graph.fromScenario(request.fromId());
        }
        return graph.topologicalOrder();
    }

    private Checkpoint openCheckpoint(ScenarioRunRequest request) {
        long now = System.currentTimeMillis();
        Checkpoint opened;
        if (request.freshRun()) {
            opened = Checkpoint.start("run_" + UUID.randomUUID(), now, request.keepCheckpoint());
        } else {
            opened = checkpointStore.load()
                    .orElseGet(() -> Checkpoint.start("run_" + UUID.randomUUID(), now, request.keepCheckpoint()));
            if (request.keepCheckpoint()) {
                opened = opened.withKeep(true, now);
            }
            // An interrupted scenario restarts from its first step.
            opened = opened.withCurrent(CurrentPointer.idle(), now);
        }
        synchronized (checkpointLock) {
            checkpoint = opened;
            checkpointStore.save(opened);
        }
        return opened;
    }

    private List<ScenarioRecord> runWave(List<Scenario> ready, String runId, ExecutorService pool) {
        if (pool == null || ready.size() < 2) {
            List<ScenarioRecord> out = new ArrayList<>();
            for (Scenario scenario : ready) {
                out.add(execute(scenario, runId));
            }
            return out;
        }
        List<CompletableFuture<ScenarioRecord>> futures = new ArrayList<>();
        for (Scenario scenario : ready) {
            futures.add(CompletableFuture.supplyAsync(() -> execute(scenario, runId), pool));
        }
        List<ScenarioRecord> out = new ArrayList<>();
        for (CompletableFuture<ScenarioRecord> future : futures) {
            out.add(future.join());
        }
        return out;
    }

    private ScenarioRecord execute(Scenario scenario, String runId) {
        long startedNs = System.nanoTime();
        List<ScenarioStep> steps = scenario.steps();
        update(c -> c.withCurrent(new CurrentPointer(scenario.id(), 0,
                steps.isEmpty() ? null : steps.get(0).name()), now()));
        Placeholders runPlaceholders = placeholders.withRunId(runId);
        Map<String, String> baselines = new HashMap<>();
        int exitMatched = 0;
        int fullyPassed = 0;
        for (int i = 0; i < steps.size(); i++) {
            ScenarioStep step = steps.get(i);
            int index = i;
            update(c -> c.withCurrent(new CurrentPointer(scenario.id(), index, step.name()), now()));
            if (step.createsResource() != null && current().preservedResource(step.createsResource()).isPresent()) {
                exitMatched++;
                fullyPassed++;
                finding(scenario.id(), i, FindingType.SKIPPED, "reused preserved resource " + step.createsResource());
                continue;
            }
            StepOutcome outcome = runStep(step, runPlaceholders, baselines);
            if (!outcome.fullyPassed() && options.autoFixEnabled()) {
                Optional<FixPattern> fix = fixPatterns.firstMatch(outcome.result().outputTail());
                if (fix.isPresent()) {
                    if (applyFix(fix.get(), runPlaceholders)) {
                        StepOutcome retried = runStep(step, runPlaceholders, baselines);
                        finding(scenario.id(), i, retried.fullyPassed() ? FindingType.FIXED : FindingType.ERROR,
                                "fix " + fix.get().id() + (retried.fullyPassed() ? " repaired " : " did not repair ")
                                        + "step " + step.name());
                        outcome = retried;
                    } else {
                        finding(scenario.id(), i, FindingType.ERROR, "fix " + fix.get().id() + " failed to apply");
                    }
                }
            }
            if (outcome.exitMatched()) {
                exitMatched++;
                if (step.captureBaseline() != null) {
                    baselines.put(step.captureBaseline(), outcome.result().outputTail().trim());
                }
                if (step.createsResource() != null) {
                    PreservedResource resource = new PreservedResource(step.createsResource(), scenario.id(), false, null);
                    update(c -> c.withResource(resource, now()));
                }
            }
            if (outcome.fullyPassed()) {
                fullyPassed++;
            } else {
                finding(scenario.id(), i, FindingType.ERROR, "step " + step.name() + " failed: " + outcome.reason());
            }
        }

        boolean passed = fullyPassed == steps.size();
        if (passed) {
            runCleanup(scenario, runPlaceholders);
        } else if (options.preserveOnFailure()) {
            for (PreservedResource resource : current().resources()) {
                if (scenario.id().equals(resource.scenarioId()) && !resource.preserve()) {
                    PreservedResource kept = new PreservedResource(resource.name(), resource.scenarioId(), true,
                            "scenario " + scenario.id() + " failed");
                    update(c -> c.withResource(kept, now()));
                }
            }
        }
        long durationMs = (System.nanoTime() - startedNs) / 1_000_000L;
        ScenarioRecord record = new ScenarioRecord(
                scenario.id(),
                passed ? ScenarioStatus.PASSED : ScenarioStatus.FAILED,
                durationMs,
                confidence.score(exitMatched, fullyPassed, steps.size()),
                fullyPassed,
                steps.size(),
                now()
        );
        update(c -> c.withRecord(record, now()));
        return record;
    }

    private StepOutcome runStep(ScenarioStep step, Placeholders runPlaceholders, Map<String, String> baselines) {
        CheckResult result = executor.run(step.command(), step.expectExit(), step.timeoutSec(), runPlaceholders);
        if (!result.passed()) {
            String reason = result.timedOut() ? "timed out" : "exit " + result.exitCode() + ", expected " + step.expectExit();
            return new StepOutcome(result, false, false, reason);
        }
        String output = result.outputTail() == null ? "" : result.outputTail();
        if (step.expectContains() != null && !step.expectContains().isEmpty() && !output.contains(step.expectContains())) {
            return new StepOutcome(result, true, false, "output does not contain '" + step.expectContains() + "'");
        }
        if (step.expectNotContains() != null && !step.expectNotContains().isEmpty() && output.contains(step.expectNotContains())) {
            return new StepOutcome(result, true, false, "output contains '" + step.expectNotContains() + "'");
        }
        if (step.compareToBaseline() != null) {
            String name = step.compareToBaseline().name();
            if (!baselines.containsKey(name)) {
                return new StepOutcome(result, true, false, "baseline '" + name + "' was not captured");
            }
            if (!BaselineComparator.matches(baselines.get(name), output, step.compareToBaseline())) {
                return new StepOutcome(result, true, false, "output '" + output.trim() + "' differs from baseline '"
                        + name + "' (" + baselines.get(name) + ", tolerance " + step.compareToBaseline().tolerance() + ")");
            }
        }
        return new StepOutcome(result, true, true, null);
    }

    private boolean applyFix(FixPattern fix, Placeholders runPlaceholders) {
        for (String command : fix.commands()) {
            if (!executor.run(command, 0, null, runPlaceholders).passed()) {
                return false;
            }
        }
        return fix.verify() == null || fix.verify().isBlank()
                || executor.run(fix.verify(), 0, null, runPlaceholders).passed();
    }

    private void runCleanup(Scenario scenario, Placeholders runPlaceholders) {
        for (String command : scenario.cleanup()) {
            CheckResult result = executor.run(command, 0, null, runPlaceholders);
            if (!result.passed()) {
                finding(scenario.id(), -1, FindingType.WARNING, "cleanup failed: " + result.command());
            }
        }
    }

    private List<String> unmetDependencies(Scenario scenario) {
        Checkpoint snapshot = current();
        List<String> unmet = new ArrayList<>();
        for (String dep : scenario.dependsOn()) {
            if (!snapshot.passed(dep)) {
                unmet.add(dep);
            }
        }
        return unmet;
    }

    private ScenarioRecord skip(Scenario scenario, String reason) {
        finding(scenario.id(), 0, FindingType.SKIPPED, reason);
        ScenarioRecord record = new ScenarioRecord(scenario.id(), ScenarioStatus.SKIPPED, 0L, 0, 0,
                scenario.steps().size(), now());
        update(c -> c.withRecord(record, now()));
        return record;
    }

    private void finding(String scenarioId, int step, FindingType type, String message) {
        Finding finding = new Finding(scenarioId, step, type, message, now());
        update(c -> c.withFinding(finding, now()));
    }

    private void update(UnaryOperator<Checkpoint> change) {
        synchronized (checkpointLock) {
            checkpoint = change.apply(checkpoint);
            checkpointStore.save(checkpoint);
        }
    }

    private Checkpoint current() {
        synchronized (checkpointLock) {
            return checkpoint;
        }
    }

    private static long now() {
        return System.currentTimeMillis();
    }

    private record StepOutcome(CheckResult result, boolean exitMatched, boolean fullyPassed, String reason) {
    }

    public record Options(
            int scenarioParallelism,
            boolean autoFixEnabled,
            boolean preserveOnFailure,
            boolean archiveOnSuccess
    ) {
    }
}
