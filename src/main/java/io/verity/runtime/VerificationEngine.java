package io.verity.runtime;

import io.verity.config.EngineSettings;
import io.verity.config.VerityConfig;
import io.verity.errors.ClassificationConflictException;
import io.verity.errors.InconsistentRegistryException;
import io.verity.errors.RegistryCorruptionException;
import io.verity.errors.VerityException;
import io.verity.exec.CheckExecutor;
import io.verity.exec.Placeholders;
import io.verity.issues.DiagnosticsCollector;
import io.verity.issues.IssueStore;
import io.verity.issues.IssueTracker;
import io.verity.model.Checkpoint;
import io.verity.model.Depth;
import io.verity.model.Feature;
import io.verity.model.HumanState;
import io.verity.model.Issue;
import io.verity.model.IssueStatus;
import io.verity.model.Item;
import io.verity.model.Registry;
import io.verity.model.Scenario;
import io.verity.model.ScenarioStatus;
import io.verity.observability.AuditLogger;
import io.verity.observability.PrometheusFormatter;
import io.verity.registry.InvalidationScanner;
import io.verity.registry.RegistryStore;
import io.verity.scenario.CheckpointStore;
import io.verity.scenario.ConfidenceCalculator;
import io.verity.scenario.FixPatternTable;
import io.verity.scenario.ScenarioCatalog;
import io.verity.scenario.ScenarioGraph;
import io.verity.scenario.ScenarioOrchestrator;
import io.verity.scenario.ScenarioRunReport;
import io.verity.scenario.ScenarioRunRequest;
import io.verity.stats.Badge;
import io.verity.stats.BadgeExporter;
import io.verity.stats.BadgeExtras;
import io.verity.stats.Statistics;
import io.verity.stats.StatisticsAggregator;
import io.verity.storage.Database;
import io.verity.storage.HistoryStore;
import io.verity.storage.PeakRow;
import io.verity.storage.RunRow;
import io.verity.verify.AutoLogOutcome;
import io.verity.verify.ConsentStore;
import io.verity.verify.HumanVerifier;
import io.verity.verify.MachineVerification;
import io.verity.verify.MachineVerifier;
import io.verity.verify.OpportunisticResult;
import io.verity.verify.PromptChannel;
import io.verity.verify.PromptPreferences;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Entry point behind every {@code verify} subcommand. Wires the stores and
 * verifiers of one data root and turns their results into run reports.
 */
public final class VerificationEngine {
    private static final String ACTOR = "engine";

    private final VerityConfig config;
    private final EngineSettings settings;
    private final RegistryStore registryStore;
    private final AuditLogger auditLogger;
    private final IssueTracker issueTracker;
    private final CheckExecutor checkExecutor;
    private final HumanVerifier humanVerifier;
    private final ConsentStore consentStore;
    private final Database database;
    private final HistoryStore historyStore;
    private final InvalidationScanner invalidationScanner;
    private final BadgeExporter badgeExporter;
    private final CheckpointStore checkpointStore;
    private final RunReportWriter reportWriter;
    private final Placeholders placeholders;

    public VerificationEngine(VerityConfig config) {
        this(config, null);
    }

    public VerificationEngine(VerityConfig config, String target) {
        this.config = config;
        this.settings = EngineSettings.load(config.settingsFile());
        this.registryStore = new RegistryStore(config, settings.maxItemShrink());
        this.auditLogger = new AuditLogger(config.auditFile(), settings.auditSigningSecret());
        this.issueTracker = new IssueTracker(
                new IssueStore(config.issuesDir()),
                registryStore,
                new DiagnosticsCollector(config.projectDir()),
                auditLogger
        );
        this.checkExecutor = new CheckExecutor(
                settings.shell(),
                settings.defaultTimeoutSec(),
                settings.outputTailLines(),
                settings.outputTailBytes(),
                config.projectDir()
        );
        this.consentStore = new ConsentStore(config.consentFile());
        this.humanVerifier = new HumanVerifier(
                registryStore,
                issueTracker,
                consentStore,
                new PromptPreferences(config.promptPreferencesFile()),
                auditLogger,
                settings.promptMode(),
                settings.testers()
        );
        this.database = new Database(config.historyDbFile());
        this.historyStore = new HistoryStore(database);
        this.invalidationScanner = new InvalidationScanner(config.projectDir());
        this.badgeExporter = new BadgeExporter(settings);
        this.checkpointStore = new CheckpointStore(config.checkpointFile(), config.checkpointArchiveDir());
        this.reportWriter = new RunReportWriter(config.reportsDir());
        String resolvedTarget = target == null || target.isBlank() ? settings.defaultTarget() : target.trim();
        this.placeholders = new Placeholders(resolvedTarget, resolvedTarget, config.projectDir().toString(), "");
    }

    public void init() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.issuesDir());
            Files.createDirectories(config.scenariosDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create data root: " + config.rootDir(), e);
        }
        database.init();
        registryStore.load();
    }

    public EngineSettings settings() {
        return settings;
    }

    public Registry registry() {
        return registryStore.snapshot();
    }

    /**
     * Machine-verifies the selected items. Features fan out over the worker
     * pool, items of one feature run in order. Per-item problems are collected
     * into the report; only fatal registry errors escape.
     */
    public RunReport run(RunRequest request) {
        long startedAtMs = System.currentTimeMillis();
        String runId = "run_" + UUID.randomUUID();
        Map<String, List<Item>> plan = plan(request);
        MachineVerifier verifier = new MachineVerifier(
                registryStore, checkExecutor, issueTracker, auditLogger, placeholders.withRunId(runId));

        List<RunReport.ItemResult> results = new ArrayList<>();
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(settings.workerPoolSize(), plan.size())));
        try {
            List<CompletableFuture<List<RunReport.ItemResult>>> futures = new ArrayList<>();
            for (List<Item> items : plan.values()) {
                futures.add(CompletableFuture.supplyAsync(() -> verifyFeature(verifier, items, request.depth()), pool));
            }
            for (CompletableFuture<List<RunReport.ItemResult>> future : futures) {
                results.addAll(joinUnwrapped(future));
            }
        } finally {
            pool.shutdownNow();
        }

        int passed = 0;
        int failed = 0;
        int skipped = 0;
        int blocked = 0;
        List<String> conflicts = new ArrayList<>();
        List<String> gaps = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int exitCode = ExitCodes.OK;
        for (RunReport.ItemResult result : results) {
            switch (result.outcome()) {
                case "verified" -> passed++;
                case "failed" -> {
                    failed++;
                    exitCode = ExitCodes.combine(exitCode, ExitCodes.FAILURES);
                }
                case "skipped" -> {
                    skipped++;
                    gaps.add(result.itemId() + ": " + result.reason());
                    // A sweep reports gaps and moves on; a single requested item has nothing else to run.
                    if (request.itemId() != null) {
                        exitCode = ExitCodes.combine(exitCode, ExitCodes.CONFIGURATION);
                    }
                }
                case "blocked" -> blocked++;
                case "conflict" -> {
                    conflicts.add(result.itemId() + ": " + result.reason());
                    exitCode = ExitCodes.combine(exitCode, ExitCodes.CONFIGURATION);
                }
                case "rolled_back" -> {
                    errors.add(result.itemId() + ": " + result.reason());
                    exitCode = ExitCodes.combine(exitCode, ExitCodes.CORRUPTION_RESTORED);
                }
                default -> {
                    errors.add(result.itemId() + ": " + result.reason());
                    exitCode = ExitCodes.combine(exitCode, ExitCodes.FAILURES);
                }
            }
        }
        if (registryStore.corruptionRestored()) {
            exitCode = ExitCodes.combine(exitCode, ExitCodes.CORRUPTION_RESTORED);
        }

        List<String> inconsistencies = new ArrayList<>();
        List<Badge> badges = List.of();
        List<String> newPeaks = List.of();
        String statisticsError = null;
        Statistics statistics = null;
        try {
            statistics = statistics();
            inconsistencies.addAll(statistics.inconsistencies());
            badges = badgeExporter.exportBadges(statistics);
            badgeExporter.write(config.badgesFile(), badges);
            newPeaks = historyStore.updatePeaks(coverageMetrics(statistics), runId);
        } catch (InconsistentRegistryException e) {
            statisticsError = e.getMessage();
            inconsistencies.addAll(e.violations());
            exitCode = ExitCodes.combine(exitCode, ExitCodes.CONFIGURATION);
        }

        long finishedAtMs = System.currentTimeMillis();
        historyStore.recordRun(new RunRow(
                runId,
                "machine",
                startedAtMs,
                finishedAtMs,
                exitCode,
                passed,
                failed,
                skipped,
                blocked,
                statistics == null ? 0.0 : statistics.machineCoverage(),
                statistics == null ? 0.0 : statistics.humanCoverage(),
                statistics == null ? 0.0 : statistics.fullCoverage()
        ));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("depth", request.depth().wireName());
        details.put("passed", passed);
        details.put("failed", failed);
        details.put("skipped", skipped);
        details.put("blocked", blocked);
        details.put("exit_code", exitCode);
        auditLogger.log(AuditLogger.AuditEvent.ofRun(
                "engine.run", ACTOR, "run/" + runId, exitCode == ExitCodes.OK ? "ok" : "degraded", runId, details));

        RunReport report = new RunReport(
                runId,
                request.depth().wireName(),
                startedAtMs,
                finishedAtMs,
                passed,
                failed,
                skipped,
                blocked,
                results,
                conflicts,
                gaps,
                errors,
                inconsistencies,
                registryStore.corruptionRestored(),
                statistics == null ? null : statistics.machineCoverage(),
                statistics == null ? null : statistics.humanCoverage(),
                statistics == null ? null : statistics.fullCoverage(),
                statisticsError,
                badges,
                newPeaks,
                exitCode
        );
        persist(runId, () -> reportWriter.write(report));
        return report;
    }

    private Map<String, List<Item>> plan(RunRequest request) {
        Registry registry = registryStore.snapshot();
        Map<String, List<Item>> out = new LinkedHashMap<>();
        if (request.itemId() != null) {
            Item item = registry.findItem(request.itemId())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown item: " + request.itemId()));
            out.put(item.featureId(), List.of(item));
            return out;
        }
        Set<String> featureIds;
        if (request.featureId() != null) {
            if (registry.findFeature(request.featureId()).isEmpty()) {
                throw new IllegalArgumentException("Unknown feature: " + request.featureId());
            }
            featureIds = Set.of(request.featureId());
        } else if (request.affected()) {
            featureIds = invalidationScanner.changedFeatures(registry);
            if (!featureIds.isEmpty()) {
                Set<String> changed = featureIds;
                registry = registryStore.atomicUpdate(r -> invalidationScanner.invalidate(r, changed));
            }
        } else {
            featureIds = null;
        }
        for (Feature feature : registry.features()) {
            if (featureIds != null && !featureIds.contains(feature.id())) {
                continue;
            }
            List<Item> items = feature.items().stream().filter(Item::automatableItem).toList();
            if (!items.isEmpty()) {
                out.put(feature.id(), items);
            }
        }
        return out;
    }

    private List<RunReport.ItemResult> verifyFeature(MachineVerifier verifier, List<Item> items, Depth depth) {
        List<RunReport.ItemResult> out = new ArrayList<>();
        for (Item item : items) {
            out.add(verifyOne(verifier, item, depth));
        }
        return out;
    }

    private RunReport.ItemResult verifyOne(MachineVerifier verifier, Item item, Depth depth) {
        long startedNs = System.nanoTime();
        try {
            MachineVerification verification = verifier.verifyItem(item.id(), depth);
            return new RunReport.ItemResult(
                    item.id(),
                    item.featureId(),
                    verification.outcome().name().toLowerCase(Locale.ROOT),
                    verification.state().durationMs(),
                    verification.reason()
            );
        } catch (ClassificationConflictException e) {
            System.err.println("WARN classification conflict: " + e.getMessage());
            return new RunReport.ItemResult(item.id(), item.featureId(), "conflict", elapsedMs(startedNs), e.getMessage());
        } catch (RegistryCorruptionException e) {
            if (!e.restored()) {
                throw e;
            }
            System.err.println("WARN registry update rolled back for " + item.id() + ": " + e.getMessage());
            return new RunReport.ItemResult(item.id(), item.featureId(), "rolled_back", elapsedMs(startedNs), e.getMessage());
        } catch (VerityException e) {
            if (e.kind().fatal()) {
                throw e;
            }
            return new RunReport.ItemResult(item.id(), item.featureId(), "error", elapsedMs(startedNs), e.getMessage());
        }
    }

    public ScenarioRunOutcome runScenarios(ScenarioRunRequest request) {
        long startedAtMs = System.currentTimeMillis();
        ScenarioGraph graph = ScenarioCatalog.load(config.scenariosDir());
        ScenarioOrchestrator orchestrator = new ScenarioOrchestrator(
                graph,
                checkExecutor,
                checkpointStore,
                FixPatternTable.load(config.fixPatternsFile()),
                new ConfidenceCalculator(settings.confidenceBands()),
                auditLogger,
                placeholders,
                new ScenarioOrchestrator.Options(
                        settings.scenarioParallelism(),
                        settings.autoFixEnabled(),
                        settings.preserveOnFailure(),
                        settings.archiveOnSuccess()
                )
        );
        ScenarioRunReport report = orchestrator.run(request);

        double coverage = scenarioCoverage(graph, report.checkpoint());
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put(BadgeExporter.PEAK_SCENARIOS, coverage);
        if (report.records().stream().anyMatch(r -> r.status() != ScenarioStatus.SKIPPED)) {
            metrics.put(BadgeExporter.PEAK_CONFIDENCE, Math.round(report.averageConfidence() * 10.0) / 10.0);
        }
        List<String> newPeaks = historyStore.updatePeaks(metrics, report.runId());

        int exitCode = report.failed() > 0 ? ExitCodes.FAILURES : ExitCodes.OK;
        if (registryStore.corruptionRestored()) {
            exitCode = ExitCodes.combine(exitCode, ExitCodes.CORRUPTION_RESTORED);
        }
        Optional<Statistics> statistics = statisticsIfConsistent();
        historyStore.recordRun(new RunRow(
                report.runId(),
                "scenario",
                startedAtMs,
                System.currentTimeMillis(),
                exitCode,
                (int) report.passed(),
                (int) report.failed(),
                (int) report.skipped(),
                0,
                statistics.map(Statistics::machineCoverage).orElse(0.0),
                statistics.map(Statistics::humanCoverage).orElse(0.0),
                statistics.map(Statistics::fullCoverage).orElse(0.0)
        ));
        ScenarioRunOutcome outcome = new ScenarioRunOutcome(report, coverage, newPeaks, exitCode);
        persist(report.runId(), () -> reportWriter.write(outcome));
        return outcome;
    }

    public List<ScenarioView> listScenarios() {
        ScenarioGraph graph = ScenarioCatalog.load(config.scenariosDir());
        Optional<Checkpoint> checkpoint = checkpointStore.load();
        List<ScenarioView> out = new ArrayList<>();
        for (Scenario scenario : graph.topologicalOrder()) {
            String status = checkpoint.flatMap(c -> c.recordOf(scenario.id()))
                    .map(r -> r.status().wireName())
                    .orElse("pending");
            out.add(new ScenarioView(
                    scenario.id(),
                    scenario.name(),
                    scenario.dependsOn(),
                    scenario.gate(),
                    scenario.estimatedDurationMinutes(),
                    scenario.steps().size(),
                    scenario.items(),
                    status
            ));
        }
        return out;
    }

    private double scenarioCoverage(ScenarioGraph graph, Checkpoint checkpoint) {
        Registry registry = registryStore.snapshot();
        int total = registry.itemCount();
        if (total == 0) {
            return 0.0;
        }
        Set<String> exercised = new HashSet<>();
        for (Scenario scenario : graph.scenarios()) {
            if (!checkpoint.passed(scenario.id())) {
                continue;
            }
            for (String itemId : scenario.items()) {
                if (registry.findItem(itemId).isPresent()) {
                    exercised.add(itemId);
                }
            }
        }
        return Math.round(exercised.size() * 1000.0 / total) / 10.0;
    }

    public Statistics statistics() {
        return StatisticsAggregator.recompute(registryStore.snapshot(), issueTracker.itemsWithBlockingIssues());
    }

    private Optional<Statistics> statisticsIfConsistent() {
        try {
            return Optional.of(statistics());
        } catch (InconsistentRegistryException e) {
            System.err.println("WARN " + e.getMessage());
            return Optional.empty();
        }
    }

    public String metricsText() {
        return PrometheusFormatter.format(statistics());
    }

    public BadgesOutcome badges(boolean extended, boolean write) {
        Statistics statistics = statistics();
        List<Badge> badges = extended
                ? badgeExporter.exportBadges(statistics, badgeExtras())
                : badgeExporter.exportBadges(statistics);
        if (write) {
            badgeExporter.write(config.badgesFile(), badges);
        }
        return new BadgesOutcome(badges, write ? config.badgesFile().toString() : null);
    }

    private BadgeExtras badgeExtras() {
        Map<String, PeakRow> peaks = historyStore.peaks();
        Map<String, Double> peakValues = new LinkedHashMap<>();
        for (PeakRow row : peaks.values()) {
            peakValues.put(row.metric(), row.peakValue());
        }
        PeakRow scenarios = peaks.get(BadgeExporter.PEAK_SCENARIOS);
        PeakRow confidence = peaks.get(BadgeExporter.PEAK_CONFIDENCE);
        return new BadgeExtras(
                scenarios == null ? null : scenarios.currentValue(),
                confidence == null ? null : confidence.currentValue(),
                peakValues
        );
    }

    private static Map<String, Double> coverageMetrics(Statistics statistics) {
        Map<String, Double> out = new LinkedHashMap<>();
        out.put(BadgeExporter.PEAK_MACHINE, statistics.machineCoverage());
        out.put(BadgeExporter.PEAK_HUMAN, statistics.humanCoverage());
        out.put(BadgeExporter.PEAK_FULL, statistics.fullCoverage());
        return out;
    }

    /**
     * Invalidates verified items of features whose sources changed since the
     * last scan, and refreshes every stored fingerprint.
     */
    public CheckOutcome check() {
        Registry registry = registryStore.snapshot();
        List<InvalidationScanner.SourceChange> changes = invalidationScanner.scan(registry);
        Set<String> changedFeatures = new LinkedHashSet<>();
        for (InvalidationScanner.SourceChange change : changes) {
            changedFeatures.add(change.featureId());
        }
        List<String> invalidated = new ArrayList<>();
        for (String featureId : changedFeatures) {
            registry.findFeature(featureId).ifPresent(f -> {
                for (Item item : f.items()) {
                    if (item.machine().verified() || item.human().verified()) {
                        invalidated.add(item.id());
                    }
                }
            });
        }
        registryStore.atomicUpdate(r -> invalidationScanner.invalidate(r, changedFeatures));
        if (!changes.isEmpty()) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "registry.invalidate",
                    ACTOR,
                    "registry/" + config.registryFile().getFileName(),
                    "invalidated",
                    Map.of("features", new ArrayList<>(changedFeatures), "items", invalidated)
            ));
        }
        return new CheckOutcome(changes, new ArrayList<>(changedFeatures), invalidated);
    }

    public HumanState logManual(String itemId, String identity) {
        return humanVerifier.logManual(itemId, identity);
    }

    public AutoLogOutcome autoLog(List<String> commandLine, String identity) {
        return humanVerifier.autoLog(commandLine, identity);
    }

    public OpportunisticResult prompt(String itemId, String identity, PromptChannel channel) {
        return humanVerifier.promptOpportunistic(itemId, identity, settings.promptTimeoutSec(), channel);
    }

    public ConsentOutcome grantConsent(String identity) {
        consentStore.grant(identity);
        auditLogger.log(AuditLogger.AuditEvent.of("consent.grant", identity, "consent/" + identity, "granted", Map.of()));
        return new ConsentOutcome(identity, true, true);
    }

    public ConsentOutcome revokeConsent(String identity) {
        boolean changed = consentStore.revoke(identity);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "consent.revoke", identity, "consent/" + identity, changed ? "revoked" : "absent", Map.of()));
        return new ConsentOutcome(identity, false, changed);
    }

    public List<Issue> listIssues(IssueStatus statusFilter) {
        return issueTracker.list(statusFilter);
    }

    public Issue showIssue(String issueId) {
        return issueTracker.show(issueId);
    }

    public Issue resolveIssue(String issueId, IssueStatus status, String note, String actor) {
        return issueTracker.transition(issueId, status, note, actor);
    }

    public Issue submitIssue(String reporter, String itemId, String command, Integer exitCode, String description) {
        return issueTracker.create(reporter, command, exitCode, itemId, description, null);
    }

    public HistoryView history(int limit) {
        return new HistoryView(historyStore.recentRuns(limit), new ArrayList<>(historyStore.peaks().values()));
    }

    private static <T> T joinUnwrapped(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw e;
        }
    }

    // Report files are best effort; the summary still goes to stdout.
    private static void persist(String runId, ReportWrite write) {
        try {
            write.run();
        } catch (IOException e) {
            System.err.println("WARN failed to write report for " + runId + ": " + e.getMessage());
        }
    }

    @FunctionalInterface
    private interface ReportWrite {
        RunReportWriter.ReportFiles run() throws IOException;
    }

    private static long elapsedMs(long startedNs) {
        return (System.nanoTime() - startedNs) / 1_000_000L;
    }

    public record ScenarioRunOutcome(
            ScenarioRunReport report,
            double scenarioCoverage,
            List<String> newPeaks,
            int exitCode
    ) {
    }

    public record ScenarioView(
            String id,
            String name,
            List<String> dependsOn,
            boolean gate,
            int estimatedDurationMinutes,
            int steps,
            List<String> items,
            String status
    ) {
    }

    public record BadgesOutcome(List<Badge> badges, String writtenTo) {
    }

    public record CheckOutcome(
            List<InvalidationScanner.SourceChange> changes,
            List<String> changedFeatures,
            List<String> invalidatedItems
    ) {
    }

    public record ConsentOutcome(String identity, boolean consented, boolean changed) {
    }

    public record HistoryView(List<RunRow> runs, List<PeakRow> peaks) {
    }
}
