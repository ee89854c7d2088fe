package io.verity.runtime;

import io.verity.model.Finding;
import io.verity.model.ScenarioRecord;
import io.verity.model.ScenarioStatus;
import io.verity.scenario.ScenarioRunReport;
import io.verity.util.AtomicFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Persists every run under {@code reports/} as {@code <runId>.json},
 * {@code <runId>.md} and {@code <runId>.junit.xml}. A resumed scenario run
 * keeps its run id, so its files are replaced with the latest state.
 */
public final class RunReportWriter {
    private final Path dir;

    public RunReportWriter(Path dir) {
        this.dir = dir;
    }

    public ReportFiles write(RunReport report) throws IOException {
        return writeAll(report.runId(), report, markdown(report), junitXml(report));
    }

    public ReportFiles write(VerificationEngine.ScenarioRunOutcome outcome) throws IOException {
        return writeAll(outcome.report().runId(), outcome, markdown(outcome), junitXml(outcome));
    }

    private ReportFiles writeAll(String runId, Object json, String markdown, String junit) throws IOException {
        Path jsonFile = dir.resolve(runId + ".json");
        Path markdownFile = dir.resolve(runId + ".md");
        Path junitFile = dir.resolve(runId + ".junit.xml");
        AtomicFiles.writeJson(jsonFile, json);
        AtomicFiles.writeString(markdownFile, markdown);
        AtomicFiles.writeString(junitFile, junit);
        return new ReportFiles(jsonFile.toString(), markdownFile.toString(), junitFile.toString());
    }

    static String markdown(RunReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Verification Report\n\n");
        sb.append("**Run ID:** ").append(report.runId()).append("  \n");
        sb.append("**Kind:** machine, depth ").append(report.depth()).append("  \n");
        sb.append("**Exit code:** ").append(report.exitCode()).append("  \n");
        sb.append("**Finished:** ").append(Instant.ofEpochMilli(report.finishedAtMs())).append("\n\n");

        sb.append("## Summary\n\n");
        sb.append("| Metric | Value |\n|--------|-------|\n");
        row(sb, "Passed", String.valueOf(report.passed()));
        row(sb, "Failed", String.valueOf(report.failed()));
        row(sb, "Skipped", String.valueOf(report.skipped()));
        row(sb, "Blocked", String.valueOf(report.blocked()));
        row(sb, "Machine coverage", percent(report.machineCoverage()));
        row(sb, "Human coverage", percent(report.humanCoverage()));
        row(sb, "Full coverage", percent(report.fullCoverage()));
        row(sb, "Duration", duration(report.finishedAtMs() - report.startedAtMs()));
        if (!report.newPeaks().isEmpty()) {
            row(sb, "New peaks", String.join(", ", report.newPeaks()));
        }

        if (!report.items().isEmpty()) {
            sb.append("\n## Items\n\n");
            sb.append("| Item | Feature | Outcome | Duration | Reason |\n|------|---------|---------|----------|--------|\n");
            for (RunReport.ItemResult item : report.items()) {
                sb.append("| ").append(cell(item.itemId()))
                        .append(" | ").append(cell(item.featureId()))
                        .append(" | ").append(cell(item.outcome()))
                        .append(" | ").append(item.durationMs()).append("ms")
                        .append(" | ").append(cell(item.reason()))
                        .append(" |\n");
            }
        }
        bullets(sb, "Classification conflicts", report.conflicts());
        bullets(sb, "Configuration gaps", report.configurationGaps());
        bullets(sb, "Errors", report.errors());
        bullets(sb, "Inconsistencies", report.inconsistencies());
        if (report.statisticsError() != null) {
            sb.append("\n**Statistics unavailable:** ").append(report.statisticsError()).append('\n');
        }
        return sb.toString();
    }

    static String markdown(VerificationEngine.ScenarioRunOutcome outcome) {
        ScenarioRunReport report = outcome.report();
        StringBuilder sb = new StringBuilder();
        sb.append("# Scenario Report\n\n");
        sb.append("**Run ID:** ").append(report.runId()).append("  \n");
        sb.append("**Exit code:** ").append(outcome.exitCode()).append("  \n");
        sb.append("**Checkpoint:** ").append(report.archived() ? "archived" : "kept").append("\n\n");

        sb.append("## Summary\n\n");
        sb.append("| Metric | Value |\n|--------|-------|\n");
        row(sb, "Passed", String.valueOf(report.passed()));
        row(sb, "Failed", String.valueOf(report.failed()));
        row(sb, "Skipped", String.valueOf(report.skipped()));
        row(sb, "Scenario coverage", percent(outcome.scenarioCoverage()));
        row(sb, "Average confidence", String.format(Locale.ROOT, "%.1f", report.averageConfidence()));
        row(sb, "Gate failed", report.gateFailed() ? "yes" : "no");

        if (!report.records().isEmpty()) {
            sb.append("\n## Scenarios\n\n");
            sb.append("| Scenario | Status | Steps | Confidence | Duration |\n|----------|--------|-------|------------|----------|\n");
            for (ScenarioRecord record : report.records()) {
                sb.append("| ").append(cell(record.id()))
                        .append(" | ").append(record.status().wireName())
                        .append(" | ").append(record.stepsPassed()).append('/').append(record.stepsTotal())
                        .append(" | ").append(record.confidence())
                        .append(" | ").append(duration(record.durationMs()))
                        .append(" |\n");
            }
        }
        List<String> findings = new ArrayList<>();
        for (Finding finding : report.findings()) {
            findings.add("**" + finding.type().wireName() + "** " + finding.scenarioId()
                    + (finding.step() > 0 ? " step " + finding.step() : "") + ": " + finding.message());
        }
        bullets(sb, "Findings", findings);
        return sb.toString();
    }

    static String junitXml(RunReport report) {
        Map<String, List<RunReport.ItemResult>> byFeature = new LinkedHashMap<>();
        for (RunReport.ItemResult item : report.items()) {
            byFeature.computeIfAbsent(item.featureId(), ignored -> new ArrayList<>()).add(item);
        }
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        sb.append("<testsuites name=\"").append(xml("verity " + report.runId()))
                .append("\" tests=\"").append(report.items().size())
                .append("\" failures=\"").append(report.failed())
                .append("\" time=\"").append(seconds(report.finishedAtMs() - report.startedAtMs()))
                .append("\">\n");
        for (Map.Entry<String, List<RunReport.ItemResult>> suite : byFeature.entrySet()) {
            List<RunReport.ItemResult> items = suite.getValue();
            long failures = items.stream().filter(i -> i.outcome().equals("failed")).count();
            long skipped = items.stream().filter(i -> i.outcome().equals("skipped") || i.outcome().equals("blocked")).count();
            long errors = items.size() - failures - skipped - items.stream().filter(i -> i.outcome().equals("verified")).count();
            sb.append("  <testsuite name=\"").append(xml(suite.getKey()))
                    .append("\" tests=\"").append(items.size())
                    .append("\" failures=\"").append(failures)
                    .append("\" errors=\"").append(errors)
                    .append("\" skipped=\"").append(skipped)
                    .append("\">\n");
            for (RunReport.ItemResult item : items) {
                testcase(sb, suite.getKey(), item.itemId(), item.durationMs(), item.outcome(), item.reason());
            }
            sb.append("  </testsuite>\n");
        }
        sb.append("</testsuites>\n");
        return sb.toString();
    }

    static String junitXml(VerificationEngine.ScenarioRunOutcome outcome) {
        ScenarioRunReport report = outcome.report();
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        sb.append("<testsuites name=\"").append(xml("verity " + report.runId()))
                .append("\" tests=\"").append(report.records().size())
                .append("\" failures=\"").append(report.failed())
                .append("\">\n");
        sb.append("  <testsuite name=\"scenarios\" tests=\"").append(report.records().size())
                .append("\" failures=\"").append(report.failed())
                .append("\" errors=\"0\" skipped=\"").append(report.skipped())
                .append("\">\n");
        for (ScenarioRecord record : report.records()) {
            String reason = record.status() == ScenarioStatus.PASSED ? null
                    : record.stepsPassed() + " of " + record.stepsTotal() + " steps passed, confidence " + record.confidence();
            testcase(sb, "scenarios", record.id(), record.durationMs(), record.status().wireName(), reason);
        }
        sb.append("  </testsuite>\n");
        sb.append("</testsuites>\n");
        return sb.toString();
    }

    private static void testcase(StringBuilder sb, String suite, String name, long durationMs, String outcome, String reason) {
        sb.append("    <testcase classname=\"").append(xml(suite))
                .append("\" name=\"").append(xml(name))
                .append("\" time=\"").append(seconds(durationMs)).append('"');
        String message = xml(reason == null ? outcome : reason);
        switch (outcome) {
            case "verified", "passed" -> sb.append("/>\n");
            case "failed" -> sb.append(">\n      <failure message=\"").append(message).append("\"/>\n    </testcase>\n");
            case "skipped", "blocked" -> sb.append(">\n      <skipped message=\"").append(message).append("\"/>\n    </testcase>\n");
            default -> sb.append(">\n      <error type=\"").append(xml(outcome)).append("\" message=\"")
                    .append(message).append("\"/>\n    </testcase>\n");
        }
    }

    private static void row(StringBuilder sb, String metric, String value) {
        sb.append("| ").append(metric).append(" | ").append(cell(value)).append(" |\n");
    }

    private static void bullets(StringBuilder sb, String title, List<String> lines) {
        if (lines.isEmpty()) {
            return;
        }
        sb.append("\n## ").append(title).append("\n\n");
        for (String line : lines) {
            sb.append("- ").append(line.replace('\n', ' ')).append('\n');
        }
    }

    private static String cell(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("|", "\\|").replace('\n', ' ').replace('\r', ' ');
    }

    private static String percent(Double value) {
        return value == null ? "n/a" : String.format(Locale.ROOT, "%.1f%%", value);
    }

    private static String duration(long ms) {
        long secs = Math.max(0L, ms) / 1000L;
        if (secs >= 3600) {
            return (secs / 3600) + "h " + (secs % 3600 / 60) + "m";
        }
        if (secs >= 60) {
            return (secs / 60) + "m " + (secs % 60) + "s";
        }
        return secs + "s";
    }

    private static String seconds(long ms) {
        return String.format(Locale.ROOT, "%.3f", Math.max(0L, ms) / 1000.0);
    }

    private static String xml(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&apos;");
                case '\n' -> out.append("&#10;");
                case '\t' -> out.append("&#9;");
                default -> {
                    // XML 1.0 has no representation for other control characters.
                    if (c >= 0x20 || c == '\r') {
                        out.append(c);
                    }
                }
            }
        }
        return out.toString();
    }

    public record ReportFiles(String json, String markdown, String junitXml) {
    }
}
