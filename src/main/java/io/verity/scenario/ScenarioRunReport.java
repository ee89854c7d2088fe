package io.verity.scenario;

import io.verity.model.Checkpoint;
import io.verity.model.Finding;
import io.verity.model.ScenarioRecord;
import io.verity.model.ScenarioStatus;

import java.util.List;

public record ScenarioRunReport(
        String runId,
        List<ScenarioRecord> records,
        List<Finding> findings,
        boolean gateFailed,
        boolean archived,
        Checkpoint checkpoint
) {
    public ScenarioRunReport {
        records = List.copyOf(records);
        findings = List.copyOf(findings);
    }

    public long passed() {
        return count(ScenarioStatus.PASSED);
    }

    public long failed() {
        return count(ScenarioStatus.FAILED);
    }

    public long skipped() {
        return count(ScenarioStatus.SKIPPED);
    }

    public double averageConfidence() {
        return records.stream()
                .filter(r -> r.status() != ScenarioStatus.SKIPPED)
                .mapToInt(ScenarioRecord::confidence)
                .average()
                .orElse(0.0);
    }

    private long count(ScenarioStatus status) {
        return records.stream().filter(r -> r.status() == status).count();
    }
}
