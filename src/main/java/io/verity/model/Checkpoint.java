package io.verity.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable resume point of a scenario run. Immutable; each update returns a new
 * instance that the checkpoint store persists.
 */
public record Checkpoint(
        String runId,
        long startedAtMs,
        long updatedAtMs,
        List<ScenarioRecord> scenarios,
        CurrentPointer current,
        List<PreservedResource> resources,
        List<Finding> findings,
        boolean keep
) {
    public Checkpoint {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("checkpoint run id cannot be empty");
        }
        scenarios = scenarios == null ? List.of() : List.copyOf(scenarios);
        current = current == null ? CurrentPointer.idle() : current;
        resources = resources == null ? List.of() : List.copyOf(resources);
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static Checkpoint start(String runId, long nowMs, boolean keep) {
        return new Checkpoint(runId, nowMs, nowMs, List.of(), CurrentPointer.idle(), List.of(), List.of(), keep);
    }

    public Optional<ScenarioRecord> recordOf(String scenarioId) {
        return scenarios.stream().filter(r -> r.id().equals(scenarioId)).findFirst();
    }

    public boolean passed(String scenarioId) {
        return recordOf(scenarioId).map(r -> r.status() == ScenarioStatus.PASSED).orElse(false);
    }

    public Optional<PreservedResource> preservedResource(String name) {
        return resources.stream().filter(r -> r.preserve() && r.name().equals(name)).findFirst();
    }

    /**
     * Replaces any earlier record of the same scenario so the completion list
     * keeps one entry per scenario in completion order.
     */
    public Checkpoint withRecord(ScenarioRecord record, long nowMs) {
        List<ScenarioRecord> next = new ArrayList<>();
        for (ScenarioRecord existing : scenarios) {
            if (!existing.id().equals(record.id())) {
                next.add(existing);
            }
        }
        next.add(record);
        CurrentPointer pointer = record.id().equals(current.scenarioId()) ? CurrentPointer.idle() : current;
        return new Checkpoint(runId, startedAtMs, nowMs, next, pointer, resources, findings, keep);
    }

    public Checkpoint withCurrent(CurrentPointer pointer, long nowMs) {
        return new Checkpoint(runId, startedAtMs, nowMs, scenarios, pointer, resources, findings, keep);
    }

    public Checkpoint withFinding(Finding finding, long nowMs) {
        List<Finding> next = new ArrayList<>(findings);
        next.add(finding);
        return new Checkpoint(runId, startedAtMs, nowMs, scenarios, current, resources, next, keep);
    }

    public Checkpoint withResource(PreservedResource resource, long nowMs) {
        List<PreservedResource> next = new ArrayList<>();
        for (PreservedResource existing : resources) {
            if (!existing.name().equals(resource.name())) {
                next.add(existing);
            }
        }
        next.add(resource);
        return new Checkpoint(runId, startedAtMs, nowMs, scenarios, current, next, findings, keep);
    }

    public Checkpoint withKeep(boolean value, long nowMs) {
        return new Checkpoint(runId, startedAtMs, nowMs, scenarios, current, resources, findings, value);
    }
}
