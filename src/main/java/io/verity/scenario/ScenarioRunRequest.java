package io.verity.scenario;

/**
 * {@code scenarioId} runs one scenario, {@code fromId} runs a scenario and its
 * dependents; neither runs the whole catalog. {@code resume} continues the
 * existing checkpoint without re-running passed scenarios.
 */
public record ScenarioRunRequest(String scenarioId, String fromId, boolean resume, boolean keepCheckpoint) {
    public ScenarioRunRequest {
        if (scenarioId != null && fromId != null) {
            throw new IllegalArgumentException("--id and --from are mutually exclusive");
        }
    }

    public static ScenarioRunRequest all() {
        return new ScenarioRunRequest(null, null, false, false);
    }

    public static ScenarioRunRequest single(String scenarioId) {
        return new ScenarioRunRequest(scenarioId, null, false, false);
    }

    public static ScenarioRunRequest resumeRun() {
        return new ScenarioRunRequest(null, null, true, false);
    }

    boolean freshRun() {
        return scenarioId == null && fromId == null && !resume;
    }
}
