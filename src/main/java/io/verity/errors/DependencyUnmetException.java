package io.verity.errors;

import java.util.List;

public final class DependencyUnmetException extends VerityException {
    private final String scenarioId;
    private final List<String> unmet;

    public DependencyUnmetException(String scenarioId, List<String> unmet) {
        super(ErrorKind.DEPENDENCY_UNMET,
                "Scenario " + scenarioId + " requires passed scenarios: " + String.join(", ", unmet));
        this.scenarioId = scenarioId;
        this.unmet = List.copyOf(unmet);
    }

    public String scenarioId() {
        return scenarioId;
    }

    public List<String> unmet() {
        return unmet;
    }
}
