package io.verity.model;

public record ScenarioStep(
        String name,
        String command,
        int expectExit,
        Integer timeoutSec,
        String expectContains,
        String expectNotContains,
        String captureBaseline,
        BaselineComparison compareToBaseline,
        String createsResource
) {
    public ScenarioStep {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("step command cannot be empty");
        }
        name = name == null || name.isBlank() ? command : name;
    }

    public static ScenarioStep of(String name, String command) {
        return new ScenarioStep(name, command, 0, null, null, null, null, null, null);
    }

    public boolean hasDeepAssertions() {
        return (expectContains != null && !expectContains.isEmpty())
                || (expectNotContains != null && !expectNotContains.isEmpty())
                || compareToBaseline != null;
    }
}
