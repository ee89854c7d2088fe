package io.verity.model;

import java.util.List;

/**
 * Multi-step integration workflow. {@code dependsOn} scenarios must have
 * passed in the current checkpoint before this one may start; a failed
 * {@code gate} scenario stops the rest of the run.
 */
public record Scenario(
        String id,
        String name,
        String description,
        List<String> dependsOn,
        int estimatedDurationMinutes,
        boolean gate,
        List<String> items,
        List<ScenarioStep> steps,
        List<String> cleanup
) {
    public Scenario {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("scenario id cannot be empty");
        }
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        items = items == null ? List.of() : List.copyOf(items);
        steps = steps == null ? List.of() : List.copyOf(steps);
        cleanup = cleanup == null ? List.of() : List.copyOf(cleanup);
    }
}
