package io.verity.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Diagnostic bundle attached to an issue: environment facts and the existence
 * and size of the artifacts relevant to the failing item.
 */
public record DiagnosticsSnapshot(
        long collectedAtMs,
        Map<String, String> environment,
        List<ArtifactCheck> artifacts
) {
    public DiagnosticsSnapshot {
        environment = environment == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(environment));
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }
}
