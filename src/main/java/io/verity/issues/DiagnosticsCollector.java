package io.verity.issues;

import io.verity.model.ArtifactCheck;
import io.verity.model.DiagnosticsSnapshot;
import io.verity.model.Feature;
import io.verity.model.Registry;
import io.verity.model.SourceRef;
import io.verity.security.SensitiveDataMasker;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gathers the environment facts and artifact checks attached to a new issue.
 */
public final class DiagnosticsCollector {
    private static final Set<String> ENV_NAMES = Set.of("PATH", "HOME", "SHELL", "TERM", "CI", "LANG");
    private static final String ENV_PREFIX = "VERITY_";

    private final Path projectDir;
    private final Map<String, String> env;

    public DiagnosticsCollector(Path projectDir) {
        this(projectDir, System.getenv());
    }

    DiagnosticsCollector(Path projectDir, Map<String, String> env) {
        this.projectDir = projectDir;
        this.env = env;
    }

    public DiagnosticsSnapshot collect(Registry registry, String itemId) {
        Map<String, String> facts = new LinkedHashMap<>();
        facts.put("os.name", System.getProperty("os.name", ""));
        facts.put("os.version", System.getProperty("os.version", ""));
        facts.put("java.version", System.getProperty("java.version", ""));
        facts.put("user.name", System.getProperty("user.name", ""));
        facts.put("user.dir", System.getProperty("user.dir", ""));
        Map<String, String> selected = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : env.entrySet()) {
            if (ENV_NAMES.contains(e.getKey()) || e.getKey().startsWith(ENV_PREFIX)) {
                selected.put("env." + e.getKey(), e.getValue());
            }
        }
        facts.putAll(SensitiveDataMasker.maskedEnvironment(selected));
        return new DiagnosticsSnapshot(System.currentTimeMillis(), facts, artifacts(registry, itemId));
    }

    private List<ArtifactCheck> artifacts(Registry registry, String itemId) {
        List<ArtifactCheck> out = new ArrayList<>();
        if (registry == null || itemId == null) {
            return out;
        }
        Feature feature = registry.featureOf(itemId).orElse(null);
        if (feature == null) {
            return out;
        }
        for (SourceRef source : feature.sources()) {
            Path file = projectDir.resolve(source.path()).normalize();
            long size = -1L;
            boolean exists = Files.exists(file);
            if (exists) {
                try {
                    size = Files.size(file);
                } catch (IOException e) {
                    System.err.println("WARN cannot size artifact " + file + ": " + e.getMessage());
                }
            }
            out.add(new ArtifactCheck(source.path(), exists, size));
        }
        return out;
    }
}
