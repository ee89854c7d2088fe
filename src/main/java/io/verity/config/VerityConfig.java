package io.verity.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class VerityConfig {
    public static final String DEFAULT_ROOT = ".verification";
    public static final int SUPPORTED_SCHEMA_VERSION = 1;
    public static final int DEFAULT_TIMEOUT_SEC = 300;
    public static final int DEFAULT_OUTPUT_TAIL_LINES = 50;
    public static final int DEFAULT_OUTPUT_TAIL_BYTES = 8 * 1024;
    public static final int DEFAULT_WORKER_POOL = 4;
    public static final int DEFAULT_SCENARIO_PARALLELISM = 1;
    public static final int DEFAULT_PROMPT_TIMEOUT_SEC = 30;

    private final Path rootDir;
    private final Path projectDir;

    public VerityConfig(Path rootDir, Path projectDir) {
        this.rootDir = rootDir;
        this.projectDir = projectDir;
    }

    public static VerityConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        Path project = base.getParent() == null ? base : base.getParent();
        return new VerityConfig(base, project);
    }

    public static VerityConfig fromRoot(String root, String projectDir) {
        VerityConfig defaults = fromRoot(root);
        if (projectDir == null || projectDir.isBlank()) {
            return defaults;
        }
        return new VerityConfig(defaults.rootDir(), Paths.get(projectDir).toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    /**
     * Directory that feature source references are resolved against.
     */
    public Path projectDir() {
        return projectDir;
    }

    public Path registryFile() {
        return rootDir.resolve("registry.json");
    }

    public Path registryBackupFile() {
        return rootDir.resolve("registry.json.bak");
    }

    public Path registryLockFile() {
        return rootDir.resolve("registry.lock");
    }

    public Path checkpointFile() {
        return rootDir.resolve("checkpoint.json");
    }

    public Path checkpointArchiveDir() {
        return rootDir.resolve("checkpoints").resolve("archive");
    }

    public Path issuesDir() {
        return rootDir.resolve("issues");
    }

    public Path scenariosDir() {
        return rootDir.resolve("scenarios");
    }

    public Path fixPatternsFile() {
        return rootDir.resolve("fix-patterns.json");
    }

    public Path consentFile() {
        return rootDir.resolve("consent.json");
    }

    public Path promptPreferencesFile() {
        return rootDir.resolve("prompt-preferences.json");
    }

    public Path settingsFile() {
        return rootDir.resolve("verity-settings.json");
    }

    public Path historyDbFile() {
        return rootDir.resolve("history.db");
    }

    public Path auditFile() {
        return rootDir.resolve("audit").resolve("audit.log");
    }

    public Path reportsDir() {
        return rootDir.resolve("reports");
    }

    public Path badgesFile() {
        return rootDir.resolve(".badges.json");
    }
}
