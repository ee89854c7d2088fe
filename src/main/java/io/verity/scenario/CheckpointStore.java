package io.verity.scenario;

import io.verity.model.Checkpoint;
import io.verity.util.AtomicFiles;
import io.verity.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Persists the scenario run checkpoint. Writes are serialized and atomic.
 */
public final class CheckpointStore {
    private final Path file;
    private final Path archiveDir;

    public CheckpointStore(Path file, Path archiveDir) {
        this.file = file;
        this.archiveDir = archiveDir;
    }

    public synchronized Optional<Checkpoint> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Jsons.read(file, Checkpoint.class));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read checkpoint: " + file, e);
        }
    }

    public synchronized void save(Checkpoint checkpoint) {
        try {
            AtomicFiles.writeJson(file, checkpoint);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write checkpoint: " + file, e);
        }
    }

    /**
     * Moves the current checkpoint to {@code checkpoints/archive/<runId>.json}.
     */
    public synchronized Path archive(Checkpoint checkpoint) {
        Path target = archiveDir.resolve(checkpoint.runId() + ".json");
        try {
            Files.createDirectories(archiveDir);
            AtomicFiles.writeJson(target, checkpoint);
            Files.deleteIfExists(file);
            return target;
        } catch (IOException e) {
            throw new RuntimeException("Failed to archive checkpoint " + checkpoint.runId(), e);
        }
    }
}
