package io.verity.registry;

import com.fasterxml.jackson.databind.JsonNode;
import io.verity.config.VerityConfig;
import io.verity.errors.RegistryCorruptionException;
import io.verity.model.Registry;
import io.verity.util.AtomicFiles;
import io.verity.util.Jsons;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Sole owner of {@code registry.json}. Writers are serialized by an in-process
 * lock plus an OS lock on {@code registry.lock}; readers get the last committed
 * snapshot without blocking.
 */
public final class RegistryStore {
    // OS file locks are held per JVM, so stores on the same file share one in-process lock.
    private static final Map<Path, ReentrantLock> WRITE_LOCKS = new ConcurrentHashMap<>();

    private final VerityConfig config;
    private final int maxItemShrink;
    private final ReentrantLock writeLock;
    private final AtomicReference<Registry> committed = new AtomicReference<>();
    private volatile boolean corruptionRestored;

    public RegistryStore(VerityConfig config, int maxItemShrink) {
        this.config = config;
        this.maxItemShrink = Math.max(0, maxItemShrink);
        this.writeLock = WRITE_LOCKS.computeIfAbsent(
                config.registryLockFile().toAbsolutePath().normalize(), ignored -> new ReentrantLock());
    }

    /**
     * Reads the registry from disk. An unreadable or invalid main file is
     * replaced by {@code registry.json.bak} when that one is valid.
     *
     * @throws io.verity.errors.UnknownSchemaVersionException for a foreign schema version
     * @throws RegistryCorruptionException when neither file holds a valid registry
     */
    public Registry load() {
        writeLock.lock();
        try (RegistryLock ignored = acquireFileLock()) {
            Registry loaded = readFromDisk();
            committed.set(loaded);
            return loaded;
        } catch (IOException e) {
            throw new RegistryCorruptionException("Failed to lock registry: " + e.getMessage(), false, e);
        } finally {
            writeLock.unlock();
        }
    }

    public Registry snapshot() {
        Registry current = committed.get();
        return current != null ? current : load();
    }

    /**
     * Applies {@code mutator} to the current registry and commits the result.
     * Nothing is written when the mutator throws or the result fails
     * validation; the previous snapshot stays in place.
     */
    public Registry atomicUpdate(UnaryOperator<Registry> mutator) {
        writeLock.lock();
        try (RegistryLock ignored = acquireFileLock()) {
            Registry current = readFromDisk();
            committed.set(current);
            Registry mutated = mutator.apply(current);
            if (mutated == null) {
                throw new IllegalArgumentException("registry mutator returned null");
            }
            Registry next = mutated.withDerivedSummaries();
            int shrink = current.itemCount() - next.itemCount();
            if (shrink > maxItemShrink) {
                throw new RegistryCorruptionException(
                        "Update removes " + shrink + " items (allowed " + maxItemShrink + "), rolled back", true);
            }
            RegistryValidator.requireSupportedSchema(next.schemaVersion());
            List<String> violations = RegistryValidator.violations(next);
            if (!violations.isEmpty()) {
                throw new RegistryCorruptionException(
                        "Update rejected, registry invalid: " + String.join("; ", violations), true);
            }
            write(next);
            committed.set(next);
            return next;
        } catch (IOException e) {
            throw new RegistryCorruptionException("Failed to write registry, previous version kept: " + e.getMessage(), true, e);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * True when the last load had to fall back to the backup file.
     */
    public boolean corruptionRestored() {
        return corruptionRestored;
    }

    public Path registryFile() {
        return config.registryFile();
    }

    private Registry readFromDisk() {
        Path main = config.registryFile();
        Path backup = config.registryBackupFile();
        if (!Files.exists(main)) {
            if (Files.exists(backup)) {
                return restoreFromBackup("registry.json is missing");
            }
            return Registry.empty(VerityConfig.SUPPORTED_SCHEMA_VERSION);
        }
        try {
            return parseValid(main);
        } catch (RegistryCorruptionException e) {
            return restoreFromBackup(e.getMessage());
        }
    }

    private Registry restoreFromBackup(String reason) {
        Path backup = config.registryBackupFile();
        if (!Files.exists(backup)) {
            throw new RegistryCorruptionException("Registry unreadable and no backup exists: " + reason, false);
        }
        Registry restored;
        try {
            restored = parseValid(backup);
        } catch (RegistryCorruptionException e) {
            throw new RegistryCorruptionException(
                    "Registry unreadable (" + reason + ") and backup invalid: " + e.getMessage(), false, e);
        }
        try {
            Path tmp = Files.createTempFile(config.rootDir(), ".registry-restore-", ".tmp");
            Files.copy(backup, tmp, StandardCopyOption.REPLACE_EXISTING);
            AtomicFiles.moveIntoPlace(tmp, config.registryFile());
        } catch (IOException e) {
            throw new RegistryCorruptionException("Failed to restore registry from backup: " + e.getMessage(), false, e);
        }
        corruptionRestored = true;
        System.err.println("WARN registry.json was invalid (" + reason + "), restored from registry.json.bak");
        return restored;
    }

    private Registry parseValid(Path file) {
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RegistryCorruptionException("Unparseable " + file.getFileName() + ": " + e.getMessage(), false, e);
        }
        if (node == null || !node.isObject()) {
            throw new RegistryCorruptionException(file.getFileName() + " is not a JSON object", false);
        }
        // Schema check comes first so a newer document is never "restored" over.
        RegistryValidator.requireSupportedSchema(node.path("schemaVersion").asInt(-1));
        Registry registry;
        try {
            registry = Jsons.mapper().treeToValue(node, Registry.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new RegistryCorruptionException("Malformed " + file.getFileName() + ": " + e.getMessage(), false, e);
        }
        List<String> violations = RegistryValidator.violations(registry);
        if (!violations.isEmpty()) {
            throw new RegistryCorruptionException(
                    file.getFileName() + " failed validation: " + String.join("; ", violations), false);
        }
        return registry;
    }

    private void write(Registry next) throws IOException {
        Files.createDirectories(config.rootDir());
        Path main = config.registryFile();
        Path tmp = Files.createTempFile(config.rootDir(), ".registry-", ".tmp");
        try {
            Files.writeString(tmp, Jsons.toJson(next), StandardCharsets.UTF_8);
            Registry reread = Jsons.read(tmp, Registry.class);
            if (reread.itemCount() != next.itemCount() || !RegistryValidator.violations(reread).isEmpty()) {
                throw new RegistryCorruptionException("Serialized registry did not read back intact", true);
            }
            if (Files.exists(main)) {
                Files.copy(main, config.registryBackupFile(), StandardCopyOption.REPLACE_EXISTING);
            }
            AtomicFiles.moveIntoPlace(tmp, main);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private RegistryLock acquireFileLock() throws IOException {
        Files.createDirectories(config.rootDir());
        FileChannel channel = FileChannel.open(config.registryLockFile(),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        try {
            return new RegistryLock(channel, channel.lock());
        } catch (IOException e) {
            channel.close();
            throw e;
        }
    }

    private record RegistryLock(FileChannel channel, FileLock lock) implements AutoCloseable {
        @Override
        public void close() throws IOException {
            try {
                lock.release();
            } finally {
                channel.close();
            }
        }
    }
}
