package io.verity.verify;

import io.verity.util.AtomicFiles;
import io.verity.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Identities that agreed to have their successful commands auto-logged as
 * human verifications.
 */
public final class ConsentStore {
    private final Path file;

    public ConsentStore(Path file) {
        this.file = file;
    }

    public synchronized void grant(String identity) {
        Map<String, Long> granted = read();
        granted.put(normalize(identity), System.currentTimeMillis());
        write(granted);
    }

    public synchronized boolean revoke(String identity) {
        Map<String, Long> granted = read();
        boolean removed = granted.remove(normalize(identity)) != null;
        if (removed) {
            write(granted);
        }
        return removed;
    }

    public synchronized boolean hasConsented(String identity) {
        if (identity == null || identity.isBlank()) {
            return false;
        }
        return read().containsKey(normalize(identity));
    }

    private Map<String, Long> read() {
        if (!Files.exists(file)) {
            return new TreeMap<>();
        }
        try {
            ConsentDocument doc = Jsons.read(file, ConsentDocument.class);
            return doc.granted() == null ? new TreeMap<>() : new TreeMap<>(doc.granted());
        } catch (IOException e) {
            throw new RuntimeException("Failed to read consent file: " + file, e);
        }
    }

    private void write(Map<String, Long> granted) {
        try {
            AtomicFiles.writeJson(file, new ConsentDocument(granted));
        } catch (IOException e) {
            throw new RuntimeException("Failed to write consent file: " + file, e);
        }
    }

    private static String normalize(String identity) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity cannot be empty");
        }
        return identity.trim();
    }

    record ConsentDocument(Map<String, Long> granted) {
    }
}
