package io.verity.verify;

import io.verity.util.AtomicFiles;
import io.verity.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Items the user asked never to be prompted about again.
 */
public final class PromptPreferences {
    private final Path file;

    public PromptPreferences(Path file) {
        this.file = file;
    }

    public synchronized void skipPermanently(String itemId, String identity) {
        Map<String, SkipEntry> skipped = read();
        skipped.put(itemId, new SkipEntry(identity, System.currentTimeMillis()));
        try {
            AtomicFiles.writeJson(file, new PreferencesDocument(skipped));
        } catch (IOException e) {
            throw new RuntimeException("Failed to write prompt preferences: " + file, e);
        }
    }

    public synchronized boolean permanentlySkipped(String itemId) {
        return read().containsKey(itemId);
    }

    private Map<String, SkipEntry> read() {
        if (!Files.exists(file)) {
            return new TreeMap<>();
        }
        try {
            PreferencesDocument doc = Jsons.read(file, PreferencesDocument.class);
            return doc.skipped() == null ? new TreeMap<>() : new TreeMap<>(doc.skipped());
        } catch (IOException e) {
            throw new RuntimeException("Failed to read prompt preferences: " + file, e);
        }
    }

    record SkipEntry(String identity, long atMs) {
    }

    record PreferencesDocument(Map<String, SkipEntry> skipped) {
    }
}
