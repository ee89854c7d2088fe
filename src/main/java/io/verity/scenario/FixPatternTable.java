package io.verity.scenario;

import com.fasterxml.jackson.core.type.TypeReference;
import io.verity.errors.ConfigurationException;
import io.verity.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public final class FixPatternTable {
    private final List<FixPattern> patterns;
    private final List<Pattern> compiled;

    public FixPatternTable(List<FixPattern> patterns) {
        this.patterns = List.copyOf(patterns);
        this.compiled = new ArrayList<>(patterns.size());
        for (FixPattern pattern : this.patterns) {
            try {
                compiled.add(pattern.compiled());
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException("Invalid regex in fix pattern " + pattern.id() + ": " + e.getMessage(), e);
            }
        }
    }

    public static FixPatternTable empty() {
        return new FixPatternTable(List.of());
    }

    /**
     * Reads {@code fix-patterns.json}; a missing file yields an empty table.
     */
    public static FixPatternTable load(Path file) {
        if (file == null || !Files.exists(file)) {
            return empty();
        }
        try {
            List<FixPattern> patterns = Jsons.mapper().readValue(file.toFile(), new TypeReference<List<FixPattern>>() {
            });
            return new FixPatternTable(patterns == null ? List.of() : patterns);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid fix pattern file " + file + ": " + e.getMessage(), e);
        }
    }

    public Optional<FixPattern> firstMatch(String output) {
        if (output == null || output.isEmpty()) {
            return Optional.empty();
        }
        for (int i = 0; i < patterns.size(); i++) {
            if (compiled.get(i).matcher(output).find()) {
                return Optional.of(patterns.get(i));
            }
        }
        return Optional.empty();
    }

    public int size() {
        return patterns.size();
    }
}
