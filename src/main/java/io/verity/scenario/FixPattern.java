package io.verity.scenario;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Known failure signature and the commands that repair it. {@code pattern} is a
 * case-insensitive regular expression matched against step output;
 * {@code verify} optionally confirms the repair before the step is retried.
 */
public record FixPattern(String id, String pattern, List<String> commands, String verify, String severity) {
    public FixPattern {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("fix pattern id cannot be empty");
        }
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("fix pattern " + id + " has no pattern");
        }
        commands = commands == null ? List.of() : List.copyOf(commands);
        severity = severity == null || severity.isBlank() ? "medium" : severity.trim().toLowerCase(Locale.ROOT);
    }

    Pattern compiled() {
        return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
    }
}
