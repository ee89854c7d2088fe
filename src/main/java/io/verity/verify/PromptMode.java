package io.verity.verify;

import java.util.Locale;

public enum PromptMode {
    UNVERIFIED,
    ALL,
    NEVER;

    public static PromptMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNVERIFIED;
        }
        for (PromptMode value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown prompt mode: " + raw);
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
