package io.verity.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Depth {
    BASIC,
    STANDARD,
    THOROUGH,
    PARANOID;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Depth fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return BASIC;
        }
        for (Depth value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown depth: " + raw + " (expected basic|standard|thorough|paranoid)");
    }
}
