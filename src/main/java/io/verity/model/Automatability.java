package io.verity.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether an item can legally be machine-verified on a local run.
 */
public enum Automatability {
    AUTOMATABLE("automatable"),
    ENVIRONMENT_DEPENDENT("environment_dependent"),
    MANUAL_ONLY("manual_only");

    private final String wireName;

    Automatability(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Automatability fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("automatability cannot be empty");
        }
        for (Automatability value : values()) {
            if (value.wireName.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown automatability: " + raw);
    }
}
