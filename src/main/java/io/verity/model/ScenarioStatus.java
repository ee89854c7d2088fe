package io.verity.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScenarioStatus {
    PENDING,
    RUNNING,
    PASSED,
    FAILED,
    SKIPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ScenarioStatus fromString(String raw) {
        for (ScenarioStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw == null ? "" : raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown scenario status: " + raw);
    }
}
