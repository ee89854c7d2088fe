package io.verity.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FindingType {
    WARNING,
    ERROR,
    FIXED,
    SKIPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FindingType fromString(String raw) {
        for (FindingType value : values()) {
            if (value.name().equalsIgnoreCase(raw == null ? "" : raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown finding type: " + raw);
    }
}
