package io.verity.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum HumanChannel {
    MANUAL("manual"),
    AUTO_LOGGED("auto-logged"),
    OPPORTUNISTIC("opportunistic");

    private final String wireName;

    HumanChannel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static HumanChannel fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        for (HumanChannel value : values()) {
            if (value.wireName.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown verification channel: " + raw);
    }
}
