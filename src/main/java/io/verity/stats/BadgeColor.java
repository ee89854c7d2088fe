package io.verity.stats;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BadgeColor {
    RED,
    ORANGE,
    YELLOW,
    BRIGHTGREEN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
