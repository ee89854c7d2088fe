package io.verity.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CombinedStatus {
    UNTESTED("untested"),
    MACHINE_ONLY("machine-only"),
    FULLY_VERIFIED("fully-verified"),
    INVALIDATED("invalidated");

    private final String wireName;

    CombinedStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
