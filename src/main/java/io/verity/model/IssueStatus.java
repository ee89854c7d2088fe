package io.verity.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum IssueStatus {
    OPEN,
    INVESTIGATING,
    FIXED,
    VERIFIED,
    WONTFIX,
    DUPLICATE,
    REOPENED;

    public Set<IssueStatus> allowedNext() {
        return switch (this) {
            case OPEN -> EnumSet.of(INVESTIGATING, WONTFIX, DUPLICATE);
            case INVESTIGATING -> EnumSet.of(FIXED);
            case FIXED -> EnumSet.of(VERIFIED, REOPENED);
            case REOPENED -> EnumSet.of(INVESTIGATING);
            case VERIFIED, WONTFIX, DUPLICATE -> EnumSet.noneOf(IssueStatus.class);
        };
    }

    public boolean canTransitionTo(IssueStatus next) {
        return next != null && allowedNext().contains(next);
    }

    /**
     * Statuses that keep the linked item from being marked verified.
     */
    public boolean blocking() {
        return this == OPEN || this == INVESTIGATING || this == REOPENED;
    }

    /**
     * Moving into these statuses resolves the report and needs a remediation note.
     */
    public boolean requiresNote() {
        return this == FIXED || this == WONTFIX || this == DUPLICATE;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IssueStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("issue status cannot be empty");
        }
        for (IssueStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown issue status: " + raw);
    }
}
