package io.verity.stats;

public record Badge(String key, String label, String value, BadgeColor color) {
}
