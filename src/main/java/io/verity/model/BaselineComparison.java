package io.verity.model;

/**
 * Compares a step's output with a previously captured baseline. Tolerance is
 * an absolute number ({@code "0"} means exact) or a percentage of the baseline
 * ({@code "5%"}).
 */
public record BaselineComparison(String name, String tolerance) {
    public BaselineComparison {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("baseline name cannot be empty");
        }
        tolerance = tolerance == null || tolerance.isBlank() ? "0" : tolerance.trim();
    }
}
