package io.verity.scenario;

import io.verity.model.BaselineComparison;

/**
 * Compares captured output against a baseline. Numeric values honor the
 * declared tolerance; anything else must match exactly after trimming.
 */
public final class BaselineComparator {
    private BaselineComparator() {
    }

    public static boolean matches(String baseline, String actual, BaselineComparison comparison) {
        String expected = baseline == null ? "" : baseline.trim();
        String value = actual == null ? "" : actual.trim();
        Double expectedNumber = parse(expected);
        Double actualNumber = parse(value);
        if (expectedNumber == null || actualNumber == null) {
            return expected.equals(value);
        }
        double allowed = allowedDelta(expectedNumber, comparison.tolerance());
        return Math.abs(actualNumber - expectedNumber) <= allowed;
    }

    static double allowedDelta(double baseline, String tolerance) {
        String raw = tolerance == null ? "0" : tolerance.trim();
        try {
            if (raw.endsWith("%")) {
                double percent = Double.parseDouble(raw.substring(0, raw.length() - 1).trim());
                return Math.abs(baseline) * percent / 100.0;
            }
            return Math.abs(Double.parseDouble(raw));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid baseline tolerance: " + tolerance, e);
        }
    }

    private static Double parse(String raw) {
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
