package io.verity.storage;

public record PeakRow(
        String metric,
        double currentValue,
        double peakValue,
        String peakRunId,
        Long peakAtMs,
        long updatedAtMs
) {
}
