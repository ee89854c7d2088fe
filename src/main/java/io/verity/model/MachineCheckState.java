package io.verity.model;

/**
 * Result of the last machine verification of an item. {@code depth} is the
 * depth the item is verified at (null when not verified); {@code exercisedDepth}
 * is the depth the last run actually executed.
 */
public record MachineCheckState(
        boolean verified,
        Depth depth,
        long verifiedAtMs,
        long durationMs,
        String lastOutput,
        Depth exercisedDepth
) {
    public static MachineCheckState unverified() {
        return new MachineCheckState(false, null, 0L, 0L, null, null);
    }

    public static MachineCheckState passed(Depth depth, long atMs, long durationMs, String lastOutput) {
        return new MachineCheckState(true, depth, atMs, durationMs, lastOutput, depth);
    }

    public static MachineCheckState failed(Depth exercised, long durationMs, String lastOutput) {
        return new MachineCheckState(false, null, 0L, durationMs, lastOutput, exercised);
    }
}
