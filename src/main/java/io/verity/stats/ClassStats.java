package io.verity.stats;

/**
 * Counts for one automatability class.
 */
public record ClassStats(int total, int machineVerified, int humanVerified, int fullyVerified) {
    public static ClassStats empty() {
        return new ClassStats(0, 0, 0, 0);
    }

    ClassStats plus(boolean machine, boolean human, boolean full) {
        return new ClassStats(total + 1,
                machineVerified + (machine ? 1 : 0),
                humanVerified + (human ? 1 : 0),
                fullyVerified + (full ? 1 : 0));
    }
}
