package io.verity.verify;

public enum MachineOutcome {
    VERIFIED,
    FAILED,
    /** No checks defined at the requested depth; nothing was run or written. */
    SKIPPED,
    /** Checks passed but blocking issues kept the item from being marked verified. */
    BLOCKED
}
