package io.verity.verify;

public enum OpportunisticOutcome {
    VERIFIED,
    ISSUE_CREATED,
    SESSION_SKIPPED,
    PERMANENTLY_SKIPPED,
    TIMED_OUT,
    /** Prompting did not apply to this item, identity or mode. */
    NOT_PROMPTED
}
