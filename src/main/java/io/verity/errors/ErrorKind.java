package io.verity.errors;

/**
 * Error taxonomy of the engine. Each kind maps to the process exit code the
 * CLI reports for it.
 */
public enum ErrorKind {
    CONFIGURATION_GAP(2, false),
    CLASSIFICATION_CONFLICT(2, false),
    BLOCKED_BY_ISSUE(0, false),
    REGISTRY_CORRUPTION(3, false),
    DEPENDENCY_UNMET(2, false),
    UNKNOWN_SCHEMA(2, true),
    INCONSISTENT_REGISTRY(2, false),
    EXECUTOR_FAULT(2, false),
    ILLEGAL_TRANSITION(2, false),
    UNRECOVERABLE_REGISTRY(2, true);

    private final int exitCode;
    private final boolean fatal;

    ErrorKind(int exitCode, boolean fatal) {
        this.exitCode = exitCode;
        this.fatal = fatal;
    }

    public int exitCode() {
        return exitCode;
    }

    public boolean fatal() {
        return fatal;
    }
}
