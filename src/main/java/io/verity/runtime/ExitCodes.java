package io.verity.runtime;

import io.verity.errors.ErrorKind;

/**
 * Process exit codes. When several conditions apply the most severe wins:
 * configuration error, then restored corruption, then failures.
 */
public final class ExitCodes {
    public static final int OK = 0;
    public static final int FAILURES = 1;
    public static final int CONFIGURATION = 2;
    public static final int CORRUPTION_RESTORED = 3;

    private ExitCodes() {
    }

    public static int combine(int a, int b) {
        return rank(a) >= rank(b) ? a : b;
    }

    public static int of(ErrorKind kind) {
        return kind == null ? CONFIGURATION : kind.exitCode();
    }

    private static int rank(int code) {
        return switch (code) {
            case CONFIGURATION -> 3;
            case CORRUPTION_RESTORED -> 2;
            case FAILURES -> 1;
            default -> 0;
        };
    }
}
