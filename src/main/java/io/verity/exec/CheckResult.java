package io.verity.exec;

/**
 * Outcome of one command. {@code exitCode} is null when the process was killed
 * on timeout.
 */
public record CheckResult(
        String command,
        boolean passed,
        Integer exitCode,
        boolean timedOut,
        long durationMs,
        String outputTail
) {
}
