package io.verity.model;

/**
 * One machine check: a command line, the exit code it must return, and an
 * optional timeout in seconds (null falls back to the engine default).
 */
public record CheckSpec(
        String command,
        int expectExit,
        Integer timeoutSec,
        String description
) {
    public CheckSpec {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("check command cannot be empty");
        }
    }

    public static CheckSpec of(String command) {
        return new CheckSpec(command, 0, null, null);
    }

    public static CheckSpec of(String command, int expectExit, Integer timeoutSec) {
        return new CheckSpec(command, expectExit, timeoutSec, null);
    }
}
