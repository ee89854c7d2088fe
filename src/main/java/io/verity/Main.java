package io.verity;

import io.verity.cli.VerifyCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new VerifyCommand())
                .setExecutionExceptionHandler(VerifyCommand.executionExceptionHandler())
                .execute(args);
        System.exit(code);
    }
}
