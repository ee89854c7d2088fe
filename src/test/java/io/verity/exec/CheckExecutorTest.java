package io.verity.exec;

import io.verity.errors.ExecutorFaultException;
import io.verity.model.CheckSpec;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

final class CheckExecutorTest {
    private static final List<String> SHELL = List.of("/bin/sh", "-c");

    @Test
    void passingAndFailingCommandsAreData() {
        CheckExecutor executor = new CheckExecutor(SHELL, 30, 50, 8192, null);

        CheckResult ok = executor.run(CheckSpec.of("echo hello"), Placeholders.none());
        Assertions.assertTrue(ok.passed());
        Assertions.assertEquals(0, ok.exitCode());
        Assertions.assertFalse(ok.timedOut());
        Assertions.assertEquals("hello", ok.outputTail());

        CheckResult failed = executor.run(CheckSpec.of("echo broken >&2; exit 3"), Placeholders.none());
        Assertions.assertFalse(failed.passed());
        Assertions.assertEquals(3, failed.exitCode());
        Assertions.assertTrue(failed.outputTail().contains("broken"));
    }

    @Test
    void expectedNonZeroExitPasses() {
        CheckExecutor executor = new CheckExecutor(SHELL, 30, 50, 8192, null);
        CheckResult result = executor.run(CheckSpec.of("exit 2", 2, null), Placeholders.none());
        Assertions.assertTrue(result.passed());
        Assertions.assertEquals(2, result.exitCode());
    }

    @Test
    void timeoutKillsProcessAndReportsNoExitCode() {
        CheckExecutor executor = new CheckExecutor(SHELL, 300, 50, 8192, null);
        long startedMs = System.currentTimeMillis();
        CheckResult result = executor.run(CheckSpec.of("sleep 10", 0, 5), Placeholders.none());
        long elapsedMs = System.currentTimeMillis() - startedMs;

        Assertions.assertFalse(result.passed());
        Assertions.assertNull(result.exitCode());
        Assertions.assertTrue(result.timedOut());
        Assertions.assertTrue(elapsedMs < 9_000L, "took " + elapsedMs + "ms");
        Assertions.assertTrue(result.outputTail().contains("timed out after 5s"));
    }

    @Test
    void outputTailKeepsOnlyLastLines() {
        CheckExecutor executor = new CheckExecutor(SHELL, 30, 3, 8192, null);
        CheckResult result = executor.run(CheckSpec.of("for i in 1 2 3 4 5 6; do echo line$i; done"), Placeholders.none());
        Assertions.assertEquals("line4\nline5\nline6", result.outputTail());
    }

    @Test
    void outputTailIsBoundedByBytes() {
        CheckExecutor executor = new CheckExecutor(SHELL, 30, 1000, 256, null);
        CheckResult result = executor.run(
                CheckSpec.of("i=0; while [ $i -lt 200 ]; do echo 0123456789; i=$((i+1)); done"),
                Placeholders.none());
        Assertions.assertTrue(result.outputTail().getBytes(StandardCharsets.UTF_8).length <= 256);
        Assertions.assertTrue(result.outputTail().endsWith("0123456789"));
    }

    @Test
    void multiMegabyteSingleLineKeepsOnlyTheTail() {
        CheckExecutor executor = new CheckExecutor(SHELL, 60, 50, 8192, null);
        CheckResult result = executor.run(
                CheckSpec.of("head -c 40000000 /dev/zero | tr '\\000' a; echo; echo done"),
                Placeholders.none());
        Assertions.assertTrue(result.passed());
        Assertions.assertEquals(0, result.exitCode());
        Assertions.assertTrue(result.outputTail().endsWith("\ndone"));
        Assertions.assertTrue(result.outputTail().startsWith("aaaa"));
        Assertions.assertTrue(result.outputTail().getBytes(StandardCharsets.UTF_8).length <= 8192);
    }

    @Test
    void placeholdersAreSubstitutedBeforeExecution() {
        CheckExecutor executor = new CheckExecutor(SHELL, 30, 50, 8192, null);
        Placeholders placeholders = new Placeholders("staging", "prod", "/srv/site", "run_1");
        CheckResult result = executor.run(CheckSpec.of("echo {site} {target} {root} {run_id} {other}"), placeholders);
        Assertions.assertEquals("staging prod /srv/site run_1 {other}", result.outputTail());
        Assertions.assertEquals("echo staging prod /srv/site run_1 {other}", result.command());
    }

    @Test
    void unspawnableShellIsExecutorFault() {
        CheckExecutor executor = new CheckExecutor(List.of("/nonexistent/verity-shell", "-c"), 30, 50, 8192, null);
        Assertions.assertThrows(ExecutorFaultException.class,
                () -> executor.run(CheckSpec.of("true"), Placeholders.none()));
    }
}
