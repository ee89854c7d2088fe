package io.verity.exec;

import io.verity.errors.ExecutorFaultException;
import io.verity.model.CheckSpec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs check and step commands as child processes through the configured
 * shell. A failing or timed-out command is reported as data; only a process
 * that cannot be started raises {@link ExecutorFaultException}.
 */
public final class CheckExecutor {
    private static final long DRAIN_GRACE_MS = 2_000L;
    private static final int DRAIN_CHUNK_BYTES = 8192;

    private final List<String> shell;
    private final int defaultTimeoutSec;
    private final int tailLines;
    private final int tailBytes;
    private final Path workingDir;

    public CheckExecutor(List<String> shell, int defaultTimeoutSec, int tailLines, int tailBytes, Path workingDir) {
        if (shell == null || shell.isEmpty()) {
            throw new IllegalArgumentException("executor shell cannot be empty");
        }
        this.shell = List.copyOf(shell);
        this.defaultTimeoutSec = Math.max(1, defaultTimeoutSec);
        this.tailLines = tailLines;
        this.tailBytes = tailBytes;
        this.workingDir = workingDir;
    }

    public CheckResult run(CheckSpec check, Placeholders placeholders) {
        return run(check.command(), check.expectExit(), check.timeoutSec(), placeholders);
    }

    public CheckResult run(String rawCommand, int expectExit, Integer timeoutSec, Placeholders placeholders) {
        if (rawCommand == null || rawCommand.isBlank()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        String command = placeholders == null ? rawCommand : placeholders.apply(rawCommand);
        long timeoutMs = TimeUnit.SECONDS.toMillis(timeoutSec == null || timeoutSec < 1 ? defaultTimeoutSec : timeoutSec);

        List<String> argv = new ArrayList<>(shell);
        argv.add(command);
        ProcessBuilder pb = new ProcessBuilder(argv);
        pb.redirectErrorStream(true);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        long startedNs = System.nanoTime();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ExecutorFaultException("Failed to spawn command: " + command, e);
        }

        OutputTail tail = new OutputTail(tailLines, tailBytes);
        Thread drainer = new Thread(() -> drain(process, tail), "check-output-drain");
        drainer.setDaemon(true);
        drainer.start();
        try {
            process.getOutputStream().close();
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyTree(process);
                drainer.join(DRAIN_GRACE_MS);
                long durationMs = elapsedMs(startedNs);
                tail.append("[timed out after " + TimeUnit.MILLISECONDS.toSeconds(timeoutMs) + "s]");
                return new CheckResult(command, false, null, true, durationMs, tail.text());
            }
            drainer.join(DRAIN_GRACE_MS);
            int exit = process.exitValue();
            return new CheckResult(command, exit == expectExit, exit, false, elapsedMs(startedNs), tail.text());
        } catch (InterruptedException e) {
            destroyTree(process);
            Thread.currentThread().interrupt();
            return new CheckResult(command, false, null, false, elapsedMs(startedNs), tail.text());
        } catch (IOException e) {
            destroyTree(process);
            return new CheckResult(command, false, null, false, elapsedMs(startedNs),
                    "execution failed: " + e.getMessage());
        }
    }

    private static void drain(Process process, OutputTail tail) {
        try (InputStream in = process.getInputStream()) {
            byte[] buffer = new byte[DRAIN_CHUNK_BYTES];
            int read;
            while ((read = in.read(buffer)) != -1) {
                tail.write(buffer, 0, read);
            }
        } catch (IOException e) {
            // Stream closes when the process is destroyed mid-read.
            tail.append("[output stream closed: " + e.getMessage() + "]");
        }
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static long elapsedMs(long startedNs) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNs);
    }
}
