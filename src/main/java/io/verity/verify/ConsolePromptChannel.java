package io.verity.verify;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public final class ConsolePromptChannel implements PromptChannel, AutoCloseable {
    private final BufferedReader reader;
    private final PrintStream out;
    private final ExecutorService readerThread = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "prompt-reader");
        t.setDaemon(true);
        return t;
    });
    private Future<String> pending;

    public ConsolePromptChannel(InputStream in, PrintStream out) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public synchronized Optional<String> ask(String question, int timeoutSec) {
        out.print(question + " ");
        out.flush();
        // A line typed after a previous timeout answers the next question.
        if (pending == null) {
            pending = readerThread.submit(reader::readLine);
        }
        try {
            String line = pending.get(Math.max(1, timeoutSec), TimeUnit.SECONDS);
            pending = null;
            return line == null ? Optional.empty() : Optional.of(line.trim());
        } catch (TimeoutException e) {
            out.println();
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            pending = null;
            throw new RuntimeException("Failed to read prompt answer", e.getCause());
        }
    }

    @Override
    public void close() {
        readerThread.shutdownNow();
    }
}
