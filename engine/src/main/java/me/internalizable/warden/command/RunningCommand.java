package me.internalizable.warden.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A spawned command whose standard output and error are drained in the background.
 *
 * <p>Both streams are read concurrently so a chatty process cannot block on
 * a full pipe while the caller waits for it to exit.</p>
 */
class RunningCommand {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunningCommand.class);
    private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(5);

    private final String commandLine;
    private final Process process;
    private final Duration drainTimeout;
    private final long startTime;
    private final CompletableFuture<String> stdout;
    private final CompletableFuture<String> stderr;
    private volatile boolean outputIncomplete = false;

    RunningCommand(@Nonnull String commandLine, @Nonnull Process process, @Nonnull Executor readers) {
        this(commandLine, process, readers, DRAIN_TIMEOUT);
    }

    RunningCommand(@Nonnull String commandLine, @Nonnull Process process, @Nonnull Executor readers,
                   @Nonnull Duration drainTimeout) {
        this.commandLine = Objects.requireNonNull(commandLine, "commandLine");
        this.process = Objects.requireNonNull(process, "process");
        this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
        this.startTime = System.currentTimeMillis();
        this.stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), readers);
        this.stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), readers);
    }

    /**
     * Wait for the process to exit.
     *
     * @param timeout maximum wait
     * @return true if the process exited in time
     * @throws InterruptedException if interrupted while waiting
     */
    boolean awaitExit(@Nonnull Duration timeout) throws InterruptedException {
        return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Kill the process and its descendants without waiting for them.
     */
    void kill() {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    int getExitCode() {
        return process.exitValue();
    }

    @Nonnull
    String getStdout() {
        return collect(stdout, "stdout");
    }

    @Nonnull
    String getStderr() {
        return collect(stderr, "stderr");
    }

    /**
     * Whether a stream could not be read to its end, in which case its text
     * was reported as empty.
     */
    boolean isOutputIncomplete() {
        return outputIncomplete;
    }

    @Nonnull
    String getCommandLine() {
        return commandLine;
    }

    long getElapsedMillis() {
        return System.currentTimeMillis() - startTime;
    }

    private static String drain(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private String collect(CompletableFuture<String> output, String stream) {
        try {
            return output.get(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outputIncomplete = true;
            LOGGER.warn("Interrupted while reading {} of '{}', treating it as empty", stream, commandLine);
            return "";
        } catch (TimeoutException e) {
            outputIncomplete = true;
            LOGGER.warn("Gave up reading {} of '{}' after {}ms, treating it as empty",
                    stream, commandLine, drainTimeout.toMillis());
            return "";
        } catch (ExecutionException e) {
            outputIncomplete = true;
            LOGGER.warn("Failed to read {} of '{}', treating it as empty: {}",
                    stream, commandLine, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return "";
        }
    }

    @Override
    public String toString() {
        return "RunningCommand{" +
                "command='" + commandLine + '\'' +
                ", pid=" + process.pid() +
                ", alive=" + process.isAlive() +
                ", elapsed=" + getElapsedMillis() + "ms" +
                '}';
    }
}
