package me.internalizable.warden.command;

import me.internalizable.warden.api.error.CommandExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Executes command lines as child processes.
 *
 * <p>The first argument is compared against the configured tool token
 * (for example {@code lxc}); when it matches it is replaced by the resolved
 * path to the management tool. Other programs (such as {@code top}) run as
 * given.</p>
 */
public class ProcessCommandExecutor implements CommandExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessCommandExecutor.class);

    private final String toolName;
    private final String toolPath;
    private final Duration defaultTimeout;
    private final ExecutorService outputReaders;

    /**
     * Create a process executor.
     *
     * @param toolName invocation token substituted by {@code toolPath}
     * @param toolPath resolved path of the management tool
     * @param defaultTimeout timeout used by {@link #execute(String)}
     */
    public ProcessCommandExecutor(@Nonnull String toolName, @Nonnull String toolPath, @Nonnull Duration defaultTimeout) {
        this.toolName = Objects.requireNonNull(toolName, "toolName");
        this.toolPath = Objects.requireNonNull(toolPath, "toolPath");
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        this.outputReaders = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "CommandOutput");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    @Nonnull
    public String execute(@Nonnull String commandLine, @Nonnull Duration timeout) {
        Objects.requireNonNull(commandLine, "commandLine");
        Objects.requireNonNull(timeout, "timeout");

        List<String> command;
        try {
            command = CommandLine.split(commandLine);
        } catch (IllegalArgumentException e) {
            throw new CommandExecutionException(e.getMessage(), e);
        }
        if (command.isEmpty()) {
            throw new CommandExecutionException("Empty command line");
        }
        if (command.get(0).equals(toolName)) {
            command.set(0, toolPath);
        }

        LOGGER.debug("Executing: {}", commandLine);

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            LOGGER.warn("Failed to launch '{}': {}", commandLine, e.getMessage());
            throw new CommandExecutionException("Failed to launch " + command.get(0) + ": " + e.getMessage(), e);
        }

        RunningCommand running = new RunningCommand(commandLine, process, outputReaders);
        try {
            if (!running.awaitExit(timeout)) {
                running.kill();
                LOGGER.warn("Command timed out: {}", commandLine);
                throw new CommandExecutionException("Command timed out after " + timeout.toSeconds() + "s");
            }
        } catch (InterruptedException e) {
            running.kill();
            Thread.currentThread().interrupt();
            throw new CommandExecutionException("Interrupted while waiting for: " + commandLine, e);
        }

        int exitCode = running.getExitCode();
        if (exitCode != 0) {
            String error = running.getStderr().trim();
            if (error.isEmpty()) {
                error = "Command failed with exit code " + exitCode + " and no error output";
            }
            LOGGER.warn("Command failed ({}): {} - {}", exitCode, commandLine, error);
            throw new CommandExecutionException(error);
        }

        String output = running.getStdout().trim();
        LOGGER.debug("Command finished in {}ms: {}", running.getElapsedMillis(), commandLine);
        return output.isEmpty() ? SUCCESS : output;
    }

    @Override
    @Nonnull
    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    /**
     * Stop the output reader threads.
     */
    public void shutdown() {
        outputReaders.shutdownNow();
    }
}
