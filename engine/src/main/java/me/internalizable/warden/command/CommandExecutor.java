package me.internalizable.warden.command;

import me.internalizable.warden.api.error.CommandExecutionException;

import javax.annotation.Nonnull;
import java.time.Duration;

/**
 * Runs command lines as child processes with a bounded wait.
 *
 * <p>Every instance-affecting action goes through this seam. Implementations
 * never report success without a zero exit status.</p>
 */
public interface CommandExecutor {

    /**
     * Returned in place of empty standard output on success.
     */
    String SUCCESS = "ok";

    Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    /**
     * Execute a command line.
     *
     * @param commandLine shell-style command line; a leading tool token is
     *                    replaced by the resolved tool path
     * @param timeout maximum time to wait for the process
     * @return trimmed standard output, or {@link #SUCCESS} if there was none
     * @throws CommandExecutionException on non-zero exit or timeout
     */
    @Nonnull
    String execute(@Nonnull String commandLine, @Nonnull Duration timeout);

    /**
     * Execute a command line with the default timeout.
     *
     * @param commandLine shell-style command line
     * @return trimmed standard output, or {@link #SUCCESS}
     * @throws CommandExecutionException on non-zero exit or timeout
     */
    @Nonnull
    default String execute(@Nonnull String commandLine) {
        return execute(commandLine, getDefaultTimeout());
    }

    @Nonnull
    default Duration getDefaultTimeout() {
        return DEFAULT_TIMEOUT;
    }
}
