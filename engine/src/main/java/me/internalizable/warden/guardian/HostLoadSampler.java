package me.internalizable.warden.guardian;

import me.internalizable.warden.api.error.CommandExecutionException;
import me.internalizable.warden.command.CommandExecutor;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Samples aggregate CPU utilisation of the host.
 */
public class HostLoadSampler {

    static final String TOP_COMMAND = "top -bn1";

    private final CommandExecutor executor;

    public HostLoadSampler(@Nonnull CommandExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Sample host CPU utilisation.
     *
     * @return usage percentage
     * @throws CommandExecutionException if {@code top} fails or its output cannot be parsed
     */
    public double sampleCpuUsage() {
        String output = executor.execute(TOP_COMMAND);
        OptionalDouble usage = UsageParser.parseCpuUsage(output);
        if (usage.isEmpty()) {
            throw new CommandExecutionException("Could not parse host CPU usage from top output");
        }
        return usage.getAsDouble();
    }
}
