package me.internalizable.warden.instance;

import me.internalizable.warden.api.WardenAPI;
import me.internalizable.warden.api.error.CommandExecutionException;
import me.internalizable.warden.api.error.ValidationException;
import me.internalizable.warden.command.CommandExecutor;
import me.internalizable.warden.command.InstanceTool;
import me.internalizable.warden.guardian.UsageParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Samples usage and diagnostics from inside an instance.
 *
 * <p>Values are measured in the instance (through the tool's {@code exec}),
 * not on the host.</p>
 */
public class InstanceSampler {

    private static final Logger LOGGER = LoggerFactory.getLogger(InstanceSampler.class);

    static final String UNKNOWN = "Unknown";

    private final CommandExecutor executor;
    private final InstanceTool tool;

    public InstanceSampler(@Nonnull CommandExecutor executor, @Nonnull InstanceTool tool) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.tool = Objects.requireNonNull(tool, "tool");
    }

    /**
     * @param instanceId instance
     * @return CPU usage percentage inside the instance
     * @throws CommandExecutionException if sampling fails or the output is malformed
     */
    public double sampleCpuUsage(@Nonnull String instanceId) {
        String output = executor.execute(tool.exec(instanceId, "top", "-bn1"));
        OptionalDouble usage = UsageParser.parseCpuUsage(output);
        if (usage.isEmpty()) {
            throw new CommandExecutionException("Could not parse CPU usage of " + instanceId);
        }
        return usage.getAsDouble();
    }

    /**
     * @param instanceId instance
     * @return RAM usage percentage inside the instance
     * @throws CommandExecutionException if sampling fails or the output is malformed
     */
    public double sampleRamUsage(@Nonnull String instanceId) {
        String output = executor.execute(tool.exec(instanceId, "free", "-m"));
        OptionalDouble usage = UsageParser.parseMemoryUsage(output);
        if (usage.isEmpty()) {
            throw new CommandExecutionException("Could not parse memory usage of " + instanceId);
        }
        return usage.getAsDouble();
    }

    /**
     * Collect a usage report. Individual metrics that cannot be sampled are
     * reported as 0 or {@code Unknown}.
     *
     * @param instanceId instance
     * @return usage report
     */
    @Nonnull
    public WardenAPI.UsageReport report(@Nonnull String instanceId) {
        String status = UNKNOWN;
        double cpu = 0.0;
        double ram = 0.0;
        String disk = UNKNOWN;

        try {
            status = UsageParser.parseToolStatus(executor.execute(tool.info(instanceId))).orElse(UNKNOWN);
        } catch (CommandExecutionException e) {
            LOGGER.debug("Could not read tool status of {}: {}", instanceId, e.getMessage());
        }
        try {
            cpu = sampleCpuUsage(instanceId);
        } catch (CommandExecutionException e) {
            LOGGER.debug("Could not sample CPU of {}: {}", instanceId, e.getMessage());
        }
        try {
            ram = sampleRamUsage(instanceId);
        } catch (CommandExecutionException e) {
            LOGGER.debug("Could not sample RAM of {}: {}", instanceId, e.getMessage());
        }
        try {
            disk = UsageParser.parseDiskUsage(executor.execute(tool.exec(instanceId, "df", "-h", "/"))).orElse(UNKNOWN);
        } catch (CommandExecutionException e) {
            LOGGER.debug("Could not sample disk of {}: {}", instanceId, e.getMessage());
        }

        return new UsageReportImpl(status, cpu, ram, disk);
    }

    @Nonnull
    public String processList(@Nonnull String instanceId) {
        return executor.execute(tool.exec(instanceId, "ps", "aux"));
    }

    /**
     * @param instanceId instance
     * @param lines number of journal lines, positive
     * @return last journal lines
     */
    @Nonnull
    public String journal(@Nonnull String instanceId, int lines) {
        if (lines <= 0) {
            throw new ValidationException("Line count must be positive, got " + lines);
        }
        return executor.execute(tool.exec(instanceId, "journalctl", "-n", String.valueOf(lines)));
    }

    @Nonnull
    public String runShell(@Nonnull String instanceId, @Nonnull String command) {
        Objects.requireNonNull(command, "command");
        return executor.execute(tool.exec(instanceId, "bash", "-c", command));
    }

    private record UsageReportImpl(String toolStatus, double cpuPercent, double ramPercent, String diskUsage)
            implements WardenAPI.UsageReport {

        @Override
        @Nonnull
        public String getToolStatus() {
            return toolStatus;
        }

        @Override
        public double getCpuPercent() {
            return cpuPercent;
        }

        @Override
        public double getRamPercent() {
            return ramPercent;
        }

        @Override
        @Nonnull
        public String getDiskUsage() {
            return diskUsage;
        }
    }
}
