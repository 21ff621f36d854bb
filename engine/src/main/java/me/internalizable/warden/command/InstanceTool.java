package me.internalizable.warden.command;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Builds command lines for the external instance management tool.
 *
 * <p>Every line starts with the tool's invocation token, which
 * {@link ProcessCommandExecutor} swaps for the resolved executable path.
 * Arguments are quoted so they survive {@link CommandLine#split(String)}.</p>
 */
public class InstanceTool {

    public static final String PROTOCOL_TCP = "tcp";
    public static final String PROTOCOL_UDP = "udp";

    private final String toolName;

    public InstanceTool(@Nonnull String toolName) {
        this.toolName = Objects.requireNonNull(toolName, "toolName");
    }

    @Nonnull
    public String getToolName() {
        return toolName;
    }

    // ==================== Lifecycle ====================

    @Nonnull
    public String init(@Nonnull String image, @Nonnull String instanceId, @Nonnull String storagePool) {
        return line("init", image, instanceId, "--storage", storagePool);
    }

    @Nonnull
    public String start(@Nonnull String instanceId) {
        return line("start", instanceId);
    }

    @Nonnull
    public String stop(@Nonnull String instanceId) {
        return line("stop", instanceId);
    }

    @Nonnull
    public String forceStop(@Nonnull String instanceId) {
        return line("stop", instanceId, "--force");
    }

    @Nonnull
    public String forceStopAll() {
        return line("stop", "--all", "--force");
    }

    @Nonnull
    public String restart(@Nonnull String instanceId) {
        return line("restart", instanceId);
    }

    @Nonnull
    public String forceDelete(@Nonnull String instanceId) {
        return line("delete", instanceId, "--force");
    }

    @Nonnull
    public String copy(@Nonnull String sourceId, @Nonnull String targetId) {
        return line("copy", sourceId, targetId);
    }

    @Nonnull
    public String copy(@Nonnull String sourceId, @Nonnull String targetId, @Nonnull String storagePool) {
        return line("copy", sourceId, targetId, "--storage", storagePool);
    }

    @Nonnull
    public String rename(@Nonnull String sourceId, @Nonnull String targetId) {
        return line("rename", sourceId, targetId);
    }

    @Nonnull
    public String info(@Nonnull String instanceId) {
        return line("info", instanceId);
    }

    // ==================== Limits ====================

    @Nonnull
    public String setMemory(@Nonnull String instanceId, int ramGb) {
        return line("config", "set", instanceId, "limits.memory", (ramGb * 1024) + "MB");
    }

    @Nonnull
    public String setCpu(@Nonnull String instanceId, int cpuCores) {
        return line("config", "set", instanceId, "limits.cpu", String.valueOf(cpuCores));
    }

    @Nonnull
    public String setDisk(@Nonnull String instanceId, int diskGb) {
        return line("config", "device", "set", instanceId, "root", "size", diskGb + "GB");
    }

    // ==================== Snapshots ====================

    @Nonnull
    public String snapshot(@Nonnull String instanceId, @Nonnull String snapshotName) {
        return line("snapshot", instanceId, snapshotName);
    }

    @Nonnull
    public String restore(@Nonnull String instanceId, @Nonnull String snapshotName) {
        return line("restore", instanceId, snapshotName);
    }

    /**
     * Build the snapshot listing command. The tool lists snapshots of every
     * instance, one name per line, so callers filter by instance id.
     *
     * @return command line
     */
    @Nonnull
    public String listSnapshots() {
        return line("list", "--type", "snapshot", "--columns", "n");
    }

    // ==================== Devices ====================

    /**
     * Build the rule forwarding a host port to a port inside the instance.
     *
     * @param instanceId instance
     * @param protocol {@link #PROTOCOL_TCP} or {@link #PROTOCOL_UDP}
     * @param hostPort port listened on by the host
     * @param internalPort port inside the instance
     * @return command line
     */
    @Nonnull
    public String addProxyDevice(@Nonnull String instanceId, @Nonnull String protocol, int hostPort, int internalPort) {
        return line("config", "device", "add", instanceId, deviceName(hostPort, protocol), "proxy",
                "listen=" + protocol + ":0.0.0.0:" + hostPort,
                "connect=" + protocol + ":127.0.0.1:" + internalPort);
    }

    @Nonnull
    public String removeProxyDevice(@Nonnull String instanceId, @Nonnull String protocol, int hostPort) {
        return line("config", "device", "remove", instanceId, deviceName(hostPort, protocol));
    }

    @Nonnull
    public static String deviceName(int hostPort, @Nonnull String protocol) {
        return "port-" + hostPort + "-" + protocol;
    }

    // ==================== Introspection ====================

    /**
     * Build a command running {@code inner} inside the instance.
     *
     * @param instanceId instance
     * @param inner program and arguments
     * @return command line
     */
    @Nonnull
    public String exec(@Nonnull String instanceId, @Nonnull String... inner) {
        List<String> arguments = new ArrayList<>(List.of("exec", instanceId, "--"));
        arguments.addAll(Arrays.asList(inner));
        return line(arguments.toArray(new String[0]));
    }

    private String line(String... arguments) {
        List<String> tokens = new ArrayList<>(arguments.length + 1);
        tokens.add(toolName);
        tokens.addAll(Arrays.asList(arguments));
        return CommandLine.join(tokens);
    }
}
