package me.internalizable.warden.config;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.nodes.Tag;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for the instance governance engine.
 *
 * <p>Loaded from {@code warden.yml}, then overridden by environment
 * variables (see {@link #applyEnvironment(Map)}).</p>
 */
public class WardenConfig {

    private String toolName = "lxc";
    private String toolPath;
    private String mainAdminId = "0";
    private String dataDirectory = "data";
    private String defaultStoragePool = "default";
    private String baseImage = "ubuntu:22.04";
    private String instancePrefix = "vps";
    private int commandTimeoutSeconds = 120;
    private int confirmationWindowSeconds = 60;
    private MonitorConfig monitor = new MonitorConfig();
    private PortConfig ports = new PortConfig();

    /**
     * Load configuration from file, creating default if not exists.
     *
     * @param path path to config file
     * @return loaded configuration
     * @throws IOException if loading fails
     */
    @Nonnull
    public static WardenConfig load(@Nonnull Path path) throws IOException {
        if (!Files.exists(path)) {
            WardenConfig config = new WardenConfig();
            config.save(path);
            return config;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(WardenConfig.class, options));
        try (InputStream is = Files.newInputStream(path)) {
            WardenConfig config = yaml.load(is);
            return config != null ? config : new WardenConfig();
        }
    }

    /**
     * Save configuration to file as a plain block mapping.
     *
     * @param path path to save to
     * @throws IOException if saving fails
     */
    public void save(@Nonnull Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Yaml yaml = new Yaml();
        try (Writer writer = Files.newBufferedWriter(path)) {
            writer.write(yaml.dumpAs(this, Tag.MAP, DumperOptions.FlowStyle.BLOCK));
        }
    }

    /**
     * Override settings from environment variables.
     *
     * @param environment variables, usually {@link System#getenv()}
     * @throws IllegalArgumentException if a numeric variable is malformed
     */
    public void applyEnvironment(@Nonnull Map<String, String> environment) {
        Objects.requireNonNull(environment, "environment");

        String value;
        if ((value = environment.get("TOOL_PATH")) != null) {
            toolPath = value;
        }
        if ((value = environment.get("MAIN_ADMIN_ID")) != null) {
            mainAdminId = value.trim();
        }
        if ((value = environment.get("DATA_DIR")) != null) {
            dataDirectory = value;
        }
        if ((value = environment.get("DEFAULT_STORAGE_POOL")) != null) {
            defaultStoragePool = value.trim();
        }
        if ((value = environment.get("BASE_IMAGE")) != null) {
            baseImage = value.trim();
        }
        if ((value = environment.get("COMMAND_TIMEOUT")) != null) {
            commandTimeoutSeconds = parseInt("COMMAND_TIMEOUT", value);
        }
        if ((value = environment.get("CPU_THRESHOLD")) != null) {
            monitor.setCpuThreshold(parseInt("CPU_THRESHOLD", value));
        }
        if ((value = environment.get("RAM_THRESHOLD")) != null) {
            monitor.setRamThreshold(parseInt("RAM_THRESHOLD", value));
        }
        if ((value = environment.get("HOST_CHECK_INTERVAL")) != null) {
            monitor.setHostCheckIntervalSeconds(parseInt("HOST_CHECK_INTERVAL", value));
        }
        if ((value = environment.get("CHECK_INTERVAL")) != null) {
            monitor.setInstanceCheckIntervalSeconds(parseInt("CHECK_INTERVAL", value));
        }
    }

    /**
     * Check that all settings are usable.
     *
     * @throws IllegalArgumentException describing the first invalid setting
     */
    public void validate() {
        requireText("toolName", toolName);
        requireText("mainAdminId", mainAdminId);
        requireText("dataDirectory", dataDirectory);
        requireText("defaultStoragePool", defaultStoragePool);
        requireText("baseImage", baseImage);
        requireText("instancePrefix", instancePrefix);
        requirePositive("commandTimeoutSeconds", commandTimeoutSeconds);
        requirePositive("confirmationWindowSeconds", confirmationWindowSeconds);

        if (monitor == null) {
            throw new IllegalArgumentException("monitor section is missing");
        }
        requirePercentage("monitor.cpuThreshold", monitor.getCpuThreshold());
        requirePercentage("monitor.ramThreshold", monitor.getRamThreshold());
        requirePositive("monitor.hostCheckIntervalSeconds", monitor.getHostCheckIntervalSeconds());
        requirePositive("monitor.instanceCheckIntervalSeconds", monitor.getInstanceCheckIntervalSeconds());

        if (ports == null) {
            throw new IllegalArgumentException("ports section is missing");
        }
        if (ports.getRangeStart() < 1 || ports.getRangeEnd() > 65535 || ports.getRangeStart() > ports.getRangeEnd()) {
            throw new IllegalArgumentException("ports range must be ordered within 1..65535, got "
                    + ports.getRangeStart() + ".." + ports.getRangeEnd());
        }
    }

    private static int parseInt(String variable, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(variable + " must be an integer, got '" + value + "'", e);
        }
    }

    private static void requireText(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    private static void requirePercentage(String name, int value) {
        if (value < 1 || value > 100) {
            throw new IllegalArgumentException(name + " must be within 1..100, got " + value);
        }
    }

    @Nonnull
    public Duration getCommandTimeout() {
        return Duration.ofSeconds(commandTimeoutSeconds);
    }

    @Nonnull
    public Duration getConfirmationWindow() {
        return Duration.ofSeconds(confirmationWindowSeconds);
    }

    // Getters and Setters

    public String getToolName() {
        return toolName;
    }

    public void setToolName(String toolName) {
        this.toolName = toolName;
    }

    @Nullable
    public String getToolPath() {
        return toolPath;
    }

    public void setToolPath(String toolPath) {
        this.toolPath = toolPath;
    }

    public String getMainAdminId() {
        return mainAdminId;
    }

    public void setMainAdminId(String mainAdminId) {
        this.mainAdminId = mainAdminId;
    }

    public String getDataDirectory() {
        return dataDirectory;
    }

    public void setDataDirectory(String dataDirectory) {
        this.dataDirectory = dataDirectory;
    }

    public String getDefaultStoragePool() {
        return defaultStoragePool;
    }

    public void setDefaultStoragePool(String defaultStoragePool) {
        this.defaultStoragePool = defaultStoragePool;
    }

    public String getBaseImage() {
        return baseImage;
    }

    public void setBaseImage(String baseImage) {
        this.baseImage = baseImage;
    }

    public String getInstancePrefix() {
        return instancePrefix;
    }

    public void setInstancePrefix(String instancePrefix) {
        this.instancePrefix = instancePrefix;
    }

    public int getCommandTimeoutSeconds() {
        return commandTimeoutSeconds;
    }

    public void setCommandTimeoutSeconds(int commandTimeoutSeconds) {
        this.commandTimeoutSeconds = commandTimeoutSeconds;
    }

    public int getConfirmationWindowSeconds() {
        return confirmationWindowSeconds;
    }

    public void setConfirmationWindowSeconds(int confirmationWindowSeconds) {
        this.confirmationWindowSeconds = confirmationWindowSeconds;
    }

    public MonitorConfig getMonitor() {
        return monitor;
    }

    public void setMonitor(MonitorConfig monitor) {
        this.monitor = monitor;
    }

    public PortConfig getPorts() {
        return ports;
    }

    public void setPorts(PortConfig ports) {
        this.ports = ports;
    }

    /**
     * Configuration for the host and per-instance guardians.
     */
    public static class MonitorConfig {
        private int cpuThreshold = 90;
        private int ramThreshold = 90;
        private int hostCheckIntervalSeconds = 60;
        private int instanceCheckIntervalSeconds = 600;
        private boolean hostGuardianEnabled = true;

        public int getCpuThreshold() {
            return cpuThreshold;
        }

        public void setCpuThreshold(int cpuThreshold) {
            this.cpuThreshold = cpuThreshold;
        }

        public int getRamThreshold() {
            return ramThreshold;
        }

        public void setRamThreshold(int ramThreshold) {
            this.ramThreshold = ramThreshold;
        }

        public int getHostCheckIntervalSeconds() {
            return hostCheckIntervalSeconds;
        }

        public void setHostCheckIntervalSeconds(int hostCheckIntervalSeconds) {
            this.hostCheckIntervalSeconds = hostCheckIntervalSeconds;
        }

        public int getInstanceCheckIntervalSeconds() {
            return instanceCheckIntervalSeconds;
        }

        public void setInstanceCheckIntervalSeconds(int instanceCheckIntervalSeconds) {
            this.instanceCheckIntervalSeconds = instanceCheckIntervalSeconds;
        }

        public boolean isHostGuardianEnabled() {
            return hostGuardianEnabled;
        }

        public void setHostGuardianEnabled(boolean hostGuardianEnabled) {
            this.hostGuardianEnabled = hostGuardianEnabled;
        }
    }

    /**
     * Configuration for host port forwarding.
     */
    public static class PortConfig {
        private int rangeStart = 10000;
        private int rangeEnd = 19999;

        public int getRangeStart() {
            return rangeStart;
        }

        public void setRangeStart(int rangeStart) {
            this.rangeStart = rangeStart;
        }

        public int getRangeEnd() {
            return rangeEnd;
        }

        public void setRangeEnd(int rangeEnd) {
            this.rangeEnd = rangeEnd;
        }
    }
}
