package me.internalizable.warden;

import me.internalizable.warden.api.NotificationSink;
import me.internalizable.warden.api.OwnershipGrants;
import me.internalizable.warden.api.WardenAPI;
import me.internalizable.warden.command.CommandExecutor;
import me.internalizable.warden.command.InstanceTool;
import me.internalizable.warden.config.WardenConfig;
import me.internalizable.warden.confirm.ConfirmationRegistry;
import me.internalizable.warden.guardian.HostGuardian;
import me.internalizable.warden.guardian.HostLoadSampler;
import me.internalizable.warden.guardian.InstanceGuardian;
import me.internalizable.warden.impl.WardenAPIImpl;
import me.internalizable.warden.instance.InstanceAccess;
import me.internalizable.warden.instance.InstanceLifecycle;
import me.internalizable.warden.instance.InstanceSampler;
import me.internalizable.warden.instance.OwnerNotifier;
import me.internalizable.warden.port.PortAllocator;
import me.internalizable.warden.store.InstanceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Main orchestrator of the instance governance engine.
 *
 * <p>Wires the command layer, the instance store, lifecycle operations,
 * port allocation, both guardians and the confirmation registry, and
 * exposes them through {@link WardenAPI}.</p>
 *
 * <h2>Data Directory</h2>
 * <pre>
 * data/
 * ├── vps_data.json     # instances keyed by owner
 * ├── admin_data.json   # main admin + delegated admins
 * └── port_data.json    # slot quotas + active forwards
 * </pre>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Warden warden = new Warden(config, executor, sink, OwnershipGrants.NONE, Clock.systemUTC());
 * warden.initialize();
 * warden.startGuardians();
 *
 * InstanceInfo info = warden.getApi().createInstance(adminId, userId, 4, 2, 20).join();
 *
 * warden.shutdown();
 * }</pre>
 */
public class Warden {

    private static final Logger LOGGER = LoggerFactory.getLogger(Warden.class);

    private final WardenConfig config;
    private final CommandExecutor executor;
    private final NotificationSink notificationSink;
    private final OwnershipGrants ownershipGrants;
    private final Clock clock;

    private InstanceStore store;
    private InstanceTool tool;
    private OwnerNotifier notifier;
    private InstanceLifecycle lifecycle;
    private InstanceAccess access;
    private InstanceSampler sampler;
    private PortAllocator portAllocator;
    private HostGuardian hostGuardian;
    private InstanceGuardian instanceGuardian;
    private ConfirmationRegistry confirmations;
    private ExecutorService asyncExecutor;
    private WardenAPI api;

    private volatile boolean initialized = false;
    private volatile boolean shutdown = false;

    /**
     * Create the engine.
     *
     * @param config validated configuration
     * @param executor command executor for the management tool
     * @param notificationSink delivers messages to owners
     * @param ownershipGrants maintains the owner marker
     * @param clock clock for timestamps and confirmation expiry
     */
    public Warden(
            @Nonnull WardenConfig config,
            @Nonnull CommandExecutor executor,
            @Nonnull NotificationSink notificationSink,
            @Nonnull OwnershipGrants ownershipGrants,
            @Nonnull Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.notificationSink = Objects.requireNonNull(notificationSink, "notificationSink");
        this.ownershipGrants = Objects.requireNonNull(ownershipGrants, "ownershipGrants");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ==================== Initialization ====================

    /**
     * Load persisted state and build all components. Guardians are not
     * started; see {@link #startGuardians()}.
     *
     * @throws IOException if the data directory cannot be created
     */
    public void initialize() throws IOException {
        if (initialized) {
            throw new IllegalStateException("Warden already initialized");
        }

        LOGGER.info("Initializing instance governance engine...");
        config.validate();

        Path dataDirectory = Paths.get(config.getDataDirectory());
        Files.createDirectories(dataDirectory);

        store = InstanceStore.load(dataDirectory, config.getMainAdminId());
        tool = new InstanceTool(config.getToolName());
        notifier = new OwnerNotifier(notificationSink, ownershipGrants);
        lifecycle = new InstanceLifecycle(config, store, executor, tool, notifier, clock);
        access = new InstanceAccess(store);
        sampler = new InstanceSampler(executor, tool);
        portAllocator = new PortAllocator(store, executor, tool,
                config.getPorts().getRangeStart(), config.getPorts().getRangeEnd());

        WardenConfig.MonitorConfig monitor = config.getMonitor();
        hostGuardian = new HostGuardian(new HostLoadSampler(executor), lifecycle,
                monitor.getCpuThreshold(), monitor.isHostGuardianEnabled());
        instanceGuardian = new InstanceGuardian(store, sampler, executor, tool, notifier, clock,
                monitor.getCpuThreshold(), monitor.getRamThreshold());

        confirmations = new ConfirmationRegistry(clock, config.getConfirmationWindow());
        asyncExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "Warden-Async");
            t.setDaemon(true);
            return t;
        });
        api = new WardenAPIImpl(this);

        initialized = true;
        LOGGER.info("Instance governance engine initialized");
        LOGGER.info("  Data directory: {}", dataDirectory.toAbsolutePath());
        LOGGER.info("  Storage pool: {}, image: {}", config.getDefaultStoragePool(), config.getBaseImage());
        LOGGER.info("  Port range: {}-{}", config.getPorts().getRangeStart(), config.getPorts().getRangeEnd());
    }

    /**
     * Start both guardians and the confirmation sweeper.
     */
    public void startGuardians() {
        checkInitialized();
        WardenConfig.MonitorConfig monitor = config.getMonitor();
        hostGuardian.start(Duration.ofSeconds(monitor.getHostCheckIntervalSeconds()));
        instanceGuardian.start(Duration.ofSeconds(monitor.getInstanceCheckIntervalSeconds()));
        confirmations.start();
    }

    // ==================== Components ====================

    @Nonnull
    public WardenAPI getApi() {
        checkInitialized();
        return api;
    }

    @Nonnull
    public WardenConfig getConfig() {
        return config;
    }

    @Nonnull
    public InstanceStore getStore() {
        checkInitialized();
        return store;
    }

    @Nonnull
    public InstanceLifecycle getLifecycle() {
        checkInitialized();
        return lifecycle;
    }

    @Nonnull
    public InstanceAccess getAccess() {
        checkInitialized();
        return access;
    }

    @Nonnull
    public InstanceSampler getSampler() {
        checkInitialized();
        return sampler;
    }

    @Nonnull
    public PortAllocator getPortAllocator() {
        checkInitialized();
        return portAllocator;
    }

    @Nonnull
    public HostGuardian getHostGuardian() {
        checkInitialized();
        return hostGuardian;
    }

    @Nonnull
    public InstanceGuardian getInstanceGuardian() {
        checkInitialized();
        return instanceGuardian;
    }

    @Nonnull
    public ConfirmationRegistry getConfirmations() {
        checkInitialized();
        return confirmations;
    }

    @Nonnull
    public ExecutorService getAsyncExecutor() {
        checkInitialized();
        return asyncExecutor;
    }

    // ==================== Lifecycle ====================

    public boolean isInitialized() {
        return initialized;
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Warden not initialized");
        }
    }

    /**
     * Stop the guardians and worker threads. Instances keep running.
     */
    public void shutdown() {
        if (!initialized || shutdown) {
            return;
        }

        shutdown = true;
        LOGGER.info("Shutting down instance governance engine...");

        hostGuardian.stop();
        instanceGuardian.stop();
        confirmations.stop();
        asyncExecutor.shutdown();

        try {
            store.save();
        } catch (RuntimeException e) {
            LOGGER.error("Final save failed: {}", e.getMessage());
        }

        LOGGER.info("Instance governance engine shut down");
    }
}
