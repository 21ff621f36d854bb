package me.internalizable.warden.guardian;

import me.internalizable.warden.command.CommandExecutor;
import me.internalizable.warden.command.InstanceTool;
import me.internalizable.warden.instance.Instance;
import me.internalizable.warden.instance.InstanceSampler;
import me.internalizable.warden.instance.InstanceStatus;
import me.internalizable.warden.instance.OwnerNotifier;
import me.internalizable.warden.instance.SuspensionEntry;
import me.internalizable.warden.store.InstanceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Recurring check of CPU and RAM usage inside each running instance.
 *
 * <p>An instance over either threshold is stopped and suspended with an
 * {@value SuspensionEntry#AUTO_SYSTEM} audit entry, and its owner is told.
 * CPU and RAM are sampled independently; a metric that cannot be sampled
 * counts as within its threshold. A failure on one instance is logged and
 * the check moves on.</p>
 */
public class InstanceGuardian {

    private static final Logger LOGGER = LoggerFactory.getLogger(InstanceGuardian.class);

    private final InstanceStore store;
    private final InstanceSampler sampler;
    private final CommandExecutor executor;
    private final InstanceTool tool;
    private final OwnerNotifier notifier;
    private final Clock clock;
    private final int cpuThreshold;
    private final int ramThreshold;

    private ScheduledExecutorService scheduler;

    /**
     * Create an instance guardian.
     *
     * @param store instance store
     * @param sampler in-instance usage sampler
     * @param executor command executor
     * @param tool command builder
     * @param notifier owner notifications
     * @param clock clock for audit entries
     * @param cpuThreshold CPU percentage above which an instance is suspended
     * @param ramThreshold RAM percentage above which an instance is suspended
     */
    public InstanceGuardian(
            @Nonnull InstanceStore store,
            @Nonnull InstanceSampler sampler,
            @Nonnull CommandExecutor executor,
            @Nonnull InstanceTool tool,
            @Nonnull OwnerNotifier notifier,
            @Nonnull Clock clock,
            int cpuThreshold,
            int ramThreshold) {
        this.store = Objects.requireNonNull(store, "store");
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.tool = Objects.requireNonNull(tool, "tool");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.cpuThreshold = cpuThreshold;
        this.ramThreshold = ramThreshold;
    }

    /**
     * Start checking periodically on a daemon thread.
     *
     * @param period time between checks
     */
    public synchronized void start(@Nonnull Duration period) {
        if (scheduler != null) {
            throw new IllegalStateException("Instance guardian already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "InstanceGuardian");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::tick, 0, period.toMillis(), TimeUnit.MILLISECONDS);
        LOGGER.info("Instance guardian started (CPU {}%, RAM {}%, every {}s)", cpuThreshold, ramThreshold,
                period.toSeconds());
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    /**
     * Check every running instance once.
     *
     * @return number of instances suspended by this check
     */
    public int tick() {
        List<String> running = store.read(state -> state.getInstancesByStatus(InstanceStatus.RUNNING).stream()
                .map(Instance::getId)
                .collect(Collectors.toList()));

        int suspended = 0;
        for (String instanceId : running) {
            try {
                OptionalDouble cpu = sample(instanceId, "CPU", sampler::sampleCpuUsage);
                OptionalDouble ram = sample(instanceId, "RAM", sampler::sampleRamUsage);
                if (cpu.isEmpty() && ram.isEmpty()) {
                    continue;
                }
                LOGGER.debug("Instance {} usage: CPU {}%, RAM {}%", instanceId,
                        cpu.isPresent() ? format(cpu.getAsDouble()) : "?",
                        ram.isPresent() ? format(ram.getAsDouble()) : "?");

                String reason = breachReason(cpu.orElse(0.0), ram.orElse(0.0));
                if (reason != null && handleBreach(instanceId, reason)) {
                    suspended++;
                }
            } catch (RuntimeException e) {
                LOGGER.error("Failed to check instance {}: {}", instanceId, e.getMessage());
            }
        }
        return suspended;
    }

    /**
     * Stop and suspend an instance that breached a threshold.
     *
     * <p>Does nothing unless the instance is still running, so repeated
     * calls never add a second audit entry and a stopped instance is
     * never suspended.</p>
     *
     * @param instanceId instance
     * @param reason reason recorded in the history
     * @return true if the instance was suspended
     */
    public boolean handleBreach(@Nonnull String instanceId, @Nonnull String reason) {
        Objects.requireNonNull(instanceId, "instanceId");
        Objects.requireNonNull(reason, "reason");

        if (!isRunning(instanceId)) {
            LOGGER.debug("Instance {} is no longer running, not suspending", instanceId);
            return false;
        }

        executor.execute(tool.stop(instanceId));

        SuspensionEntry entry = new SuspensionEntry(clock.instant(), reason, SuspensionEntry.AUTO_SYSTEM);
        String ownerId = store.compute(state -> {
            Instance instance = state.findInstance(instanceId);
            if (instance == null || !instance.isRunning()) {
                return null;
            }
            instance.suspend(entry);
            return instance.getOwnerId();
        });
        if (ownerId == null) {
            LOGGER.debug("Instance {} changed while being stopped, not suspending", instanceId);
            return false;
        }
        store.save();

        LOGGER.warn("Suspended instance {}: {}", instanceId, reason);
        notifier.notifyOwner(ownerId, "Your instance " + instanceId
                + " has been automatically suspended. Reason: " + reason
                + ". Contact an admin to unsuspend it.");
        return true;
    }

    /**
     * Describe which thresholds were exceeded.
     *
     * @param cpu sampled CPU percentage
     * @param ram sampled RAM percentage
     * @return reason text, or null if both are within limits
     */
    @Nullable
    public String breachReason(double cpu, double ram) {
        List<String> parts = new ArrayList<>(2);
        if (cpu > cpuThreshold) {
            parts.add("CPU usage exceeded: " + format(cpu) + "% (threshold " + cpuThreshold + "%)");
        }
        if (ram > ramThreshold) {
            parts.add("RAM usage exceeded: " + format(ram) + "% (threshold " + ramThreshold + "%)");
        }
        return parts.isEmpty() ? null : String.join("; ", parts);
    }

    private OptionalDouble sample(String instanceId, String metric, ToDoubleFunction<String> sampling) {
        try {
            return OptionalDouble.of(sampling.applyAsDouble(instanceId));
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to sample {} of instance {}: {}", metric, instanceId, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    private boolean isRunning(String instanceId) {
        return store.read(state -> {
            Instance instance = state.findInstance(instanceId);
            return instance != null && instance.isRunning();
        });
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
