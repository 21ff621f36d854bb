package me.internalizable.warden.guardian;

import me.internalizable.warden.instance.InstanceLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Recurring check of aggregate host CPU usage.
 *
 * <p>When usage exceeds the threshold every instance on the host is
 * force-stopped. The guardian can be switched off and on at runtime; a
 * disabled guardian keeps its schedule but skips its checks.</p>
 */
public class HostGuardian {

    private static final Logger LOGGER = LoggerFactory.getLogger(HostGuardian.class);

    private final HostLoadSampler sampler;
    private final InstanceLifecycle lifecycle;
    private final int cpuThreshold;
    private final AtomicBoolean enabled;

    private ScheduledExecutorService scheduler;

    /**
     * Create a host guardian.
     *
     * @param sampler host CPU sampler
     * @param lifecycle lifecycle operations used for the force-stop
     * @param cpuThreshold CPU percentage above which all instances are stopped
     * @param enabled initial state of the toggle
     */
    public HostGuardian(@Nonnull HostLoadSampler sampler, @Nonnull InstanceLifecycle lifecycle,
                        int cpuThreshold, boolean enabled) {
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.cpuThreshold = cpuThreshold;
        this.enabled = new AtomicBoolean(enabled);
    }

    /**
     * Start checking periodically on a daemon thread.
     *
     * @param period time between checks
     */
    public synchronized void start(@Nonnull Duration period) {
        if (scheduler != null) {
            throw new IllegalStateException("Host guardian already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "HostGuardian");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::tick, 0, period.toMillis(), TimeUnit.MILLISECONDS);
        LOGGER.info("Host guardian started (threshold {}%, every {}s, {})", cpuThreshold, period.toSeconds(),
                enabled.get() ? "enabled" : "disabled");
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    /**
     * Run one check.
     *
     * @return true if the force-stop was issued
     */
    public boolean tick() {
        if (!enabled.get()) {
            LOGGER.debug("Host guardian disabled, skipping check");
            return false;
        }

        double usage;
        try {
            usage = sampler.sampleCpuUsage();
        } catch (RuntimeException e) {
            LOGGER.error("Failed to sample host CPU usage: {}", e.getMessage());
            return false;
        }
        LOGGER.info("Host CPU usage: {}%", String.format(Locale.ROOT, "%.1f", usage));

        if (usage <= cpuThreshold) {
            return false;
        }

        LOGGER.warn("Host CPU usage {}% exceeded threshold {}%, stopping all instances",
                String.format(Locale.ROOT, "%.1f", usage), cpuThreshold);
        try {
            lifecycle.forceStopAll();
            return true;
        } catch (RuntimeException e) {
            LOGGER.error("Failed to stop all instances: {}", e.getMessage());
            return false;
        }
    }

    public void setEnabled(boolean enabled) {
        if (this.enabled.getAndSet(enabled) != enabled) {
            LOGGER.info("Host guardian {}", enabled ? "enabled" : "disabled");
        }
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    public int getCpuThreshold() {
        return cpuThreshold;
    }
}
