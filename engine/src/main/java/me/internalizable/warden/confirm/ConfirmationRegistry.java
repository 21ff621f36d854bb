package me.internalizable.warden.confirm;

import me.internalizable.warden.api.WardenAPI;
import me.internalizable.warden.api.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Two-step confirmation of destructive actions.
 *
 * <p>{@link #request(String, Runnable)} parks an action behind an opaque
 * token that is valid for a fixed window. {@link #confirm(String)} runs it
 * at most once; {@link #cancel(String)} or expiry discards it without
 * effect.</p>
 */
public class ConfirmationRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfirmationRegistry.class);

    private final Clock clock;
    private final Duration window;
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();

    private ScheduledExecutorService sweeper;

    /**
     * Create a registry.
     *
     * @param clock clock for expiry
     * @param window how long a token stays valid
     */
    public ConfirmationRegistry(@Nonnull Clock clock, @Nonnull Duration window) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.window = Objects.requireNonNull(window, "window");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Confirmation window must be positive");
        }
    }

    /**
     * Park an action until it is confirmed.
     *
     * @param description what will happen, shown to the user
     * @param action action to run on confirmation
     * @return the pending confirmation
     */
    @Nonnull
    public WardenAPI.PendingConfirmation request(@Nonnull String description, @Nonnull Runnable action) {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(action, "action");

        Pending entry = new Pending(UUID.randomUUID().toString(), description, clock.instant().plus(window), action);
        pending.put(entry.token(), entry);
        LOGGER.debug("Awaiting confirmation {} until {}: {}", entry.token(), entry.expiresAt(), description);
        return entry;
    }

    /**
     * Run a pending action. The token is consumed even if the action fails.
     *
     * @param token confirmation token
     * @throws ValidationException if the token is unknown, resolved or expired
     */
    public void confirm(@Nonnull String token) {
        Objects.requireNonNull(token, "token");
        Pending entry = pending.remove(token);
        if (entry == null) {
            throw new ValidationException("Unknown or already resolved confirmation: " + token);
        }
        if (isExpired(entry)) {
            throw new ValidationException("Confirmation expired: " + entry.description());
        }
        LOGGER.info("Confirmed: {}", entry.description());
        entry.action().run();
    }

    /**
     * Discard a pending action.
     *
     * @param token confirmation token
     * @return true if a live confirmation was cancelled
     */
    public boolean cancel(@Nonnull String token) {
        Objects.requireNonNull(token, "token");
        Pending entry = pending.remove(token);
        if (entry == null || isExpired(entry)) {
            return false;
        }
        LOGGER.info("Cancelled: {}", entry.description());
        return true;
    }

    /**
     * Drop expired confirmations.
     *
     * @return number dropped
     */
    public int sweep() {
        int before = pending.size();
        pending.values().removeIf(this::isExpired);
        return before - pending.size();
    }

    public int size() {
        return pending.size();
    }

    /**
     * Start sweeping expired confirmations on a daemon thread.
     */
    public synchronized void start() {
        if (sweeper != null) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ConfirmationSweeper");
            t.setDaemon(true);
            return t;
        });
        long period = window.toMillis();
        sweeper.scheduleAtFixedRate(() -> {
            int dropped = sweep();
            if (dropped > 0) {
                LOGGER.debug("Discarded {} expired confirmation(s)", dropped);
            }
        }, period, period, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
    }

    private boolean isExpired(Pending entry) {
        return !clock.instant().isBefore(entry.expiresAt());
    }

    private record Pending(String token, String description, Instant expiresAt, Runnable action)
            implements WardenAPI.PendingConfirmation {

        @Override
        @Nonnull
        public String getToken() {
            return token;
        }

        @Override
        @Nonnull
        public String getDescription() {
            return description;
        }

        @Override
        @Nonnull
        public Instant getExpiresAt() {
            return expiresAt;
        }
    }
}
