package me.internalizable.warden.instance;

import me.internalizable.warden.api.WardenAPI;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.Objects;

/**
 * One audit entry in an instance's suspension history.
 *
 * @param time when the suspension happened
 * @param reason why, e.g. {@code "CPU usage exceeded (92.0%)"}
 * @param actor user id of the admin, or {@link #AUTO_SYSTEM}
 */
public record SuspensionEntry(@Nonnull Instant time, @Nonnull String reason, @Nonnull String actor)
        implements WardenAPI.SuspensionInfo {

    /**
     * Actor recorded for suspensions made by the instance guardian.
     */
    public static final String AUTO_SYSTEM = "auto-system";

    public SuspensionEntry {
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(actor, "actor");
    }

    @Override
    @Nonnull
    public Instant getTime() {
        return time;
    }

    @Override
    @Nonnull
    public String getReason() {
        return reason;
    }

    @Override
    @Nonnull
    public String getActor() {
        return actor;
    }
}
