package me.internalizable.warden.instance;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Lifecycle status of a managed instance.
 *
 * <h2>Transitions</h2>
 * <pre>
 * RUNNING   → STOPPED    explicit stop, resize/reinstall prelude, host force-stop
 * RUNNING   → SUSPENDED  guardian breach, admin suspend
 * STOPPED   → RUNNING    explicit start, resize/reinstall completion
 * SUSPENDED → RUNNING    unsuspend
 * </pre>
 * Requesting the current status is a no-op, never a transition.
 */
public enum InstanceStatus {
    /**
     * Instance is started in the external tool.
     */
    RUNNING,

    /**
     * Instance is stopped and may be started by its owner.
     */
    STOPPED,

    /**
     * Instance was stopped for a policy breach or by an admin and stays
     * stopped until unsuspended.
     */
    SUSPENDED;

    /**
     * Check whether moving to {@code target} is a valid transition.
     *
     * @param target requested status
     * @return true for one of the listed transitions; false for the current status
     */
    public boolean canTransitionTo(@Nonnull InstanceStatus target) {
        switch (this) {
            case RUNNING:
                return target == STOPPED || target == SUSPENDED;
            case STOPPED:
            case SUSPENDED:
                return target == RUNNING;
            default:
                return false;
        }
    }

    /**
     * Get the persisted, lower-case name.
     *
     * @return status name, e.g. {@code running}
     */
    @Nonnull
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a persisted status name.
     *
     * @param name status name, any case
     * @return status
     * @throws IllegalArgumentException for an unknown name
     */
    @Nonnull
    public static InstanceStatus fromName(@Nonnull String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
