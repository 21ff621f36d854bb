package me.internalizable.warden.instance;

import me.internalizable.warden.api.error.AccessDeniedException;
import me.internalizable.warden.store.InstanceStore;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Objects;

/**
 * Decides who may do what to an instance.
 *
 * <p>Admins may do anything. Owners and shared users get the subset their
 * {@link Action} allows. A suspended instance only accepts reads from
 * non-admins.</p>
 */
public class InstanceAccess {

    /**
     * Instance-scoped actions and who besides admins may perform them.
     */
    public enum Action {
        READ(true, true),
        START(true, true),
        STOP(true, true),
        RESTART(true, true),
        REINSTALL(true, false),
        SHARE(true, false),
        FORWARD_PORTS(true, false),
        SUSPEND(false, false),
        UNSUSPEND(false, false),
        RESIZE(false, false),
        CLONE(false, false),
        MIGRATE(false, false),
        DELETE(false, false),
        SNAPSHOT(false, false),
        RESTORE(false, false),
        INSPECT(false, false);

        private final boolean ownerAllowed;
        private final boolean sharedAllowed;

        Action(boolean ownerAllowed, boolean sharedAllowed) {
            this.ownerAllowed = ownerAllowed;
            this.sharedAllowed = sharedAllowed;
        }

        public boolean isOwnerAllowed() {
            return ownerAllowed;
        }

        public boolean isSharedAllowed() {
            return sharedAllowed;
        }

        String describe() {
            return name().toLowerCase(Locale.ROOT).replace('_', ' ');
        }
    }

    private final InstanceStore store;

    public InstanceAccess(@Nonnull InstanceStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Check that a user may perform an action on an instance.
     *
     * @param actorId acting user
     * @param instance instance (a copy is fine)
     * @param action requested action
     * @throws AccessDeniedException if not allowed
     */
    public void check(@Nonnull String actorId, @Nonnull Instance instance, @Nonnull Action action) {
        Objects.requireNonNull(actorId, "actorId");
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(action, "action");

        if (isAdmin(actorId)) {
            return;
        }
        if (instance.isSuspended() && action != Action.READ) {
            throw new AccessDeniedException("Instance " + instance.getId()
                    + " is suspended; contact an admin to unsuspend it");
        }
        if (instance.getOwnerId().equals(actorId) && action.isOwnerAllowed()) {
            return;
        }
        if (instance.isSharedWith(actorId) && action.isSharedAllowed()) {
            return;
        }
        throw new AccessDeniedException("User " + actorId + " may not " + action.describe()
                + " instance " + instance.getId());
    }

    /**
     * @param actorId acting user
     * @throws AccessDeniedException if the user is not an admin
     */
    public void requireAdmin(@Nonnull String actorId) {
        if (!isAdmin(actorId)) {
            throw new AccessDeniedException("User " + actorId + " is not an admin");
        }
    }

    /**
     * @param actorId acting user
     * @throws AccessDeniedException if the user is not the main admin
     */
    public void requireMainAdmin(@Nonnull String actorId) {
        if (!store.read(state -> state.getAdmins().isMainAdmin(actorId))) {
            throw new AccessDeniedException("Only the main admin may do this");
        }
    }

    public boolean isAdmin(@Nonnull String userId) {
        return store.read(state -> state.getAdmins().isAdmin(userId));
    }
}
