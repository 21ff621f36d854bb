package me.internalizable.warden.api;

import javax.annotation.Nonnull;

/**
 * Maintains the platform-side marker (role, group, ...) that identifies
 * instance owners.
 *
 * <p>The engine grants it after a user's instance is created and revokes it
 * once the user owns no instances. Failures are logged and ignored.</p>
 */
public interface OwnershipGrants {

    /**
     * Grants that do nothing.
     */
    OwnershipGrants NONE = new OwnershipGrants() {
        @Override
        public void grant(@Nonnull String userId) {
        }

        @Override
        public void revoke(@Nonnull String userId) {
        }
    };

    void grant(@Nonnull String userId);

    void revoke(@Nonnull String userId);
}
