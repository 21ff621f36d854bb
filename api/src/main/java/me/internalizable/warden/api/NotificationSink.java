package me.internalizable.warden.api;

import javax.annotation.Nonnull;

/**
 * Delivers messages to instance owners (direct message, mail, ...).
 *
 * <p>Calls are fire-and-forget: the engine logs and swallows any exception
 * thrown here, so a failed delivery never fails the triggering operation.</p>
 */
@FunctionalInterface
public interface NotificationSink {

    /**
     * Notify a user.
     *
     * @param userId recipient
     * @param message message text
     */
    void notifyOwner(@Nonnull String userId, @Nonnull String message);
}
