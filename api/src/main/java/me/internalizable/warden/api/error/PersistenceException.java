package me.internalizable.warden.api.error;

import javax.annotation.Nonnull;

/**
 * Saving state failed, or a damaged data file could not be preserved on load.
 * The in-memory mutation that preceded a failed save is not rolled back.
 */
public class PersistenceException extends WardenException {

    public PersistenceException(@Nonnull String message, Throwable cause) {
        super(ErrorKind.PERSISTENCE, message, cause);
    }
}
