package me.internalizable.warden.api.error;

import javax.annotation.Nonnull;

/**
 * The requested operation is invalid for the instance's current status,
 * e.g. suspending an instance that is not running.
 */
public class StateConflictException extends WardenException {

    public StateConflictException(@Nonnull String message) {
        super(ErrorKind.STATE_CONFLICT, message);
    }
}
