package me.internalizable.warden.api.error;

import javax.annotation.Nonnull;

/**
 * The acting user lacks the rights for the requested operation.
 */
public class AccessDeniedException extends WardenException {

    public AccessDeniedException(@Nonnull String message) {
        super(ErrorKind.FORBIDDEN, message);
    }
}
