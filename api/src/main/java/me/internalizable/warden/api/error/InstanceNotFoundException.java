package me.internalizable.warden.api.error;

import javax.annotation.Nonnull;

/**
 * Unknown instance id, owner or port forward.
 */
public class InstanceNotFoundException extends WardenException {

    public InstanceNotFoundException(@Nonnull String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
