package me.internalizable.warden.api.error;

import javax.annotation.Nonnull;

/**
 * Bad caller input.
 */
public class ValidationException extends WardenException {

    public ValidationException(@Nonnull String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
