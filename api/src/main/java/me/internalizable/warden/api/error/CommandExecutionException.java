package me.internalizable.warden.api.error;

import javax.annotation.Nonnull;

/**
 * An external command failed. The message carries the tool's stderr text or
 * a timeout notice.
 */
public class CommandExecutionException extends WardenException {

    public CommandExecutionException(@Nonnull String message) {
        super(ErrorKind.EXECUTION, message);
    }

    public CommandExecutionException(@Nonnull String message, Throwable cause) {
        super(ErrorKind.EXECUTION, message, cause);
    }
}
