package me.internalizable.warden.api.error;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Base class for every failure the engine reports to its callers.
 *
 * <p>Each subclass maps to exactly one {@link ErrorKind} so collaborators can
 * render a structured description without inspecting exception types.</p>
 */
public abstract class WardenException extends RuntimeException {

    private final ErrorKind kind;

    protected WardenException(@Nonnull ErrorKind kind, @Nonnull String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    protected WardenException(@Nonnull ErrorKind kind, @Nonnull String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /**
     * Get the kind of failure.
     *
     * @return error kind
     */
    @Nonnull
    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Render the failure for display, e.g. {@code "EXECUTION: timed out after 120s"}.
     *
     * @return kind and message
     */
    @Nonnull
    public String describe() {
        return kind.name() + ": " + getMessage();
    }
}
