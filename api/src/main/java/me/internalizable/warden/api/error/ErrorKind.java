package me.internalizable.warden.api.error;

/**
 * Classifies a failure reported by the engine.
 */
public enum ErrorKind {
    /**
     * An external command exited non-zero or timed out.
     */
    EXECUTION,

    /**
     * The caller supplied bad input (non-positive resources, exhausted quota, ...).
     */
    VALIDATION,

    /**
     * The referenced instance or owner does not exist.
     */
    NOT_FOUND,

    /**
     * The operation is not valid for the instance's current status.
     */
    STATE_CONFLICT,

    /**
     * Persisting the state to disk failed.
     */
    PERSISTENCE,

    /**
     * The acting user is not allowed to perform the operation.
     */
    FORBIDDEN
}
