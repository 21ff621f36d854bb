/**
 * Failures reported by the governance engine.
 *
 * <p>All exceptions are unchecked and extend
 * {@link me.internalizable.warden.api.error.WardenException}, which exposes an
 * {@link me.internalizable.warden.api.error.ErrorKind} for structured display.</p>
 */
package me.internalizable.warden.api.error;
