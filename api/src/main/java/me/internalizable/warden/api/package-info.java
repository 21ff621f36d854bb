/**
 * API for instance lifecycle and resource governance.
 *
 * <p>Provides the interfaces collaborators use to drive the engine and the
 * callbacks the engine uses to reach back out to them.</p>
 *
 * @see me.internalizable.warden.api.WardenAPI
 * @see me.internalizable.warden.api.NotificationSink
 * @see me.internalizable.warden.api.OwnershipGrants
 */
package me.internalizable.warden.api;
