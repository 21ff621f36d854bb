/**
 * In-memory fleet state and its JSON persistence in the data directory.
 *
 * @see me.internalizable.warden.store.InstanceStore
 */
package me.internalizable.warden.store;
