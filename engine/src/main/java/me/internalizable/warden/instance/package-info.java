/**
 * Instance records and the operations that move them between states.
 *
 * <p>Every operation composes tool commands with store mutations and saves
 * before it returns.</p>
 *
 * @see me.internalizable.warden.instance.Instance
 * @see me.internalizable.warden.instance.InstanceLifecycle
 */
package me.internalizable.warden.instance;
