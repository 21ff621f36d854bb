/**
 * Instance lifecycle and resource governance for a single virtualization host.
 *
 * <p>Drives an external container tool to create, start, stop, suspend, resize
 * and delete user instances, keeps a crash-safe record of them, hands out
 * host-port forwards and enforces CPU/RAM ceilings in the background.</p>
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link me.internalizable.warden.Warden} - Main orchestrator</li>
 *   <li>{@link me.internalizable.warden.command.ProcessCommandExecutor} - Timeout-bounded tool invocation</li>
 *   <li>{@link me.internalizable.warden.store.InstanceStore} - Persisted instance, admin and port records</li>
 *   <li>{@link me.internalizable.warden.instance.InstanceLifecycle} - State-transition operations</li>
 *   <li>{@link me.internalizable.warden.port.PortAllocator} - Host-port forwards</li>
 *   <li>{@link me.internalizable.warden.guardian.HostGuardian} - Host CPU protection</li>
 *   <li>{@link me.internalizable.warden.guardian.InstanceGuardian} - Per-instance auto-suspension</li>
 * </ul>
 *
 * <h2>Instance States</h2>
 * <ul>
 *   <li><b>running</b> - Started by the tool</li>
 *   <li><b>stopped</b> - Stopped explicitly or by the host guardian</li>
 *   <li><b>suspended</b> - Stopped by an admin or the instance guardian; only unsuspend leaves it</li>
 * </ul>
 *
 * @see me.internalizable.warden.Warden
 */
package me.internalizable.warden;
