package me.internalizable.warden.api;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * API for instance lifecycle and resource governance.
 *
 * <p>Entry point for the collaborators that front the engine (chat commands,
 * admin consoles). Every mutating call names the acting user so the engine can
 * apply its owner / shared-user / admin rules. Failures complete the returned
 * future exceptionally with a
 * {@link me.internalizable.warden.api.error.WardenException}.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * WardenAPI api = warden.getApi();
 *
 * api.createInstance(adminId, "4211", 4, 2, 40)
 *     .thenAccept(info -> System.out.println("Created " + info.getId()));
 *
 * // Destructive operations are two-phase
 * PendingConfirmation pending = api.requestReinstall("4211", "vps-4211-1");
 * api.confirm(pending.getToken()).join();
 * }</pre>
 */
public interface WardenAPI {

    // ==================== Lifecycle ====================

    /**
     * Create and start a new instance for a user.
     *
     * @param actorId acting admin
     * @param ownerId future owner
     * @param ramGb memory in GB, positive
     * @param cpuCores CPU cores, positive
     * @param diskGb disk in GB, positive
     * @return future completing with the created instance
     */
    @Nonnull
    CompletableFuture<InstanceInfo> createInstance(@Nonnull String actorId, @Nonnull String ownerId,
                                                   int ramGb, int cpuCores, int diskGb);

    @Nonnull
    CompletableFuture<InstanceInfo> startInstance(@Nonnull String actorId, @Nonnull String instanceId);

    @Nonnull
    CompletableFuture<InstanceInfo> stopInstance(@Nonnull String actorId, @Nonnull String instanceId);

    @Nonnull
    CompletableFuture<InstanceInfo> restartInstance(@Nonnull String actorId, @Nonnull String instanceId);

    /**
     * Suspend a running instance and record the reason in its history.
     *
     * @param actorId acting admin
     * @param instanceId instance identifier
     * @param reason reason shown to the owner
     * @return future completing with the suspended instance
     */
    @Nonnull
    CompletableFuture<InstanceInfo> suspendInstance(@Nonnull String actorId, @Nonnull String instanceId,
                                                    @Nonnull String reason);

    @Nonnull
    CompletableFuture<InstanceInfo> unsuspendInstance(@Nonnull String actorId, @Nonnull String instanceId);

    /**
     * Change the resources of an instance, stopping and restarting it if it was running.
     *
     * @param actorId acting admin
     * @param instanceId instance identifier
     * @param options absolute values or deltas
     * @return future completing with the resized instance
     */
    @Nonnull
    CompletableFuture<InstanceInfo> resizeInstance(@Nonnull String actorId, @Nonnull String instanceId,
                                                   @Nonnull ResizeOptions options);

    /**
     * Copy an instance under the same owner.
     *
     * @param actorId acting admin
     * @param instanceId source instance
     * @param newId id for the copy, or null to derive one
     * @return future completing with the copy
     */
    @Nonnull
    CompletableFuture<InstanceInfo> cloneInstance(@Nonnull String actorId, @Nonnull String instanceId,
                                                  @Nullable String newId);

    @Nonnull
    CompletableFuture<InstanceInfo> migrateInstance(@Nonnull String actorId, @Nonnull String instanceId,
                                                    @Nonnull String targetPool);

    @Nonnull
    CompletableFuture<Void> deleteInstance(@Nonnull String actorId, @Nonnull String instanceId,
                                           @Nonnull String reason);

    @Nonnull
    CompletableFuture<String> snapshotInstance(@Nonnull String actorId, @Nonnull String instanceId);

    @Nonnull
    CompletableFuture<Void> restoreInstance(@Nonnull String actorId, @Nonnull String instanceId,
                                            @Nonnull String snapshotName);

    @Nonnull
    CompletableFuture<List<String>> listSnapshots(@Nonnull String actorId, @Nonnull String instanceId);

    // ==================== Confirmation ====================

    /**
     * Request a reinstall. Nothing happens until the returned handle is confirmed.
     *
     * @param actorId acting owner
     * @param instanceId instance identifier
     * @return pending confirmation handle
     */
    @Nonnull
    PendingConfirmation requestReinstall(@Nonnull String actorId, @Nonnull String instanceId);

    /**
     * Request that every instance on the host be force-stopped.
     *
     * @param actorId acting admin
     * @return pending confirmation handle
     */
    @Nonnull
    PendingConfirmation requestStopAll(@Nonnull String actorId);

    /**
     * Confirm a pending action and run it.
     *
     * @param token handle token
     * @return future completing when the action is done
     */
    @Nonnull
    CompletableFuture<Void> confirm(@Nonnull String token);

    /**
     * Discard a pending action.
     *
     * @param token handle token
     * @return true if a pending action was discarded
     */
    boolean cancel(@Nonnull String token);

    // ==================== Introspection ====================

    /**
     * Sample an instance's current usage from inside the instance.
     *
     * @param actorId acting user (admin, owner or shared user)
     * @param instanceId instance
     * @return future completing with the usage report
     */
    @Nonnull
    CompletableFuture<UsageReport> getUsage(@Nonnull String actorId, @Nonnull String instanceId);

    /**
     * List the processes running inside an instance (admin only).
     *
     * @param actorId acting admin
     * @param instanceId instance
     * @return future completing with the process table
     */
    @Nonnull
    CompletableFuture<String> getProcessList(@Nonnull String actorId, @Nonnull String instanceId);

    /**
     * Tail the system journal of an instance (admin only).
     *
     * @param actorId acting admin
     * @param instanceId instance
     * @param lines number of lines, positive
     * @return future completing with the journal lines
     */
    @Nonnull
    CompletableFuture<String> getJournal(@Nonnull String actorId, @Nonnull String instanceId, int lines);

    /**
     * Run a shell command inside an instance (admin only).
     *
     * @param actorId acting admin
     * @param instanceId instance
     * @param command command passed to {@code bash -c}
     * @return future completing with the command output
     */
    @Nonnull
    CompletableFuture<String> executeInInstance(@Nonnull String actorId, @Nonnull String instanceId,
                                                @Nonnull String command);

    // ==================== Sharing ====================

    @Nonnull
    CompletableFuture<InstanceInfo> shareInstance(@Nonnull String actorId, @Nonnull String instanceId,
                                                  @Nonnull String userId);

    @Nonnull
    CompletableFuture<InstanceInfo> revokeShare(@Nonnull String actorId, @Nonnull String instanceId,
                                                @Nonnull String userId);

    // ==================== Ports ====================

    /**
     * Forward a free host port (TCP and UDP) to a port inside the user's instance.
     *
     * @param userId acting user, charged against their slots
     * @param instanceId instance owned by the user
     * @param internalPort port inside the instance
     * @return future completing with the new forward
     */
    @Nonnull
    CompletableFuture<PortForwardInfo> allocatePort(@Nonnull String userId, @Nonnull String instanceId,
                                                    int internalPort);

    @Nonnull
    CompletableFuture<Void> releasePort(@Nonnull String userId, int hostPort);

    /**
     * Adjust a user's forward quota.
     *
     * @param actorId acting admin
     * @param userId user whose quota changes
     * @param amount slots to add (negative to take away)
     * @return the new quota
     */
    int addPortSlots(@Nonnull String actorId, @Nonnull String userId, int amount);

    @Nonnull
    List<PortForwardInfo> getPortForwards(@Nonnull String userId);

    int getPortSlots(@Nonnull String userId);

    // ==================== Admins ====================

    void addAdmin(@Nonnull String actorId, @Nonnull String userId);

    void removeAdmin(@Nonnull String actorId, @Nonnull String userId);

    boolean isAdmin(@Nonnull String userId);

    boolean isMainAdmin(@Nonnull String userId);

    @Nonnull
    String getMainAdmin();

    @Nonnull
    Set<String> getAdmins();

    // ==================== Guardians ====================

    void setHostGuardianEnabled(@Nonnull String actorId, boolean enabled);

    boolean isHostGuardianEnabled();

    // ==================== Queries ====================

    @Nullable
    InstanceInfo getInstance(@Nonnull String instanceId);

    @Nonnull
    List<InstanceInfo> getInstancesByOwner(@Nonnull String ownerId);

    @Nonnull
    List<InstanceInfo> getInstancesSharedWith(@Nonnull String userId);

    @Nonnull
    Collection<InstanceInfo> getAllInstances();

    /**
     * Get the newest suspension entries of an instance.
     *
     * @param instanceId instance identifier
     * @param limit maximum entries to return
     * @return entries, newest first
     */
    @Nonnull
    List<SuspensionInfo> getSuspensionHistory(@Nonnull String instanceId, int limit);

    @Nonnull
    FleetStats getStats();

    /**
     * Instance information.
     */
    interface InstanceInfo {
        @Nonnull
        String getId();

        @Nonnull
        String getOwnerId();

        int getRamGb();

        int getCpuCores();

        int getDiskGb();

        /**
         * Get the human-readable resource summary, e.g. {@code "4GB RAM / 2 CPU / 40GB Disk"}.
         */
        @Nonnull
        String getConfig();

        /**
         * Get the status name: {@code running}, {@code stopped} or {@code suspended}.
         */
        @Nonnull
        String getStatus();

        boolean isSuspended();

        @Nonnull
        Instant getCreatedAt();

        @Nonnull
        Set<String> getSharedWith();

        int getSuspensionCount();
    }

    /**
     * One suspension audit entry.
     */
    interface SuspensionInfo {
        @Nonnull
        Instant getTime();

        @Nonnull
        String getReason();

        @Nonnull
        String getActor();
    }

    /**
     * An active host-port forward.
     */
    interface PortForwardInfo {
        @Nonnull
        String getInstanceId();

        int getInternalPort();

        int getHostPort();
    }

    /**
     * A destructive action awaiting confirmation.
     */
    interface PendingConfirmation {
        @Nonnull
        String getToken();

        @Nonnull
        String getDescription();

        @Nonnull
        Instant getExpiresAt();
    }

    /**
     * Resize request: absolute targets or deltas per dimension.
     */
    interface ResizeOptions {
        /**
         * Check whether the values are added to the current resources.
         */
        boolean isDelta();

        @Nullable
        Integer getRamGb();

        @Nullable
        Integer getCpuCores();

        @Nullable
        Integer getDiskGb();

        /**
         * Create a builder whose values replace the current resources.
         */
        @Nonnull
        static Builder absolute() {
            return new ResizeOptionsBuilder(false);
        }

        /**
         * Create a builder whose values are added to the current resources.
         */
        @Nonnull
        static Builder delta() {
            return new ResizeOptionsBuilder(true);
        }

        /**
         * Builder for resize options.
         */
        interface Builder {
            Builder ramGb(int ramGb);
            Builder cpuCores(int cpuCores);
            Builder diskGb(int diskGb);
            ResizeOptions build();
        }
    }

    /**
     * Fleet statistics.
     */
    /**
     * Usage sampled inside an instance.
     */
    interface UsageReport {
        /**
         * @return status as reported by the management tool, or {@code Unknown}
         */
        @Nonnull
        String getToolStatus();

        double getCpuPercent();

        double getRamPercent();

        /**
         * @return root filesystem usage, e.g. {@code 1.2G/10G (12%)}, or {@code Unknown}
         */
        @Nonnull
        String getDiskUsage();
    }

    interface FleetStats {
        int getTotalOwners();
        int getTotalInstances();
        int getRunningInstances();
        int getStoppedInstances();
        int getSuspendedInstances();
        int getTotalAdmins();
        long getTotalRamGb();
        long getTotalCpuCores();
        long getTotalDiskGb();
    }
}
