package me.internalizable.warden.instance;

import me.internalizable.warden.api.WardenAPI;
import me.internalizable.warden.api.error.StateConflictException;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The record of one managed instance.
 *
 * <p>Instances are mutable and not thread-safe: they are only touched inside
 * {@code InstanceStore} mutations and are handed to callers as
 * {@link #copy() copies}.</p>
 *
 * <h2>Lifecycle States</h2>
 * <pre>
 * STOPPED ⇄ RUNNING → SUSPENDED
 *              ↑__________|  (unsuspend)
 * </pre>
 */
public class Instance implements WardenAPI.InstanceInfo {

    private final String id;
    private final String ownerId;
    private Resources resources;
    private InstanceStatus status;
    private Instant createdAt;
    private final List<SuspensionEntry> suspensionHistory;
    private final Set<String> sharedWith;

    /**
     * Create a running instance with empty history and sharing.
     *
     * @param id instance id, also the name in the external tool
     * @param ownerId owning user
     * @param resources resource allotment
     * @param createdAt creation time
     */
    public Instance(@Nonnull String id, @Nonnull String ownerId, @Nonnull Resources resources,
                    @Nonnull Instant createdAt) {
        this(id, ownerId, resources, InstanceStatus.RUNNING, createdAt, List.of(), Set.of());
    }

    /**
     * Restore an instance from persisted state.
     *
     * @param id instance id
     * @param ownerId owning user
     * @param resources resource allotment
     * @param status current status
     * @param createdAt creation time
     * @param suspensionHistory audit trail, oldest first
     * @param sharedWith users granted access
     */
    public Instance(@Nonnull String id, @Nonnull String ownerId, @Nonnull Resources resources,
                    @Nonnull InstanceStatus status, @Nonnull Instant createdAt,
                    @Nonnull List<SuspensionEntry> suspensionHistory, @Nonnull Set<String> sharedWith) {
        this.id = Objects.requireNonNull(id, "id");
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.resources = Objects.requireNonNull(resources, "resources");
        this.status = Objects.requireNonNull(status, "status");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.suspensionHistory = new ArrayList<>(suspensionHistory);
        this.sharedWith = new LinkedHashSet<>(sharedWith);
    }

    // ==================== Lifecycle ====================

    /**
     * Move to another status.
     *
     * @param target requested status
     * @return true if the status changed, false if it already was {@code target}
     * @throws StateConflictException if the transition is not allowed
     */
    public boolean transitionTo(@Nonnull InstanceStatus target) {
        Objects.requireNonNull(target, "target");
        if (status == target) {
            return false;
        }
        if (!status.canTransitionTo(target)) {
            throw new StateConflictException("Instance " + id + " cannot go from "
                    + status.getName() + " to " + target.getName());
        }
        status = target;
        return true;
    }

    /**
     * Suspend a running instance and record why.
     *
     * @param entry audit entry to append
     * @throws StateConflictException if the instance is not running
     */
    public void suspend(@Nonnull SuspensionEntry entry) {
        Objects.requireNonNull(entry, "entry");
        if (status != InstanceStatus.RUNNING) {
            throw new StateConflictException("Instance " + id + " is " + status.getName() + ", not running");
        }
        status = InstanceStatus.SUSPENDED;
        suspensionHistory.add(entry);
    }

    /**
     * Replace the resource allotment after the external tool accepted it.
     *
     * @param resources new allotment
     */
    public void setResources(@Nonnull Resources resources) {
        this.resources = Objects.requireNonNull(resources, "resources");
    }

    /**
     * Reset the creation time, as done by a reinstall.
     *
     * @param createdAt new creation time
     */
    public void resetCreatedAt(@Nonnull Instant createdAt) {
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public boolean addSharedUser(@Nonnull String userId) {
        return sharedWith.add(Objects.requireNonNull(userId, "userId"));
    }

    public boolean removeSharedUser(@Nonnull String userId) {
        return sharedWith.remove(Objects.requireNonNull(userId, "userId"));
    }

    /**
     * Create an independent copy.
     *
     * @return copy sharing no mutable state with this instance
     */
    @Nonnull
    public Instance copy() {
        return new Instance(id, ownerId, resources, status, createdAt, suspensionHistory, sharedWith);
    }

    // ==================== Getters ====================

    @Override
    @Nonnull
    public String getId() {
        return id;
    }

    @Override
    @Nonnull
    public String getOwnerId() {
        return ownerId;
    }

    @Nonnull
    public Resources getResources() {
        return resources;
    }

    @Override
    public int getRamGb() {
        return resources.ramGb();
    }

    @Override
    public int getCpuCores() {
        return resources.cpuCores();
    }

    @Override
    public int getDiskGb() {
        return resources.diskGb();
    }

    @Override
    @Nonnull
    public String getConfig() {
        return resources.describe();
    }

    @Nonnull
    public InstanceStatus getInstanceStatus() {
        return status;
    }

    @Override
    @Nonnull
    public String getStatus() {
        return status.getName();
    }

    /**
     * Derived from the status; there is no separate flag.
     */
    @Override
    public boolean isSuspended() {
        return status == InstanceStatus.SUSPENDED;
    }

    public boolean isRunning() {
        return status == InstanceStatus.RUNNING;
    }

    @Override
    @Nonnull
    public Instant getCreatedAt() {
        return createdAt;
    }

    @Nonnull
    public List<SuspensionEntry> getSuspensionHistory() {
        return Collections.unmodifiableList(suspensionHistory);
    }

    @Override
    public int getSuspensionCount() {
        return suspensionHistory.size();
    }

    @Override
    @Nonnull
    public Set<String> getSharedWith() {
        return Collections.unmodifiableSet(sharedWith);
    }

    public boolean isSharedWith(@Nonnull String userId) {
        return sharedWith.contains(userId);
    }

    @Override
    public String toString() {
        return "Instance{" +
                "id='" + id + '\'' +
                ", owner='" + ownerId + '\'' +
                ", config='" + resources.describe() + '\'' +
                ", status=" + status +
                ", suspensions=" + suspensionHistory.size() +
                '}';
    }
}
