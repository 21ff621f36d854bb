package me.internalizable.warden.instance;

import me.internalizable.warden.api.WardenAPI;
import me.internalizable.warden.api.error.CommandExecutionException;
import me.internalizable.warden.api.error.StateConflictException;
import me.internalizable.warden.api.error.ValidationException;
import me.internalizable.warden.api.error.WardenException;
import me.internalizable.warden.command.CommandExecutor;
import me.internalizable.warden.command.InstanceTool;
import me.internalizable.warden.config.WardenConfig;
import me.internalizable.warden.store.InstanceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Instance lifecycle operations.
 *
 * <p>Each operation runs its tool commands strictly in order and records
 * every state change that must survive a crash before moving on. A failing
 * command aborts the rest of the operation; steps already done are not
 * rolled back, so callers should look at the record afterwards rather than
 * assume all-or-nothing.</p>
 *
 * <p>All methods block on tool commands and are meant to be called from a
 * worker thread.</p>
 */
public class InstanceLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(InstanceLifecycle.class);

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final InstanceStore store;
    private final CommandExecutor executor;
    private final InstanceTool tool;
    private final OwnerNotifier notifier;
    private final Clock clock;
    private final String baseImage;
    private final String defaultStoragePool;
    private final String instancePrefix;

    // ids of creates and clones in flight, guarded by the store lock
    private final Set<String> pendingIds = new HashSet<>();

    /**
     * Create the lifecycle operations.
     *
     * @param config engine configuration (image, storage pool, id prefix)
     * @param store instance store
     * @param executor command executor
     * @param tool command builder
     * @param notifier owner collaborators
     * @param clock clock for creation and audit times
     */
    public InstanceLifecycle(
            @Nonnull WardenConfig config,
            @Nonnull InstanceStore store,
            @Nonnull CommandExecutor executor,
            @Nonnull InstanceTool tool,
            @Nonnull OwnerNotifier notifier,
            @Nonnull Clock clock) {
        Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.tool = Objects.requireNonNull(tool, "tool");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.baseImage = config.getBaseImage();
        this.defaultStoragePool = config.getDefaultStoragePool();
        this.instancePrefix = config.getInstancePrefix();
    }

    // ==================== Create & Delete ====================

    /**
     * Create, configure and start a new instance.
     *
     * @param ownerId owning user
     * @param ramGb memory in GB
     * @param cpuCores CPU cores
     * @param diskGb disk in GB
     * @return the recorded instance
     * @throws ValidationException if a resource value is not positive
     * @throws CommandExecutionException if a tool command fails; nothing is recorded
     */
    @Nonnull
    public Instance create(@Nonnull String ownerId, int ramGb, int cpuCores, int diskGb) {
        Objects.requireNonNull(ownerId, "ownerId");
        Resources resources = new Resources(ramGb, cpuCores, diskGb);

        String instanceId = store.compute(state -> {
            int sequence = state.countInstances(ownerId) + 1;
            String candidate = instancePrefix + "-" + ownerId + "-" + sequence;
            while (state.hasInstance(candidate) || pendingIds.contains(candidate)) {
                sequence++;
                candidate = instancePrefix + "-" + ownerId + "-" + sequence;
            }
            pendingIds.add(candidate);
            return candidate;
        });

        LOGGER.info("Creating instance {} for {} ({})", instanceId, ownerId, resources.describe());
        Instance instance = new Instance(instanceId, ownerId, resources, clock.instant());
        try {
            executor.execute(tool.init(baseImage, instanceId, defaultStoragePool));
            applyLimits(instanceId, resources);
            executor.execute(tool.start(instanceId));

            store.mutate(state -> {
                pendingIds.remove(instanceId);
                state.addInstance(instance);
            });
        } catch (RuntimeException e) {
            store.mutate(state -> pendingIds.remove(instanceId));
            LOGGER.error("Failed to create instance {}: {}", instanceId, e.getMessage());
            throw e;
        }
        store.save();

        notifier.grantOwnership(ownerId);
        LOGGER.info("Created instance {}", instanceId);
        return instance.copy();
    }

    /**
     * Force-stop and delete an instance, dropping its record and port forwards.
     *
     * @param instanceId instance
     * @param reason reason given to the owner
     * @throws CommandExecutionException if the delete command fails; the record stays
     */
    public void delete(@Nonnull String instanceId, @Nonnull String reason) {
        Objects.requireNonNull(reason, "reason");
        Instance current = get(instanceId);

        forceStopQuietly(instanceId);
        executor.execute(tool.forceDelete(instanceId));

        String ownerId = current.getOwnerId();
        boolean ownerEmpty = store.compute(state -> {
            state.removeInstance(instanceId);
            state.getPorts().removeForwardsFor(instanceId);
            return state.countInstances(ownerId) == 0;
        });
        store.save();

        LOGGER.info("Deleted instance {} of {}: {}", instanceId, ownerId, reason);
        if (ownerEmpty) {
            notifier.revokeOwnership(ownerId);
        }
        notifier.notifyOwner(ownerId, "Your instance " + instanceId + " has been deleted. Reason: " + reason);
    }

    // ==================== Start / Stop ====================

    /**
     * Start a stopped instance. Starting a running instance does nothing.
     *
     * @param instanceId instance
     * @return the instance after the operation
     * @throws StateConflictException if the instance is suspended
     */
    @Nonnull
    public Instance start(@Nonnull String instanceId) {
        Instance current = get(instanceId);
        if (current.isRunning()) {
            return current;
        }
        requireNotSuspended(current, "start");

        executor.execute(tool.start(instanceId));
        commitTransition(instanceId, InstanceStatus.STOPPED, InstanceStatus.RUNNING);
        store.save();
        LOGGER.info("Started instance {}", instanceId);
        return get(instanceId);
    }

    /**
     * Stop a running instance. Stopping a stopped instance does nothing.
     *
     * @param instanceId instance
     * @return the instance after the operation
     * @throws StateConflictException if the instance is suspended
     */
    @Nonnull
    public Instance stop(@Nonnull String instanceId) {
        Instance current = get(instanceId);
        if (current.getInstanceStatus() == InstanceStatus.STOPPED) {
            return current;
        }
        requireNotSuspended(current, "stop");

        executor.execute(tool.stop(instanceId));
        commitTransition(instanceId, InstanceStatus.RUNNING, InstanceStatus.STOPPED);
        store.save();
        LOGGER.info("Stopped instance {}", instanceId);
        return get(instanceId);
    }

    /**
     * Restart an instance. A stopped instance is simply started.
     *
     * @param instanceId instance
     * @return the running instance
     * @throws StateConflictException if the instance is suspended
     */
    @Nonnull
    public Instance restart(@Nonnull String instanceId) {
        Instance current = get(instanceId);
        requireNotSuspended(current, "restart");
        if (!current.isRunning()) {
            return start(instanceId);
        }

        executor.execute(tool.restart(instanceId));
        LOGGER.info("Restarted instance {}", instanceId);
        return get(instanceId);
    }

    /**
     * Force-stop every instance on the host and mark running records stopped.
     *
     * @return number of records moved from running to stopped
     */
    public int forceStopAll() {
        executor.execute(tool.forceStopAll());
        int stopped = store.compute(state -> {
            List<Instance> running = state.getInstancesByStatus(InstanceStatus.RUNNING);
            running.forEach(instance -> instance.transitionTo(InstanceStatus.STOPPED));
            return running.size();
        });
        store.save();
        LOGGER.info("Force-stopped all instances ({} were running)", stopped);
        return stopped;
    }

    // ==================== Suspension ====================

    /**
     * Stop a running instance and mark it suspended.
     *
     * @param instanceId instance
     * @param reason reason recorded in the history
     * @param actorId acting admin
     * @return the suspended instance
     * @throws StateConflictException if the instance is not running
     */
    @Nonnull
    public Instance suspend(@Nonnull String instanceId, @Nonnull String reason, @Nonnull String actorId) {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(actorId, "actorId");
        Instance current = get(instanceId);
        if (!current.isRunning()) {
            throw new StateConflictException("Instance " + instanceId + " is " + current.getStatus()
                    + "; only running instances can be suspended");
        }

        executor.execute(tool.stop(instanceId));
        SuspensionEntry entry = new SuspensionEntry(clock.instant(), reason, actorId);
        update(instanceId, instance -> instance.suspend(entry));
        store.save();

        LOGGER.warn("Suspended instance {} by {}: {}", instanceId, actorId, reason);
        notifier.notifyOwner(current.getOwnerId(), "Your instance " + instanceId
                + " has been suspended. Reason: " + reason);
        return get(instanceId);
    }

    /**
     * Restart a suspended instance and clear the suspension.
     *
     * @param instanceId instance
     * @param actorId acting admin
     * @return the running instance
     * @throws StateConflictException if the instance is not suspended
     */
    @Nonnull
    public Instance unsuspend(@Nonnull String instanceId, @Nonnull String actorId) {
        Objects.requireNonNull(actorId, "actorId");
        Instance current = get(instanceId);
        if (!current.isSuspended()) {
            throw new StateConflictException("Instance " + instanceId + " is not suspended");
        }

        executor.execute(tool.start(instanceId));
        commitTransition(instanceId, InstanceStatus.SUSPENDED, InstanceStatus.RUNNING);
        store.save();

        LOGGER.info("Unsuspended instance {} by {}", instanceId, actorId);
        notifier.notifyOwner(current.getOwnerId(), "Your instance " + instanceId + " has been unsuspended.");
        return get(instanceId);
    }

    // ==================== Resize ====================

    /**
     * Change the resources of an instance.
     *
     * <p>A running instance is stopped first and restarted afterwards. Each
     * changed dimension is applied by its own command and written to the
     * record only once that command succeeded.</p>
     *
     * @param instanceId instance
     * @param options absolute values or deltas; unset dimensions are kept
     * @return the instance after the operation
     * @throws ValidationException if a resulting value is not positive
     */
    @Nonnull
    public Instance resize(@Nonnull String instanceId, @Nonnull WardenAPI.ResizeOptions options) {
        Objects.requireNonNull(options, "options");
        Instance current = get(instanceId);
        Resources from = current.getResources();
        Resources to = new Resources(
                target(from.ramGb(), options.getRamGb(), options.isDelta()),
                target(from.cpuCores(), options.getCpuCores(), options.isDelta()),
                target(from.diskGb(), options.getDiskGb(), options.isDelta()));
        if (to.equals(from)) {
            return current;
        }

        boolean wasRunning = current.isRunning();
        if (wasRunning) {
            executor.execute(tool.stop(instanceId));
            commitTransition(instanceId, InstanceStatus.RUNNING, InstanceStatus.STOPPED);
            store.save();
        }

        try {
            if (to.ramGb() != from.ramGb()) {
                executor.execute(tool.setMemory(instanceId, to.ramGb()));
                update(instanceId, instance -> instance.setResources(instance.getResources().withRamGb(to.ramGb())));
            }
            if (to.cpuCores() != from.cpuCores()) {
                executor.execute(tool.setCpu(instanceId, to.cpuCores()));
                update(instanceId, instance -> instance.setResources(instance.getResources().withCpuCores(to.cpuCores())));
            }
            if (to.diskGb() != from.diskGb()) {
                executor.execute(tool.setDisk(instanceId, to.diskGb()));
                update(instanceId, instance -> instance.setResources(instance.getResources().withDiskGb(to.diskGb())));
            }
        } catch (WardenException e) {
            store.save();
            LOGGER.error("Resize of {} stopped part-way: {}", instanceId, e.getMessage());
            throw e;
        }
        store.save();

        if (wasRunning) {
            executor.execute(tool.start(instanceId));
            commitTransition(instanceId, InstanceStatus.STOPPED, InstanceStatus.RUNNING);
            store.save();
        }

        LOGGER.info("Resized instance {} from {} to {}", instanceId, from.describe(), to.describe());
        return get(instanceId);
    }

    private static int target(int current, @Nullable Integer requested, boolean delta) {
        if (requested == null) {
            return current;
        }
        return delta ? current + requested : requested;
    }

    // ==================== Reinstall / Clone / Migrate ====================

    /**
     * Destroy and recreate an instance from the base image with its
     * original resources, resetting its creation time.
     *
     * <p>If a command fails after the delete, the instance is gone from the
     * tool but still recorded (as stopped) until an admin intervenes.</p>
     *
     * @param instanceId instance
     * @return the reinstalled, running instance
     * @throws StateConflictException if the instance is suspended
     */
    @Nonnull
    public Instance reinstall(@Nonnull String instanceId) {
        Instance current = get(instanceId);
        requireNotSuspended(current, "reinstall");
        Resources resources = current.getResources();

        LOGGER.info("Reinstalling instance {}", instanceId);
        forceStopQuietly(instanceId);
        executor.execute(tool.forceDelete(instanceId));
        if (current.isRunning()) {
            commitTransition(instanceId, InstanceStatus.RUNNING, InstanceStatus.STOPPED);
            store.save();
        }

        executor.execute(tool.init(baseImage, instanceId, defaultStoragePool));
        applyLimits(instanceId, resources);
        executor.execute(tool.start(instanceId));

        update(instanceId, instance -> {
            commit(instance, InstanceStatus.STOPPED, InstanceStatus.RUNNING);
            instance.resetCreatedAt(clock.instant());
        });
        store.save();

        LOGGER.info("Reinstalled instance {}", instanceId);
        return get(instanceId);
    }

    /**
     * Copy an instance into a new one under the same owner and start it.
     *
     * @param instanceId source instance
     * @param newId id of the copy, or null for {@code <id>-clone-<timestamp>}
     * @return the new instance, with no sharing and no history
     * @throws ValidationException if the new id is blank or already in use
     */
    @Nonnull
    public Instance clone(@Nonnull String instanceId, @Nullable String newId) {
        Instance source = get(instanceId);
        String cloneId = newId != null ? newId.trim() : instanceId + "-clone-" + timestamp();
        if (cloneId.isEmpty()) {
            throw new ValidationException("Clone id must not be blank");
        }

        store.mutate(state -> {
            if (state.hasInstance(cloneId) || pendingIds.contains(cloneId)) {
                throw new ValidationException("Instance id already in use: " + cloneId);
            }
            pendingIds.add(cloneId);
        });

        Instance copy = new Instance(cloneId, source.getOwnerId(), source.getResources(), clock.instant());
        try {
            executor.execute(tool.copy(instanceId, cloneId));
            executor.execute(tool.start(cloneId));

            store.mutate(state -> {
                pendingIds.remove(cloneId);
                state.addInstance(copy);
            });
        } catch (RuntimeException e) {
            store.mutate(state -> pendingIds.remove(cloneId));
            LOGGER.error("Failed to clone {} to {}: {}", instanceId, cloneId, e.getMessage());
            throw e;
        }
        store.save();

        LOGGER.info("Cloned instance {} to {}", instanceId, cloneId);
        return copy.copy();
    }

    /**
     * Move an instance to another storage pool, keeping its id.
     *
     * <p>The data is copied to a temporary instance in the target pool before
     * the original is deleted, so there is always at least one copy.</p>
     *
     * @param instanceId instance
     * @param targetPool storage pool to move to
     * @return the migrated, running instance
     * @throws StateConflictException if the instance is suspended
     */
    @Nonnull
    public Instance migrate(@Nonnull String instanceId, @Nonnull String targetPool) {
        Objects.requireNonNull(targetPool, "targetPool");
        if (targetPool.isBlank()) {
            throw new ValidationException("Target storage pool must not be blank");
        }
        Instance current = get(instanceId);
        requireNotSuspended(current, "migrate");
        String tempId = instanceId + "-temp-" + clock.instant().getEpochSecond();

        LOGGER.info("Migrating instance {} to pool {}", instanceId, targetPool);
        if (current.isRunning()) {
            executor.execute(tool.stop(instanceId));
            commitTransition(instanceId, InstanceStatus.RUNNING, InstanceStatus.STOPPED);
            store.save();
        }

        executor.execute(tool.copy(instanceId, tempId, targetPool));
        executor.execute(tool.forceDelete(instanceId));
        executor.execute(tool.rename(tempId, instanceId));
        executor.execute(tool.start(instanceId));

        commitTransition(instanceId, InstanceStatus.STOPPED, InstanceStatus.RUNNING);
        store.save();

        LOGGER.info("Migrated instance {} to pool {}", instanceId, targetPool);
        return get(instanceId);
    }

    // ==================== Snapshots ====================

    /**
     * @param instanceId instance
     * @return name of the new snapshot
     */
    @Nonnull
    public String snapshot(@Nonnull String instanceId) {
        get(instanceId);
        String snapshotName = instanceId + "-backup-" + timestamp();
        executor.execute(tool.snapshot(instanceId, snapshotName));
        LOGGER.info("Created snapshot {} of {}", snapshotName, instanceId);
        return snapshotName;
    }

    public void restore(@Nonnull String instanceId, @Nonnull String snapshotName) {
        Objects.requireNonNull(snapshotName, "snapshotName");
        if (snapshotName.isBlank()) {
            throw new ValidationException("Snapshot name must not be blank");
        }
        get(instanceId);
        executor.execute(tool.restore(instanceId, snapshotName));
        LOGGER.info("Restored instance {} from snapshot {}", instanceId, snapshotName);
    }

    /**
     * @param instanceId instance
     * @return snapshot names belonging to the instance
     */
    @Nonnull
    public List<String> listSnapshots(@Nonnull String instanceId) {
        get(instanceId);
        String output = executor.execute(tool.listSnapshots());
        List<String> names = new ArrayList<>();
        if (CommandExecutor.SUCCESS.equals(output)) {
            return names;
        }
        for (String line : output.split("\\R")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && trimmed.contains(instanceId)) {
                names.add(trimmed.split("\\s+")[0]);
            }
        }
        return names;
    }

    // ==================== Sharing ====================

    /**
     * @param instanceId instance
     * @param userId user to grant access
     * @return the updated instance
     * @throws ValidationException if the user is the owner or already has access
     */
    @Nonnull
    public Instance share(@Nonnull String instanceId, @Nonnull String userId) {
        Objects.requireNonNull(userId, "userId");
        update(instanceId, instance -> {
            if (instance.getOwnerId().equals(userId)) {
                throw new ValidationException("User " + userId + " already owns " + instanceId);
            }
            if (!instance.addSharedUser(userId)) {
                throw new ValidationException("User " + userId + " already has access to " + instanceId);
            }
        });
        store.save();
        LOGGER.info("Shared instance {} with {}", instanceId, userId);
        return get(instanceId);
    }

    /**
     * @param instanceId instance
     * @param userId user to remove
     * @return the updated instance
     * @throws ValidationException if the user had no access
     */
    @Nonnull
    public Instance revokeShare(@Nonnull String instanceId, @Nonnull String userId) {
        Objects.requireNonNull(userId, "userId");
        update(instanceId, instance -> {
            if (!instance.removeSharedUser(userId)) {
                throw new ValidationException("User " + userId + " has no access to " + instanceId);
            }
        });
        store.save();
        LOGGER.info("Revoked access of {} to instance {}", userId, instanceId);
        return get(instanceId);
    }

    // ==================== Helpers ====================

    /**
     * Get a copy of an instance record.
     *
     * @param instanceId instance
     * @return copy of the record
     * @throws me.internalizable.warden.api.error.InstanceNotFoundException if not found
     */
    @Nonnull
    public Instance get(@Nonnull String instanceId) {
        Objects.requireNonNull(instanceId, "instanceId");
        return store.read(state -> state.requireInstance(instanceId).copy());
    }

    private void applyLimits(String instanceId, Resources resources) {
        executor.execute(tool.setMemory(instanceId, resources.ramGb()));
        executor.execute(tool.setCpu(instanceId, resources.cpuCores()));
        executor.execute(tool.setDisk(instanceId, resources.diskGb()));
    }

    private void forceStopQuietly(String instanceId) {
        try {
            executor.execute(tool.forceStop(instanceId));
        } catch (CommandExecutionException e) {
            LOGGER.debug("Ignoring stop failure of {}: {}", instanceId, e.getMessage());
        }
    }

    private void update(String instanceId, Consumer<Instance> change) {
        store.mutate(state -> change.accept(state.requireInstance(instanceId)));
    }

    private void commitTransition(String instanceId, InstanceStatus expected, InstanceStatus target) {
        update(instanceId, instance -> commit(instance, expected, target));
    }

    /**
     * Apply {@code expected → target} unless the record already reached
     * {@code target}; any other status means a concurrent change won.
     */
    private static void commit(Instance instance, InstanceStatus expected, InstanceStatus target) {
        InstanceStatus actual = instance.getInstanceStatus();
        if (actual == target) {
            return;
        }
        if (actual != expected) {
            throw new StateConflictException("Instance " + instance.getId() + " changed to "
                    + actual.getName() + " while going from " + expected.getName() + " to " + target.getName());
        }
        instance.transitionTo(target);
    }

    private static void requireNotSuspended(Instance instance, String operation) {
        if (instance.isSuspended()) {
            throw new StateConflictException("Cannot " + operation + " suspended instance " + instance.getId()
                    + "; unsuspend it first");
        }
    }

    private String timestamp() {
        return LocalDateTime.now(clock).format(TIMESTAMP);
    }
}
