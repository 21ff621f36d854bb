package me.internalizable.warden.impl;

import me.internalizable.warden.Warden;
import me.internalizable.warden.api.WardenAPI;
import me.internalizable.warden.instance.Instance;
import me.internalizable.warden.instance.InstanceAccess;
import me.internalizable.warden.instance.InstanceAccess.Action;
import me.internalizable.warden.instance.InstanceLifecycle;
import me.internalizable.warden.instance.InstanceStatus;
import me.internalizable.warden.instance.SuspensionEntry;
import me.internalizable.warden.port.PortAllocator;
import me.internalizable.warden.store.FleetState;
import me.internalizable.warden.store.InstanceStore;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Implementation of the WardenAPI for collaborator access.
 *
 * <p>Checks the caller's rights, then runs the operation on the engine's
 * worker pool. Returned records are copies.</p>
 */
public class WardenAPIImpl implements WardenAPI {

    private final Warden warden;

    public WardenAPIImpl(@Nonnull Warden warden) {
        this.warden = Objects.requireNonNull(warden, "warden");
    }

    // ==================== Lifecycle ====================

    @Override
    @Nonnull
    public CompletableFuture<InstanceInfo> createInstance(@Nonnull String actorId, @Nonnull String ownerId,
                                                          int ramGb, int cpuCores, int diskGb) {
        Objects.requireNonNull(actorId, "actorId");
        Objects.requireNonNull(ownerId, "ownerId");
        return async(() -> {
            access().requireAdmin(actorId);
            return lifecycle().create(ownerId, ramGb, cpuCores, diskGb);
        });
    }

    @Override
    @Nonnull
    public CompletableFuture<InstanceInfo> startInstance(@Nonnull String actorId, @Nonnull String instanceId) {
        return guarded(actorId, instanceId, Action.START, () -> lifecycle().start(instanceId));
    }

    @Override
    @Nonnull
    public CompletableFuture<InstanceInfo> stopInstance(@Nonnull String actorId, @Nonnull String instanceId) {
        return guarded(actorId, instanceId, Action.STOP, () -> lifecycle().stop(instanceId));
    }

    @Override
    @Nonnull
    public CompletableFuture<InstanceInfo> restartInstance(@Nonnull String actorId, @Nonnull String instanceId) {
        return guarded(actorId, instanceId, Action.RESTART, () -> lifecycle().restart(instanceId));
    }

    @Override
    @Nonnull
    public CompletableFuture<InstanceInfo> suspendInstance(@Nonnull String actorId, @Nonnull String instanceId,
                                                           @Nonnull String reason) {
        Objects.requireNonNull(reason, "reason");
        return guarded(actorId, instanceId, Action.SUSPEND, () -> lifecycle().suspend(instanceId, reason, actorId));
    }

    @Override
    @Nonnull
    public CompletableFuture<InstanceInfo> unsuspendInstance(@Nonnull String actorId, @Nonnull String instanceId) {
        return guarded(actorId, instanceId, Action.UNSUSPEND, () -> lifecycle().unsuspend(instanceId, actorId));
    }

    @Override
    @Nonnull
    public CompletableFuture<InstanceInfo> resizeInstance(@Nonnull String actorId, @Nonnull String instanceId,
                                                          @Nonnull ResizeOptions options) {
        Objects.requireNonNull(options, "options");
        return guarded(actorId, instanceId, Action.RESIZE, () -> lifecycle().resize(instanceId, options));
    }

    @Override
    @Nonnull
    public CompletableFuture<InstanceInfo> cloneInstance(@Nonnull String actorId, @Nonnull String instanceId,
                                                         @Nullable String newId) {
        return guarded(actorId, instanceId, Action.CLONE, () -> lifecycle().clone(instanceId, newId));
    }

    @Override
    @Nonnull
    public CompletableFuture<InstanceInfo> migrateInstance(@Nonnull String actorId, @Nonnull String instanceId,
                                                           @Nonnull String targetPool) {
        Objects.requireNonNull(targetPool, "targetPool");
        return guarded(actorId, instanceId, Action.MIGRATE, () -> lifecycle().migrate(instanceId, targetPool));
    }

    @Override
    @Nonnull
    public CompletableFuture<Void> deleteInstance(@Nonnull String actorId, @Nonnull String instanceId,
                                                  @Nonnull String reason) {
        Objects.requireNonNull(reason, "reason");
        return guarded(actorId, instanceId, Action.DELETE, () -> {
            lifecycle().delete(instanceId, reason);
            return null;
        });
    }

    @Override
    @Nonnull
    public CompletableFuture<String> snapshotInstance(@Nonnull String actorId, @Nonnull String instanceId) {
        return guarded(actorId, instanceId, Action.SNAPSHOT, () -> lifecycle().snapshot(instanceId));
    }

    @Override
    @Nonnull
    public CompletableFuture<Void> restoreInstance(@Nonnull String actorId, @Nonnull String instanceId,
                                                   @Nonnull String snapshotName) {
        Objects.requireNonNull(snapshotName, "snapshotName");
        return guarded(actorId, instanceId, Action.RESTORE, () -> {
            lifecycle().restore(instanceId, snapshotName);
            return null;
        });
    }

    @Override
    @Nonnull
    public CompletableFuture<List<String>> listSnapshots(@Nonnull String actorId, @Nonnull String instanceId) {
        return guarded(actorId, instanceId, Action.SNAPSHOT, () -> lifecycle().listSnapshots(instanceId));
    }

    // ==================== Confirmation ====================

    @Override
    @Nonnull
    public PendingConfirmation requestReinstall(@Nonnull String actorId, @Nonnull String instanceId) {
        Objects.requireNonNull(actorId, "actorId");
        Instance instance = lifecycle().get(instanceId);
        access().check(actorId, instance, Action.REINSTALL);
        return warden.getConfirmations().request(
                "Reinstall instance " + instanceId + " (" + instance.getConfig() + "); all data will be lost",
                () -> lifecycle().reinstall(instanceId));
    }

    @Override
    @Nonnull
    public PendingConfirmation requestStopAll(@Nonnull String actorId) {
        Objects.requireNonNull(actorId, "actorId");
        access().requireAdmin(actorId);
        return warden.getConfirmations().request("Force-stop every instance on the host",
                lifecycle()::forceStopAll);
    }

    @Override
    @Nonnull
    public CompletableFuture<Void> confirm(@Nonnull String token) {
        Objects.requireNonNull(token, "token");
        return async(() -> {
            warden.getConfirmations().confirm(token);
            return null;
        });
    }

    @Override
    public boolean cancel(@Nonnull String token) {
        return warden.getConfirmations().cancel(token);
    }

    // ==================== Introspection ====================

    @Override
    @Nonnull
    public CompletableFuture<UsageReport> getUsage(@Nonnull String actorId, @Nonnull String instanceId) {
        return guarded(actorId, instanceId, Action.READ, () -> warden.getSampler().report(instanceId));
    }

    @Override
    @Nonnull
    public CompletableFuture<String> getProcessList(@Nonnull String actorId, @Nonnull String instanceId) {
        return guarded(actorId, instanceId, Action.INSPECT, () -> warden.getSampler().processList(instanceId));
    }

    @Override
    @Nonnull
    public CompletableFuture<String> getJournal(@Nonnull String actorId, @Nonnull String instanceId, int lines) {
        return guarded(actorId, instanceId, Action.INSPECT, () -> warden.getSampler().journal(instanceId, lines));
    }

    @Override
    @Nonnull
    public CompletableFuture<String> executeInInstance(@Nonnull String actorId, @Nonnull String instanceId,
                                                       @Nonnull String command) {
        Objects.requireNonNull(command, "command");
        return guarded(actorId, instanceId, Action.INSPECT, () -> warden.getSampler().runShell(instanceId, command));
    }

    // ==================== Sharing ====================

    @Override
    @Nonnull
    public CompletableFuture<InstanceInfo> shareInstance(@Nonnull String actorId, @Nonnull String instanceId,
                                                         @Nonnull String userId) {
        Objects.requireNonNull(userId, "userId");
        return guarded(actorId, instanceId, Action.SHARE, () -> lifecycle().share(instanceId, userId));
    }

    @Override
    @Nonnull
    public CompletableFuture<InstanceInfo> revokeShare(@Nonnull String actorId, @Nonnull String instanceId,
                                                       @Nonnull String userId) {
        Objects.requireNonNull(userId, "userId");
        return guarded(actorId, instanceId, Action.SHARE, () -> lifecycle().revokeShare(instanceId, userId));
    }

    // ==================== Ports ====================

    @Override
    @Nonnull
    public CompletableFuture<PortForwardInfo> allocatePort(@Nonnull String userId, @Nonnull String instanceId,
                                                           int internalPort) {
        return guarded(userId, instanceId, Action.FORWARD_PORTS,
                () -> ports().allocate(userId, instanceId, internalPort));
    }

    @Override
    @Nonnull
    public CompletableFuture<Void> releasePort(@Nonnull String userId, int hostPort) {
        Objects.requireNonNull(userId, "userId");
        return async(() -> {
            ports().release(userId, hostPort);
            return null;
        });
    }

    @Override
    public int addPortSlots(@Nonnull String actorId, @Nonnull String userId, int amount) {
        Objects.requireNonNull(userId, "userId");
        access().requireAdmin(actorId);
        return ports().addSlots(userId, amount);
    }

    @Override
    @Nonnull
    public List<PortForwardInfo> getPortForwards(@Nonnull String userId) {
        Objects.requireNonNull(userId, "userId");
        return new ArrayList<>(ports().getForwards(userId));
    }

    @Override
    public int getPortSlots(@Nonnull String userId) {
        Objects.requireNonNull(userId, "userId");
        return ports().getSlots(userId);
    }

    // ==================== Admins ====================

    @Override
    public void addAdmin(@Nonnull String actorId, @Nonnull String userId) {
        Objects.requireNonNull(userId, "userId");
        access().requireMainAdmin(actorId);
        store().mutate(state -> state.getAdmins().add(userId));
        store().save();
    }

    @Override
    public void removeAdmin(@Nonnull String actorId, @Nonnull String userId) {
        Objects.requireNonNull(userId, "userId");
        access().requireMainAdmin(actorId);
        store().mutate(state -> state.getAdmins().remove(userId));
        store().save();
    }

    @Override
    public boolean isAdmin(@Nonnull String userId) {
        return access().isAdmin(userId);
    }

    @Override
    public boolean isMainAdmin(@Nonnull String userId) {
        return store().read(state -> state.getAdmins().isMainAdmin(userId));
    }

    @Override
    @Nonnull
    public String getMainAdmin() {
        return store().read(state -> state.getAdmins().getMainAdminId());
    }

    @Override
    @Nonnull
    public Set<String> getAdmins() {
        return Collections.unmodifiableSet(store().read(state -> new LinkedHashSet<>(state.getAdmins().getDelegated())));
    }

    // ==================== Guardians ====================

    @Override
    public void setHostGuardianEnabled(@Nonnull String actorId, boolean enabled) {
        access().requireAdmin(actorId);
        warden.getHostGuardian().setEnabled(enabled);
    }

    @Override
    public boolean isHostGuardianEnabled() {
        return warden.getHostGuardian().isEnabled();
    }

    // ==================== Queries ====================

    @Override
    @Nullable
    public InstanceInfo getInstance(@Nonnull String instanceId) {
        Objects.requireNonNull(instanceId, "instanceId");
        return store().read(state -> {
            Instance instance = state.findInstance(instanceId);
            return instance != null ? instance.copy() : null;
        });
    }

    @Override
    @Nonnull
    public List<InstanceInfo> getInstancesByOwner(@Nonnull String ownerId) {
        Objects.requireNonNull(ownerId, "ownerId");
        return store().read(state -> copies(state.getInstances(ownerId)));
    }

    @Override
    @Nonnull
    public List<InstanceInfo> getInstancesSharedWith(@Nonnull String userId) {
        Objects.requireNonNull(userId, "userId");
        return store().read(state -> copies(state.getInstances(instance -> instance.isSharedWith(userId))));
    }

    @Override
    @Nonnull
    public Collection<InstanceInfo> getAllInstances() {
        return store().read(state -> copies(state.getAllInstances()));
    }

    @Override
    @Nonnull
    public List<SuspensionInfo> getSuspensionHistory(@Nonnull String instanceId, int limit) {
        Objects.requireNonNull(instanceId, "instanceId");
        List<SuspensionEntry> history = store().read(state ->
                new ArrayList<>(state.requireInstance(instanceId).getSuspensionHistory()));
        Collections.reverse(history);
        if (limit > 0 && history.size() > limit) {
            history = history.subList(0, limit);
        }
        return new ArrayList<>(history);
    }

    @Override
    @Nonnull
    public FleetStats getStats() {
        return store().read(this::computeStats);
    }

    private FleetStats computeStats(FleetState state) {
        List<Instance> all = state.getAllInstances();
        int running = 0;
        int stopped = 0;
        int suspended = 0;
        long ram = 0;
        long cpu = 0;
        long disk = 0;
        for (Instance instance : all) {
            InstanceStatus status = instance.getInstanceStatus();
            if (status == InstanceStatus.RUNNING) {
                running++;
            } else if (status == InstanceStatus.STOPPED) {
                stopped++;
            } else {
                suspended++;
            }
            ram += instance.getRamGb();
            cpu += instance.getCpuCores();
            disk += instance.getDiskGb();
        }
        int owners = (int) state.getOwnerIds().stream()
                .filter(ownerId -> state.countInstances(ownerId) > 0)
                .count();
        return new FleetStatsImpl(owners, all.size(), running, stopped, suspended,
                state.getAdmins().size(), ram, cpu, disk);
    }

    // ==================== Helpers ====================

    private <T> CompletableFuture<T> guarded(String actorId, String instanceId, Action action, Supplier<T> operation) {
        Objects.requireNonNull(actorId, "actorId");
        Objects.requireNonNull(instanceId, "instanceId");
        return async(() -> {
            Instance instance = lifecycle().get(instanceId);
            access().check(actorId, instance, action);
            return operation.get();
        });
    }

    private <T> CompletableFuture<T> async(Supplier<T> operation) {
        return CompletableFuture.supplyAsync(operation, warden.getAsyncExecutor());
    }

    private static List<InstanceInfo> copies(List<Instance> instances) {
        return instances.stream().<InstanceInfo>map(Instance::copy).collect(Collectors.toList());
    }

    private InstanceLifecycle lifecycle() {
        return warden.getLifecycle();
    }

    private InstanceAccess access() {
        return warden.getAccess();
    }

    private PortAllocator ports() {
        return warden.getPortAllocator();
    }

    private InstanceStore store() {
        return warden.getStore();
    }

    private record FleetStatsImpl(
            int totalOwners,
            int totalInstances,
            int runningInstances,
            int stoppedInstances,
            int suspendedInstances,
            int totalAdmins,
            long totalRamGb,
            long totalCpuCores,
            long totalDiskGb
    ) implements FleetStats {

        @Override
        public int getTotalOwners() {
            return totalOwners;
        }

        @Override
        public int getTotalInstances() {
            return totalInstances;
        }

        @Override
        public int getRunningInstances() {
            return runningInstances;
        }

        @Override
        public int getStoppedInstances() {
            return stoppedInstances;
        }

        @Override
        public int getSuspendedInstances() {
            return suspendedInstances;
        }

        @Override
        public int getTotalAdmins() {
            return totalAdmins;
        }

        @Override
        public long getTotalRamGb() {
            return totalRamGb;
        }

        @Override
        public long getTotalCpuCores() {
            return totalCpuCores;
        }

        @Override
        public long getTotalDiskGb() {
            return totalDiskGb;
        }
    }
}
