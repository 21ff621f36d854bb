package me.internalizable.warden.instance;

import me.internalizable.warden.api.WardenAPI.ResizeOptions;
import me.internalizable.warden.api.error.CommandExecutionException;
import me.internalizable.warden.api.error.InstanceNotFoundException;
import me.internalizable.warden.api.error.StateConflictException;
import me.internalizable.warden.api.error.ValidationException;
import me.internalizable.warden.command.InstanceTool;
import me.internalizable.warden.command.RecordingCommandExecutor;
import me.internalizable.warden.config.WardenConfig;
import me.internalizable.warden.store.InstanceStore;
import me.internalizable.warden.store.PortForward;
import me.internalizable.warden.support.MutableClock;
import me.internalizable.warden.support.RecordingNotifications;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link InstanceLifecycle}.
 */
class InstanceLifecycleTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private InstanceStore store;
    private RecordingCommandExecutor executor;
    private RecordingNotifications notifications;
    private MutableClock clock;
    private InstanceLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        store = InstanceStore.empty(tempDir, "1");
        executor = new RecordingCommandExecutor();
        notifications = new RecordingNotifications();
        clock = new MutableClock(NOW);
        lifecycle = new InstanceLifecycle(new WardenConfig(), store, executor, new InstanceTool("lxc"),
                new OwnerNotifier(notifications, notifications), clock);
    }

    private Instance create() {
        Instance instance = lifecycle.create("42", 4, 2, 10);
        executor.clear();
        return instance;
    }

    private Instance reload(String instanceId) {
        return InstanceStore.load(tempDir, "1").read(state -> state.requireInstance(instanceId).copy());
    }

    @Nested
    @DisplayName("Create")
    class Create {

        @Test
        @DisplayName("create runs init, limits and start, then records a running instance")
        void create_commandsAndRecord() {
            Instance instance = lifecycle.create("42", 4, 2, 10);

            assertEquals(List.of(
                    "lxc init ubuntu:22.04 vps-42-1 --storage default",
                    "lxc config set vps-42-1 limits.memory 4096MB",
                    "lxc config set vps-42-1 limits.cpu 2",
                    "lxc config device set vps-42-1 root size 10GB",
                    "lxc start vps-42-1"), executor.getCommands());
            assertEquals("vps-42-1", instance.getId());
            assertEquals("4GB RAM / 2 CPU / 10GB Disk", instance.getConfig());
            assertEquals(InstanceStatus.RUNNING, instance.getInstanceStatus());
            assertEquals(NOW, instance.getCreatedAt());
            assertEquals(InstanceStatus.RUNNING, reload("vps-42-1").getInstanceStatus());
            assertEquals(List.of("42"), notifications.getGranted());
        }

        @Test
        @DisplayName("ids count up per owner and skip taken ones")
        void create_sequentialIds() {
            lifecycle.create("42", 1, 1, 5);
            lifecycle.create("42", 1, 1, 5);
            lifecycle.delete("vps-42-1", "cleanup");

            assertEquals("vps-42-3", lifecycle.create("42", 1, 1, 5).getId());
            assertEquals("vps-77-1", lifecycle.create("77", 1, 1, 5).getId());
        }

        @Test
        @DisplayName("non-positive resources are rejected before any command")
        void create_invalidResources() {
            assertThrows(ValidationException.class, () -> lifecycle.create("42", 0, 2, 10));
            assertTrue(executor.getCommands().isEmpty());
        }

        @Test
        @DisplayName("a failed command records nothing and frees the id")
        void create_failure() {
            executor.fail("lxc config set vps-42-1 limits.cpu", "Error: invalid value");

            CommandExecutionException e = assertThrows(CommandExecutionException.class,
                    () -> lifecycle.create("42", 4, 2, 10));

            assertEquals("Error: invalid value", e.getMessage());
            assertFalse(store.<Boolean>read(state -> state.hasInstance("vps-42-1")));
            assertTrue(notifications.getGranted().isEmpty());

            executor.forget("lxc config set vps-42-1 limits.cpu");
            assertEquals("vps-42-1", lifecycle.create("42", 4, 2, 10).getId());
        }

        @Test
        @DisplayName("a failing ownership grant does not fail the create")
        void create_grantFailureIgnored() {
            notifications.setFailing(true);

            Instance instance = lifecycle.create("42", 4, 2, 10);

            assertTrue(store.<Boolean>read(state -> state.hasInstance(instance.getId())));
        }
    }

    @Nested
    @DisplayName("Delete")
    class Delete {

        @Test
        @DisplayName("delete force-stops, deletes and drops the record and its forwards")
        void delete_removesEverything() {
            create();
            store.mutate(state -> {
                state.getPorts().addSlots("42", 1);
                state.getPorts().addForward("42", new PortForward("vps-42-1", 22, 10000));
            });

            lifecycle.delete("vps-42-1", "Terms of service");

            assertEquals(List.of("lxc stop vps-42-1 --force", "lxc delete vps-42-1 --force"), executor.getCommands());
            assertFalse(store.<Boolean>read(state -> state.hasInstance("vps-42-1")));
            assertTrue(store.<Boolean>read(state -> state.getPorts().getForwards("42").isEmpty()));
            assertEquals(List.of("42"), notifications.getRevoked());
            assertEquals(List.of("42: Your instance vps-42-1 has been deleted. Reason: Terms of service"),
                    notifications.getMessages());
        }

        @Test
        @DisplayName("the ownership role stays while other instances remain")
        void delete_keepsRoleWithOtherInstances() {
            create();
            lifecycle.create("42", 1, 1, 5);

            lifecycle.delete("vps-42-1", "cleanup");

            assertTrue(notifications.getRevoked().isEmpty());
        }

        @Test
        @DisplayName("a failing stop does not prevent the delete")
        void delete_stopFailureIgnored() {
            create();
            executor.fail("lxc stop", "Error: already stopped");

            lifecycle.delete("vps-42-1", "cleanup");

            assertFalse(store.<Boolean>read(state -> state.hasInstance("vps-42-1")));
        }

        @Test
        @DisplayName("a failing delete keeps the record")
        void delete_failureKeepsRecord() {
            create();
            executor.fail("lxc delete", "Error: busy");

            assertThrows(CommandExecutionException.class, () -> lifecycle.delete("vps-42-1", "cleanup"));

            assertTrue(store.<Boolean>read(state -> state.hasInstance("vps-42-1")));
        }

        @Test
        @DisplayName("unknown instances are reported")
        void delete_unknown() {
            assertThrows(InstanceNotFoundException.class, () -> lifecycle.delete("vps-42-9", "x"));
        }
    }

    @Nested
    @DisplayName("Start, stop and restart")
    class StartStop {

        @Test
        @DisplayName("stop then start round-trips through the tool")
        void stopThenStart() {
            create();

            assertEquals(InstanceStatus.STOPPED, lifecycle.stop("vps-42-1").getInstanceStatus());
            assertEquals(InstanceStatus.RUNNING, lifecycle.start("vps-42-1").getInstanceStatus());

            assertEquals(List.of("lxc stop vps-42-1", "lxc start vps-42-1"), executor.getCommands());
        }

        @Test
        @DisplayName("same-state requests issue no command")
        void sameState_noCommand() {
            create();

            lifecycle.start("vps-42-1");
            lifecycle.stop("vps-42-1");
            lifecycle.stop("vps-42-1");

            assertEquals(List.of("lxc stop vps-42-1"), executor.getCommands());
        }

        @Test
        @DisplayName("a failed stop leaves the record running")
        void stop_failure() {
            create();
            executor.fail("lxc stop", "Error: timeout");

            assertThrows(CommandExecutionException.class, () -> lifecycle.stop("vps-42-1"));

            assertEquals(InstanceStatus.RUNNING, lifecycle.get("vps-42-1").getInstanceStatus());
        }

        @Test
        @DisplayName("restart of a running instance uses the restart command")
        void restart_running() {
            create();

            assertEquals(InstanceStatus.RUNNING, lifecycle.restart("vps-42-1").getInstanceStatus());
            assertEquals(List.of("lxc restart vps-42-1"), executor.getCommands());
        }

        @Test
        @DisplayName("restart of a stopped instance starts it")
        void restart_stopped() {
            create();
            lifecycle.stop("vps-42-1");
            executor.clear();

            assertEquals(InstanceStatus.RUNNING, lifecycle.restart("vps-42-1").getInstanceStatus());
            assertEquals(List.of("lxc start vps-42-1"), executor.getCommands());
        }

        @Test
        @DisplayName("suspended instances can only leave through unsuspend")
        void suspended_rejected() {
            create();
            lifecycle.suspend("vps-42-1", "abuse", "1");
            executor.clear();

            assertThrows(StateConflictException.class, () -> lifecycle.start("vps-42-1"));
            assertThrows(StateConflictException.class, () -> lifecycle.stop("vps-42-1"));
            assertThrows(StateConflictException.class, () -> lifecycle.restart("vps-42-1"));
            assertTrue(executor.getCommands().isEmpty());
        }

        @Test
        @DisplayName("force-stop-all marks only running records stopped")
        void forceStopAll() {
            create();
            lifecycle.create("42", 1, 1, 5);
            lifecycle.create("77", 1, 1, 5);
            lifecycle.suspend("vps-42-2", "abuse", "1");
            lifecycle.stop("vps-77-1");
            executor.clear();

            assertEquals(1, lifecycle.forceStopAll());

            assertEquals(List.of("lxc stop --all --force"), executor.getCommands());
            assertEquals(InstanceStatus.STOPPED, reload("vps-42-1").getInstanceStatus());
            assertEquals(InstanceStatus.SUSPENDED, reload("vps-42-2").getInstanceStatus());
            assertEquals(InstanceStatus.STOPPED, reload("vps-77-1").getInstanceStatus());
        }
    }

    @Nested
    @DisplayName("Suspension")
    class Suspension {

        @Test
        @DisplayName("suspend stops the instance, records the entry and notifies the owner")
        void suspend_recordsEntry() {
            create();

            Instance suspended = lifecycle.suspend("vps-42-1", "Crypto mining", "9");

            assertEquals(List.of("lxc stop vps-42-1"), executor.getCommands());
            assertTrue(suspended.isSuspended());
            assertEquals(List.of(new SuspensionEntry(NOW, "Crypto mining", "9")), suspended.getSuspensionHistory());
            assertTrue(reload("vps-42-1").isSuspended());
            assertEquals(List.of("42: Your instance vps-42-1 has been suspended. Reason: Crypto mining"),
                    notifications.getMessages());
        }

        @Test
        @DisplayName("only running instances can be suspended")
        void suspend_notRunning() {
            create();
            lifecycle.stop("vps-42-1");

            assertThrows(StateConflictException.class, () -> lifecycle.suspend("vps-42-1", "abuse", "1"));
        }

        @Test
        @DisplayName("unsuspend starts the instance and keeps the history")
        void unsuspend_startsAndKeepsHistory() {
            create();
            lifecycle.suspend("vps-42-1", "abuse", "1");
            executor.clear();

            Instance instance = lifecycle.unsuspend("vps-42-1", "1");

            assertEquals(List.of("lxc start vps-42-1"), executor.getCommands());
            assertEquals(InstanceStatus.RUNNING, instance.getInstanceStatus());
            assertEquals(1, instance.getSuspensionCount());
            assertThrows(StateConflictException.class, () -> lifecycle.unsuspend("vps-42-1", "1"));
        }

        @Test
        @DisplayName("a notification failure does not undo the suspension")
        void suspend_notificationFailure() {
            create();
            notifications.setFailing(true);

            lifecycle.suspend("vps-42-1", "abuse", "1");

            assertTrue(reload("vps-42-1").isSuspended());
        }
    }

    @Nested
    @DisplayName("Resize")
    class Resize {

        @Test
        @DisplayName("a delta on a running instance stops, applies and restarts")
        void resize_deltaRunning() {
            create();

            Instance resized = lifecycle.resize("vps-42-1", ResizeOptions.delta().ramGb(2).build());

            assertEquals(List.of(
                    "lxc stop vps-42-1",
                    "lxc config set vps-42-1 limits.memory 6144MB",
                    "lxc start vps-42-1"), executor.getCommands());
            assertEquals(new Resources(6, 2, 10), resized.getResources());
            assertEquals("6GB RAM / 2 CPU / 10GB Disk", resized.getConfig());
            assertEquals(InstanceStatus.RUNNING, resized.getInstanceStatus());
            assertEquals(new Resources(6, 2, 10), reload("vps-42-1").getResources());
        }

        @Test
        @DisplayName("absolute values on a stopped instance leave it stopped")
        void resize_absoluteStopped() {
            create();
            lifecycle.stop("vps-42-1");
            executor.clear();

            Instance resized = lifecycle.resize("vps-42-1", ResizeOptions.absolute().cpuCores(4).diskGb(20).build());

            assertEquals(List.of(
                    "lxc config set vps-42-1 limits.cpu 4",
                    "lxc config device set vps-42-1 root size 20GB"), executor.getCommands());
            assertEquals(new Resources(4, 4, 20), resized.getResources());
            assertEquals(InstanceStatus.STOPPED, resized.getInstanceStatus());
        }

        @Test
        @DisplayName("an unchanged resize does nothing")
        void resize_unchanged() {
            create();

            lifecycle.resize("vps-42-1", ResizeOptions.absolute().ramGb(4).build());

            assertTrue(executor.getCommands().isEmpty());
        }

        @Test
        @DisplayName("a result that is not positive is rejected before any command")
        void resize_nonPositive() {
            create();

            assertThrows(ValidationException.class,
                    () -> lifecycle.resize("vps-42-1", ResizeOptions.delta().cpuCores(-2).build()));
            assertTrue(executor.getCommands().isEmpty());
        }

        @Test
        @DisplayName("a failure part-way keeps what was applied and leaves the instance stopped")
        void resize_partialFailure() {
            create();
            executor.fail("lxc config set vps-42-1 limits.cpu", "Error: too many cores");

            assertThrows(CommandExecutionException.class, () -> lifecycle.resize("vps-42-1",
                    ResizeOptions.absolute().ramGb(8).cpuCores(64).build()));

            Instance stored = reload("vps-42-1");
            assertEquals(new Resources(8, 2, 10), stored.getResources());
            assertEquals(InstanceStatus.STOPPED, stored.getInstanceStatus());
        }
    }

    @Nested
    @DisplayName("Reinstall, clone and migrate")
    class Rebuild {

        @Test
        @DisplayName("reinstall recreates the instance with its resources and a new creation time")
        void reinstall_recreates() {
            create();
            clock.advance(Duration.ofDays(3));

            Instance instance = lifecycle.reinstall("vps-42-1");

            assertEquals(List.of(
                    "lxc stop vps-42-1 --force",
                    "lxc delete vps-42-1 --force",
                    "lxc init ubuntu:22.04 vps-42-1 --storage default",
                    "lxc config set vps-42-1 limits.memory 4096MB",
                    "lxc config set vps-42-1 limits.cpu 2",
                    "lxc config device set vps-42-1 root size 10GB",
                    "lxc start vps-42-1"), executor.getCommands());
            assertEquals(InstanceStatus.RUNNING, instance.getInstanceStatus());
            assertEquals(NOW.plus(Duration.ofDays(3)), instance.getCreatedAt());
        }

        @Test
        @DisplayName("a reinstall that fails after the delete leaves the record stopped")
        void reinstall_failureAfterDelete() {
            create();
            executor.fail("lxc init", "Error: image not found");

            assertThrows(CommandExecutionException.class, () -> lifecycle.reinstall("vps-42-1"));

            assertEquals(InstanceStatus.STOPPED, reload("vps-42-1").getInstanceStatus());
        }

        @Test
        @DisplayName("suspended instances cannot be reinstalled or migrated")
        void suspended_rejected() {
            create();
            lifecycle.suspend("vps-42-1", "abuse", "1");

            assertThrows(StateConflictException.class, () -> lifecycle.reinstall("vps-42-1"));
            assertThrows(StateConflictException.class, () -> lifecycle.migrate("vps-42-1", "fast"));
        }

        @Test
        @DisplayName("clone copies under the same owner with a timestamped id")
        void clone_defaultId() {
            create();
            lifecycle.share("vps-42-1", "77");
            executor.clear();

            Instance copy = lifecycle.clone("vps-42-1", null);

            assertEquals("vps-42-1-clone-20240301-120000", copy.getId());
            assertEquals(List.of("lxc copy vps-42-1 vps-42-1-clone-20240301-120000",
                    "lxc start vps-42-1-clone-20240301-120000"), executor.getCommands());
            assertEquals("42", copy.getOwnerId());
            assertEquals(new Resources(4, 2, 10), copy.getResources());
            assertTrue(copy.getSharedWith().isEmpty());
            assertEquals(InstanceStatus.RUNNING, reload(copy.getId()).getInstanceStatus());
        }

        @Test
        @DisplayName("clone refuses an id already in use")
        void clone_idInUse() {
            create();
            lifecycle.create("42", 1, 1, 5);
            executor.clear();

            assertThrows(ValidationException.class, () -> lifecycle.clone("vps-42-1", "vps-42-2"));
            assertTrue(executor.getCommands().isEmpty());
        }

        @Test
        @DisplayName("migrate copies through a temporary instance and ends running")
        void migrate_running() {
            create();

            Instance migrated = lifecycle.migrate("vps-42-1", "fast");

            assertEquals(List.of(
                    "lxc stop vps-42-1",
                    "lxc copy vps-42-1 vps-42-1-temp-1709294400 --storage fast",
                    "lxc delete vps-42-1 --force",
                    "lxc rename vps-42-1-temp-1709294400 vps-42-1",
                    "lxc start vps-42-1"), executor.getCommands());
            assertEquals(InstanceStatus.RUNNING, migrated.getInstanceStatus());
        }

        @Test
        @DisplayName("a failed copy keeps the original and leaves it stopped")
        void migrate_copyFailure() {
            create();
            executor.fail("lxc copy", "Error: pool not found");

            assertThrows(CommandExecutionException.class, () -> lifecycle.migrate("vps-42-1", "fast"));

            assertTrue(executor.getCommandsStartingWith("lxc delete").isEmpty());
            assertEquals(InstanceStatus.STOPPED, reload("vps-42-1").getInstanceStatus());
        }

        @Test
        @DisplayName("a blank target pool is rejected")
        void migrate_blankPool() {
            create();

            assertThrows(ValidationException.class, () -> lifecycle.migrate("vps-42-1", " "));
        }
    }

    @Nested
    @DisplayName("Snapshots and sharing")
    class SnapshotsAndSharing {

        @Test
        @DisplayName("snapshots are named after the instance and the time")
        void snapshot_name() {
            create();

            assertEquals("vps-42-1-backup-20240301-120000", lifecycle.snapshot("vps-42-1"));
            assertEquals(List.of("lxc snapshot vps-42-1 vps-42-1-backup-20240301-120000"), executor.getCommands());
        }

        @Test
        @DisplayName("listSnapshots keeps only the instance's snapshots")
        void listSnapshots_filters() {
            create();
            executor.respond("lxc list --type snapshot", "vps-42-1-backup-20240301-120000\n"
                    + "vps-77-1-backup-20240301-120000\n\nvps-42-1-backup-20240302-080000");

            assertEquals(List.of("vps-42-1-backup-20240301-120000", "vps-42-1-backup-20240302-080000"),
                    lifecycle.listSnapshots("vps-42-1"));
        }

        @Test
        @DisplayName("no snapshots yields an empty list")
        void listSnapshots_empty() {
            create();

            assertTrue(lifecycle.listSnapshots("vps-42-1").isEmpty());
        }

        @Test
        @DisplayName("restore needs a snapshot name")
        void restore() {
            create();

            lifecycle.restore("vps-42-1", "vps-42-1-backup-20240301-120000");

            assertEquals(List.of("lxc restore vps-42-1 vps-42-1-backup-20240301-120000"), executor.getCommands());
            assertThrows(ValidationException.class, () -> lifecycle.restore("vps-42-1", ""));
        }

        @Test
        @DisplayName("sharing rejects the owner, duplicates and unknown grants")
        void share_rules() {
            create();

            assertEquals(Set.of("77"), lifecycle.share("vps-42-1", "77").getSharedWith());
            assertThrows(ValidationException.class, () -> lifecycle.share("vps-42-1", "77"));
            assertThrows(ValidationException.class, () -> lifecycle.share("vps-42-1", "42"));

            assertTrue(lifecycle.revokeShare("vps-42-1", "77").getSharedWith().isEmpty());
            assertThrows(ValidationException.class, () -> lifecycle.revokeShare("vps-42-1", "77"));
            assertTrue(reload("vps-42-1").getSharedWith().isEmpty());
        }
    }
}
