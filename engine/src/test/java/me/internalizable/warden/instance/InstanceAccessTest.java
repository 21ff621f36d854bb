package me.internalizable.warden.instance;

import me.internalizable.warden.api.error.AccessDeniedException;
import me.internalizable.warden.api.error.ErrorKind;
import me.internalizable.warden.instance.InstanceAccess.Action;
import me.internalizable.warden.store.InstanceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link InstanceAccess}.
 */
class InstanceAccessTest {

    @TempDir
    Path tempDir;

    private InstanceAccess access;
    private Instance instance;

    @BeforeEach
    void setUp() {
        InstanceStore store = InstanceStore.empty(tempDir, "1");
        store.mutate(state -> state.getAdmins().add("9"));
        access = new InstanceAccess(store);

        instance = new Instance("vps-42-1", "42", new Resources(2, 1, 10), Instant.EPOCH);
        instance.addSharedUser("77");
    }

    @ParameterizedTest
    @EnumSource(Action.class)
    @DisplayName("admins may do anything, even on suspended instances")
    void check_admins(Action action) {
        instance.suspend(new SuspensionEntry(Instant.EPOCH, "abuse", "1"));

        assertDoesNotThrow(() -> access.check("1", instance, action));
        assertDoesNotThrow(() -> access.check("9", instance, action));
    }

    @ParameterizedTest
    @EnumSource(value = Action.class, names = {"READ", "START", "STOP", "RESTART", "REINSTALL", "SHARE", "FORWARD_PORTS"})
    @DisplayName("the owner may operate, reinstall, share and forward ports")
    void check_ownerAllowed(Action action) {
        assertDoesNotThrow(() -> access.check("42", instance, action));
    }

    @ParameterizedTest
    @EnumSource(value = Action.class, names = {"SUSPEND", "UNSUSPEND", "RESIZE", "CLONE", "MIGRATE", "DELETE",
            "SNAPSHOT", "RESTORE", "INSPECT"})
    @DisplayName("admin-only actions are refused to the owner")
    void check_ownerDenied(Action action) {
        AccessDeniedException e = assertThrows(AccessDeniedException.class,
                () -> access.check("42", instance, action));

        assertEquals(ErrorKind.FORBIDDEN, e.getKind());
    }

    @ParameterizedTest
    @EnumSource(value = Action.class, names = {"READ", "START", "STOP", "RESTART"})
    @DisplayName("a shared user may read and operate")
    void check_sharedAllowed(Action action) {
        assertDoesNotThrow(() -> access.check("77", instance, action));
    }

    @ParameterizedTest
    @EnumSource(value = Action.class, names = {"REINSTALL", "SHARE", "FORWARD_PORTS", "DELETE"})
    @DisplayName("a shared user gets no destructive rights")
    void check_sharedDenied(Action action) {
        assertThrows(AccessDeniedException.class, () -> access.check("77", instance, action));
    }

    @Test
    @DisplayName("strangers may not even read")
    void check_stranger() {
        assertThrows(AccessDeniedException.class, () -> access.check("5", instance, Action.READ));
    }

    @Test
    @DisplayName("a suspended instance only accepts reads from non-admins")
    void check_suspended() {
        instance.suspend(new SuspensionEntry(Instant.EPOCH, "abuse", "1"));

        assertDoesNotThrow(() -> access.check("42", instance, Action.READ));
        assertDoesNotThrow(() -> access.check("77", instance, Action.READ));
        assertThrows(AccessDeniedException.class, () -> access.check("42", instance, Action.START));
        assertThrows(AccessDeniedException.class, () -> access.check("77", instance, Action.STOP));
    }

    @Test
    @DisplayName("admin checks distinguish main and delegated admins")
    void requireAdmin_levels() {
        assertDoesNotThrow(() -> access.requireAdmin("9"));
        assertDoesNotThrow(() -> access.requireMainAdmin("1"));
        assertThrows(AccessDeniedException.class, () -> access.requireMainAdmin("9"));
        assertThrows(AccessDeniedException.class, () -> access.requireAdmin("42"));
    }
}
