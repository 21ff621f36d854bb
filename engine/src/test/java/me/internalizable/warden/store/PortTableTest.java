package me.internalizable.warden.store;

import me.internalizable.warden.api.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link PortTable}.
 */
class PortTableTest {

    private PortTable table;

    @BeforeEach
    void setUp() {
        table = new PortTable();
    }

    @Test
    @DisplayName("slots start at zero and cannot go negative")
    void addSlots_bounds() {
        assertEquals(0, table.getSlots("42"));
        assertEquals(3, table.addSlots("42", 3));
        assertEquals(1, table.addSlots("42", -2));

        assertThrows(ValidationException.class, () -> table.addSlots("42", -2));
        assertEquals(1, table.getSlots("42"));
    }

    @Test
    @DisplayName("host ports are unique across all users")
    void addForward_uniqueHostPort() {
        table.addForward("42", new PortForward("vps-42-1", 22, 10000));

        assertThrows(IllegalStateException.class,
                () -> table.addForward("77", new PortForward("vps-77-1", 80, 10000)));
        assertEquals(Set.of(10000), table.usedHostPorts());
    }

    @Test
    @DisplayName("removeForward only finds the user's own forwards")
    void removeForward_ownOnly() {
        table.addForward("42", new PortForward("vps-42-1", 22, 10000));

        assertNull(table.removeForward("77", 10000));
        assertEquals(new PortForward("vps-42-1", 22, 10000), table.removeForward("42", 10000));
        assertEquals(0, table.countForwards("42"));
    }

    @Test
    @DisplayName("removeForwardsFor drops every forward targeting an instance")
    void removeForwardsFor_instance() {
        table.addForward("42", new PortForward("vps-42-1", 22, 10000));
        table.addForward("42", new PortForward("vps-42-2", 22, 10001));
        table.addForward("77", new PortForward("vps-42-1", 80, 10002));

        Map<String, List<PortForward>> removed = table.removeForwardsFor("vps-42-1");

        assertEquals(Set.of("42", "77"), removed.keySet());
        assertEquals(List.of(new PortForward("vps-42-2", 22, 10001)), table.getForwards("42"));
        assertTrue(table.getForwards("77").isEmpty());
        assertEquals(Set.of(10001), table.usedHostPorts());
    }
}
