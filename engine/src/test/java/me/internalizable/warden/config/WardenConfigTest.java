package me.internalizable.warden.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link WardenConfig}.
 */
class WardenConfigTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("a missing file is created with defaults")
        void load_missingFile_createsDefaults() throws IOException {
            Path path = tempDir.resolve("conf/warden.yml");

            WardenConfig config = WardenConfig.load(path);

            assertTrue(Files.exists(path));
            assertEquals("lxc", config.getToolName());
            assertNull(config.getToolPath());
            assertEquals("0", config.getMainAdminId());
            assertEquals("data", config.getDataDirectory());
            assertEquals("default", config.getDefaultStoragePool());
            assertEquals("ubuntu:22.04", config.getBaseImage());
            assertEquals("vps", config.getInstancePrefix());
            assertEquals(Duration.ofSeconds(120), config.getCommandTimeout());
            assertEquals(Duration.ofSeconds(60), config.getConfirmationWindow());
            assertEquals(90, config.getMonitor().getCpuThreshold());
            assertEquals(90, config.getMonitor().getRamThreshold());
            assertEquals(60, config.getMonitor().getHostCheckIntervalSeconds());
            assertEquals(600, config.getMonitor().getInstanceCheckIntervalSeconds());
            assertTrue(config.getMonitor().isHostGuardianEnabled());
            assertEquals(10000, config.getPorts().getRangeStart());
            assertEquals(19999, config.getPorts().getRangeEnd());
        }

        @Test
        @DisplayName("the written defaults load back and validate")
        void load_writtenDefaults_reload() throws IOException {
            Path path = tempDir.resolve("warden.yml");
            WardenConfig.load(path);

            String yaml = Files.readString(path);
            assertFalse(yaml.contains("!!"), "saved file should be a plain mapping");
            assertFalse(yaml.contains("commandTimeout:"), "derived durations are not saved");

            WardenConfig reloaded = WardenConfig.load(path);
            assertDoesNotThrow(reloaded::validate);
            assertEquals(600, reloaded.getMonitor().getInstanceCheckIntervalSeconds());
        }

        @Test
        @DisplayName("partial sections keep defaults for omitted keys")
        void load_partialFile() throws IOException {
            Path path = tempDir.resolve("warden.yml");
            Files.writeString(path, String.join("\n",
                    "toolName: incus",
                    "mainAdminId: '42'",
                    "monitor:",
                    "  cpuThreshold: 80",
                    "  hostGuardianEnabled: false",
                    "ports:",
                    "  rangeStart: 20000",
                    "  rangeEnd: 20010",
                    ""));

            WardenConfig config = WardenConfig.load(path);

            assertEquals("incus", config.getToolName());
            assertEquals("42", config.getMainAdminId());
            assertEquals(80, config.getMonitor().getCpuThreshold());
            assertEquals(90, config.getMonitor().getRamThreshold());
            assertFalse(config.getMonitor().isHostGuardianEnabled());
            assertEquals(20000, config.getPorts().getRangeStart());
            assertEquals(20010, config.getPorts().getRangeEnd());
            assertEquals("ubuntu:22.04", config.getBaseImage());
        }
    }

    @Nested
    @DisplayName("Environment overrides")
    class Environment {

        @Test
        @DisplayName("variables override file values")
        void applyEnvironment_overrides() {
            WardenConfig config = new WardenConfig();

            config.applyEnvironment(Map.of(
                    "TOOL_PATH", "/snap/bin/lxc",
                    "MAIN_ADMIN_ID", " 1234 ",
                    "DATA_DIR", "/var/lib/warden",
                    "DEFAULT_STORAGE_POOL", "fast",
                    "BASE_IMAGE", "debian:12",
                    "COMMAND_TIMEOUT", "30",
                    "CPU_THRESHOLD", "75",
                    "RAM_THRESHOLD", "85",
                    "HOST_CHECK_INTERVAL", "15",
                    "CHECK_INTERVAL", "120"));

            assertEquals("/snap/bin/lxc", config.getToolPath());
            assertEquals("1234", config.getMainAdminId());
            assertEquals("/var/lib/warden", config.getDataDirectory());
            assertEquals("fast", config.getDefaultStoragePool());
            assertEquals("debian:12", config.getBaseImage());
            assertEquals(Duration.ofSeconds(30), config.getCommandTimeout());
            assertEquals(75, config.getMonitor().getCpuThreshold());
            assertEquals(85, config.getMonitor().getRamThreshold());
            assertEquals(15, config.getMonitor().getHostCheckIntervalSeconds());
            assertEquals(120, config.getMonitor().getInstanceCheckIntervalSeconds());
        }

        @Test
        @DisplayName("absent variables leave values untouched")
        void applyEnvironment_absent() {
            WardenConfig config = new WardenConfig();

            config.applyEnvironment(Map.of("UNRELATED", "x"));

            assertEquals("0", config.getMainAdminId());
            assertEquals(90, config.getMonitor().getCpuThreshold());
        }

        @Test
        @DisplayName("malformed numbers fail fast")
        void applyEnvironment_malformedNumber() {
            WardenConfig config = new WardenConfig();

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> config.applyEnvironment(Map.of("CPU_THRESHOLD", "ninety")));
            assertEquals("CPU_THRESHOLD must be an integer, got 'ninety'", e.getMessage());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("defaults are valid")
        void validate_defaults() {
            assertDoesNotThrow(() -> new WardenConfig().validate());
        }

        @Test
        @DisplayName("thresholds must be percentages")
        void validate_thresholds() {
            WardenConfig config = new WardenConfig();
            config.getMonitor().setRamThreshold(101);

            assertThrows(IllegalArgumentException.class, config::validate);

            config.getMonitor().setRamThreshold(0);
            assertThrows(IllegalArgumentException.class, config::validate);
        }

        @Test
        @DisplayName("intervals and timeouts must be positive")
        void validate_positive() {
            WardenConfig config = new WardenConfig();
            config.getMonitor().setInstanceCheckIntervalSeconds(0);
            assertThrows(IllegalArgumentException.class, config::validate);

            WardenConfig timeout = new WardenConfig();
            timeout.setCommandTimeoutSeconds(-1);
            assertThrows(IllegalArgumentException.class, timeout::validate);
        }

        @Test
        @DisplayName("blank identifiers are rejected")
        void validate_blank() {
            WardenConfig config = new WardenConfig();
            config.setMainAdminId(" ");

            assertThrows(IllegalArgumentException.class, config::validate);
        }

        @Test
        @DisplayName("the port range must be ordered and in bounds")
        void validate_portRange() {
            WardenConfig reversed = new WardenConfig();
            reversed.getPorts().setRangeStart(20000);
            reversed.getPorts().setRangeEnd(10000);
            assertThrows(IllegalArgumentException.class, reversed::validate);

            WardenConfig outOfBounds = new WardenConfig();
            outOfBounds.getPorts().setRangeEnd(70000);
            assertThrows(IllegalArgumentException.class, outOfBounds::validate);
        }
    }
}
