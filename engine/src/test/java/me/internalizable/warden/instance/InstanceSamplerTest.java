package me.internalizable.warden.instance;

import me.internalizable.warden.api.WardenAPI;
import me.internalizable.warden.api.error.CommandExecutionException;
import me.internalizable.warden.api.error.ValidationException;
import me.internalizable.warden.command.InstanceTool;
import me.internalizable.warden.command.RecordingCommandExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link InstanceSampler}.
 */
class InstanceSamplerTest {

    private RecordingCommandExecutor executor;
    private InstanceSampler sampler;

    @BeforeEach
    void setUp() {
        executor = new RecordingCommandExecutor();
        sampler = new InstanceSampler(executor, new InstanceTool("lxc"));
    }

    @Test
    @DisplayName("report combines status, CPU, RAM and disk from inside the instance")
    void report_allMetrics() {
        executor.respond("lxc info vps-42-1", "Name: vps-42-1\nStatus: RUNNING");
        executor.respond("lxc exec vps-42-1 -- top -bn1", "%Cpu(s): 20.0 us,  5.0 sy,  0.0 ni, 75.0 id,  0.0 wa");
        executor.respond("lxc exec vps-42-1 -- free -m", "header\nMem: 2000 500 1500");
        executor.respond("lxc exec vps-42-1 -- df -h /",
                "Filesystem Size Used Avail Use% Mounted on\nrootfs 10G 1.2G 8.8G 12% /");

        WardenAPI.UsageReport report = sampler.report("vps-42-1");

        assertEquals("RUNNING", report.getToolStatus());
        assertEquals(25.0, report.getCpuPercent(), 0.001);
        assertEquals(25.0, report.getRamPercent(), 0.001);
        assertEquals("1.2G/10G (12%)", report.getDiskUsage());
    }

    @Test
    @DisplayName("metrics that cannot be sampled fall back instead of failing the report")
    void report_fallbacks() {
        executor.fail("lxc info", "Error: not found");
        executor.fail("lxc exec", "Error: instance is not running");

        WardenAPI.UsageReport report = sampler.report("vps-42-1");

        assertEquals("Unknown", report.getToolStatus());
        assertEquals(0.0, report.getCpuPercent());
        assertEquals(0.0, report.getRamPercent());
        assertEquals("Unknown", report.getDiskUsage());
    }

    @Test
    @DisplayName("unparseable CPU output is an execution failure")
    void sampleCpuUsage_malformed() {
        executor.respond("lxc exec vps-42-1 -- top", "nothing useful");

        assertThrows(CommandExecutionException.class, () -> sampler.sampleCpuUsage("vps-42-1"));
    }

    @Test
    @DisplayName("journal and process list run inside the instance")
    void journalAndProcesses() {
        sampler.journal("vps-42-1", 50);
        sampler.processList("vps-42-1");

        assertEquals(List.of(
                "lxc exec vps-42-1 -- journalctl -n 50",
                "lxc exec vps-42-1 -- ps aux"), executor.getCommands());
        assertThrows(ValidationException.class, () -> sampler.journal("vps-42-1", 0));
    }
}
