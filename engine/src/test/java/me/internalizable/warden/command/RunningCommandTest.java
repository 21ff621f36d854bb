package me.internalizable.warden.command;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link RunningCommand}.
 */
class RunningCommandTest {

    private final CountDownLatch release = new CountDownLatch(1);
    private ExecutorService readers;

    @BeforeEach
    void setUp() {
        readers = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        readers.shutdownNow();
    }

    @Test
    @DisplayName("output of an exited process is read in full")
    void getStdout_exited_fullText() {
        RunningCommand running = new RunningCommand("tool list", new ExitedProcess(text("vps-42-1\n"), text("")),
                readers, Duration.ofSeconds(5));

        assertEquals("vps-42-1\n", running.getStdout());
        assertEquals("", running.getStderr());
        assertFalse(running.isOutputIncomplete());
    }

    @Test
    @DisplayName("a stream held open past the drain timeout is reported as incomplete")
    void getStdout_heldOpen_incomplete() {
        RunningCommand running = new RunningCommand("tool list", new ExitedProcess(new HeldOpenStream(), text("")),
                readers, Duration.ofMillis(100));

        assertEquals("", running.getStdout());
        assertTrue(running.isOutputIncomplete());
    }

    @Test
    @DisplayName("a stream that fails to read is reported as incomplete")
    void getStderr_readFailure_incomplete() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("Stream closed");
            }
        };
        RunningCommand running = new RunningCommand("tool list", new ExitedProcess(text("ok"), broken),
                readers, Duration.ofSeconds(5));

        assertEquals("", running.getStderr());
        assertTrue(running.isOutputIncomplete());
    }

    private static InputStream text(String value) {
        return new ByteArrayInputStream(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Blocks readers until the test ends, like a pipe inherited by a background child.
     */
    private final class HeldOpenStream extends InputStream {

        @Override
        public int read() throws IOException {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return -1;
        }
    }

    /**
     * A process that has already exited with code 0.
     */
    private static final class ExitedProcess extends Process {

        private final InputStream stdout;
        private final InputStream stderr;

        ExitedProcess(InputStream stdout, InputStream stderr) {
            this.stdout = stdout;
            this.stderr = stderr;
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return stdout;
        }

        @Override
        public InputStream getErrorStream() {
            return stderr;
        }

        @Override
        public int waitFor() {
            return 0;
        }

        @Override
        public int exitValue() {
            return 0;
        }

        @Override
        public void destroy() {
        }
    }
}
