package me.internalizable.warden;

import me.internalizable.warden.api.OwnershipGrants;
import me.internalizable.warden.api.error.PersistenceException;
import me.internalizable.warden.command.ProcessCommandExecutor;
import me.internalizable.warden.command.ToolLocator;
import me.internalizable.warden.config.WardenConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Daemon entry point.
 *
 * <p>Reads {@code warden.yml} from the working directory (or the path given
 * as the first argument), applies environment overrides, resolves the
 * management tool and runs both guardians until the JVM is stopped.</p>
 */
public final class WardenLauncher {

    private static final Logger LOGGER = LoggerFactory.getLogger(WardenLauncher.class);

    private static final String DEFAULT_CONFIG = "warden.yml";

    private WardenLauncher() {
    }

    public static void main(String[] args) {
        Path workingDirectory = Paths.get("").toAbsolutePath();
        Path configPath = args.length > 0 ? Paths.get(args[0]) : workingDirectory.resolve(DEFAULT_CONFIG);

        WardenConfig config;
        Path toolPath;
        try {
            config = WardenConfig.load(configPath);
            config.applyEnvironment(System.getenv());
            config.validate();
            toolPath = ToolLocator.locate(config.getToolName(), config.getToolPath(),
                    System.getenv("PATH"), workingDirectory);
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.error("Startup failed: {}", e.getMessage());
            System.exit(1);
            return;
        }

        ProcessCommandExecutor executor = new ProcessCommandExecutor(
                config.getToolName(), toolPath.toString(), config.getCommandTimeout());
        Warden warden = new Warden(config, executor, new LoggingNotificationSink(),
                OwnershipGrants.NONE, Clock.systemUTC());

        try {
            warden.initialize();
        } catch (IOException | PersistenceException e) {
            LOGGER.error("Failed to initialize: {}", e.getMessage());
            executor.shutdown();
            System.exit(1);
            return;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            warden.shutdown();
            executor.shutdown();
            stopped.countDown();
        }, "Warden-Shutdown"));

        warden.startGuardians();
        LOGGER.info("Warden running with tool {}", toolPath);

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
