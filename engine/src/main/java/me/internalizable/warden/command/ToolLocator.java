package me.internalizable.warden.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.File;
import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Resolves the executable of the external management tool.
 *
 * <p>Lookup order: an explicitly configured path, each directory on the
 * search path, then the working directory.</p>
 */
public final class ToolLocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ToolLocator.class);

    private ToolLocator() {
    }

    /**
     * Locate the tool executable.
     *
     * @param toolName executable name, e.g. {@code lxc}
     * @param configuredPath explicit path, or null/blank to search
     * @param searchPath value of the {@code PATH} variable, or null
     * @param workingDirectory directory searched last
     * @return absolute path to an executable file
     * @throws FileNotFoundException if the tool cannot be found
     */
    @Nonnull
    public static Path locate(@Nonnull String toolName, @Nullable String configuredPath,
                              @Nullable String searchPath, @Nonnull Path workingDirectory)
            throws FileNotFoundException {
        Objects.requireNonNull(toolName, "toolName");
        Objects.requireNonNull(workingDirectory, "workingDirectory");

        if (configuredPath != null && !configuredPath.isBlank()) {
            Path configured = Paths.get(configuredPath.trim());
            if (isExecutable(configured)) {
                return configured.toAbsolutePath();
            }
            throw new FileNotFoundException("Configured tool path is not an executable file: " + configured);
        }

        if (searchPath != null) {
            for (String directory : searchPath.split(File.pathSeparator)) {
                if (directory.isEmpty()) {
                    continue;
                }
                Path candidate = Paths.get(directory, toolName);
                if (isExecutable(candidate)) {
                    LOGGER.debug("Found {} on PATH at {}", toolName, candidate);
                    return candidate.toAbsolutePath();
                }
            }
        }

        Path local = workingDirectory.resolve(toolName);
        if (isExecutable(local)) {
            LOGGER.debug("Found {} in working directory at {}", toolName, local);
            return local.toAbsolutePath();
        }

        throw new FileNotFoundException("Could not find '" + toolName + "' on PATH or in " + workingDirectory);
    }

    private static boolean isExecutable(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }
}
