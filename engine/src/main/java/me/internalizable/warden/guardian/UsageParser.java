package me.internalizable.warden.guardian;

import javax.annotation.Nonnull;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Parses the output of the standard Linux tools used for sampling.
 */
public final class UsageParser {

    private static final String CPU_LINE_MARKER = "%Cpu(s):";
    private static final String IDLE_TOKEN = "id,";
    private static final String STATUS_PREFIX = "Status: ";

    private UsageParser() {
    }

    /**
     * Parse CPU utilisation from {@code top -bn1} output as 100 minus idle.
     *
     * @param topOutput output of {@code top -bn1}
     * @return usage percentage, or empty if the summary line is missing or malformed
     */
    @Nonnull
    public static OptionalDouble parseCpuUsage(@Nonnull String topOutput) {
        for (String line : topOutput.split("\\R")) {
            if (!line.contains(CPU_LINE_MARKER)) {
                continue;
            }
            String[] words = line.trim().split("\\s+");
            for (int i = 1; i < words.length; i++) {
                if (words[i].equals(IDLE_TOKEN)) {
                    String idle = words[i - 1];
                    if (idle.endsWith(",")) {
                        idle = idle.substring(0, idle.length() - 1);
                    }
                    // a fully idle CPU prints "ni,100.0 id,"
                    idle = idle.substring(idle.lastIndexOf(',') + 1);
                    try {
                        return OptionalDouble.of(100.0 - Double.parseDouble(idle));
                    } catch (NumberFormatException e) {
                        return OptionalDouble.empty();
                    }
                }
            }
            return OptionalDouble.empty();
        }
        return OptionalDouble.empty();
    }

    /**
     * Parse memory utilisation from {@code free -m} output as used / total.
     *
     * @param freeOutput output of {@code free -m}
     * @return usage percentage (0 when total is 0), or empty if malformed
     */
    @Nonnull
    public static OptionalDouble parseMemoryUsage(@Nonnull String freeOutput) {
        String[] lines = freeOutput.split("\\R");
        if (lines.length < 2) {
            return OptionalDouble.empty();
        }
        String[] parts = lines[1].trim().split("\\s+");
        if (parts.length < 3) {
            return OptionalDouble.empty();
        }
        try {
            long total = Long.parseLong(parts[1]);
            long used = Long.parseLong(parts[2]);
            return OptionalDouble.of(total > 0 ? used * 100.0 / total : 0.0);
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /**
     * Parse root filesystem usage from {@code df -h /} output.
     *
     * @param dfOutput output of {@code df -h /}
     * @return e.g. {@code 1.2G/10G (12%)}, or empty if no line is mounted on {@code /}
     */
    @Nonnull
    public static Optional<String> parseDiskUsage(@Nonnull String dfOutput) {
        for (String line : dfOutput.split("\\R")) {
            String[] parts = line.trim().split("\\s+");
            if (parts.length >= 6 && parts[parts.length - 1].equals("/")) {
                return Optional.of(parts[2] + "/" + parts[1] + " (" + parts[4] + ")");
            }
        }
        return Optional.empty();
    }

    /**
     * Parse the status reported by the tool's {@code info} command.
     *
     * @param infoOutput output of {@code info <id>}
     * @return the value of the {@code Status:} line, or empty
     */
    @Nonnull
    public static Optional<String> parseToolStatus(@Nonnull String infoOutput) {
        for (String line : infoOutput.split("\\R")) {
            if (line.startsWith(STATUS_PREFIX)) {
                return Optional.of(line.substring(STATUS_PREFIX.length()).trim());
            }
        }
        return Optional.empty();
    }
}
