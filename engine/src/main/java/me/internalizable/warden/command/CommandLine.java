package me.internalizable.warden.command;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Shell-style splitting and quoting of command lines.
 *
 * <p>Supports single quotes (literal), double quotes (backslash escapes
 * {@code "} and {@code \}) and backslash escapes outside quotes. No variable
 * expansion or globbing is performed.</p>
 */
public final class CommandLine {

    private CommandLine() {
    }

    /**
     * Split a command line into an argument vector.
     *
     * @param commandLine command line
     * @return arguments
     * @throws IllegalArgumentException on an unterminated quote or trailing escape
     */
    @Nonnull
    public static List<String> split(@Nonnull String commandLine) {
        Objects.requireNonNull(commandLine, "commandLine");

        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        int i = 0;
        int length = commandLine.length();

        while (i < length) {
            char c = commandLine.charAt(i);
            if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
                i++;
            } else if (c == '\'') {
                int end = commandLine.indexOf('\'', i + 1);
                if (end < 0) {
                    throw new IllegalArgumentException("Unterminated single quote in: " + commandLine);
                }
                current.append(commandLine, i + 1, end);
                inToken = true;
                i = end + 1;
            } else if (c == '"') {
                i++;
                boolean closed = false;
                while (i < length) {
                    char q = commandLine.charAt(i);
                    if (q == '"') {
                        closed = true;
                        i++;
                        break;
                    }
                    if (q == '\\' && i + 1 < length
                            && (commandLine.charAt(i + 1) == '"' || commandLine.charAt(i + 1) == '\\')) {
                        current.append(commandLine.charAt(i + 1));
                        i += 2;
                    } else {
                        current.append(q);
                        i++;
                    }
                }
                if (!closed) {
                    throw new IllegalArgumentException("Unterminated double quote in: " + commandLine);
                }
                inToken = true;
            } else if (c == '\\') {
                if (i + 1 >= length) {
                    throw new IllegalArgumentException("Trailing escape in: " + commandLine);
                }
                current.append(commandLine.charAt(i + 1));
                inToken = true;
                i += 2;
            } else {
                current.append(c);
                inToken = true;
                i++;
            }
        }

        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    /**
     * Join arguments into a command line that {@link #split(String)} turns back
     * into the same arguments.
     *
     * @param arguments arguments
     * @return command line
     */
    @Nonnull
    public static String join(@Nonnull List<String> arguments) {
        StringBuilder builder = new StringBuilder();
        for (String argument : arguments) {
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(quote(argument));
        }
        return builder.toString();
    }

    /**
     * Quote a single argument if it contains characters the splitter treats specially.
     *
     * @param argument argument
     * @return argument, single-quoted when needed
     */
    @Nonnull
    public static String quote(@Nonnull String argument) {
        if (!argument.isEmpty() && argument.chars().noneMatch(CommandLine::isSpecial)) {
            return argument;
        }
        return "'" + argument.replace("'", "'\\''") + "'";
    }

    private static boolean isSpecial(int c) {
        return Character.isWhitespace(c) || c == '\'' || c == '"' || c == '\\';
    }
}
