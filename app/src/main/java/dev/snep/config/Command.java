package dev.snep.config;

import java.util.Locale;

/**
 * Operation selected on the command line.
 */
public enum Command {
    RENDER,
    JSON,
    CHECK,
    ASSEMBLE;

    public static Command from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Command must be provided");
        }
        for (Command command : values()) {
            if (command.name().equalsIgnoreCase(raw.trim())) {
                return command;
            }
        }
        throw new IllegalArgumentException("Unsupported command: " + raw);
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
