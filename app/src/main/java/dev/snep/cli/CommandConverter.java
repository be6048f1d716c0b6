package dev.snep.cli;

import dev.snep.config.Command;
import picocli.CommandLine;

/**
 * Parses the command positional parameter.
 */
public class CommandConverter implements CommandLine.ITypeConverter<Command> {
    @Override
    public Command convert(String value) {
        return Command.from(value);
    }
}
