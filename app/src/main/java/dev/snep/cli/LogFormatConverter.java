package dev.snep.cli;

import dev.snep.config.LogFormat;
import picocli.CommandLine;

/**
 * Converts {@code --log-format}; unknown values surface as picocli usage errors.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}
