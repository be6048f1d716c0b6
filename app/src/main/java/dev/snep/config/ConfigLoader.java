package dev.snep.config;

import dev.snep.cli.CliArguments;
import dev.snep.snippet.SnippetLibrary;
import dev.snep.syntax.DirectiveSyntax;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_SYNTAX = "SNEP_SYNTAX";
    static final String ENV_SNIPPETS_ELEMENT = "SNEP_SNIPPETS_ELEMENT";
    static final String ENV_LIBRARY = "SNEP_LIBRARY";
    static final String ENV_LOG_FORMAT = "SNEP_LOG_FORMAT";
    static final String ENV_DRY_RUN = "SNEP_DRY_RUN";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Command command = arguments.command();
        if (command == null) {
            throw new IllegalArgumentException("command must be provided");
        }
        List<Path> files = arguments.files() == null ? List.of() : arguments.files();

        Optional<Path> library = Optional.ofNullable(arguments.library())
                .or(() -> environmentReader.value(ENV_LIBRARY).filter(ConfigLoader::isNotBlank).map(String::trim).map(Path::of));

        Optional<DirectiveSyntax> syntax = Optional.ofNullable(arguments.syntax())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environmentReader.value(ENV_SYNTAX).filter(ConfigLoader::isNotBlank))
                .map(DirectiveSyntax::forName);

        String snippetsElement = firstNonBlank(arguments.snippetsElement(), ENV_SNIPPETS_ELEMENT,
                SnippetLibrary.DEFAULT_CONTAINER).trim();

        return new Config(command, files, library, syntax, snippetsElement, resolveLogFormat(arguments),
                resolveDryRun(arguments), arguments.prettyJson());
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.value(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveDryRun(CliArguments arguments) {
        if (arguments.dryRun()) {
            return true;
        }
        return environmentReader.value(ENV_DRY_RUN)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.value(envKey)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
