package dev.snep.config;

import dev.snep.syntax.DirectiveSyntax;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 *
 * @param syntax directive syntax forced for every file; empty to guess it per file
 */
public record Config(
        Command command,
        List<Path> files,
        Optional<Path> library,
        Optional<DirectiveSyntax> syntax,
        String snippetsElement,
        LogFormat logFormat,
        boolean dryRun,
        boolean prettyJson
) {

    public Config {
        Objects.requireNonNull(command, "command");
        files = List.copyOf(Objects.requireNonNull(files, "files"));
        if (files.isEmpty()) {
            throw new IllegalArgumentException("at least one file must be provided");
        }
        library = library == null ? Optional.empty() : library;
        syntax = syntax == null ? Optional.empty() : syntax;
        if (snippetsElement == null || snippetsElement.isBlank()) {
            throw new IllegalArgumentException("snippetsElement must not be blank");
        }
        if (snippetsElement.chars().anyMatch(ch -> Character.isWhitespace(ch) || ch == '[' || ch == ':')) {
            throw new IllegalArgumentException("snippetsElement is not a valid element name: " + snippetsElement);
        }
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        if (command == Command.ASSEMBLE && library.isEmpty()) {
            throw new IllegalArgumentException("--library must be provided for the assemble command");
        }
    }
}
