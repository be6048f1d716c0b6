package dev.snep.cli;

import dev.snep.config.Config;
import dev.snep.config.ConfigLoader;
import dev.snep.config.SystemEnvironmentReader;
import dev.snep.document.DocumentJson;
import dev.snep.document.Element;
import dev.snep.document.ElementLookupException;
import dev.snep.logging.LoggingConfigurator;
import dev.snep.parse.DocumentParser;
import dev.snep.parse.ParseException;
import dev.snep.snippet.AssemblyResult;
import dev.snep.snippet.SnippetAssembler;
import dev.snep.snippet.SnippetException;
import dev.snep.snippet.SnippetLibrary;
import dev.snep.syntax.DirectiveSyntax;
import dev.snep.syntax.SyntaxGuesser;
import dev.snep.writer.DocumentWriter;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and document pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    private static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final DocumentWriter documentWriter;
    private final SyntaxGuesser syntaxGuesser;
    private final PrintWriter out;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new DocumentWriter(),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, DocumentWriter documentWriter, PrintWriter out) {
        this.configLoader = configLoader;
        this.documentWriter = documentWriter;
        this.syntaxGuesser = new SyntaxGuesser();
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.debug("Running {} on {} file(s) (dryRun={})",
                config.command().displayName(), config.files().size(), config.dryRun());

        try {
            return switch (config.command()) {
                case RENDER -> render(config);
                case JSON -> json(config);
                case CHECK -> check(config);
                case ASSEMBLE -> assemble(config);
            };
        } finally {
            out.flush();
        }
    }

    private int render(Config config) {
        int exitCode = 0;
        for (Path file : config.files()) {
            try {
                DirectiveSyntax syntax = syntaxFor(config, file);
                out.print(new DocumentParser(syntax).parse(file).render(syntax));
            } catch (ParseException | UncheckedIOException ex) {
                LOGGER.error("{}", ex.getMessage());
                exitCode = EXIT_FAILURE;
            }
        }
        return exitCode;
    }

    private int json(Config config) {
        int exitCode = 0;
        for (Path file : config.files()) {
            try {
                Element document = new DocumentParser(syntaxFor(config, file)).parse(file);
                out.println(DocumentJson.write(document, config.prettyJson()));
            } catch (ParseException | UncheckedIOException ex) {
                LOGGER.error("{}", ex.getMessage());
                exitCode = EXIT_FAILURE;
            }
        }
        return exitCode;
    }

    private int check(Config config) {
        int exitCode = 0;
        for (Path file : config.files()) {
            try {
                new DocumentParser(syntaxFor(config, file)).parse(file);
                LOGGER.info("{}: ok", file);
            } catch (ParseException | UncheckedIOException ex) {
                LOGGER.error("{}", ex.getMessage());
                exitCode = EXIT_FAILURE;
            }
        }
        return exitCode;
    }

    private int assemble(Config config) {
        Path libraryPath = config.library().orElseThrow();
        SnippetLibrary library;
        try {
            Element libraryDocument = new DocumentParser(syntaxFor(config, libraryPath)).parse(libraryPath);
            library = SnippetLibrary.from(libraryDocument, config.snippetsElement());
        } catch (ParseException | ElementLookupException | SnippetException | UncheckedIOException ex) {
            LOGGER.error("Cannot load snippet library {}: {}", libraryPath, ex.getMessage());
            return EXIT_FAILURE;
        }
        LOGGER.info("Loaded {} snippets from {}", library.size(), libraryPath);

        SnippetAssembler assembler = new SnippetAssembler(config.snippetsElement());
        int exitCode = 0;
        for (Path target : config.files()) {
            try {
                DirectiveSyntax syntax = syntaxFor(config, target);
                AssemblyResult result = assembler.assemble(new DocumentParser(syntax).parse(target), library);
                String rendered = result.document().render(syntax);
                if (!result.externalRequirements().isEmpty()) {
                    LOGGER.info("{} also needs {}", target, String.join(" ", result.externalRequirements()));
                }
                if (config.dryRun()) {
                    out.print(rendered);
                } else if (documentWriter.writeIfChanged(target, rendered)) {
                    LOGGER.info("Updated {} with {}", target, String.join(", ", result.snippetNames()));
                } else {
                    LOGGER.info("{} is up to date", target);
                }
            } catch (ParseException | ElementLookupException | SnippetException | UncheckedIOException ex) {
                LOGGER.warn("Skipped {}: {}", target, ex.getMessage());
                exitCode = EXIT_FAILURE;
            }
        }
        return exitCode;
    }

    private DirectiveSyntax syntaxFor(Config config, Path file) {
        if (config.syntax().isPresent()) {
            return config.syntax().get();
        }
        List<DirectiveSyntax> candidates = syntaxGuesser.guess(
                SyntaxGuesser.extensionOf(file.getFileName().toString()), firstLine(file));
        DirectiveSyntax syntax = candidates.isEmpty() ? DirectiveSyntax.defaultSyntax() : candidates.get(0);
        LOGGER.debug("Using syntax {} for {}", syntax.name(), file);
        return syntax;
    }

    private static String firstLine(Path file) {
        if (!Files.isRegularFile(file)) {
            return "";
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line = reader.readLine();
            return line == null ? "" : line;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read document: " + file, ex);
        }
    }
}
