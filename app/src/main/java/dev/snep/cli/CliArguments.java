package dev.snep.cli;

import dev.snep.config.Command;
import dev.snep.config.LogFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "snep", mixinStandardHelpOptions = true,
        description = "Parses, renders and assembles snippet directive documents")
public class CliArguments {

    @CommandLine.Parameters(index = "0", converter = CommandConverter.class, paramLabel = "COMMAND",
            description = "render, json, check or assemble")
    private Command command;

    @CommandLine.Parameters(index = "1..*", arity = "1..*", paramLabel = "FILE",
            description = "Documents to process (assembly targets for the assemble command)")
    private List<Path> files = new ArrayList<>();

    @CommandLine.Option(names = "--library", description = "Snippet library document used by assemble", paramLabel = "FILE")
    private Path library;

    @CommandLine.Option(names = "--syntax", description = "Directive syntax: sh, c++, c, hs or hs-block (guessed per file when omitted)", paramLabel = "NAME")
    private String syntax;

    @CommandLine.Option(names = "--snippets-element", description = "Name of the element holding the snippets", paramLabel = "NAME")
    private String snippetsElement;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--dry-run", description = "Print assembled targets instead of saving them")
    private boolean dryRun;

    @CommandLine.Option(names = "--pretty", description = "Indent the output of the json command")
    private boolean prettyJson;

    public Command command() {
        return command;
    }

    public List<Path> files() {
        return files;
    }

    public Path library() {
        return library;
    }

    public String syntax() {
        return syntax;
    }

    public String snippetsElement() {
        return snippetsElement;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean dryRun() {
        return dryRun;
    }

    public boolean prettyJson() {
        return prettyJson;
    }
}
