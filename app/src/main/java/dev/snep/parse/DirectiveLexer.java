package dev.snep.parse;

import dev.snep.syntax.DirectiveSyntax;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns numbered source lines into {@link DirectiveEvent}s, one line at a time.
 *
 * <p>Lines without the directive marker become {@code LINE} events. Marked lines with an empty body
 * produce nothing. Malformed directives raise {@link ParseException} as soon as they are reached.
 */
public class DirectiveLexer implements Iterator<DirectiveEvent> {

    private static final Pattern KEYED = Pattern.compile("([^\\[:\\s]+)\\s*([\\[:])\\s*(.*)", Pattern.DOTALL);

    private final Iterator<SourceLine> lines;
    private final String source;
    private final DirectiveSyntax syntax;
    private DirectiveEvent pending;
    private int lastLine;

    public DirectiveLexer(Iterator<SourceLine> lines, String source, DirectiveSyntax syntax) {
        this.lines = Objects.requireNonNull(lines, "lines");
        this.source = source;
        this.syntax = Objects.requireNonNull(syntax, "syntax");
    }

    @Override
    public boolean hasNext() {
        while (pending == null && lines.hasNext()) {
            SourceLine line = lines.next();
            lastLine = line.number();
            pending = lex(line);
        }
        return pending != null;
    }

    @Override
    public DirectiveEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        DirectiveEvent event = pending;
        pending = null;
        return event;
    }

    /**
     * Number of the last line pulled from the input, 0 before the first one.
     */
    public int lastLine() {
        return lastLine;
    }

    private DirectiveEvent lex(SourceLine line) {
        Optional<String> body = syntax.directiveBody(line.text());
        if (body.isEmpty()) {
            return DirectiveEvent.text(line.number(), line.text());
        }
        String directive = body.get();
        if (directive.isEmpty()) {
            return null;
        }
        if (directive.startsWith("]")) {
            return DirectiveEvent.end(line.number(), directive.substring(1));
        }
        Matcher matcher = KEYED.matcher(directive);
        if (!matcher.matches()) {
            throw new ParseException(source, line.number(), "invalid directive: " + display(line));
        }
        String key = matcher.group(1);
        String value = matcher.group(3);
        if (matcher.group(2).equals(":")) {
            return DirectiveEvent.attribute(line.number(), key, value);
        }
        if (!value.isEmpty()) {
            throw new ParseException(source, line.number(), "trailing garbage after '[': " + display(line));
        }
        return DirectiveEvent.begin(line.number(), key);
    }

    private static String display(SourceLine line) {
        return line.text().stripTrailing();
    }
}
