package dev.snep.parse;

import dev.snep.document.Attribute;
import dev.snep.document.Element;
import dev.snep.document.Node;
import dev.snep.document.Origin;
import dev.snep.document.Text;
import dev.snep.syntax.DirectiveSyntax;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds an immutable {@link Element} tree from directive text.
 *
 * <p>Nesting is tracked with an explicit stack of open frames, so deeply nested input does not grow
 * the call stack. Bracket imbalance raises {@link ParseException}; no partial tree is ever returned.
 */
public class DocumentParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentParser.class);

    private final DirectiveSyntax syntax;

    public DocumentParser() {
        this(DirectiveSyntax.defaultSyntax());
    }

    public DocumentParser(DirectiveSyntax syntax) {
        this.syntax = Objects.requireNonNull(syntax, "syntax");
    }

    public DirectiveSyntax syntax() {
        return syntax;
    }

    public Element parse(String text, String source) {
        Objects.requireNonNull(text, "text");
        return parse(new StringReader(text), source);
    }

    public Element parse(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader, path.toString());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read document: " + path, ex);
        }
    }

    public Element parse(Reader reader, String source) {
        Objects.requireNonNull(reader, "reader");
        DirectiveLexer lexer = new DirectiveLexer(SourceLine.lines(reader), source, syntax);
        Element root = build(lexer, source);
        LOGGER.debug("Parsed {} ({} lines, {} top-level nodes)", source, lexer.lastLine(), root.children().size());
        return root;
    }

    /**
     * Convenience for callers holding a plain iterator of numbered lines.
     */
    public Element parseLines(Iterator<SourceLine> lines, String source) {
        return build(new DirectiveLexer(lines, source, syntax), source);
    }

    /**
     * Consumes {@code events} and returns the finalized root element.
     */
    public Element build(DirectiveLexer events, String source) {
        Frame current = new Frame(null, Origin.of(source, 1));
        Deque<Frame> stack = new ArrayDeque<>();
        int lastEventLine = 0;

        while (events.hasNext()) {
            DirectiveEvent event = events.next();
            lastEventLine = event.line();
            Origin origin = Origin.of(source, event.line());
            switch (event.kind()) {
                case LINE -> current.children.add(new Text(event.value(), origin));
                case ATTR -> current.children.add(new Attribute(event.name(), event.value(), origin));
                case BEGIN -> {
                    current.children.add(null);
                    stack.push(current);
                    current = new Frame(event.name(), origin);
                }
                case END -> {
                    if (stack.isEmpty()) {
                        throw new ParseException(source, event.line(), "unmatched ']'");
                    }
                    Element finished = new Element(current.name, current.children, current.origin, event.value());
                    current = stack.pop();
                    current.children.set(current.children.size() - 1, finished);
                }
            }
        }
        if (!stack.isEmpty()) {
            // marker-only lines yield no event, so they do not move the reported position
            throw new ParseException(source, lastEventLine, "unclosed '['");
        }
        return Element.root(current.children, current.origin);
    }

    private static final class Frame {

        private final String name;
        private final Origin origin;
        private final List<Node> children = new ArrayList<>();

        private Frame(String name, Origin origin) {
            this.name = name;
            this.origin = origin;
        }
    }
}
