package dev.snep.document;

import dev.snep.syntax.DirectiveSyntax;
import java.util.Objects;

/**
 * Serializes a document tree back into directive text.
 *
 * <p>Directive lines always start at column 0: when the text emitted so far does not end with a
 * newline, one is inserted before the next directive.
 */
public class DocumentRenderer {

    private final DirectiveSyntax syntax;

    public DocumentRenderer(DirectiveSyntax syntax) {
        this.syntax = Objects.requireNonNull(syntax, "syntax");
    }

    public String render(Node node) {
        StringBuilder out = new StringBuilder();
        write(node, out);
        return out.toString();
    }

    private void write(Node node, StringBuilder out) {
        if (node instanceof Text text) {
            out.append(text.value());
        } else if (node instanceof Attribute attribute) {
            directive(out, attribute.name() + ": " + attribute.value());
        } else if (node instanceof Element element) {
            if (element.isRoot()) {
                writeChildren(element, out);
                return;
            }
            String name = element.name().orElseThrow();
            directive(out, name + "[");
            writeChildren(element, out);
            directive(out, "]" + element.trailingComment());
        } else {
            throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getName());
        }
    }

    private void writeChildren(Element element, StringBuilder out) {
        for (Node child : element.children()) {
            write(child, out);
        }
    }

    private void directive(StringBuilder out, String body) {
        if (out.length() > 0 && out.charAt(out.length() - 1) != '\n') {
            out.append('\n');
        }
        out.append(syntax.directiveLine(body));
    }
}
