package dev.snep.parse;

import java.util.Objects;

/**
 * Structural event produced by {@link DirectiveLexer} for one input line.
 *
 * <p>{@code name} is set for {@link Kind#ATTR} and {@link Kind#BEGIN}. {@code value} holds the line
 * text for {@link Kind#LINE}, the attribute value for {@link Kind#ATTR} and the trailing comment for
 * {@link Kind#END}.
 */
public record DirectiveEvent(Kind kind, int line, String name, String value) {

    public enum Kind {
        LINE,
        ATTR,
        BEGIN,
        END
    }

    public DirectiveEvent {
        Objects.requireNonNull(kind, "kind");
    }

    public static DirectiveEvent text(int line, String text) {
        return new DirectiveEvent(Kind.LINE, line, null, text);
    }

    public static DirectiveEvent attribute(int line, String name, String value) {
        return new DirectiveEvent(Kind.ATTR, line, name, value);
    }

    public static DirectiveEvent begin(int line, String name) {
        return new DirectiveEvent(Kind.BEGIN, line, name, null);
    }

    public static DirectiveEvent end(int line, String comment) {
        return new DirectiveEvent(Kind.END, line, null, comment);
    }
}
