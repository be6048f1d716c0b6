package dev.snep.document;

import java.util.OptionalInt;

/**
 * Where a node came from. Diagnostic only: never part of a node's identity.
 */
public record Origin(String source, int line, OptionalInt column) {

    private static final Origin UNKNOWN = new Origin(null, 0, OptionalInt.empty());

    public Origin {
        column = column == null ? OptionalInt.empty() : column;
    }

    public static Origin of(String source, int line) {
        return new Origin(source, line, OptionalInt.empty());
    }

    public static Origin unknown() {
        return UNKNOWN;
    }

    public boolean isKnown() {
        return source != null;
    }

    @Override
    public String toString() {
        if (!isKnown()) {
            return "<unknown>";
        }
        StringBuilder builder = new StringBuilder(source).append(':').append(line);
        column.ifPresent(value -> builder.append(':').append(value));
        return builder.toString();
    }
}
