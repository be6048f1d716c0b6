package dev.snep.document;

import java.util.Objects;

/**
 * A verbatim run of source text, normally one line including its terminator.
 */
public final class Text implements Node {

    private final String value;
    private final Origin origin;

    public Text(String value) {
        this(value, Origin.unknown());
    }

    public Text(String value, Origin origin) {
        this.value = Objects.requireNonNull(value, "value");
        this.origin = Objects.requireNonNull(origin, "origin");
    }

    public String value() {
        return value;
    }

    @Override
    public Origin origin() {
        return origin;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Text other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Text[" + value + "]";
    }
}
