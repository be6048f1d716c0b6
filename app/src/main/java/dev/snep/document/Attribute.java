package dev.snep.document;

import java.util.Objects;

/**
 * A named scalar attached to the enclosing element.
 */
public final class Attribute implements Node {

    private final String name;
    private final String value;
    private final Origin origin;

    public Attribute(String name, String value) {
        this(name, value, Origin.unknown());
    }

    public Attribute(String name, String value, Origin origin) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = Objects.requireNonNull(value, "value");
        this.origin = Objects.requireNonNull(origin, "origin");
    }

    public String name() {
        return name;
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
        return obj instanceof Attribute other && name.equals(other.name) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        return "Attribute[" + name + "=" + value + "]";
    }
}
