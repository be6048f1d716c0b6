package dev.snep.document;

import dev.snep.syntax.DirectiveSyntax;

/**
 * A node of a parsed document: {@link Text}, {@link Attribute} or {@link Element}.
 *
 * <p>Equality, hashing and ordering only consider structural content. {@link #origin()} and element
 * trailing comments never take part in them.
 */
public interface Node extends Comparable<Node> {

    Origin origin();

    @Override
    default int compareTo(Node other) {
        return NodeOrder.compare(this, other);
    }

    default String render() {
        return render(DirectiveSyntax.defaultSyntax());
    }

    default String render(DirectiveSyntax syntax) {
        return new DocumentRenderer(syntax).render(this);
    }
}
