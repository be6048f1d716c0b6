package dev.snep.document;

import java.util.Iterator;
import java.util.List;

/**
 * Total order over nodes: Text before Attribute before Element, then by identity fields.
 */
final class NodeOrder {

    private NodeOrder() {
    }

    static int compare(Node left, Node right) {
        int byKind = Integer.compare(rank(left), rank(right));
        if (byKind != 0) {
            return byKind;
        }
        if (left instanceof Text a && right instanceof Text b) {
            return a.value().compareTo(b.value());
        }
        if (left instanceof Attribute a && right instanceof Attribute b) {
            int byName = a.name().compareTo(b.name());
            return byName != 0 ? byName : a.value().compareTo(b.value());
        }
        Element a = (Element) left;
        Element b = (Element) right;
        int byName = compareNames(a.name().orElse(null), b.name().orElse(null));
        return byName != 0 ? byName : compareChildren(a.children(), b.children());
    }

    private static int rank(Node node) {
        if (node instanceof Text) {
            return 0;
        }
        if (node instanceof Attribute) {
            return 1;
        }
        if (node instanceof Element) {
            return 2;
        }
        throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getName());
    }

    // absent (root) names sort first
    private static int compareNames(String left, String right) {
        if (left == null || right == null) {
            return left == null ? (right == null ? 0 : -1) : 1;
        }
        return left.compareTo(right);
    }

    private static int compareChildren(List<Node> left, List<Node> right) {
        Iterator<Node> l = left.iterator();
        Iterator<Node> r = right.iterator();
        while (l.hasNext() && r.hasNext()) {
            int result = compare(l.next(), r.next());
            if (result != 0) {
                return result;
            }
        }
        return Boolean.compare(l.hasNext(), r.hasNext());
    }
}
