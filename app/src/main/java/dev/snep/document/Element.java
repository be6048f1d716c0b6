package dev.snep.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Named, ordered container of child nodes.
 *
 * <p>Elements are immutable. The {@code replace*} operations return new elements and share every
 * untouched subtree with the receiver. Exactly one element of a document, the root, has no name.
 */
public final class Element implements Node {

    private final String name;
    private final List<Node> children;
    private final Origin origin;
    private final String trailingComment;

    private volatile Views views;
    private int hash;

    public Element(String name, List<? extends Node> children) {
        this(name, children, Origin.unknown(), "");
    }

    public Element(String name, List<? extends Node> children, Origin origin, String trailingComment) {
        this(Objects.requireNonNull(name, "name"), children, origin, trailingComment, true);
    }

    private Element(String name, List<? extends Node> children, Origin origin, String trailingComment,
                    boolean copyChildren) {
        Objects.requireNonNull(children, "children");
        this.name = name;
        this.children = copyChildren ? List.copyOf(children) : Collections.unmodifiableList(children);
        this.origin = Objects.requireNonNull(origin, "origin");
        this.trailingComment = trailingComment == null ? "" : trailingComment;
    }

    public static Element root(List<? extends Node> children) {
        return root(children, Origin.unknown());
    }

    public static Element root(List<? extends Node> children, Origin origin) {
        return new Element(null, children, origin, "", true);
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public boolean isRoot() {
        return name == null;
    }

    public List<Node> children() {
        return children;
    }

    @Override
    public Origin origin() {
        return origin;
    }

    /**
     * Text that followed the closing bracket of this element, kept for rendering only.
     */
    public String trailingComment() {
        return trailingComment;
    }

    /**
     * Attribute values by name. Repeated names are joined with {@code "\n"} in document order.
     */
    public Map<String, String> attributes() {
        return views().attributes;
    }

    public Optional<String> attribute(String attributeName) {
        return Optional.ofNullable(attributes().get(attributeName));
    }

    /**
     * Every child element grouped by name, in document order.
     */
    public Map<String, List<Element>> elements() {
        return views().elements;
    }

    /**
     * Child elements whose name occurs exactly once among the children.
     */
    public Map<String, Element> uniqueElements() {
        return views().uniqueElements;
    }

    public boolean hasUniqueElements() {
        Views current = views();
        return current.elements.size() == current.uniqueElements.size();
    }

    /**
     * Positions in {@link #children()} of the child elements with each name.
     */
    public Map<String, List<Integer>> elementIndices() {
        return views().elementIndices;
    }

    /**
     * Returns the child element with the given name.
     *
     * @throws ElementNotFoundException if no child element has that name
     * @throws NonUniqueElementException if more than one child element has that name
     */
    public Element getElement(String elementName) {
        return findElement(elementName).orElseThrow(() -> new ElementNotFoundException(elementName));
    }

    /**
     * Like {@link #getElement(String)} but reports absence as an empty result.
     *
     * @throws NonUniqueElementException if more than one child element has that name
     */
    public Optional<Element> findElement(String elementName) {
        Element unique = uniqueElements().get(elementName);
        if (unique != null) {
            return Optional.of(unique);
        }
        List<Element> all = elements().get(elementName);
        if (all == null) {
            return Optional.empty();
        }
        throw new NonUniqueElementException(elementName, all.size());
    }

    public Element replaceName(String newName) {
        return new Element(Objects.requireNonNull(newName, "newName"), children, origin, trailingComment, false);
    }

    public Element replaceChildren(List<? extends Node> newChildren) {
        return new Element(name, newChildren, origin, trailingComment, true);
    }

    /**
     * Returns a copy of this element where the unique child named {@code elementName} is replaced by
     * {@code element}, at the same position.
     */
    public Element replaceElement(String elementName, Element element) {
        Objects.requireNonNull(element, "element");
        getElement(elementName);
        int index = elementIndices().get(elementName).get(0);
        List<Node> updated = new ArrayList<>(children);
        updated.set(index, element);
        return new Element(name, updated, origin, trailingComment, false);
    }

    public Element replaceElementChildren(String elementName, List<? extends Node> newChildren) {
        return replaceElement(elementName, getElement(elementName).replaceChildren(newChildren));
    }

    private Views views() {
        Views current = views;
        if (current == null) {
            current = new Views(children);
            views = current;
        }
        return current;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Element other)) {
            return false;
        }
        return Objects.equals(name, other.name) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        int result = hash;
        if (result == 0) {
            result = 31 * Objects.hashCode(name) + children.hashCode();
            hash = result;
        }
        return result;
    }

    @Override
    public String toString() {
        return "Element[" + (name == null ? "<root>" : name) + ", " + children + "]";
    }

    /**
     * Projections of the children, built in a single pass.
     */
    private static final class Views {

        private final Map<String, String> attributes;
        private final Map<String, List<Element>> elements;
        private final Map<String, Element> uniqueElements;
        private final Map<String, List<Integer>> elementIndices;

        private Views(List<Node> children) {
            Map<String, String> attrs = new LinkedHashMap<>();
            Map<String, List<Element>> byName = new LinkedHashMap<>();
            Map<String, List<Integer>> indices = new LinkedHashMap<>();
            for (int i = 0; i < children.size(); i++) {
                Node node = children.get(i);
                if (node instanceof Attribute attribute) {
                    attrs.merge(attribute.name(), attribute.value(), (existing, added) -> existing + "\n" + added);
                } else if (node instanceof Element element && element.name != null) {
                    byName.computeIfAbsent(element.name, key -> new ArrayList<>()).add(element);
                    indices.computeIfAbsent(element.name, key -> new ArrayList<>()).add(i);
                }
            }
            Map<String, Element> unique = new LinkedHashMap<>();
            byName.forEach((key, list) -> {
                if (list.size() == 1) {
                    unique.put(key, list.get(0));
                }
            });
            this.attributes = Collections.unmodifiableMap(attrs);
            this.elements = freezeLists(byName);
            this.uniqueElements = Collections.unmodifiableMap(unique);
            this.elementIndices = freezeLists(indices);
        }

        private static <T> Map<String, List<T>> freezeLists(Map<String, List<T>> source) {
            Map<String, List<T>> frozen = new LinkedHashMap<>();
            source.forEach((key, list) -> frozen.put(key, List.copyOf(list)));
            return Collections.unmodifiableMap(frozen);
        }
    }
}
