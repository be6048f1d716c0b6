package dev.snep.snippet;

import dev.snep.document.Element;
import dev.snep.document.Node;
import dev.snep.graph.CyclicGraphException;
import dev.snep.graph.DependencyGraph;
import dev.snep.graph.TopologicalSorter;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Snippets declared as child elements of a library document's container element.
 */
public final class SnippetLibrary {

    public static final String DEFAULT_CONTAINER = "snips";

    private static final Logger LOGGER = LoggerFactory.getLogger(SnippetLibrary.class);

    private final Map<String, Snippet> snippets;

    private SnippetLibrary(Map<String, Snippet> snippets) {
        this.snippets = snippets;
    }

    public static SnippetLibrary from(Element document) {
        return from(document, DEFAULT_CONTAINER);
    }

    /**
     * @throws dev.snep.document.ElementLookupException if the container is missing or not unique
     * @throws SnippetException if two snippets share a name
     */
    public static SnippetLibrary from(Element document, String container) {
        Objects.requireNonNull(document, "document");
        Element snips = document.getElement(Objects.requireNonNull(container, "container"));
        Map<String, Snippet> byName = new LinkedHashMap<>();
        int position = 0;
        for (Node child : snips.children()) {
            if (!(child instanceof Element element)) {
                continue;
            }
            Snippet snippet = Snippet.of(element, position++);
            if (byName.putIfAbsent(snippet.name(), snippet) != null) {
                throw new SnippetException("duplicate snippet: " + snippet.name());
            }
        }
        LOGGER.debug("Loaded {} snippets from '{}'", byName.size(), container);
        return new SnippetLibrary(byName);
    }

    public List<Snippet> snippets() {
        return List.copyOf(snippets.values());
    }

    public Optional<Snippet> find(String name) {
        return Optional.ofNullable(snippets.get(name));
    }

    public int size() {
        return snippets.size();
    }

    /**
     * Returns the requested snippets and everything they transitively require, requirements first.
     * Snippets without an ordering constraint between them keep their library order.
     *
     * @throws SnippetException if a name is unknown or the requirements are cyclic
     */
    public List<Snippet> resolve(Collection<String> names) {
        Objects.requireNonNull(names, "names");
        for (String name : names) {
            if (!snippets.containsKey(name)) {
                throw new SnippetException("unknown snippet: " + name);
            }
        }
        Set<String> closure = DependencyGraph.reachable(names, this::requirementsOf);
        Map<String, List<String>> graph = closure.stream()
                .collect(Collectors.toMap(name -> name, name -> snippets.get(name).requires(),
                        (left, right) -> left, LinkedHashMap::new));
        Comparator<String> byPosition = Comparator.comparingInt(name -> snippets.get(name).position());
        try {
            return TopologicalSorter.orderedBy(byPosition).sort(graph).stream()
                    .map(snippets::get)
                    .collect(Collectors.toList());
        } catch (CyclicGraphException ex) {
            throw new SnippetException("snippet requirements are cyclic among " + closure, ex);
        }
    }

    private List<String> requirementsOf(String name) {
        Snippet snippet = snippets.get(name);
        for (String required : snippet.requires()) {
            if (!snippets.containsKey(required)) {
                throw new SnippetException("unknown snippet '" + required + "' required by '" + name + "'");
            }
        }
        return snippet.requires();
    }
}
