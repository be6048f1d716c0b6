package dev.snep.snippet;

import dev.snep.document.Element;
import dev.snep.document.Node;
import dev.snep.document.Text;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills the snippet container of a target document with the snippets its root requires.
 *
 * <p>The target names its needs with top-level {@code requires} attributes. The container's previous
 * content is discarded and replaced by the resolved snippets, one blank line between consecutive
 * snippets.
 */
public class SnippetAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(SnippetAssembler.class);

    private final String container;

    public SnippetAssembler() {
        this(SnippetLibrary.DEFAULT_CONTAINER);
    }

    public SnippetAssembler(String container) {
        this.container = Objects.requireNonNull(container, "container");
    }

    /**
     * @throws dev.snep.document.ElementLookupException if the target has no unique container element
     * @throws SnippetException if a requirement cannot be resolved
     */
    public AssemblyResult assemble(Element target, SnippetLibrary library) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(library, "library");

        Snippet.Requirements roots = Snippet.Requirements.of(target);
        List<Snippet> ordered = library.resolve(roots.snippets());

        Set<String> external = new TreeSet<>(roots.external());
        List<Node> children = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (Snippet snippet : ordered) {
            if (!children.isEmpty()) {
                children.add(new Text("\n"));
            }
            children.add(snippet.element());
            names.add(snippet.name());
            external.addAll(snippet.external());
        }

        Element document = target.replaceElementChildren(container, children);
        LOGGER.debug("Assembled {} snippets into '{}'", names.size(), container);
        return new AssemblyResult(document, names, external);
    }
}
