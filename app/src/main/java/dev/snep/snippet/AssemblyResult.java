package dev.snep.snippet;

import dev.snep.document.Element;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of assembling one target document.
 *
 * @param document the target with its snippet container rewritten
 * @param snippetNames names of the inserted snippets, in output order
 * @param externalRequirements qualified requirements collected from the target and the snippets, sorted
 */
public record AssemblyResult(Element document, List<String> snippetNames, Set<String> externalRequirements) {

    public AssemblyResult {
        Objects.requireNonNull(document, "document");
        snippetNames = List.copyOf(snippetNames);
        externalRequirements = Collections.unmodifiableSet(new TreeSet<>(externalRequirements));
    }
}
