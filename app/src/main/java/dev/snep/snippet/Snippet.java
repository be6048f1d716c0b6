package dev.snep.snippet;

import dev.snep.document.Element;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named element of a snippet library together with its declared requirements.
 *
 * @param position index of the snippet within its library, used as the ordering key
 * @param requires names of other snippets this one needs, in declaration order
 * @param external qualified requirements such as {@code mod:io}, never resolved against the library
 */
public record Snippet(String name, Element element, int position, List<String> requires, Set<String> external) {

    public static final String REQUIRES_ATTRIBUTE = "requires";

    public Snippet {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(element, "element");
        requires = List.copyOf(requires);
        external = Set.copyOf(external);
    }

    static Snippet of(Element element, int position) {
        String name = element.name().orElseThrow(() -> new SnippetException("snippet must be named"));
        Requirements requirements = Requirements.of(element);
        return new Snippet(name, element, position, requirements.snippets(), requirements.external());
    }

    /**
     * Requirements declared by the {@code requires} attributes of an element, split on whitespace.
     * A token containing {@code ':'} is external.
     */
    record Requirements(List<String> snippets, Set<String> external) {

        static Requirements of(Element element) {
            String declared = element.attribute(REQUIRES_ATTRIBUTE).orElse("");
            Set<String> snippets = new LinkedHashSet<>();
            Set<String> external = new LinkedHashSet<>();
            Arrays.stream(declared.split("\\s+"))
                    .filter(token -> !token.isEmpty())
                    .forEach(token -> (token.indexOf(':') >= 0 ? external : snippets).add(token));
            return new Requirements(new ArrayList<>(snippets), external);
        }
    }
}
