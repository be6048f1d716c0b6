package dev.snep.snippet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.snep.document.Element;
import dev.snep.document.ElementNotFoundException;
import dev.snep.graph.CyclicGraphException;
import dev.snep.parse.DocumentParser;
import java.util.List;
import org.junit.jupiter.api.Test;

class SnippetLibraryTest {

    static final String LIBRARY = String.join("",
            "#!/bin/sh\n",
            "#@snips[\n",
            "#@alpha[\n",
            "alpha body\n",
            "#@]\n",
            "\n",
            "#@beta[\n",
            "#@requires: alpha mod:io\n",
            "beta body\n",
            "#@]\n",
            "\n",
            "#@gamma[\n",
            "#@requires: beta\n",
            "gamma body\n",
            "#@]\n",
            "\n",
            "#@delta[\n",
            "delta body\n",
            "#@]\n",
            "#@]\n");

    private final DocumentParser parser = new DocumentParser();

    @Test
    void readsSnippetsWithRequirements() {
        SnippetLibrary library = SnippetLibrary.from(parser.parse(LIBRARY, "lib.sh"));

        assertThat(library.size()).isEqualTo(4);
        assertThat(library.snippets()).extracting(Snippet::name).containsExactly("alpha", "beta", "gamma", "delta");
        Snippet beta = library.find("beta").orElseThrow();
        assertThat(beta.requires()).containsExactly("alpha");
        assertThat(beta.external()).containsExactly("mod:io");
        assertThat(beta.position()).isEqualTo(1);
        assertThat(library.find("omega")).isEmpty();
    }

    @Test
    void resolvesTransitiveRequirementsDependenciesFirst() {
        SnippetLibrary library = SnippetLibrary.from(parser.parse(LIBRARY, "lib.sh"));

        assertThat(library.resolve(List.of("gamma"))).extracting(Snippet::name)
                .containsExactly("alpha", "beta", "gamma");
        assertThat(library.resolve(List.of("delta", "alpha"))).extracting(Snippet::name)
                .containsExactly("alpha", "delta");
        assertThat(library.resolve(List.of())).isEmpty();
    }

    @Test
    void rejectsUnknownNames() {
        SnippetLibrary library = SnippetLibrary.from(parser.parse(LIBRARY, "lib.sh"));

        assertThatThrownBy(() -> library.resolve(List.of("omega")))
                .isInstanceOf(SnippetException.class)
                .hasMessage("unknown snippet: omega");
    }

    @Test
    void rejectsUnknownRequirementOfSnippet() {
        SnippetLibrary library = SnippetLibrary.from(parser.parse(
                "#@snips[\n#@a[\n#@requires: ghost\n#@]\n#@]\n", "lib"));

        assertThatThrownBy(() -> library.resolve(List.of("a")))
                .isInstanceOf(SnippetException.class)
                .hasMessageContaining("'ghost' required by 'a'");
    }

    @Test
    void rejectsDuplicateSnippets() {
        Element document = parser.parse("#@snips[\n#@a[\n#@]\n#@a[\n#@]\n#@]\n", "lib");

        assertThatThrownBy(() -> SnippetLibrary.from(document))
                .isInstanceOf(SnippetException.class)
                .hasMessage("duplicate snippet: a");
    }

    @Test
    void reportsCyclicRequirements() {
        SnippetLibrary library = SnippetLibrary.from(parser.parse(String.join("",
                "#@snips[\n",
                "#@a[\n#@requires: b\n#@]\n",
                "#@b[\n#@requires: a\n#@]\n",
                "#@]\n"), "lib"));

        assertThatThrownBy(() -> library.resolve(List.of("a")))
                .isInstanceOf(SnippetException.class)
                .hasMessageContaining("cyclic")
                .hasCauseInstanceOf(CyclicGraphException.class);
    }

    @Test
    void requiresContainerElement() {
        assertThatThrownBy(() -> SnippetLibrary.from(parser.parse("text\n", "lib")))
                .isInstanceOf(ElementNotFoundException.class);
        assertThat(SnippetLibrary.from(parser.parse("#@parts[\n#@x[\n#@]\n#@]\n", "lib"), "parts").size())
                .isEqualTo(1);
    }
}
