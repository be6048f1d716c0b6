package dev.snep.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TopologicalSorterTest {

    private final TopologicalSorter<String> sorter = TopologicalSorter.natural();

    @Test
    void placesDependenciesFirst() {
        assertThat(sorter.sort(graph("D:B,C", "C:A", "B:A", "A:"))).containsExactly("A", "B", "C", "D");
    }

    @Test
    void takesSmallestReadyVertexAtEachStep() {
        assertThat(sorter.sort(graph("C:A,B", "A:", "B:"))).containsExactly("A", "B", "C");
        assertThat(sorter.sort(graph("A:C", "B:", "C:"))).containsExactly("B", "C", "A");
    }

    @Test
    void honoursCustomComparator() {
        TopologicalSorter<String> reversed = TopologicalSorter.orderedBy(Comparator.<String>naturalOrder().reversed());

        assertThat(reversed.sort(graph("C:A,B", "A:", "B:"))).containsExactly("B", "A", "C");
    }

    @Test
    void flippedSorterReadsValuesAsDependents() {
        TopologicalSorter<String> flipped = sorter.flipped();

        assertThat(flipped.isFlipped()).isTrue();
        assertThat(flipped.flipped().isFlipped()).isFalse();
        assertThat(flipped.sort(graph("A:B,C", "B:D", "C:D", "D:"))).containsExactly("A", "B", "C", "D");
    }

    @Test
    void includesVerticesNamedOnlyInEdgesAndIgnoresDuplicates() {
        assertThat(sorter.sort(graph("B:A,A"))).containsExactly("A", "B");
        assertThat(sorter.sort(graph("X:", "A:"))).containsExactly("A", "X");
        assertThat(sorter.sort(graph())).isEmpty();
    }

    @Test
    void rejectsCycles() {
        assertThatThrownBy(() -> sorter.sort(graph("A:B", "B:A", "C:")))
                .isInstanceOf(CyclicGraphException.class)
                .hasMessageContaining("2 of 3")
                .satisfies(ex -> assertThat(((CyclicGraphException) ex).unresolved()).isEqualTo(2));
        assertThatThrownBy(() -> sorter.sort(graph("A:A"))).isInstanceOf(CyclicGraphException.class);
    }

    /**
     * Builds a graph from entries like {@code "D:B,C"}.
     */
    private static Map<String, List<String>> graph(String... entries) {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        for (String entry : entries) {
            String[] parts = entry.split(":", -1);
            List<String> targets = parts[1].isEmpty() ? List.of() : Arrays.asList(parts[1].split(","));
            graph.put(parts[0], targets);
        }
        return graph;
    }
}
