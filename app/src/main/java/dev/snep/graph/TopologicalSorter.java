package dev.snep.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic topological sort.
 *
 * <p>The graph maps each vertex to the vertices it depends on; dependencies come first in the
 * result. A {@linkplain #flipped() flipped} sorter reads the values as dependents instead. Among all
 * valid orders the lexicographically smallest one under the configured comparator is returned: at
 * every step the smallest vertex whose dependencies have all been emitted is taken next. The result is
 * therefore unique whenever the comparator distinguishes all vertices.
 *
 * <p>Vertices are the map keys plus every vertex named in an edge. Duplicate edges count once.
 *
 * @param <T> vertex type
 */
public final class TopologicalSorter<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(TopologicalSorter.class);

    private final Comparator<? super T> order;
    private final boolean flip;

    private TopologicalSorter(Comparator<? super T> order, boolean flip) {
        this.order = Objects.requireNonNull(order, "order");
        this.flip = flip;
    }

    public static <T extends Comparable<? super T>> TopologicalSorter<T> natural() {
        return new TopologicalSorter<>(Comparator.naturalOrder(), false);
    }

    /**
     * Ties between ready vertices are broken by {@code order}. Use {@code order.reversed()} to prefer
     * the largest vertex instead.
     */
    public static <T> TopologicalSorter<T> orderedBy(Comparator<? super T> order) {
        return new TopologicalSorter<>(order, false);
    }

    /**
     * Returns a sorter that treats each map value as the dependents of its key.
     */
    public TopologicalSorter<T> flipped() {
        return new TopologicalSorter<>(order, !flip);
    }

    public boolean isFlipped() {
        return flip;
    }

    /**
     * @throws CyclicGraphException if the graph has a cycle
     */
    public List<T> sort(Map<T, ? extends Collection<? extends T>> graph) {
        Objects.requireNonNull(graph, "graph");

        // dependency -> dependents, materialized once for both directions
        Map<T, Set<T>> dependents = new LinkedHashMap<>();
        for (T vertex : graph.keySet()) {
            dependents.computeIfAbsent(Objects.requireNonNull(vertex, "vertex"), key -> new LinkedHashSet<>());
        }
        for (Map.Entry<T, ? extends Collection<? extends T>> entry : graph.entrySet()) {
            for (T other : entry.getValue()) {
                Objects.requireNonNull(other, "vertex");
                dependents.computeIfAbsent(other, key -> new LinkedHashSet<>());
                if (flip) {
                    dependents.get(entry.getKey()).add(other);
                } else {
                    dependents.get(other).add(entry.getKey());
                }
            }
        }

        Map<T, Integer> remaining = new HashMap<>();
        for (T vertex : dependents.keySet()) {
            remaining.put(vertex, 0);
        }
        for (Set<T> targets : dependents.values()) {
            for (T target : targets) {
                remaining.merge(target, 1, Integer::sum);
            }
        }

        PriorityQueue<T> ready = new PriorityQueue<>(Math.max(1, dependents.size()), order);
        remaining.forEach((vertex, count) -> {
            if (count == 0) {
                ready.add(vertex);
            }
        });

        // Kahn's algorithm
        List<T> result = new ArrayList<>(dependents.size());
        while (!ready.isEmpty()) {
            T vertex = ready.poll();
            result.add(vertex);
            for (T dependent : dependents.get(vertex)) {
                int count = remaining.merge(dependent, -1, Integer::sum);
                if (count == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (result.size() != dependents.size()) {
            throw new CyclicGraphException(dependents.size() - result.size(), dependents.size());
        }
        LOGGER.debug("Sorted {} vertices", result.size());
        return result;
    }
}
