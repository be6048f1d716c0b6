package dev.snep.graph;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Graph helpers that work on an implicit neighbour function.
 */
public final class DependencyGraph {

    private DependencyGraph() {
    }

    /**
     * Every vertex reachable from {@code initial}, the initial vertices included, in discovery order.
     */
    public static <T> Set<T> reachable(Collection<? extends T> initial,
                                       Function<? super T, ? extends Collection<? extends T>> neighbours) {
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(neighbours, "neighbours");
        Set<T> seen = new LinkedHashSet<>(initial);
        Deque<T> queue = new ArrayDeque<>(seen);
        while (!queue.isEmpty()) {
            T vertex = queue.poll();
            for (T next : neighbours.apply(vertex)) {
                if (seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        return seen;
    }
}
