package dev.snep.graph;

/**
 * The dependency graph contains at least one cycle, so no topological order exists.
 */
public class CyclicGraphException extends RuntimeException {

    private final int unresolved;

    public CyclicGraphException(int unresolved, int total) {
        super("graph is cyclic: " + unresolved + " of " + total + " vertices could not be ordered");
        this.unresolved = unresolved;
    }

    public int unresolved() {
        return unresolved;
    }
}
