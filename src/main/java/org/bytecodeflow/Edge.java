package org.bytecodeflow;

import java.util.Objects;

/** Directed edge to the block starting at {@code target}. */
public class Edge {
    public final int target;
    public final boolean conditional;
    public final String label;

    public Edge(int target, boolean conditional, String label) {
        this.target = target;
        this.conditional = conditional;
        this.label = Objects.requireNonNull(label);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Edge)) return false;
        Edge e = (Edge) o;
        return target == e.target && conditional == e.conditional && label.equals(e.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, conditional, label);
    }

    @Override
    public String toString() {
        return "-> " + target + (conditional ? " [" + label + "]" : "");
    }
}
