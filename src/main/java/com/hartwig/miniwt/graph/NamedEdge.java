package com.hartwig.miniwt.graph;

import org.jgrapht.graph.DefaultEdge;

/**
 * Dependency of one call on another, labelled with the outputs it reads.
 */
public class NamedEdge extends DefaultEdge {
    private final String name;

    public NamedEdge(String label) {
        this.name = label;
    }

    public String name() {
        return name;
    }

    public String dependent() {
        return (String) getSource();
    }

    public String dependency() {
        return (String) getTarget();
    }

    @Override
    public String toString() {
        return "(" + getSource() + " : " + getTarget() + " : " + name + ")";
    }
}
