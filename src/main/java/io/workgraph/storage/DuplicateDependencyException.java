package io.workgraph.storage;

import io.workgraph.model.DependencyEdge;

/**
 * An edge with exactly the same (from, to, type) triple already exists.
 */
public final class DuplicateDependencyException extends IllegalArgumentException {
    private final DependencyEdge edge;

    public DuplicateDependencyException(DependencyEdge edge) {
        super("Dependency already exists: " + edge.fromId() + " -[" + edge.type().wireName() + "]-> " + edge.toId());
        this.edge = edge;
    }

    public DependencyEdge edge() {
        return edge;
    }
}
