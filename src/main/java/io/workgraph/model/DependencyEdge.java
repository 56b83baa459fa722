package io.workgraph.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Directed, typed edge. {@code fromId} depends on {@code toId}; for
 * {@link DependencyType#PARENT_CHILD} the source is the child and the target the parent.
 * The uniqueness key is (fromId, toId, type).
 */
public record DependencyEdge(
        String fromId,
        String toId,
        DependencyType type,
        long createdAtMs,
        String createdBy,
        String note
) {
    public static DependencyEdge of(String fromId, String toId, DependencyType type, String createdBy, long nowMs) {
        return new DependencyEdge(fromId, toId, type, nowMs, createdBy, null);
    }

    public DependencyEdge withNote(String nextNote) {
        return new DependencyEdge(fromId, toId, type, createdAtMs, createdBy, nextNote);
    }

    @JsonIgnore
    public String key() {
        return fromId + "|" + toId + "|" + type.wireName();
    }
}
