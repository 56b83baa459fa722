package io.workgraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Display status. {@link #BLOCKED} is computed from the graph and never persisted.
 */
public enum EffectiveStatus {
    OPEN("open"),
    BLOCKED("blocked"),
    IN_PROGRESS("in_progress"),
    DEFERRED("deferred"),
    CLOSED("closed");

    private final String wireName;

    EffectiveStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
