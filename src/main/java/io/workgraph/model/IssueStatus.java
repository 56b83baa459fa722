package io.workgraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Persisted issue status. This is the complete set of values that may ever be
 * written to storage; "blocked" and "ready" are derived, never stored.
 */
public enum IssueStatus {
    OPEN("open"),
    IN_PROGRESS("in_progress"),
    DEFERRED("deferred"),
    CLOSED("closed");

    private final String wireName;

    IssueStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static IssueStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Status must not be blank");
        }
        String normalized = raw.trim();
        for (IssueStatus value : values()) {
            if (value.wireName.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Invalid status: " + raw + " (allowed: open, in_progress, deferred, closed)");
    }
}
