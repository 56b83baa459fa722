package io.workgraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Built-in issue types. Issues store the type as a plain string so configured
 * custom types can live next to these.
 */
public enum IssueType {
    BUG("bug"),
    FEATURE("feature"),
    TASK("task"),
    EPIC("epic"),
    CHORE("chore");

    private final String wireName;

    IssueType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<IssueType> find(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (IssueType value : values()) {
            if (value.wireName.equals(normalized)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
