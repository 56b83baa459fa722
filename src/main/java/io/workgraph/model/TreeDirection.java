package io.workgraph.model;

import java.util.Locale;

public enum TreeDirection {
    /** Follow outgoing edges: what the root depends on. */
    DOWN,
    /** Follow incoming edges: what depends on the root. */
    UP;

    public static TreeDirection fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return DOWN;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "down", "dependencies" -> DOWN;
            case "up", "reverse", "dependents" -> UP;
            default -> throw new IllegalArgumentException("Unknown tree direction: " + raw);
        };
    }
}
