package io.workgraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DependencyType {
    BLOCKS("blocks", DependencyCategory.BLOCKING),
    PARENT_CHILD("parent-child", DependencyCategory.HIERARCHICAL),
    CAUSED_BY("caused-by", DependencyCategory.INFORMATIONAL),
    VALIDATES("validates", DependencyCategory.INFORMATIONAL),
    TRACKS("tracks", DependencyCategory.INFORMATIONAL),
    RELATES_TO("relates-to", DependencyCategory.INFORMATIONAL),
    DISCOVERED_FROM("discovered-from", DependencyCategory.INFORMATIONAL),
    SUPERSEDES("supersedes", DependencyCategory.INFORMATIONAL),
    DUPLICATE_OF("duplicate-of", DependencyCategory.INFORMATIONAL);

    private final String wireName;
    private final DependencyCategory category;

    DependencyType(String wireName, DependencyCategory category) {
        this.wireName = wireName;
        this.category = category;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public DependencyCategory category() {
        return category;
    }

    public boolean isBlocking() {
        return category == DependencyCategory.BLOCKING;
    }

    public static DependencyType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return BLOCKS;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if ("related".equals(normalized)) {
            return RELATES_TO;
        }
        for (DependencyType value : values()) {
            if (value.wireName.equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown dependency type: " + raw);
    }
}
