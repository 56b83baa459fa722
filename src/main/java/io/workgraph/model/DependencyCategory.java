package io.workgraph.model;

public enum DependencyCategory {
    /** Gates readiness of the source while the target is not closed. */
    BLOCKING(true),
    /** Parent/child structure; never gates readiness. */
    HIERARCHICAL(true),
    INFORMATIONAL(false);

    private final boolean acyclic;

    DependencyCategory(boolean acyclic) {
        this.acyclic = acyclic;
    }

    /**
     * Whether edges of this category must form an acyclic subgraph.
     */
    public boolean acyclic() {
        return acyclic;
    }
}
