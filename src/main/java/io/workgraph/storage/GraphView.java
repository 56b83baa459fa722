package io.workgraph.storage;

import io.workgraph.model.DependencyCategory;
import io.workgraph.model.DependencyEdge;
import io.workgraph.model.Issue;

import java.util.List;
import java.util.Optional;

/**
 * Read-only surface the graph engine and status resolver work against. Both a plain
 * store and a store bound to an open transaction implement it.
 */
public interface GraphView {
    Optional<Issue> findIssue(String id);

    /**
     * Edges whose source is {@code issueId}, ordered by target then type.
     */
    List<DependencyEdge> edgesFrom(String issueId);

    /**
     * Edges whose target is {@code issueId}, ordered by source then type.
     */
    List<DependencyEdge> edgesTo(String issueId);

    List<DependencyEdge> edgesByCategory(DependencyCategory category);
}
