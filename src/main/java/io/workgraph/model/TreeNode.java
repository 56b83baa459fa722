package io.workgraph.model;

/**
 * One emitted row of a dependency tree. {@code parentId} is the node whose expansion
 * produced this row (null only for the root); renderers key child lookups by it.
 */
public record TreeNode(
        String issueId,
        String title,
        IssueStatus status,
        int priority,
        int depth,
        String parentId,
        DependencyType edgeType,
        boolean alreadyShown,
        boolean truncated
) {
}
