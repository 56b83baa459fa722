package io.workgraph.graph;

import io.workgraph.model.DependencyCategory;
import io.workgraph.model.DependencyEdge;
import io.workgraph.model.DependencyType;
import io.workgraph.model.Issue;
import io.workgraph.model.IssueStatus;
import io.workgraph.model.TreeDirection;
import io.workgraph.model.TreeNode;
import io.workgraph.storage.GraphView;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Stateless queries over a {@link GraphView}. Holds no cache; callers pass the view so
 * the same engine answers both against the plain store and inside a transaction.
 * All walks are iterative and bounded.
 */
public final class DependencyGraph {
    private final int traversalBudget;

    public DependencyGraph(int traversalBudget) {
        this.traversalBudget = Math.max(1, traversalBudget);
    }

    public boolean isReady(GraphView view, Issue issue, long nowMs) {
        if (issue == null || issue.status() != IssueStatus.OPEN) {
            return false;
        }
        if (issue.deferredAt(nowMs)) {
            return false;
        }
        return blockingEdges(view, issue.id()).isEmpty();
    }

    /**
     * Outgoing blocking edges of {@code issueId} whose target still exists and is not
     * closed. Informational and hierarchical edges never appear here.
     */
    public List<DependencyEdge> blockingEdges(GraphView view, String issueId) {
        List<DependencyEdge> out = new ArrayList<>();
        for (DependencyEdge edge : view.edgesFrom(issueId)) {
            if (!edge.type().isBlocking()) {
                continue;
            }
            Optional<Issue> target = view.findIssue(edge.toId());
            if (target.isPresent() && target.get().status() != IssueStatus.CLOSED) {
                out.add(edge);
            }
        }
        return out;
    }

    public boolean isBlocked(GraphView view, String issueId) {
        return !blockingEdges(view, issueId).isEmpty();
    }

    /**
     * Whether adding {@code from -[type]-> to} would close a cycle in the subgraph of
     * {@code type}'s category. Self-edges are always rejected; informational types never
     * are. Running past the traversal budget counts as a cycle.
     */
    public boolean wouldCreateCycle(GraphView view, String fromId, String toId, DependencyType type) {
        if (fromId.equals(toId)) {
            return true;
        }
        DependencyCategory category = type.category();
        if (!category.acyclic()) {
            return false;
        }
        Deque<String> pending = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        pending.add(toId);
        visited.add(toId);
        int expanded = 0;
        while (!pending.isEmpty()) {
            String current = pending.poll();
            if (++expanded > traversalBudget) {
                return true;
            }
            for (DependencyEdge edge : view.edgesFrom(current)) {
                if (edge.type().category() != category) {
                    continue;
                }
                if (edge.toId().equals(fromId)) {
                    return true;
                }
                if (visited.add(edge.toId())) {
                    pending.add(edge.toId());
                }
            }
        }
        return false;
    }

    /**
     * Depth-first tree rooted at {@code rootId}. A node reached a second time (a diamond)
     * is emitted once more as an {@code alreadyShown} marker under its new tree parent and
     * not expanded again. A node at {@code maxDepth} that still has neighbours is emitted
     * with {@code truncated} set.
     */
    public List<TreeNode> buildTree(GraphView view, String rootId, TreeDirection direction, int maxDepth) {
        Issue root = view.findIssue(rootId)
                .orElseThrow(() -> new IllegalArgumentException("Issue not found: " + rootId));
        int depthBound = Math.max(0, maxDepth);
        List<TreeNode> out = new ArrayList<>();
        Set<String> expanded = new HashSet<>();
        Map<String, Issue> cache = new HashMap<>();
        cache.put(root.id(), root);

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root.id(), null, 0, null));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            Issue issue = cache.computeIfAbsent(frame.issueId(), id -> view.findIssue(id).orElse(null));
            if (issue == null) {
                continue;
            }
            if (!expanded.add(issue.id())) {
                out.add(node(issue, frame, true, false));
                continue;
            }
            List<DependencyEdge> edges = direction == TreeDirection.DOWN
                    ? view.edgesFrom(issue.id())
                    : view.edgesTo(issue.id());
            if (frame.depth() >= depthBound) {
                out.add(node(issue, frame, false, !edges.isEmpty()));
                continue;
            }
            out.add(node(issue, frame, false, false));
            // Push in reverse so neighbours pop in edge order.
            for (int i = edges.size() - 1; i >= 0; i--) {
                DependencyEdge edge = edges.get(i);
                String next = direction == TreeDirection.DOWN ? edge.toId() : edge.fromId();
                stack.push(new Frame(next, issue.id(), frame.depth() + 1, edge.type()));
            }
            if (out.size() > traversalBudget) {
                throw new IllegalStateException("Tree of " + rootId + " exceeds traversal budget " + traversalBudget);
            }
        }
        return out;
    }

    private static TreeNode node(Issue issue, Frame frame, boolean alreadyShown, boolean truncated) {
        return new TreeNode(
                issue.id(),
                issue.title(),
                issue.status(),
                issue.priority(),
                frame.depth(),
                frame.parentId(),
                frame.edgeType(),
                alreadyShown,
                truncated
        );
    }

    private record Frame(String issueId, String parentId, int depth, DependencyType edgeType) {
    }

    /**
     * Issues whose parent-child edge points at {@code parentId}, in id order.
     */
    public List<Issue> children(GraphView view, String parentId) {
        List<Issue> out = new ArrayList<>();
        for (DependencyEdge edge : view.edgesTo(parentId)) {
            if (edge.type() == DependencyType.PARENT_CHILD) {
                view.findIssue(edge.fromId()).ifPresent(out::add);
            }
        }
        return out;
    }

    public Optional<String> parentOf(GraphView view, String childId) {
        for (DependencyEdge edge : view.edgesFrom(childId)) {
            if (edge.type() == DependencyType.PARENT_CHILD) {
                return Optional.of(edge.toId());
            }
        }
        return Optional.empty();
    }

    /**
     * Open issues that were waiting only on {@code closedId}: they had a blocking edge to
     * it and now have no unresolved blockers left.
     */
    public List<String> unblockedBy(GraphView view, String closedId, long nowMs) {
        Set<String> out = new LinkedHashSet<>();
        for (DependencyEdge edge : view.edgesTo(closedId)) {
            if (!edge.type().isBlocking()) {
                continue;
            }
            view.findIssue(edge.fromId())
                    .filter(dependent -> isReady(view, dependent, nowMs))
                    .ifPresent(dependent -> out.add(dependent.id()));
        }
        return new ArrayList<>(out);
    }

    /**
     * Audits the blocking subgraph for cycles that predate edge-time enforcement. Each
     * reported cycle lists its issue ids in edge order, starting from the first id
     * encountered.
     */
    public List<List<String>> findCycles(GraphView view) {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (DependencyEdge edge : view.edgesByCategory(DependencyCategory.BLOCKING)) {
            adjacency.computeIfAbsent(edge.fromId(), k -> new ArrayList<>()).add(edge.toId());
        }
        List<String> starts = new ArrayList<>(adjacency.keySet());
        starts.sort(String::compareTo);

        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String start : starts) {
            if (visited.contains(start)) {
                continue;
            }
            Deque<Cursor> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            Set<String> visiting = new HashSet<>();
            stack.push(new Cursor(start, adjacency.getOrDefault(start, List.of())));
            path.add(start);
            visiting.add(start);
            while (!stack.isEmpty()) {
                Cursor top = stack.peek();
                if (top.next < top.neighbours.size()) {
                    String dep = top.neighbours.get(top.next++);
                    if (visiting.contains(dep)) {
                        cycles.add(new ArrayList<>(path.subList(path.indexOf(dep), path.size())));
                    } else if (!visited.contains(dep)) {
                        stack.push(new Cursor(dep, adjacency.getOrDefault(dep, List.of())));
                        path.add(dep);
                        visiting.add(dep);
                    }
                } else {
                    stack.pop();
                    path.remove(path.size() - 1);
                    visiting.remove(top.issueId);
                    visited.add(top.issueId);
                }
            }
        }
        return cycles;
    }

    private static final class Cursor {
        private final String issueId;
        private final List<String> neighbours;
        private int next;

        private Cursor(String issueId, List<String> neighbours) {
            this.issueId = issueId;
            this.neighbours = neighbours;
        }
    }
}
