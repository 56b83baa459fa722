package io.workgraph.status;

import io.workgraph.graph.DependencyGraph;
import io.workgraph.model.DependencyEdge;
import io.workgraph.model.EffectiveStatus;
import io.workgraph.model.Issue;
import io.workgraph.model.IssueState;
import io.workgraph.model.IssueStatus;
import io.workgraph.model.IssueType;
import io.workgraph.storage.GraphView;
import io.workgraph.storage.IssueQuery;
import io.workgraph.storage.IssueStore;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Derives display status and readiness from persisted status plus the graph, and
 * validates every value headed for a persisted issue field. Ready, blocked and deferred
 * listings all come from {@link #classify}, so an open issue lands in exactly one of them.
 */
public final class StatusResolver {
    public static final int MAX_TITLE_LENGTH = 500;
    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 4;

    private final DependencyGraph graph;
    private final Set<String> customIssueTypes;

    public StatusResolver(DependencyGraph graph, List<String> customIssueTypes) {
        this.graph = graph;
        this.customIssueTypes = new LinkedHashSet<>();
        if (customIssueTypes != null) {
            for (String type : customIssueTypes) {
                if (type != null && !type.isBlank()) {
                    this.customIssueTypes.add(type.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
    }

    public IssueStatus requirePersistable(String raw) {
        return IssueStatus.fromString(raw);
    }

    public String requireTitle(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Title must not be empty");
        }
        String title = raw.trim();
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new IllegalArgumentException("Title exceeds " + MAX_TITLE_LENGTH + " characters");
        }
        return title;
    }

    public List<String> requireLabels(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String label : raw) {
            if (label == null || label.isBlank()) {
                throw new IllegalArgumentException("Label must not be empty");
            }
            out.add(label.trim());
        }
        return List.copyOf(out);
    }

    public int requirePriority(int priority) {
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException(
                    "Priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY + ": " + priority);
        }
        return priority;
    }

    public String requireIssueType(String raw) {
        if (raw == null || raw.isBlank()) {
            return IssueType.TASK.wireName();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (IssueType.find(normalized).isPresent() || customIssueTypes.contains(normalized)) {
            return normalized;
        }
        throw new IllegalArgumentException("Unknown issue type: " + raw + " (allowed: bug, feature, task, epic, chore"
                + (customIssueTypes.isEmpty() ? "" : ", " + String.join(", ", customIssueTypes)) + ")");
    }

    public EffectiveStatus effectiveStatus(GraphView view, Issue issue, long nowMs) {
        return switch (classify(view, issue, nowMs)) {
            case READY -> EffectiveStatus.OPEN;
            case BLOCKED -> EffectiveStatus.BLOCKED;
            case DEFERRED -> EffectiveStatus.DEFERRED;
            case IN_PROGRESS -> EffectiveStatus.IN_PROGRESS;
            case CLOSED -> EffectiveStatus.CLOSED;
        };
    }

    public boolean isDeferred(Issue issue, long nowMs) {
        return issue.status() == IssueStatus.DEFERRED
                || (issue.status() == IssueStatus.OPEN && issue.deferredAt(nowMs));
    }

    /**
     * True only when the issue would appear in {@link #blockedIssues}; a future deferral
     * takes precedence over open blockers.
     */
    public boolean isBlocked(GraphView view, Issue issue, long nowMs) {
        return classify(view, issue, nowMs) == Bucket.BLOCKED;
    }

    public boolean isReady(GraphView view, Issue issue, long nowMs) {
        return classify(view, issue, nowMs) == Bucket.READY;
    }

    /**
     * Open issues, not deferred into the future, with no unresolved blocking edge.
     * Ordered by priority then creation order.
     */
    public List<Issue> readyIssues(IssueStore store, long nowMs, int limit) {
        List<Issue> out = new ArrayList<>();
        for (Issue issue : store.queryIssues(IssueQuery.readyCandidates(nowMs))) {
            if (classify(store, issue, nowMs) != Bucket.READY) {
                continue;
            }
            out.add(issue);
            if (limit > 0 && out.size() >= limit) {
                break;
            }
        }
        return out;
    }

    public List<BlockedIssue> blockedIssues(IssueStore store, long nowMs) {
        List<BlockedIssue> out = new ArrayList<>();
        for (Issue issue : store.queryIssues(IssueQuery.readyCandidates(nowMs))) {
            if (classify(store, issue, nowMs) != Bucket.BLOCKED) {
                continue;
            }
            List<String> blockers = new ArrayList<>();
            for (DependencyEdge edge : graph.blockingEdges(store, issue.id())) {
                blockers.add(edge.toId());
            }
            out.add(new BlockedIssue(issue, blockers));
        }
        return out;
    }

    public List<Issue> deferredIssues(IssueStore store, long nowMs) {
        List<Issue> out = new ArrayList<>();
        for (Issue issue : store.queryIssues(new IssueQuery(
                Set.of(IssueStatus.OPEN, IssueStatus.DEFERRED), null, null, IssueQuery.Deferral.ANY, nowMs, 0))) {
            if (isDeferred(issue, nowMs)) {
                out.add(issue);
            }
        }
        return out;
    }

    /**
     * Reopening returns the issue to open and forgets its deferral and closure details.
     */
    public IssueState reopenState(Issue issue) {
        if (issue.status() != IssueStatus.CLOSED) {
            throw new IllegalArgumentException("Issue is not closed: " + issue.id());
        }
        return issue.state().reopened();
    }

    Bucket classify(GraphView view, Issue issue, long nowMs) {
        return switch (issue.status()) {
            case CLOSED -> Bucket.CLOSED;
            case IN_PROGRESS -> Bucket.IN_PROGRESS;
            case DEFERRED -> Bucket.DEFERRED;
            case OPEN -> {
                if (issue.deferredAt(nowMs)) {
                    yield Bucket.DEFERRED;
                }
                yield graph.isBlocked(view, issue.id()) ? Bucket.BLOCKED : Bucket.READY;
            }
        };
    }

    enum Bucket {
        READY,
        BLOCKED,
        DEFERRED,
        IN_PROGRESS,
        CLOSED
    }

    public record BlockedIssue(Issue issue, List<String> blockedBy) {
    }
}
