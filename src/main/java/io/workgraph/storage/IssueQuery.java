package io.workgraph.storage;

import io.workgraph.model.IssueStatus;

import java.util.EnumSet;
import java.util.Set;

/**
 * Predicate for {@link IssueStore#queryIssues(IssueQuery)}. Results are ordered by
 * priority ascending, then creation order.
 */
public record IssueQuery(
        Set<IssueStatus> statuses,
        String assignee,
        String label,
        Deferral deferral,
        long atMs,
        int limit
) {
    public enum Deferral {
        ANY,
        /** defer_until unset or not after {@code atMs} */
        NOT_DEFERRED,
        /** defer_until after {@code atMs} */
        DEFERRED
    }

    public IssueQuery {
        statuses = statuses == null || statuses.isEmpty() ? EnumSet.allOf(IssueStatus.class) : EnumSet.copyOf(statuses);
        deferral = deferral == null ? Deferral.ANY : deferral;
    }

    public static IssueQuery withStatus(IssueStatus status) {
        return new IssueQuery(EnumSet.of(status), null, null, Deferral.ANY, 0L, 0);
    }

    public static IssueQuery readyCandidates(long nowMs) {
        return new IssueQuery(EnumSet.of(IssueStatus.OPEN), null, null, Deferral.NOT_DEFERRED, nowMs, 0);
    }

    public static IssueQuery inProgressFor(String actor) {
        return new IssueQuery(EnumSet.of(IssueStatus.IN_PROGRESS), actor, null, Deferral.ANY, 0L, 0);
    }

    public IssueQuery withLabel(String value) {
        return new IssueQuery(statuses, assignee, value, deferral, atMs, limit);
    }

    public IssueQuery withLimit(int value) {
        return new IssueQuery(statuses, assignee, label, deferral, atMs, value);
    }
}
