package io.workgraph.model;

/**
 * The slice of an issue that only changes through the store's compare-and-set.
 */
public record IssueState(
        IssueStatus status,
        String assignee,
        Long deferUntilMs,
        Long closedAtMs,
        String closeReason,
        String verified
) {
    public IssueState claimedBy(String actor) {
        return new IssueState(IssueStatus.IN_PROGRESS, actor, deferUntilMs, null, null, null);
    }

    public IssueState released() {
        return new IssueState(IssueStatus.OPEN, assignee, deferUntilMs, null, null, null);
    }

    public IssueState closed(String reason, String verifiedBy, long nowMs) {
        return new IssueState(IssueStatus.CLOSED, assignee, deferUntilMs, nowMs, reason, verifiedBy);
    }

    public IssueState reopened() {
        return new IssueState(IssueStatus.OPEN, assignee, null, null, null, null);
    }

    public IssueState deferred(Long untilMs) {
        return new IssueState(IssueStatus.DEFERRED, assignee, untilMs, null, null, null);
    }

    public IssueState withStatus(IssueStatus next) {
        return new IssueState(next, assignee, deferUntilMs, closedAtMs, closeReason, verified);
    }

    public IssueState withAssignee(String next) {
        return new IssueState(status, next, deferUntilMs, closedAtMs, closeReason, verified);
    }

    public IssueState withDeferUntil(Long untilMs) {
        return new IssueState(status, assignee, untilMs, closedAtMs, closeReason, verified);
    }
}
