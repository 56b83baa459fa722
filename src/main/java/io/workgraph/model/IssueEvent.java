package io.workgraph.model;

public record IssueEvent(
        long id,
        String issueId,
        String eventType,
        String actor,
        String oldValue,
        String newValue,
        String comment,
        long createdAtMs
) {
    public static IssueEvent of(String issueId, String eventType, String actor, String oldValue, String newValue,
                                String comment, long nowMs) {
        return new IssueEvent(0L, issueId, eventType, actor, oldValue, newValue, comment, nowMs);
    }
}
