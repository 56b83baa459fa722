package io.workgraph.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record Issue(
        String id,
        String title,
        String description,
        String issueType,
        int priority,
        IssueStatus status,
        String assignee,
        Long deferUntilMs,
        String notes,
        List<String> labels,
        String closeReason,
        String verified,
        long createdAtMs,
        long updatedAtMs,
        Long closedAtMs
) {
    public Issue {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    @JsonIgnore
    public IssueState state() {
        return new IssueState(status, assignee, deferUntilMs, closedAtMs, closeReason, verified);
    }

    @JsonIgnore
    public boolean isEpic() {
        return IssueType.EPIC.wireName().equals(issueType);
    }

    public boolean deferredAt(long nowMs) {
        return deferUntilMs != null && deferUntilMs > nowMs;
    }

    public Issue withDetails(String nextTitle, String nextDescription, String nextType, int nextPriority,
                             String nextNotes, List<String> nextLabels, long nowMs) {
        return new Issue(id, nextTitle, nextDescription, nextType, nextPriority, status, assignee, deferUntilMs,
                nextNotes, nextLabels, closeReason, verified, createdAtMs, nowMs, closedAtMs);
    }

    public Issue withNotes(String nextNotes, long nowMs) {
        return withDetails(title, description, issueType, priority, nextNotes, labels, nowMs);
    }
}
