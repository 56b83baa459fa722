package io.workgraph.storage;

import io.workgraph.model.DependencyEdge;
import io.workgraph.model.DependencyType;
import io.workgraph.model.Issue;
import io.workgraph.model.IssueEvent;
import io.workgraph.model.IssueState;
import io.workgraph.model.IssueStatus;

import java.util.List;
import java.util.function.Function;

/**
 * Narrow capability interface over issue storage. Every per-issue state transition
 * goes through {@link #compareAndSetState}; every edge insert through
 * {@link #insertEdgeIfAbsent}. How a backend makes those atomic (row locks, a single
 * writer, optimistic retries) stays behind this interface.
 */
public interface IssueStore extends GraphView {

    /**
     * @throws IllegalArgumentException if an issue with the same id exists
     */
    void insertIssue(Issue issue);

    /**
     * Writes descriptive fields (title, description, type, priority, notes, labels).
     * Never touches status, assignee, deferral or closure fields.
     *
     * @return false if the issue does not exist
     */
    boolean saveDetails(Issue issue);

    /**
     * Atomically replaces the issue's state if its current status and assignee still
     * equal the expected values. A null expected assignee matches only an unassigned
     * issue.
     *
     * @return true if this call won and the row was written
     */
    boolean compareAndSetState(String issueId, IssueStatus expectedStatus, String expectedAssignee,
                               IssueState next, long nowMs);

    /**
     * Deletes the issue and cascades its edges, labels and events.
     */
    boolean deleteIssue(String issueId);

    List<Issue> queryIssues(IssueQuery query);

    /**
     * Inserts the edge unless the exact (from, to, type) triple already exists. An
     * edge of a different type between the same pair never collides.
     *
     * @return true if inserted, false on an exact-triple duplicate
     */
    boolean insertEdgeIfAbsent(DependencyEdge edge);

    boolean deleteEdge(String fromId, String toId, DependencyType type);

    void appendEvent(IssueEvent event);

    List<IssueEvent> events(String issueId, int limit);

    /**
     * Allocates the next hierarchical child id, {@code <parentId>.<n>}.
     */
    String nextChildId(String parentId);

    /**
     * Runs {@code work} against a view of this store bound to one transaction. The
     * transaction commits when {@code work} returns and rolls back if it throws.
     * Calling this on an already-bound store joins the open transaction.
     */
    <T> T inTransaction(Function<IssueStore, T> work);
}
