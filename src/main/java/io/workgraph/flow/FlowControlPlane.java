package io.workgraph.flow;

import io.workgraph.config.WorkGraphSettings;
import io.workgraph.graph.DependencyGraph;
import io.workgraph.model.DependencyEdge;
import io.workgraph.model.DependencyType;
import io.workgraph.model.Issue;
import io.workgraph.model.IssueEvent;
import io.workgraph.model.IssueStatus;
import io.workgraph.observability.AuditLogger;
import io.workgraph.status.StatusResolver;
import io.workgraph.storage.IssueQuery;
import io.workgraph.storage.IssueStore;
import io.workgraph.storage.StoreException;
import io.workgraph.storage.StoreUnavailableException;
import io.workgraph.util.Jsons;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Atomic multi-step operations for actors sharing one store. Each operation runs its
 * reads and writes in a single store transaction, reports a {@link FlowResult} instead
 * of throwing, and records the outcome in the audit log after the transaction ends.
 */
public final class FlowControlPlane {
    static final String CLAIM_NEXT = "claim-next";
    static final String CLOSE_SAFE = "close-safe";
    static final String BLOCK_WITH_CONTEXT = "block-with-context";
    static final String DEFAULT_CLOSE_REASON = "Closed";

    private final IssueStore store;
    private final DependencyGraph graph;
    private final StatusResolver resolver;
    private final WorkGraphSettings settings;
    private final AuditLogger auditLogger;
    private final Clock clock;

    public FlowControlPlane(IssueStore store, DependencyGraph graph, StatusResolver resolver,
                            WorkGraphSettings settings, AuditLogger auditLogger, Clock clock) {
        this.store = store;
        this.graph = graph;
        this.resolver = resolver;
        this.settings = settings;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    /**
     * Claims up to {@code limit} ready issues for {@code actor}, never more than the
     * actor's free WIP slots. Candidates are ready issues that are unassigned or already
     * assigned to the actor, highest priority first.
     */
    public FlowResult claimNext(String actor, int limit) {
        if (actor == null || actor.isBlank()) {
            return audited(CLAIM_NEXT, actor, null, new FlowResult.InvalidInput(CLAIM_NEXT, "Actor must not be blank"));
        }
        String who = actor.trim();
        return audited(CLAIM_NEXT, who, null, guarded(CLAIM_NEXT, () -> claimLoop(who, Math.max(1, limit))));
    }

    private FlowResult claimLoop(String actor, int limit) {
        int wipLimit = settings.wipLimit();
        List<Issue> held = store.queryIssues(IssueQuery.inProgressFor(actor));
        int want = limit;
        if (wipLimit > 0) {
            if (held.size() >= wipLimit) {
                return new FlowResult.WipBlocked(actor, wipLimit, ids(held));
            }
            want = Math.min(want, wipLimit - held.size());
        }

        List<String> claimed = new ArrayList<>();
        Set<String> contended = new LinkedHashSet<>();
        int attempts = 0;
        boolean wipFull = false;
        while (claimed.size() < want && contended.size() < settings.claimRetryBound()) {
            long now = clock.millis();
            ClaimStep step = store.inTransaction(tx -> tryClaim(tx, actor, now, claimed, contended));
            if (step.outcome() == ClaimAttempt.NONE_READY) {
                break;
            }
            attempts++;
            if (step.outcome() == ClaimAttempt.WON) {
                claimed.add(step.issueId());
            } else if (step.outcome() == ClaimAttempt.WIP_FULL) {
                wipFull = true;
                break;
            } else {
                contended.add(step.issueId());
            }
        }

        if (!claimed.isEmpty()) {
            return new FlowResult.Claimed(actor, claimed, new ArrayList<>(contended));
        }
        if (wipFull) {
            return new FlowResult.WipBlocked(actor, wipLimit, ids(store.queryIssues(IssueQuery.inProgressFor(actor))));
        }
        if (!contended.isEmpty()) {
            return new FlowResult.Contention(CLAIM_NEXT, actor, new ArrayList<>(contended), attempts);
        }
        return new FlowResult.NoReady(actor);
    }

    private Optional<Issue> nextCandidate(IssueStore view, String actor, long now, List<String> claimed,
                                          Set<String> contended) {
        for (Issue issue : resolver.readyIssues(view, now, 0)) {
            if (claimed.contains(issue.id()) || contended.contains(issue.id())) {
                continue;
            }
            if (issue.assignee() != null && !issue.assignee().isBlank() && !issue.assignee().equals(actor)) {
                continue;
            }
            return Optional.of(issue);
        }
        return Optional.empty();
    }

    /**
     * One claim attempt. The candidate is chosen from the ready set read inside the same
     * write transaction, so on a single-writer store the compare-and-set only fails when a
     * backend lets another writer interleave.
     */
    private ClaimStep tryClaim(IssueStore tx, String actor, long now, List<String> claimed, Set<String> contended) {
        int wipLimit = settings.wipLimit();
        if (wipLimit > 0 && tx.queryIssues(IssueQuery.inProgressFor(actor)).size() >= wipLimit) {
            return new ClaimStep(ClaimAttempt.WIP_FULL, null);
        }
        Optional<Issue> candidate = nextCandidate(tx, actor, now, claimed, contended);
        if (candidate.isEmpty()) {
            return new ClaimStep(ClaimAttempt.NONE_READY, null);
        }
        Issue seen = candidate.get();
        boolean won = tx.compareAndSetState(seen.id(), seen.status(), seen.assignee(),
                seen.state().claimedBy(actor), now);
        if (!won) {
            return new ClaimStep(ClaimAttempt.LOST, seen.id());
        }
        tx.appendEvent(IssueEvent.of(seen.id(), "claimed", actor,
                seen.status().wireName(), IssueStatus.IN_PROGRESS.wireName(), null, now));
        return new ClaimStep(ClaimAttempt.WON, seen.id());
    }

    private enum ClaimAttempt {
        WON,
        LOST,
        WIP_FULL,
        NONE_READY
    }

    private record ClaimStep(ClaimAttempt outcome, String issueId) {
    }

    /**
     * Closes {@code issueId} unless it still has unresolved blockers. {@code force}
     * closes it anyway and marks the result as forced.
     */
    public FlowResult closeSafe(String issueId, String reason, String verified, boolean force, String actor) {
        if (issueId == null || issueId.isBlank()) {
            return audited(CLOSE_SAFE, actor, issueId, new FlowResult.InvalidInput(CLOSE_SAFE, "Issue id must not be blank"));
        }
        String id = issueId.trim();
        String closeReason = reason == null || reason.isBlank() ? DEFAULT_CLOSE_REASON : reason.trim();
        String verifiedBy = verified == null || verified.isBlank() ? null : verified.trim();
        return audited(CLOSE_SAFE, actor, id, guarded(CLOSE_SAFE,
                () -> store.inTransaction(tx -> closeInTransaction(tx, id, closeReason, verifiedBy, force, actor))));
    }

    private FlowResult closeInTransaction(IssueStore tx, String id, String reason, String verified,
                                          boolean force, String actor) {
        Optional<Issue> found = tx.findIssue(id);
        if (found.isEmpty()) {
            return new FlowResult.PolicyViolation(CLOSE_SAFE, id, "not_found", List.of(), "Issue not found: " + id);
        }
        Issue issue = found.get();
        if (issue.status() == IssueStatus.CLOSED) {
            return new FlowResult.PolicyViolation(CLOSE_SAFE, id, "already_closed", List.of(), "Issue already closed: " + id);
        }
        List<String> blockers = new ArrayList<>();
        for (DependencyEdge edge : graph.blockingEdges(tx, id)) {
            blockers.add(edge.toId());
        }
        if (!blockers.isEmpty() && !force) {
            return new FlowResult.PolicyViolation(CLOSE_SAFE, id, "unresolved_blockers", blockers,
                    "Issue " + id + " is blocked by open issues: " + String.join(", ", blockers));
        }
        long now = clock.millis();
        if (!tx.compareAndSetState(id, issue.status(), issue.assignee(), issue.state().closed(reason, verified, now), now)) {
            return new FlowResult.Contention(CLOSE_SAFE, actor, List.of(id), 1);
        }
        tx.appendEvent(IssueEvent.of(id, "closed", actor, issue.status().wireName(), IssueStatus.CLOSED.wireName(),
                reason, now));
        return new FlowResult.Closed(id, reason, verified, !blockers.isEmpty(), graph.unblockedBy(tx, id, now));
    }

    /**
     * Records that {@code issueId} is blocked by {@code blockerId}: adds the blocking edge
     * carrying the context pack, appends the context to the issue's notes, and releases
     * the issue to open if it was in progress. All or nothing.
     */
    public FlowResult blockWithContext(String issueId, String blockerId, String contextPack, String actor) {
        if (issueId == null || issueId.isBlank() || blockerId == null || blockerId.isBlank()) {
            return audited(BLOCK_WITH_CONTEXT, actor, issueId,
                    new FlowResult.InvalidInput(BLOCK_WITH_CONTEXT, "Issue id and blocker id must not be blank"));
        }
        if (contextPack == null || contextPack.isBlank()) {
            return audited(BLOCK_WITH_CONTEXT, actor, issueId,
                    new FlowResult.InvalidInput(BLOCK_WITH_CONTEXT, "Context pack must not be blank"));
        }
        String id = issueId.trim();
        String blocker = blockerId.trim();
        String context = contextPack.trim();
        return audited(BLOCK_WITH_CONTEXT, actor, id, guarded(BLOCK_WITH_CONTEXT, () -> {
            try {
                return store.inTransaction(tx -> blockInTransaction(tx, id, blocker, context, actor));
            } catch (ReleaseLostException e) {
                return new FlowResult.Contention(BLOCK_WITH_CONTEXT, actor, List.of(id), 1);
            }
        }));
    }

    private FlowResult blockInTransaction(IssueStore tx, String id, String blocker, String context, String actor) {
        Optional<Issue> found = tx.findIssue(id);
        if (found.isEmpty()) {
            return new FlowResult.InvalidInput(BLOCK_WITH_CONTEXT, "Issue not found: " + id);
        }
        if (tx.findIssue(blocker).isEmpty()) {
            return new FlowResult.InvalidInput(BLOCK_WITH_CONTEXT, "Blocker not found: " + blocker);
        }
        Issue issue = found.get();
        if (id.equals(blocker)) {
            return new FlowResult.PartialState(BLOCK_WITH_CONTEXT, id, blocker, "self_block",
                    "Issue cannot block itself: " + id);
        }
        if (graph.wouldCreateCycle(tx, id, blocker, DependencyType.BLOCKS)) {
            return new FlowResult.PartialState(BLOCK_WITH_CONTEXT, id, blocker, "cycle",
                    "Blocking " + id + " on " + blocker + " would create a dependency cycle");
        }
        if (issue.status() == IssueStatus.CLOSED) {
            return new FlowResult.PolicyViolation(BLOCK_WITH_CONTEXT, id, "already_closed", List.of(),
                    "Issue already closed: " + id);
        }

        long now = clock.millis();
        boolean edgeCreated = tx.insertEdgeIfAbsent(
                DependencyEdge.of(id, blocker, DependencyType.BLOCKS, actor, now).withNote("Context pack: " + context));
        if (edgeCreated) {
            tx.appendEvent(IssueEvent.of(id, "dependency_added", actor, null,
                    DependencyType.BLOCKS.wireName() + ":" + blocker, context, now));
        }
        String entry = "[blocked by " + blocker + "] " + context;
        String notes = issue.notes() == null || issue.notes().isBlank() ? entry : issue.notes() + "\n\n" + entry;
        tx.saveDetails(issue.withNotes(notes, now));
        tx.appendEvent(IssueEvent.of(id, "commented", actor, null, null, entry, now));

        boolean released = false;
        if (issue.status() == IssueStatus.IN_PROGRESS) {
            if (!tx.compareAndSetState(id, IssueStatus.IN_PROGRESS, issue.assignee(), issue.state().released(), now)) {
                throw new ReleaseLostException();
            }
            tx.appendEvent(IssueEvent.of(id, "status_changed", actor,
                    IssueStatus.IN_PROGRESS.wireName(), IssueStatus.OPEN.wireName(), "blocked by " + blocker, now));
            released = true;
        }
        return new FlowResult.Blocked(id, blocker, context, edgeCreated, released);
    }

    /**
     * Thrown inside the transaction to roll back the edge and note when the release
     * compare-and-set loses.
     */
    private static final class ReleaseLostException extends RuntimeException {
        private ReleaseLostException() {
            super("Issue state changed during release");
        }
    }

    private FlowResult guarded(String operation, Supplier<FlowResult> work) {
        try {
            return work.get();
        } catch (StoreUnavailableException e) {
            return new FlowResult.StoreUnavailable(operation, e.getMessage());
        } catch (StoreException e) {
            return new FlowResult.SystemError(operation, e.getMessage());
        } catch (IllegalArgumentException e) {
            return new FlowResult.InvalidInput(operation, e.getMessage());
        }
    }

    /**
     * Records the outcome after the store transaction has ended. A failed append is
     * reported on stderr and never changes the result of a committed operation.
     */
    private FlowResult audited(String operation, String actor, String resource, FlowResult result) {
        Map<String, Object> details = Jsons.toMap(result.toPayload());
        try {
            auditLogger.log(AuditLogger.AuditEvent.of("flow." + operation, actor, resource, result.tag().wireName(), details));
        } catch (RuntimeException e) {
            System.err.println("WARN audit append failed for flow." + operation + ": " + e.getMessage());
        }
        return result;
    }

    private static List<String> ids(List<Issue> issues) {
        List<String> out = new ArrayList<>();
        for (Issue issue : issues) {
            out.add(issue.id());
        }
        return out;
    }
}
