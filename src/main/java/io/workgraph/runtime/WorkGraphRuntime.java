package io.workgraph.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.workgraph.config.WorkGraphConfig;
import io.workgraph.config.WorkGraphSettings;
import io.workgraph.flow.FlowControlPlane;
import io.workgraph.flow.FlowResult;
import io.workgraph.graph.DependencyGraph;
import io.workgraph.model.DependencyEdge;
import io.workgraph.model.DependencyType;
import io.workgraph.model.EffectiveStatus;
import io.workgraph.model.Issue;
import io.workgraph.model.IssueEvent;
import io.workgraph.model.IssueState;
import io.workgraph.model.IssueStatus;
import io.workgraph.model.TreeDirection;
import io.workgraph.model.TreeNode;
import io.workgraph.observability.AuditLogger;
import io.workgraph.status.StatusResolver;
import io.workgraph.storage.Database;
import io.workgraph.storage.DuplicateDependencyException;
import io.workgraph.storage.IssueStore;
import io.workgraph.storage.SqliteIssueStore;
import io.workgraph.util.Hashing;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Facade over one WorkGraph root: wires settings, database, store, graph engine, status
 * resolver, flow plane and audit log, and exposes the issue lifecycle to the CLI.
 */
public final class WorkGraphRuntime {
    public static final int DEFAULT_PRIORITY = 2;
    private static final int ID_HASH_LENGTH = 6;

    private final WorkGraphConfig config;
    private final WorkGraphSettings settings;
    private final Database database;
    private final IssueStore store;
    private final DependencyGraph graph;
    private final StatusResolver resolver;
    private final FlowControlPlane flow;
    private final AuditLogger auditLogger;
    private final Clock clock;

    public WorkGraphRuntime(WorkGraphConfig config) {
        this(config, Clock.systemUTC());
    }

    public WorkGraphRuntime(WorkGraphConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.settings = WorkGraphSettings.load(config.settingsFile());
        this.database = new Database(config, settings.busyTimeoutMs());
        this.store = new SqliteIssueStore(database);
        this.graph = new DependencyGraph(settings.cycleTraversalBudget());
        this.resolver = new StatusResolver(graph, settings.customIssueTypes());
        this.auditLogger = new AuditLogger(config.auditFile(), config.namespace());
        this.flow = new FlowControlPlane(store, graph, resolver, settings, auditLogger, clock);
    }

    public void init() {
        database.init();
    }

    public WorkGraphConfig config() {
        return config;
    }

    public WorkGraphSettings settings() {
        return settings;
    }

    public IssueStore store() {
        return store;
    }

    public Issue create(CreateRequest request, String actor) {
        String title = resolver.requireTitle(request.title());
        String issueType = resolver.requireIssueType(request.issueType());
        int priority = resolver.requirePriority(request.priority() == null ? DEFAULT_PRIORITY : request.priority());
        List<String> labels = resolver.requireLabels(request.labels());
        String parentId = blankToNull(request.parentId());
        List<String> blockers = distinctIds(request.blockedBy());
        long now = clock.millis();

        Issue created = store.inTransaction(tx -> {
            if (parentId != null) {
                requireIssue(tx, parentId);
            }
            for (String blocker : blockers) {
                requireIssue(tx, blocker);
            }
            String id = parentId != null ? tx.nextChildId(parentId) : generateId(tx, title, now);
            Issue issue = new Issue(
                    id,
                    title,
                    Objects.requireNonNullElse(request.description(), ""),
                    issueType,
                    priority,
                    IssueStatus.OPEN,
                    blankToNull(request.assignee()),
                    null,
                    Objects.requireNonNullElse(request.notes(), ""),
                    labels,
                    null,
                    null,
                    now,
                    now,
                    null
            );
            tx.insertIssue(issue);
            tx.appendEvent(IssueEvent.of(id, "created", actor, null, title, null, now));
            // A brand-new issue has no incoming edges, so neither edge below can close a cycle.
            if (parentId != null) {
                tx.insertEdgeIfAbsent(DependencyEdge.of(id, parentId, DependencyType.PARENT_CHILD, actor, now));
                tx.appendEvent(IssueEvent.of(id, "dependency_added", actor, null,
                        DependencyType.PARENT_CHILD.wireName() + ":" + parentId, null, now));
            }
            for (String blocker : blockers) {
                tx.insertEdgeIfAbsent(DependencyEdge.of(id, blocker, DependencyType.BLOCKS, actor, now));
                tx.appendEvent(IssueEvent.of(id, "dependency_added", actor, null,
                        DependencyType.BLOCKS.wireName() + ":" + blocker, null, now));
            }
            return issue;
        });
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("title", created.title());
        details.put("type", created.issueType());
        details.put("priority", created.priority());
        if (parentId != null) {
            details.put("parent", parentId);
        }
        if (!blockers.isEmpty()) {
            details.put("blocked_by", blockers);
        }
        audit("issue.create", actor, created.id(), "created", details);
        return created;
    }

    private String generateId(IssueStore tx, String title, long now) {
        for (int nonce = 0; ; nonce++) {
            String hash = Hashing.sha256Hex(title + "|" + now + "|" + config.namespace() + "|" + nonce);
            String candidate = settings.issuePrefix() + "-" + hash.substring(0, ID_HASH_LENGTH);
            if (tx.findIssue(candidate).isEmpty()) {
                return candidate;
            }
        }
    }

    public IssueView show(String issueId) {
        Issue issue = requireIssue(store, issueId);
        long now = clock.millis();
        List<String> blockedBy = new ArrayList<>();
        for (DependencyEdge edge : graph.blockingEdges(store, issue.id())) {
            blockedBy.add(edge.toId());
        }
        List<String> childIds = new ArrayList<>();
        for (Issue child : graph.children(store, issue.id())) {
            childIds.add(child.id());
        }
        return new IssueView(
                issue,
                resolver.effectiveStatus(store, issue, now),
                resolver.isReady(store, issue, now),
                store.edgesFrom(issue.id()),
                store.edgesTo(issue.id()),
                blockedBy,
                graph.parentOf(store, issue.id()).orElse(null),
                childIds
        );
    }

    /**
     * Applies the non-null fields of {@code patch}. Status changes here cover open,
     * in_progress and deferred; closing goes through {@link #close}.
     */
    public Issue update(String issueId, IssueUpdate patch, String actor) {
        String title = patch.title() == null ? null : resolver.requireTitle(patch.title());
        String issueType = patch.issueType() == null ? null : resolver.requireIssueType(patch.issueType());
        Integer priority = patch.priority() == null ? null : resolver.requirePriority(patch.priority());
        List<String> labels = patch.labels() == null ? null : resolver.requireLabels(patch.labels());
        IssueStatus status = patch.status() == null ? null : resolver.requirePersistable(patch.status());
        if (status == IssueStatus.CLOSED) {
            throw new IllegalArgumentException("Use close to close an issue");
        }
        long now = clock.millis();

        Issue updated = store.inTransaction(tx -> {
            Issue current = requireIssue(tx, issueId);
            Issue next = current.withDetails(
                    title == null ? current.title() : title,
                    patch.description() == null ? current.description() : patch.description(),
                    issueType == null ? current.issueType() : issueType,
                    priority == null ? current.priority() : priority,
                    patch.notes() == null ? current.notes() : patch.notes(),
                    labels == null ? current.labels() : labels,
                    now
            );
            if (!next.equals(current.withDetails(current.title(), current.description(), current.issueType(),
                    current.priority(), current.notes(), current.labels(), now))) {
                tx.saveDetails(next);
                tx.appendEvent(IssueEvent.of(current.id(), "updated", actor, null, null, null, now));
            }

            IssueState state = current.state();
            IssueState target = state;
            if (status != null && status != current.status()) {
                target = current.status() == IssueStatus.CLOSED ? state.reopened().withStatus(status) : state.withStatus(status);
                if (status != IssueStatus.DEFERRED && current.status() == IssueStatus.DEFERRED) {
                    target = target.withDeferUntil(null);
                }
            }
            if (patch.clearAssignee()) {
                target = target.withAssignee(null);
            } else if (patch.assignee() != null && !patch.assignee().isBlank()) {
                target = target.withAssignee(patch.assignee().trim());
            }
            if (!target.equals(state)) {
                casOrFail(tx, current, target, now);
                if (target.status() != state.status()) {
                    tx.appendEvent(IssueEvent.of(current.id(), "status_changed", actor,
                            state.status().wireName(), target.status().wireName(), null, now));
                }
                if (!Objects.equals(target.assignee(), state.assignee())) {
                    tx.appendEvent(IssueEvent.of(current.id(), "updated", actor,
                            state.assignee(), target.assignee(), "assignee", now));
                }
            }
            return requireIssue(tx, current.id());
        });
        audit("issue.update", actor, updated.id(), "updated", Map.of("status", updated.status().wireName()));
        return updated;
    }

    public FlowResult close(String issueId, String reason, String verified, boolean force, String actor) {
        return flow.closeSafe(issueId, reason, verified, force, actor);
    }

    public Issue reopen(String issueId, String reason, String actor) {
        long now = clock.millis();
        Issue reopened = store.inTransaction(tx -> {
            Issue current = requireIssue(tx, issueId);
            casOrFail(tx, current, resolver.reopenState(current), now);
            tx.appendEvent(IssueEvent.of(current.id(), "reopened", actor,
                    IssueStatus.CLOSED.wireName(), IssueStatus.OPEN.wireName(), blankToNull(reason), now));
            return requireIssue(tx, current.id());
        });
        audit("issue.reopen", actor, reopened.id(), "reopened", Map.of());
        return reopened;
    }

    /**
     * Without {@code untilMs} the issue moves to status deferred. With it the issue stays
     * open and is hidden from ready work until that time.
     */
    public Issue defer(String issueId, Long untilMs, String actor) {
        long now = clock.millis();
        if (untilMs != null && untilMs <= now) {
            throw new IllegalArgumentException("Defer time must be in the future");
        }
        Issue deferred = store.inTransaction(tx -> {
            Issue current = requireIssue(tx, issueId);
            if (current.status() == IssueStatus.CLOSED) {
                throw new IllegalArgumentException("Cannot defer a closed issue: " + current.id());
            }
            IssueState next = untilMs == null
                    ? current.state().deferred(null)
                    : current.state().withStatus(IssueStatus.OPEN).withDeferUntil(untilMs);
            casOrFail(tx, current, next, now);
            tx.appendEvent(IssueEvent.of(current.id(), "status_changed", actor, current.status().wireName(),
                    IssueStatus.DEFERRED.wireName(), untilMs == null ? null : "until " + untilMs, now));
            return requireIssue(tx, current.id());
        });
        audit("issue.defer", actor, deferred.id(), "deferred",
                untilMs == null ? Map.of() : Map.of("until_ms", untilMs));
        return deferred;
    }

    public Issue undefer(String issueId, String actor) {
        long now = clock.millis();
        Issue undeferred = store.inTransaction(tx -> {
            Issue current = requireIssue(tx, issueId);
            if (!resolver.isDeferred(current, now) && current.deferUntilMs() == null) {
                throw new IllegalArgumentException("Issue is not deferred: " + current.id());
            }
            casOrFail(tx, current, current.state().withStatus(IssueStatus.OPEN).withDeferUntil(null), now);
            tx.appendEvent(IssueEvent.of(current.id(), "status_changed", actor,
                    IssueStatus.DEFERRED.wireName(), IssueStatus.OPEN.wireName(), null, now));
            return requireIssue(tx, current.id());
        });
        audit("issue.undefer", actor, undeferred.id(), "undeferred", Map.of());
        return undeferred;
    }

    /**
     * Deletes the issue; its edges, labels and events go with it.
     */
    public DeleteOutcome delete(String issueId, String actor) {
        DeleteOutcome outcome = store.inTransaction(tx -> {
            Issue current = requireIssue(tx, issueId);
            Set<String> affected = new LinkedHashSet<>();
            for (DependencyEdge edge : tx.edgesTo(current.id())) {
                affected.add(edge.fromId());
            }
            tx.deleteIssue(current.id());
            return new DeleteOutcome(current.id(), new ArrayList<>(affected));
        });
        audit("issue.delete", actor, outcome.issueId(), "deleted", Map.of("dependents", outcome.dependentIds()));
        return outcome;
    }

    /**
     * @throws DuplicateDependencyException if the exact (from, to, type) edge exists
     * @throws IllegalArgumentException on self-dependency, cycle or unknown issue
     */
    public DependencyEdge addDependency(String fromId, String toId, String typeRaw, String note, String actor) {
        DependencyType type = DependencyType.fromString(typeRaw);
        long now = clock.millis();
        DependencyEdge added = store.inTransaction(tx -> {
            Issue from = requireIssue(tx, fromId);
            Issue to = requireIssue(tx, toId);
            if (from.id().equals(to.id())) {
                throw new IllegalArgumentException("Issue cannot depend on itself: " + from.id());
            }
            if (type == DependencyType.PARENT_CHILD) {
                Optional<String> existing = graph.parentOf(tx, from.id());
                if (existing.isPresent() && !existing.get().equals(to.id())) {
                    throw new IllegalArgumentException(
                            "Issue " + from.id() + " already has parent " + existing.get() + "; use reparent");
                }
            }
            if (graph.wouldCreateCycle(tx, from.id(), to.id(), type)) {
                throw new IllegalArgumentException("Adding " + from.id() + " -[" + type.wireName() + "]-> "
                        + to.id() + " would create a dependency cycle");
            }
            DependencyEdge edge = DependencyEdge.of(from.id(), to.id(), type, actor, now).withNote(blankToNull(note));
            if (!tx.insertEdgeIfAbsent(edge)) {
                throw new DuplicateDependencyException(edge);
            }
            tx.appendEvent(IssueEvent.of(from.id(), "dependency_added", actor, null,
                    type.wireName() + ":" + to.id(), edge.note(), now));
            return edge;
        });
        audit("dependency.add", actor, added.fromId(), "added",
                Map.of("to", added.toId(), "type", added.type().wireName()));
        return added;
    }

    public void removeDependency(String fromId, String toId, String typeRaw, String actor) {
        DependencyType type = DependencyType.fromString(typeRaw);
        long now = clock.millis();
        store.inTransaction(tx -> {
            if (!tx.deleteEdge(fromId, toId, type)) {
                throw new IllegalArgumentException(
                        "Dependency not found: " + fromId + " -[" + type.wireName() + "]-> " + toId);
            }
            tx.appendEvent(IssueEvent.of(fromId, "dependency_removed", actor,
                    type.wireName() + ":" + toId, null, null, now));
            return null;
        });
        audit("dependency.remove", actor, fromId, "removed", Map.of("to", toId, "type", type.wireName()));
    }

    /**
     * Moves {@code childId} under {@code newParentId}, replacing any previous parent edge
     * in the same transaction.
     */
    public ReparentOutcome reparent(String childId, String newParentId, String actor) {
        long now = clock.millis();
        ReparentOutcome outcome = store.inTransaction(tx -> {
            Issue child = requireIssue(tx, childId);
            Issue parent = requireIssue(tx, newParentId);
            if (child.id().equals(parent.id())) {
                throw new IllegalArgumentException("Issue cannot be its own parent: " + child.id());
            }
            String oldParent = graph.parentOf(tx, child.id()).orElse(null);
            if (parent.id().equals(oldParent)) {
                return new ReparentOutcome(child.id(), oldParent, parent.id(), false);
            }
            if (oldParent != null) {
                tx.deleteEdge(child.id(), oldParent, DependencyType.PARENT_CHILD);
                tx.appendEvent(IssueEvent.of(child.id(), "dependency_removed", actor,
                        DependencyType.PARENT_CHILD.wireName() + ":" + oldParent, null, null, now));
            }
            if (graph.wouldCreateCycle(tx, child.id(), parent.id(), DependencyType.PARENT_CHILD)) {
                throw new IllegalArgumentException(
                        "Moving " + child.id() + " under " + parent.id() + " would create a hierarchy cycle");
            }
            tx.insertEdgeIfAbsent(DependencyEdge.of(child.id(), parent.id(), DependencyType.PARENT_CHILD, actor, now));
            tx.appendEvent(IssueEvent.of(child.id(), "dependency_added", actor, null,
                    DependencyType.PARENT_CHILD.wireName() + ":" + parent.id(), null, now));
            return new ReparentOutcome(child.id(), oldParent, parent.id(), true);
        });
        if (outcome.changed()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("old_parent", outcome.oldParentId());
            details.put("new_parent", outcome.newParentId());
            audit("issue.reparent", actor, outcome.childId(), "reparented", details);
        }
        return outcome;
    }

    public List<Issue> children(String parentId) {
        requireIssue(store, parentId);
        return graph.children(store, parentId.trim());
    }

    public List<TreeNode> tree(String rootId, String directionRaw, Integer maxDepth) {
        int depth = maxDepth == null ? settings.treeMaxDepth() : maxDepth;
        if (depth < 0) {
            throw new IllegalArgumentException("Max depth must be >= 0");
        }
        return graph.buildTree(store, rootId.trim(), TreeDirection.fromString(directionRaw), depth);
    }

    public List<Issue> ready(int limit) {
        return resolver.readyIssues(store, clock.millis(), limit);
    }

    public List<StatusResolver.BlockedIssue> blocked() {
        return resolver.blockedIssues(store, clock.millis());
    }

    public List<Issue> deferred() {
        return resolver.deferredIssues(store, clock.millis());
    }

    public List<List<String>> cycles() {
        return graph.findCycles(store);
    }

    public List<IssueEvent> events(String issueId, int limit) {
        requireIssue(store, issueId);
        return store.events(issueId.trim(), limit);
    }

    /**
     * Child counts for an epic and whether every child is closed. Never closes the epic.
     */
    public EpicStatus epicStatus(String epicId) {
        Issue epic = requireIssue(store, epicId);
        List<Issue> children = graph.children(store, epic.id());
        int closed = 0;
        for (Issue child : children) {
            if (child.status() == IssueStatus.CLOSED) {
                closed++;
            }
        }
        boolean eligible = !children.isEmpty() && closed == children.size() && epic.status() != IssueStatus.CLOSED;
        return new EpicStatus(epic.id(), children.size(), closed, eligible);
    }

    public boolean isReady(String issueId) {
        Issue issue = requireIssue(store, issueId);
        return graph.isReady(store, issue, clock.millis());
    }

    public List<DependencyEdge> blockingEdges(String issueId) {
        Issue issue = requireIssue(store, issueId);
        return graph.blockingEdges(store, issue.id());
    }

    public FlowResult claimNext(String actor, int limit) {
        return flow.claimNext(actor, limit);
    }

    public FlowResult closeSafe(String issueId, String reason, String verified, boolean force, String actor) {
        return flow.closeSafe(issueId, reason, verified, force, actor);
    }

    public FlowResult blockWithContext(String issueId, String blockerId, String contextPack, String actor) {
        return flow.blockWithContext(issueId, blockerId, contextPack, actor);
    }

    public List<JsonNode> auditTail(int limit) {
        return auditLogger.tail(limit);
    }

    public AuditLogger.ChainVerification verifyAudit() {
        return auditLogger.verifyChain();
    }

    public List<Database.SchemaMigrationRow> schemaMigrations(int limit) {
        return database.listSchemaMigrations(limit);
    }

    private void casOrFail(IssueStore tx, Issue current, IssueState next, long now) {
        if (!tx.compareAndSetState(current.id(), current.status(), current.assignee(), next, now)) {
            throw new IllegalStateException("Issue changed concurrently: " + current.id());
        }
    }

    private static Issue requireIssue(IssueStore view, String issueId) {
        if (issueId == null || issueId.isBlank()) {
            throw new IllegalArgumentException("Issue id must not be blank");
        }
        return view.findIssue(issueId.trim())
                .orElseThrow(() -> new IllegalArgumentException("Issue not found: " + issueId.trim()));
    }

    // Runs after commit; the store change stands even if the audit row cannot be written.
    private void audit(String action, String actor, String issueId, String result, Map<String, Object> details) {
        try {
            auditLogger.log(AuditLogger.AuditEvent.of(action, actor, "issue/" + issueId, result, details));
        } catch (RuntimeException e) {
            System.err.println("WARN audit append failed for " + action + ": " + e.getMessage());
        }
    }

    private static List<String> distinctIds(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String id : raw) {
            if (id != null && !id.isBlank()) {
                out.add(id.trim());
            }
        }
        return List.copyOf(out);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public record CreateRequest(
            String title,
            String description,
            String issueType,
            Integer priority,
            List<String> labels,
            String assignee,
            String parentId,
            List<String> blockedBy,
            String notes
    ) {
        public static CreateRequest titled(String title) {
            return new CreateRequest(title, null, null, null, null, null, null, null, null);
        }

        public CreateRequest withPriority(int value) {
            return new CreateRequest(title, description, issueType, value, labels, assignee, parentId, blockedBy, notes);
        }

        public CreateRequest withParent(String value) {
            return new CreateRequest(title, description, issueType, priority, labels, assignee, value, blockedBy, notes);
        }

        public CreateRequest withBlockedBy(List<String> value) {
            return new CreateRequest(title, description, issueType, priority, labels, assignee, parentId, value, notes);
        }

        public CreateRequest withType(String value) {
            return new CreateRequest(title, description, value, priority, labels, assignee, parentId, blockedBy, notes);
        }

        public CreateRequest withLabels(List<String> value) {
            return new CreateRequest(title, description, issueType, priority, value, assignee, parentId, blockedBy, notes);
        }
    }

    public record IssueUpdate(
            String title,
            String description,
            String issueType,
            Integer priority,
            String notes,
            List<String> labels,
            String status,
            String assignee,
            boolean clearAssignee
    ) {
        public static IssueUpdate empty() {
            return new IssueUpdate(null, null, null, null, null, null, null, null, false);
        }

        public IssueUpdate withTitle(String value) {
            return new IssueUpdate(value, description, issueType, priority, notes, labels, status, assignee, clearAssignee);
        }

        public IssueUpdate withStatus(String value) {
            return new IssueUpdate(title, description, issueType, priority, notes, labels, value, assignee, clearAssignee);
        }

        public IssueUpdate withLabels(List<String> value) {
            return new IssueUpdate(title, description, issueType, priority, notes, value, status, assignee, clearAssignee);
        }

        public IssueUpdate withPriority(Integer value) {
            return new IssueUpdate(title, description, issueType, value, notes, labels, status, assignee, clearAssignee);
        }
    }

    public record IssueView(
            Issue issue,
            EffectiveStatus effectiveStatus,
            boolean ready,
            List<DependencyEdge> dependencies,
            List<DependencyEdge> dependents,
            List<String> blockedBy,
            String parentId,
            List<String> childIds
    ) {
    }

    public record DeleteOutcome(String issueId, List<String> dependentIds) {
    }

    public record ReparentOutcome(String childId, String oldParentId, String newParentId, boolean changed) {
    }

    public record EpicStatus(String epicId, int totalChildren, int closedChildren, boolean eligibleForClose) {
    }
}
