package io.workgraph.status;

import io.workgraph.config.WorkGraphConfig;
import io.workgraph.graph.DependencyGraph;
import io.workgraph.model.DependencyEdge;
import io.workgraph.model.DependencyType;
import io.workgraph.model.EffectiveStatus;
import io.workgraph.model.Issue;
import io.workgraph.model.IssueStatus;
import io.workgraph.storage.Database;
import io.workgraph.storage.SqliteIssueStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

final class StatusResolverTest {
    private static final long NOW = 1_700_000_000_000L;

    @Test
    void onlyTheFourPersistedStatusesAreAccepted() {
        StatusResolver resolver = new StatusResolver(new DependencyGraph(100), List.of());

        Assertions.assertEquals(IssueStatus.IN_PROGRESS, resolver.requirePersistable("in_progress"));
        Assertions.assertEquals(IssueStatus.CLOSED, resolver.requirePersistable(" CLOSED "));
        for (String illegal : List.of("blocked", "ready", "tombstone", "", "pinned")) {
            Assertions.assertThrows(IllegalArgumentException.class, () -> resolver.requirePersistable(illegal));
        }
    }

    @Test
    void titlesLabelsPriorityAndTypeAreValidated() {
        StatusResolver resolver = new StatusResolver(new DependencyGraph(100), List.of("Spike"));

        Assertions.assertEquals("Fix login", resolver.requireTitle("  Fix login "));
        Assertions.assertThrows(IllegalArgumentException.class, () -> resolver.requireTitle("   "));
        Assertions.assertThrows(IllegalArgumentException.class, () -> resolver.requireTitle("x".repeat(501)));

        Assertions.assertEquals(List.of("ui", "backend"), resolver.requireLabels(List.of(" ui", "backend", "ui ")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> resolver.requireLabels(List.of("ui", " ")));

        Assertions.assertEquals(0, resolver.requirePriority(0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> resolver.requirePriority(5));
        Assertions.assertThrows(IllegalArgumentException.class, () -> resolver.requirePriority(-1));

        Assertions.assertEquals("task", resolver.requireIssueType(null));
        Assertions.assertEquals("epic", resolver.requireIssueType("EPIC"));
        Assertions.assertEquals("spike", resolver.requireIssueType("spike"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> resolver.requireIssueType("story"));
    }

    @Test
    void everyNonClosedIssueFallsInExactlyOneListing() throws Exception {
        Path root = Files.createTempDirectory("workgraph-test-listings-");
        try {
            Database db = new Database(WorkGraphConfig.fromRoot(root.toString()), 1_000);
            db.init();
            SqliteIssueStore store = new SqliteIssueStore(db);
            StatusResolver resolver = new StatusResolver(new DependencyGraph(1_000), List.of());

            store.insertIssue(issue("ready", IssueStatus.OPEN, null, null));
            store.insertIssue(issue("blocked", IssueStatus.OPEN, null, null));
            store.insertIssue(issue("deferred-status", IssueStatus.DEFERRED, null, null));
            store.insertIssue(issue("deferred-until", IssueStatus.OPEN, null, NOW + 60_000));
            store.insertIssue(issue("working", IssueStatus.IN_PROGRESS, "alice", null));
            store.insertEdgeIfAbsent(DependencyEdge.of("blocked", "working", DependencyType.BLOCKS, "t", NOW));

            List<String> ready = resolver.readyIssues(store, NOW, 0).stream().map(Issue::id).toList();
            List<StatusResolver.BlockedIssue> blocked = resolver.blockedIssues(store, NOW);
            List<String> deferred = resolver.deferredIssues(store, NOW).stream().map(Issue::id).toList();

            Assertions.assertEquals(List.of("ready"), ready);
            Assertions.assertEquals(1, blocked.size());
            Assertions.assertEquals("blocked", blocked.get(0).issue().id());
            Assertions.assertEquals(List.of("working"), blocked.get(0).blockedBy());
            Assertions.assertEquals(Set.of("deferred-status", "deferred-until"), Set.copyOf(deferred));

            Set<EffectiveStatus> effective = Stream.of("ready", "blocked", "deferred-status", "deferred-until", "working")
                    .map(id -> resolver.effectiveStatus(store, store.findIssue(id).orElseThrow(), NOW))
                    .collect(Collectors.toSet());
            Assertions.assertEquals(Set.of(EffectiveStatus.OPEN, EffectiveStatus.BLOCKED, EffectiveStatus.DEFERRED,
                    EffectiveStatus.IN_PROGRESS), effective);

            // Once the deferral lapses the issue is ready again.
            Assertions.assertTrue(resolver.isReady(store, store.findIssue("deferred-until").orElseThrow(), NOW + 60_000));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deferralTakesPrecedenceOverBlockersOnEverySurface() throws Exception {
        Path root = Files.createTempDirectory("workgraph-test-deferred-blocked-");
        try {
            Database db = new Database(WorkGraphConfig.fromRoot(root.toString()), 1_000);
            db.init();
            SqliteIssueStore store = new SqliteIssueStore(db);
            StatusResolver resolver = new StatusResolver(new DependencyGraph(1_000), List.of());

            store.insertIssue(issue("blocker", IssueStatus.OPEN, null, null));
            store.insertIssue(issue("gated", IssueStatus.OPEN, null, NOW + 60_000));
            store.insertEdgeIfAbsent(DependencyEdge.of("gated", "blocker", DependencyType.BLOCKS, "t", NOW));
            Issue gated = store.findIssue("gated").orElseThrow();

            Assertions.assertFalse(resolver.isBlocked(store, gated, NOW));
            Assertions.assertFalse(resolver.isReady(store, gated, NOW));
            Assertions.assertEquals(EffectiveStatus.DEFERRED, resolver.effectiveStatus(store, gated, NOW));
            Assertions.assertTrue(resolver.blockedIssues(store, NOW).stream().noneMatch(b -> b.issue().id().equals("gated")));
            Assertions.assertEquals(List.of("gated"),
                    resolver.deferredIssues(store, NOW).stream().map(Issue::id).toList());

            long later = NOW + 60_000;
            Assertions.assertTrue(resolver.isBlocked(store, gated, later));
            Assertions.assertEquals(EffectiveStatus.BLOCKED, resolver.effectiveStatus(store, gated, later));
            Assertions.assertEquals(List.of("gated"),
                    resolver.blockedIssues(store, later).stream().map(b -> b.issue().id()).toList());
            Assertions.assertTrue(resolver.deferredIssues(store, later).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reopenClearsDeferralAndClosureFields() {
        StatusResolver resolver = new StatusResolver(new DependencyGraph(100), List.of());
        Issue closed = new Issue("wg-1", "t", "", "task", 2, IssueStatus.CLOSED, "alice", NOW + 5, "", List.of(),
                "done", "ci", NOW, NOW, NOW);

        var reopened = resolver.reopenState(closed);
        Assertions.assertEquals(IssueStatus.OPEN, reopened.status());
        Assertions.assertEquals("alice", reopened.assignee());
        Assertions.assertNull(reopened.deferUntilMs());
        Assertions.assertNull(reopened.closedAtMs());
        Assertions.assertNull(reopened.closeReason());
        Assertions.assertNull(reopened.verified());

        Issue open = new Issue("wg-2", "t", "", "task", 2, IssueStatus.OPEN, null, null, "", List.of(),
                null, null, NOW, NOW, null);
        Assertions.assertThrows(IllegalArgumentException.class, () -> resolver.reopenState(open));
    }

    private static Issue issue(String id, IssueStatus status, String assignee, Long deferUntilMs) {
        return new Issue(id, "Issue " + id, "", "task", 2, status, assignee, deferUntilMs, "", List.of(),
                null, null, NOW, NOW, null);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
