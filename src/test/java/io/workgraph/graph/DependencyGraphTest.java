package io.workgraph.graph;

import io.workgraph.config.WorkGraphConfig;
import io.workgraph.model.DependencyEdge;
import io.workgraph.model.DependencyType;
import io.workgraph.model.Issue;
import io.workgraph.model.IssueStatus;
import io.workgraph.model.TreeDirection;
import io.workgraph.model.TreeNode;
import io.workgraph.storage.Database;
import io.workgraph.storage.SqliteIssueStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class DependencyGraphTest {
    private static final long NOW = 1_700_000_000_000L;

    @Test
    void informationalEdgesNeverChangeReadiness() throws Exception {
        Path root = Files.createTempDirectory("workgraph-test-informational-");
        try {
            SqliteIssueStore store = openStore(root, "a", "b");
            DependencyGraph graph = new DependencyGraph(1_000);
            for (DependencyType type : DependencyType.values()) {
                if (type.isBlocking() || type == DependencyType.PARENT_CHILD) {
                    continue;
                }
                store.insertEdgeIfAbsent(DependencyEdge.of("a", "b", type, "t", NOW));
            }
            store.insertEdgeIfAbsent(DependencyEdge.of("a", "b", DependencyType.PARENT_CHILD, "t", NOW));

            Issue a = store.findIssue("a").orElseThrow();
            Assertions.assertTrue(graph.isReady(store, a, NOW));
            Assertions.assertTrue(graph.blockingEdges(store, "a").isEmpty());

            store.insertEdgeIfAbsent(DependencyEdge.of("a", "b", DependencyType.BLOCKS, "t", NOW));
            Assertions.assertFalse(graph.isReady(store, a, NOW));
            Assertions.assertEquals(1, graph.blockingEdges(store, "a").size());

            Issue b = store.findIssue("b").orElseThrow();
            Assertions.assertTrue(store.compareAndSetState("b", IssueStatus.OPEN, null, b.state().closed("done", null, NOW), NOW));
            Assertions.assertTrue(graph.isReady(store, a, NOW));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deferredOrNonOpenIssuesAreNotReady() throws Exception {
        Path root = Files.createTempDirectory("workgraph-test-ready-status-");
        try {
            SqliteIssueStore store = openStore(root, "a");
            DependencyGraph graph = new DependencyGraph(1_000);
            Issue a = store.findIssue("a").orElseThrow();

            Assertions.assertTrue(graph.isReady(store, a, NOW));
            Assertions.assertFalse(graph.isReady(store, withDeferUntil(a, NOW + 1), NOW));
            Assertions.assertTrue(graph.isReady(store, withDeferUntil(a, NOW), NOW));

            store.compareAndSetState("a", IssueStatus.OPEN, null, a.state().claimedBy("alice"), NOW);
            Assertions.assertFalse(graph.isReady(store, store.findIssue("a").orElseThrow(), NOW));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cycleCheckIsPerCategoryAndSelfEdgesAlwaysFail() throws Exception {
        Path root = Files.createTempDirectory("workgraph-test-cycles-");
        try {
            SqliteIssueStore store = openStore(root, "a", "b", "c");
            DependencyGraph graph = new DependencyGraph(1_000);
            store.insertEdgeIfAbsent(DependencyEdge.of("a", "b", DependencyType.BLOCKS, "t", NOW));
            store.insertEdgeIfAbsent(DependencyEdge.of("b", "c", DependencyType.BLOCKS, "t", NOW));

            Assertions.assertTrue(graph.wouldCreateCycle(store, "c", "a", DependencyType.BLOCKS));
            Assertions.assertFalse(graph.wouldCreateCycle(store, "a", "c", DependencyType.BLOCKS));
            Assertions.assertFalse(graph.wouldCreateCycle(store, "c", "a", DependencyType.PARENT_CHILD));
            Assertions.assertFalse(graph.wouldCreateCycle(store, "c", "a", DependencyType.CAUSED_BY));
            Assertions.assertFalse(graph.wouldCreateCycle(store, "c", "a", DependencyType.RELATES_TO));
            Assertions.assertTrue(graph.wouldCreateCycle(store, "a", "a", DependencyType.RELATES_TO));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cycleCheckFailsClosedPastTheTraversalBudget() throws Exception {
        Path root = Files.createTempDirectory("workgraph-test-budget-");
        try {
            SqliteIssueStore store = openStore(root, "a", "b", "c", "d", "e");
            store.insertEdgeIfAbsent(DependencyEdge.of("b", "c", DependencyType.BLOCKS, "t", NOW));
            store.insertEdgeIfAbsent(DependencyEdge.of("c", "d", DependencyType.BLOCKS, "t", NOW));
            store.insertEdgeIfAbsent(DependencyEdge.of("d", "e", DependencyType.BLOCKS, "t", NOW));

            Assertions.assertFalse(new DependencyGraph(1_000).wouldCreateCycle(store, "a", "b", DependencyType.BLOCKS));
            Assertions.assertTrue(new DependencyGraph(2).wouldCreateCycle(store, "a", "b", DependencyType.BLOCKS));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void diamondTreeEmitsSharedNodeOnceAndThenAsMarker() throws Exception {
        Path root = Files.createTempDirectory("workgraph-test-diamond-");
        try {
            SqliteIssueStore store = openStore(root, "a", "b", "c", "d");
            store.insertEdgeIfAbsent(DependencyEdge.of("a", "b", DependencyType.BLOCKS, "t", NOW));
            store.insertEdgeIfAbsent(DependencyEdge.of("a", "c", DependencyType.BLOCKS, "t", NOW));
            store.insertEdgeIfAbsent(DependencyEdge.of("b", "d", DependencyType.BLOCKS, "t", NOW));
            store.insertEdgeIfAbsent(DependencyEdge.of("c", "d", DependencyType.BLOCKS, "t", NOW));

            List<TreeNode> tree = new DependencyGraph(1_000).buildTree(store, "a", TreeDirection.DOWN, 10);

            Assertions.assertEquals(List.of("a", "b", "d", "c", "d"), tree.stream().map(TreeNode::issueId).toList());
            Assertions.assertEquals(4, tree.stream().filter(n -> !n.alreadyShown()).count());
            Assertions.assertNull(tree.get(0).parentId());
            Assertions.assertEquals("b", tree.get(2).parentId());
            Assertions.assertFalse(tree.get(2).alreadyShown());
            Assertions.assertEquals(2, tree.get(2).depth());
            Assertions.assertEquals("c", tree.get(4).parentId());
            Assertions.assertTrue(tree.get(4).alreadyShown());
            Assertions.assertEquals(DependencyType.BLOCKS, tree.get(4).edgeType());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reverseTreeFollowsDependents() throws Exception {
        Path root = Files.createTempDirectory("workgraph-test-reverse-tree-");
        try {
            SqliteIssueStore store = openStore(root, "a", "b", "c");
            store.insertEdgeIfAbsent(DependencyEdge.of("a", "c", DependencyType.BLOCKS, "t", NOW));
            store.insertEdgeIfAbsent(DependencyEdge.of("b", "c", DependencyType.DISCOVERED_FROM, "t", NOW));

            List<TreeNode> tree = new DependencyGraph(1_000).buildTree(store, "c", TreeDirection.UP, 10);

            Assertions.assertEquals(List.of("c", "a", "b"), tree.stream().map(TreeNode::issueId).toList());
            Assertions.assertEquals("c", tree.get(1).parentId());
            Assertions.assertEquals(DependencyType.DISCOVERED_FROM, tree.get(2).edgeType());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void treeMarksNodesTruncatedAtTheDepthBound() throws Exception {
        Path root = Files.createTempDirectory("workgraph-test-truncated-tree-");
        try {
            SqliteIssueStore store = openStore(root, "a", "b", "c");
            store.insertEdgeIfAbsent(DependencyEdge.of("a", "b", DependencyType.BLOCKS, "t", NOW));
            store.insertEdgeIfAbsent(DependencyEdge.of("b", "c", DependencyType.BLOCKS, "t", NOW));

            List<TreeNode> tree = new DependencyGraph(1_000).buildTree(store, "a", TreeDirection.DOWN, 1);

            Assertions.assertEquals(List.of("a", "b"), tree.stream().map(TreeNode::issueId).toList());
            Assertions.assertFalse(tree.get(0).truncated());
            Assertions.assertTrue(tree.get(1).truncated());

            List<TreeNode> full = new DependencyGraph(1_000).buildTree(store, "a", TreeDirection.DOWN, 5);
            Assertions.assertFalse(full.get(2).truncated());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cycleAuditFindsCyclesInsertedBeforeEnforcement() throws Exception {
        Path root = Files.createTempDirectory("workgraph-test-cycle-audit-");
        try {
            SqliteIssueStore store = openStore(root, "a", "b", "c", "d");
            store.insertEdgeIfAbsent(DependencyEdge.of("a", "b", DependencyType.BLOCKS, "t", NOW));
            store.insertEdgeIfAbsent(DependencyEdge.of("b", "c", DependencyType.BLOCKS, "t", NOW));
            store.insertEdgeIfAbsent(DependencyEdge.of("c", "a", DependencyType.BLOCKS, "t", NOW));
            store.insertEdgeIfAbsent(DependencyEdge.of("d", "a", DependencyType.RELATES_TO, "t", NOW));
            store.insertEdgeIfAbsent(DependencyEdge.of("a", "d", DependencyType.RELATES_TO, "t", NOW));

            List<List<String>> cycles = new DependencyGraph(1_000).findCycles(store);

            Assertions.assertEquals(1, cycles.size());
            Assertions.assertEquals(List.of("a", "b", "c"), cycles.get(0));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void childrenAndParentFollowParentChildEdgesOnly() throws Exception {
        Path root = Files.createTempDirectory("workgraph-test-children-");
        try {
            SqliteIssueStore store = openStore(root, "epic", "x", "y");
            store.insertEdgeIfAbsent(DependencyEdge.of("x", "epic", DependencyType.PARENT_CHILD, "t", NOW));
            store.insertEdgeIfAbsent(DependencyEdge.of("y", "epic", DependencyType.BLOCKS, "t", NOW));
            DependencyGraph graph = new DependencyGraph(1_000);

            Assertions.assertEquals(List.of("x"), graph.children(store, "epic").stream().map(Issue::id).toList());
            Assertions.assertEquals("epic", graph.parentOf(store, "x").orElseThrow());
            Assertions.assertTrue(graph.parentOf(store, "y").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Issue withDeferUntil(Issue issue, long untilMs) {
        return new Issue(issue.id(), issue.title(), issue.description(), issue.issueType(), issue.priority(),
                issue.status(), issue.assignee(), untilMs, issue.notes(), issue.labels(), issue.closeReason(),
                issue.verified(), issue.createdAtMs(), issue.updatedAtMs(), issue.closedAtMs());
    }

    private static SqliteIssueStore openStore(Path root, String... ids) {
        Database db = new Database(WorkGraphConfig.fromRoot(root.toString()), 1_000);
        db.init();
        SqliteIssueStore store = new SqliteIssueStore(db);
        long created = NOW;
        for (String id : ids) {
            store.insertIssue(new Issue(id, "Issue " + id, "", "task", 2, IssueStatus.OPEN, null, null, "",
                    List.of(), null, null, created, created, null));
            created++;
        }
        return store;
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
