package io.workgraph.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class WorkGraphConfigTest {

    @Test
    void namespacesGetTheirOwnDirectoryUnderTheRoot() {
        WorkGraphConfig def = WorkGraphConfig.fromRoot("/tmp/wg-root");
        Assertions.assertEquals(Path.of("/tmp/wg-root"), def.rootDir());
        Assertions.assertEquals(Path.of("/tmp/wg-root/workgraph.db"), def.dbFile());
        Assertions.assertEquals(Path.of("/tmp/wg-root/audit/audit.log"), def.auditFile());

        WorkGraphConfig team = WorkGraphConfig.fromRoot("/tmp/wg-root", "Team A/../B");
        Assertions.assertEquals("team-a-..-b", team.namespace());
        Assertions.assertEquals(Path.of("/tmp/wg-root/namespaces/team-a-..-b"), team.rootDir());
    }

    @Test
    void namespaceSanitizingKeepsASinglePathSegment() {
        Assertions.assertEquals("default", WorkGraphConfig.sanitizeNamespace(null));
        Assertions.assertEquals("default", WorkGraphConfig.sanitizeNamespace("  "));
        Assertions.assertEquals("ops_1", WorkGraphConfig.sanitizeNamespace("OPS_1"));
        Assertions.assertEquals("a-b", WorkGraphConfig.sanitizeNamespace("a  //  b"));
        Assertions.assertEquals("ns.hidden", WorkGraphConfig.sanitizeNamespace(".hidden"));
    }

    @Test
    void settingsFallBackToDefaultsAndClampOutOfRangeValues() throws Exception {
        Path root = Files.createTempDirectory("workgraph-test-settings-file-");
        try {
            Path file = root.resolve(WorkGraphConfig.SETTINGS_FILE);
            Assertions.assertEquals(WorkGraphSettings.defaults(), WorkGraphSettings.load(file));

            Files.writeString(file, "{\"wipLimit\": -3, \"claimRetryBound\": 0, \"issuePrefix\": \"  \","
                    + " \"customIssueTypes\": [\"Spike\", \"spike\", \"\"], \"unknown\": true}");
            WorkGraphSettings settings = WorkGraphSettings.load(file);
            Assertions.assertEquals(0, settings.wipLimit());
            Assertions.assertEquals(1, settings.claimRetryBound());
            Assertions.assertEquals(WorkGraphSettings.DEFAULT_ISSUE_PREFIX, settings.issuePrefix());
            Assertions.assertEquals(List.of("spike"), settings.customIssueTypes());
            Assertions.assertEquals(WorkGraphSettings.DEFAULT_TREE_MAX_DEPTH, settings.treeMaxDepth());

            Files.writeString(file, "[1, 2]");
            Assertions.assertThrows(IllegalArgumentException.class, () -> WorkGraphSettings.load(file));
        } finally {
            deleteRecursively(root);
        }
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
