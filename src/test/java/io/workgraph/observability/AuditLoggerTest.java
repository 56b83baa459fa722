package io.workgraph.observability;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void rowsChainToTheirPredecessor() throws Exception {
        Path root = Files.createTempDirectory("workgraph-test-audit-chain-");
        try {
            AuditLogger logger = new AuditLogger(root.resolve("audit").resolve("audit.log"), "ops");
            Assertions.assertEquals("", logger.currentHash());

            logger.log(AuditLogger.AuditEvent.of("issue.create", "alice", "issue/wg-1", "created", Map.of("title", "a")));
            logger.log(AuditLogger.AuditEvent.of("issue.delete", "bob", "issue/wg-1", "deleted", null));

            List<JsonNode> rows = logger.tail(10);
            Assertions.assertEquals(2, rows.size());
            Assertions.assertEquals("", rows.get(0).path("prev_hash").asText());
            Assertions.assertEquals(rows.get(0).path("hash").asText(), rows.get(1).path("prev_hash").asText());
            Assertions.assertEquals("ops", rows.get(1).path("namespace").asText());
            Assertions.assertEquals(rows.get(1).path("hash").asText(), logger.currentHash());
            Assertions.assertEquals(1, logger.tail(1).size());

            AuditLogger.ChainVerification verification = logger.verifyChain();
            Assertions.assertTrue(verification.valid());
            Assertions.assertEquals(2, verification.rows());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void chainHeadIsFoundFromTheFileTailAcrossChunksAndBlankLines() throws Exception {
        Path root = Files.createTempDirectory("workgraph-test-audit-tail-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "default");
            String large = "x".repeat(AuditLogger.TAIL_CHUNK_BYTES * 3);
            logger.log(AuditLogger.AuditEvent.of("issue.create", "alice", "issue/wg-1", "created", Map.of("notes", large)));
            String firstHash = logger.currentHash();
            Assertions.assertEquals(logger.tail(1).get(0).path("hash").asText(), firstHash);

            Files.writeString(file, "\n\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
            Assertions.assertEquals(firstHash, logger.currentHash());

            logger.log(AuditLogger.AuditEvent.of("issue.update", "bob", "issue/wg-1", "updated", Map.of("notes", large)));
            logger.log(AuditLogger.AuditEvent.of("issue.delete", "bob", "issue/wg-1", "deleted", Map.of()));

            List<JsonNode> rows = logger.tail(3);
            Assertions.assertEquals(firstHash, rows.get(1).path("prev_hash").asText());
            Assertions.assertEquals(rows.get(1).path("hash").asText(), rows.get(2).path("prev_hash").asText());
            Assertions.assertTrue(logger.verifyChain().valid());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("workgraph-test-audit-tamper-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "default");
            logger.log(AuditLogger.AuditEvent.of("flow.close-safe", "alice", "wg-1", "policy_violation", Map.of()));
            logger.log(AuditLogger.AuditEvent.of("flow.close-safe", "alice", "wg-1", "closed", Map.of()));

            String content = Files.readString(file, StandardCharsets.UTF_8);
            Files.writeString(file, content.replaceFirst("policy_violation", "closed"), StandardCharsets.UTF_8);

            AuditLogger.ChainVerification verification = logger.verifyChain();
            Assertions.assertFalse(verification.valid());
            Assertions.assertEquals("hash mismatch at row 1", verification.message());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentLoggersOnOneFileKeepALinearChain() throws Exception {
        Path root = Files.createTempDirectory("workgraph-test-audit-concurrent-");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            Path file = root.resolve("audit.log");
            List<Future<?>> futures = new ArrayList<>();
            for (int worker = 0; worker < 4; worker++) {
                AuditLogger logger = new AuditLogger(file, "default");
                String actor = "worker-" + worker;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 10; i++) {
                        logger.log(AuditLogger.AuditEvent.of("issue.update", actor, "issue/wg-" + i, "updated", Map.of()));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }

            AuditLogger.ChainVerification verification = new AuditLogger(file, "default").verifyChain();
            Assertions.assertTrue(verification.valid(), verification.message());
            Assertions.assertEquals(40, verification.rows());
        } finally {
            pool.shutdownNow();
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
