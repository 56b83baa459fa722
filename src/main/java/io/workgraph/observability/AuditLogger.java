package io.workgraph.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.workgraph.util.Hashing;
import io.workgraph.util.Jsons;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Append-only JSON-lines audit trail. Each row carries the hash of the previous row, so
 * truncation or edits show up in {@link #verifyChain()}. Several processes may share one
 * file; appends are serialized with an exclusive file lock and the chain head is re-read
 * under that lock.
 */
public final class AuditLogger {
    // File locks are held per JVM, so loggers in one process must also queue on a monitor.
    private static final ConcurrentMap<Path, Object> APPEND_MONITORS = new ConcurrentHashMap<>();
    static final int TAIL_CHUNK_BYTES = 4_096;

    private final Path auditFile;
    private final Object appendMonitor;
    private final String namespace;

    public AuditLogger(Path auditFile, String namespace) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.appendMonitor = APPEND_MONITORS.computeIfAbsent(auditFile.toAbsolutePath().normalize(), k -> new Object());
        try {
            Files.createDirectories(auditFile.getParent());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    public void log(AuditEvent event) {
        synchronized (appendMonitor) {
            append(event);
        }
    }

    private void append(AuditEvent event) {
        try (FileChannel channel = FileChannel.open(auditFile,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", Instant.now().toString());
            row.put("namespace", namespace);
            row.put("action", event.action());
            row.put("actor", event.actor());
            row.put("resource", event.resource());
            row.put("result", event.result());
            row.put("details", event.details());
            row.put("prev_hash", lastHash(channel));
            String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
            row.put("hash", rowHash);
            byte[] line = (Jsons.toCompactJson(row) + "\n").getBytes(StandardCharsets.UTF_8);
            channel.position(channel.size());
            ByteBuffer buffer = ByteBuffer.wrap(line);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    /**
     * Last {@code limit} rows, oldest first.
     */
    public List<JsonNode> tail(int limit) {
        List<String> lines = readLines();
        int from = Math.max(0, lines.size() - Math.max(1, limit));
        List<JsonNode> out = new ArrayList<>();
        for (String line : lines.subList(from, lines.size())) {
            out.add(parse(line));
        }
        return out;
    }

    public String currentHash() {
        if (!Files.exists(auditFile)) {
            return "";
        }
        try (FileChannel channel = FileChannel.open(auditFile, StandardOpenOption.READ)) {
            return lastHash(channel);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    /**
     * Recomputes every row hash and checks each row links to its predecessor.
     */
    public ChainVerification verifyChain() {
        String previous = "";
        int rows = 0;
        for (String line : readLines()) {
            rows++;
            JsonNode node = parse(line);
            String prevHash = node.path("prev_hash").asText("");
            String hash = node.path("hash").asText("");
            if (!prevHash.equals(previous)) {
                return new ChainVerification(false, rows, "prev_hash mismatch at row " + rows);
            }
            ObjectNode body = node.deepCopy();
            body.remove("hash");
            String expected = Hashing.sha256Hex(Jsons.toCompactJson(body));
            if (!expected.equals(hash)) {
                return new ChainVerification(false, rows, "hash mismatch at row " + rows);
            }
            previous = hash;
        }
        return new ChainVerification(true, rows, "ok");
    }

    /**
     * Hash of the last non-blank row, found by reading the file backwards from its end in
     * {@value #TAIL_CHUNK_BYTES}-byte chunks.
     */
    private String lastHash(FileChannel channel) throws IOException {
        byte[] tail = new byte[0];
        long position = channel.size();
        while (position > 0) {
            int chunk = (int) Math.min(TAIL_CHUNK_BYTES, position);
            position -= chunk;
            ByteBuffer buffer = ByteBuffer.allocate(chunk);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer, position + buffer.position()) < 0) {
                    throw new IOException("Audit log shrank while reading: " + auditFile);
                }
            }
            byte[] merged = new byte[chunk + tail.length];
            System.arraycopy(buffer.array(), 0, merged, 0, chunk);
            System.arraycopy(tail, 0, merged, chunk, tail.length);
            tail = merged;
            String line = lastLine(tail, position == 0);
            if (line != null) {
                return line.isEmpty() ? "" : parse(line).path("hash").asText("");
            }
        }
        return "";
    }

    /**
     * Last non-blank line of {@code bytes}, or null when it may continue before the
     * buffer start. Empty when the whole file holds no row.
     */
    private static String lastLine(byte[] bytes, boolean atFileStart) {
        int end = bytes.length;
        while (end > 0 && Character.isWhitespace(bytes[end - 1])) {
            end--;
        }
        if (end == 0) {
            return atFileStart ? "" : null;
        }
        int start = end - 1;
        while (start >= 0 && bytes[start] != '\n') {
            start--;
        }
        if (start < 0 && !atFileStart) {
            return null;
        }
        return new String(bytes, start + 1, end - start - 1, StandardCharsets.UTF_8);
    }

    private List<String> readLines() {
        if (!Files.exists(auditFile)) {
            return List.of();
        }
        try {
            List<String> out = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(line);
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private JsonNode parse(String line) {
        try {
            return Jsons.readTree(line);
        } catch (IOException e) {
            throw new RuntimeException("Corrupt audit row in " + auditFile, e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result,
                                    Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }

    public record ChainVerification(boolean valid, int rows, String message) {
    }
}
