package io.workgraph.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Where one WorkGraph store lives on disk. The default namespace uses the root directly;
 * any other namespace gets its own database and audit log under {@code namespaces/<ns>}.
 */
public record WorkGraphConfig(Path rootDir, String namespace) {
    public static final String DEFAULT_ROOT = "data";
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String NAMESPACES_DIR = "namespaces";
    public static final String DB_FILE = "workgraph.db";
    public static final String SETTINGS_FILE = "workgraph-settings.json";

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^a-z0-9_.-]");
    private static final Pattern DASH_RUNS = Pattern.compile("-{2,}");

    public static WorkGraphConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    public static WorkGraphConfig fromRoot(String root, String namespace) {
        Path base = Paths.get(root == null || root.isBlank() ? DEFAULT_ROOT : root.trim())
                .toAbsolutePath()
                .normalize();
        String ns = sanitizeNamespace(namespace);
        if (DEFAULT_NAMESPACE.equals(ns)) {
            return new WorkGraphConfig(base, ns);
        }
        return new WorkGraphConfig(base.resolve(NAMESPACES_DIR).resolve(ns), ns);
    }

    /**
     * Lowercases and replaces anything outside {@code [a-z0-9_.-]} with a dash, so a
     * namespace is always a single safe path segment.
     */
    static String sanitizeNamespace(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_NAMESPACE;
        }
        String value = UNSAFE_CHARS.matcher(raw.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
        value = DASH_RUNS.matcher(value).replaceAll("-");
        if (value.startsWith(".")) {
            value = "ns" + value;
        }
        return value;
    }

    public Path dbFile() {
        return rootDir.resolve(DB_FILE);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
