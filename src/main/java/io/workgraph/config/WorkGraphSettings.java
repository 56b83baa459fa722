package io.workgraph.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import io.workgraph.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tunables read from {@code workgraph-settings.json} in the runtime root. Missing
 * keys keep their defaults; out-of-range values are clamped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkGraphSettings(
        int wipLimit,
        int claimRetryBound,
        int treeMaxDepth,
        int cycleTraversalBudget,
        int busyTimeoutMs,
        String issuePrefix,
        List<String> customIssueTypes
) {
    public static final int DEFAULT_WIP_LIMIT = 1;
    public static final int DEFAULT_CLAIM_RETRY_BOUND = 8;
    public static final int DEFAULT_TREE_MAX_DEPTH = 50;
    public static final int DEFAULT_CYCLE_TRAVERSAL_BUDGET = 100_000;
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5_000;
    public static final String DEFAULT_ISSUE_PREFIX = "wg";

    public WorkGraphSettings {
        customIssueTypes = customIssueTypes == null ? List.of() : List.copyOf(customIssueTypes);
    }

    public static WorkGraphSettings defaults() {
        return new WorkGraphSettings(
                DEFAULT_WIP_LIMIT,
                DEFAULT_CLAIM_RETRY_BOUND,
                DEFAULT_TREE_MAX_DEPTH,
                DEFAULT_CYCLE_TRAVERSAL_BUDGET,
                DEFAULT_BUSY_TIMEOUT_MS,
                DEFAULT_ISSUE_PREFIX,
                List.of()
        );
    }

    public static WorkGraphSettings load(Path settingsFile) {
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults();
        }
        try {
            JsonNode node = Jsons.readTree(settingsFile);
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("Settings file must contain a JSON object: " + settingsFile);
            }
            WorkGraphSettings d = defaults();
            Set<String> types = new LinkedHashSet<>();
            for (JsonNode t : node.path("customIssueTypes")) {
                String value = t.asText("").trim().toLowerCase(Locale.ROOT);
                if (!value.isEmpty()) {
                    types.add(value);
                }
            }
            String prefix = node.path("issuePrefix").asText(d.issuePrefix()).trim();
            return new WorkGraphSettings(
                    Math.max(0, node.path("wipLimit").asInt(d.wipLimit())),
                    Math.max(1, node.path("claimRetryBound").asInt(d.claimRetryBound())),
                    Math.max(1, node.path("treeMaxDepth").asInt(d.treeMaxDepth())),
                    Math.max(16, node.path("cycleTraversalBudget").asInt(d.cycleTraversalBudget())),
                    Math.max(0, node.path("busyTimeoutMs").asInt(d.busyTimeoutMs())),
                    prefix.isEmpty() ? d.issuePrefix() : prefix,
                    List.copyOf(types)
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings file: " + settingsFile, e);
        }
    }
}
