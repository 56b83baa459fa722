package io.workgraph.flow;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of flow outcomes. Exit codes are part of the command-line contract and are
 * never reassigned.
 */
public enum FlowResultTag {
    CLAIMED("claimed", 0),
    WIP_BLOCKED("wip_blocked", 0),
    NO_READY("no_ready", 0),
    CONTENTION("contention", 0),
    CLOSED("closed", 0),
    BLOCKED("blocked", 0),
    SYSTEM_ERROR("system_error", 1),
    INVALID_INPUT("invalid_input", 2),
    POLICY_VIOLATION("policy_violation", 3),
    PARTIAL_STATE("partial_state", 4),
    STORE_UNAVAILABLE("store_unavailable", 5);

    private final String wireName;
    private final int exitCode;

    FlowResultTag(String wireName, int exitCode) {
        this.wireName = wireName;
        this.exitCode = exitCode;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int exitCode() {
        return exitCode;
    }
}
