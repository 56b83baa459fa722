package io.workgraph.flow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.workgraph.util.Jsons;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a flow operation. Each variant carries only its own fields; the payload
 * printed for callers is {@code {"result": <tag>, "exitCode": n, ...fields}}.
 */
public sealed interface FlowResult {

    FlowResultTag tag();

    default int exitCode() {
        return tag().exitCode();
    }

    default ObjectNode toPayload() {
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("result", tag().wireName());
        out.put("exitCode", exitCode());
        JsonNode fields = Jsons.mapper().valueToTree(this);
        for (Map.Entry<String, JsonNode> field : (Iterable<Map.Entry<String, JsonNode>>) fields::fields) {
            out.set(field.getKey(), field.getValue());
        }
        return out;
    }

    record Claimed(String actor, List<String> issueIds, List<String> contendedIds) implements FlowResult {
        public Claimed {
            issueIds = List.copyOf(issueIds);
            contendedIds = List.copyOf(contendedIds);
        }

        @Override
        public FlowResultTag tag() {
            return FlowResultTag.CLAIMED;
        }
    }

    record WipBlocked(String actor, int wipLimit, List<String> inProgressIds) implements FlowResult {
        public WipBlocked {
            inProgressIds = List.copyOf(inProgressIds);
        }

        @Override
        public FlowResultTag tag() {
            return FlowResultTag.WIP_BLOCKED;
        }
    }

    record NoReady(String actor) implements FlowResult {
        @Override
        public FlowResultTag tag() {
            return FlowResultTag.NO_READY;
        }
    }

    record Contention(String operation, String actor, List<String> contendedIds, int attempts) implements FlowResult {
        public Contention {
            contendedIds = List.copyOf(contendedIds);
        }

        @Override
        public FlowResultTag tag() {
            return FlowResultTag.CONTENTION;
        }
    }

    record Closed(String issueId, String closeReason, String verified, boolean forced,
                  List<String> unblockedIds) implements FlowResult {
        public Closed {
            unblockedIds = List.copyOf(unblockedIds);
        }

        @Override
        public FlowResultTag tag() {
            return FlowResultTag.CLOSED;
        }
    }

    record Blocked(String issueId, String blockerId, String contextPack, boolean edgeCreated,
                   boolean released) implements FlowResult {
        @Override
        public FlowResultTag tag() {
            return FlowResultTag.BLOCKED;
        }
    }

    record PolicyViolation(String operation, String issueId, String reason, List<String> blockerIds,
                           String message) implements FlowResult {
        public PolicyViolation {
            blockerIds = List.copyOf(blockerIds);
        }

        @Override
        public FlowResultTag tag() {
            return FlowResultTag.POLICY_VIOLATION;
        }
    }

    /**
     * The operation could not complete and nothing was written.
     */
    record PartialState(String operation, String issueId, String blockerId, String reason,
                        String message) implements FlowResult {
        @Override
        public FlowResultTag tag() {
            return FlowResultTag.PARTIAL_STATE;
        }
    }

    record InvalidInput(String operation, String message) implements FlowResult {
        @Override
        public FlowResultTag tag() {
            return FlowResultTag.INVALID_INPUT;
        }
    }

    record StoreUnavailable(String operation, String message) implements FlowResult {
        @Override
        public FlowResultTag tag() {
            return FlowResultTag.STORE_UNAVAILABLE;
        }
    }

    record SystemError(String operation, String message) implements FlowResult {
        @Override
        public FlowResultTag tag() {
            return FlowResultTag.SYSTEM_ERROR;
        }
    }
}
