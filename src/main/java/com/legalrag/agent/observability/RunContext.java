package com.legalrag.agent.observability;

import com.legalrag.agent.core.AgentNode;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-query record of which nodes ran and how long each took.
 * Filled by the orchestrator, flushed to a {@link QueryTrace} at the end.
 */
@Data
public class RunContext {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<NodeVisit> nodeVisits = new ArrayList<>();

    public void recordNode(AgentNode node, long latencyMs) {
        nodeVisits.add(new NodeVisit(node, latencyMs));
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public record NodeVisit(AgentNode node, long latencyMs) {}
}
