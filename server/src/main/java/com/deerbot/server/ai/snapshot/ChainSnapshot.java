package com.deerbot.server.ai.snapshot;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persistence-ready form of a chain: its order and every tail with its node.
 */
public class ChainSnapshot {
    public int order;
    public Map<String, NodeRecord> graph = new LinkedHashMap<>();

    public ChainSnapshot() {
    }

    public ChainSnapshot(int order, Map<String, NodeRecord> graph) {
        this.order = order;
        this.graph = graph;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChainSnapshot))
            return false;
        ChainSnapshot other = (ChainSnapshot) o;
        return order == other.order && java.util.Objects.equals(graph, other.graph);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(order, graph);
    }
}
