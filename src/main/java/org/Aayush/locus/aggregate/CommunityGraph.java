package org.Aayush.locus.aggregate;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.locus.graph.WeightedGraph;

import java.util.List;

/**
 * Immutable community-level graph.
 *
 * <p>Nodes are sorted by community id, edges by {@code (communityA, communityB)}. A node's
 * slot is its position in {@link #nodes()}; {@link #toWeightedGraph()} uses slots as node ids.</p>
 */
public final class CommunityGraph {
    private final List<CommunityNode> nodes;
    private final List<InterCommunityEdge> edges;
    private final Int2IntOpenHashMap slotById;
    private final int[][] connections;

    CommunityGraph(List<CommunityNode> nodes, List<InterCommunityEdge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.slotById = new Int2IntOpenHashMap(this.nodes.size());
        this.slotById.defaultReturnValue(-1);
        for (int slot = 0; slot < this.nodes.size(); slot++) {
            slotById.put(this.nodes.get(slot).getCommunityId(), slot);
        }

        IntArrayList[] adjacent = new IntArrayList[this.nodes.size()];
        for (int slot = 0; slot < adjacent.length; slot++) {
            adjacent[slot] = new IntArrayList();
        }
        // edges sorted by (a, b) with a < b: for any x, every (a, x) precedes every (x, b),
        // so each list fills in ascending order
        for (InterCommunityEdge edge : this.edges) {
            adjacent[requireSlot(edge.getCommunityA())].add(edge.getCommunityB());
            adjacent[requireSlot(edge.getCommunityB())].add(edge.getCommunityA());
        }
        this.connections = new int[adjacent.length][];
        for (int slot = 0; slot < adjacent.length; slot++) {
            connections[slot] = adjacent[slot].toIntArray();
        }
    }

    public List<CommunityNode> nodes() {
        return nodes;
    }

    public List<InterCommunityEdge> edges() {
        return edges;
    }

    public int communityCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean containsCommunity(int communityId) {
        return slotById.containsKey(communityId);
    }

    public CommunityNode node(int communityId) {
        return nodes.get(requireSlot(communityId));
    }

    /**
     * Community ids linked to the given community by at least one crossing edge, ascending.
     */
    public int[] connections(int communityId) {
        return connections[requireSlot(communityId)].clone();
    }

    /**
     * Slot-indexed weighted view (weight = crossing weight sum) for community-level layout.
     */
    public WeightedGraph toWeightedGraph() {
        WeightedGraph.Builder builder = WeightedGraph.builder(nodes.size());
        for (InterCommunityEdge edge : edges) {
            builder.addEdge(requireSlot(edge.getCommunityA()), requireSlot(edge.getCommunityB()), edge.getWeightSum());
        }
        return builder.build();
    }

    private int requireSlot(int communityId) {
        int slot = slotById.get(communityId);
        if (slot < 0) {
            throw new IllegalArgumentException("Unknown community id: " + communityId);
        }
        return slot;
    }

    @Override
    public String toString() {
        return String.format("CommunityGraph[communities=%d, edges=%d]", nodes.size(), edges.size());
    }
}
