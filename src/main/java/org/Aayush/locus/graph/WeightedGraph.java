package org.Aayush.locus.graph;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.NoSuchElementException;

/**
 * Immutable undirected weighted graph over dense node ids.
 * <p>
 * Layout:
 * - Edge list in insertion order (each unordered pair stored once).
 * - CSR arc index where every edge contributes one arc per endpoint, so
 *   neighbor iteration is O(degree) with no hashing.
 * - Arcs of a node keep edge insertion order.
 * <p>
 * Self-loops and duplicate pairs are rejected by the {@link Builder}.
 */
public final class WeightedGraph {

    // ========================================================================
    // EDGE LIST
    // ========================================================================
    private final int[] edgeSource;
    private final int[] edgeTarget;
    private final double[] edgeWeight;

    // ========================================================================
    // CSR ARC INDEX
    // ========================================================================
    // firstArc[node] -> start index in arc arrays, length nodeCount + 1
    private final int[] firstArc;
    private final int[] arcNeighbor;
    private final int[] arcEdge;

    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;

    private WeightedGraph(int nodeCount, int[] edgeSource, int[] edgeTarget, double[] edgeWeight) {
        this.nodeCount = nodeCount;
        this.edgeCount = edgeSource.length;
        this.edgeSource = edgeSource;
        this.edgeTarget = edgeTarget;
        this.edgeWeight = edgeWeight;

        this.firstArc = new int[nodeCount + 1];
        for (int e = 0; e < edgeCount; e++) {
            firstArc[edgeSource[e] + 1]++;
            firstArc[edgeTarget[e] + 1]++;
        }
        for (int node = 0; node < nodeCount; node++) {
            firstArc[node + 1] += firstArc[node];
        }

        int arcCount = edgeCount * 2;
        this.arcNeighbor = new int[arcCount];
        this.arcEdge = new int[arcCount];
        int[] cursor = new int[nodeCount];
        for (int e = 0; e < edgeCount; e++) {
            int u = edgeSource[e];
            int v = edgeTarget[e];
            int arcU = firstArc[u] + cursor[u]++;
            arcNeighbor[arcU] = v;
            arcEdge[arcU] = e;
            int arcV = firstArc[v] + cursor[v]++;
            arcNeighbor[arcV] = u;
            arcEdge[arcV] = e;
        }
    }

    /**
     * Creates an edgeless graph with the given node count.
     */
    public static WeightedGraph edgeless(int nodeCount) {
        return builder(nodeCount).build();
    }

    /**
     * Starts a builder for a graph with a fixed node count.
     */
    public static Builder builder(int nodeCount) {
        return new Builder(nodeCount);
    }

    // ========================================================================
    // EDGE ACCESSORS
    // ========================================================================

    public int getEdgeSource(int edgeId) {
        checkEdge(edgeId);
        return edgeSource[edgeId];
    }

    public int getEdgeTarget(int edgeId) {
        checkEdge(edgeId);
        return edgeTarget[edgeId];
    }

    public double getEdgeWeight(int edgeId) {
        checkEdge(edgeId);
        return edgeWeight[edgeId];
    }

    /**
     * Sum of all edge weights (each undirected edge counted once).
     */
    public double totalWeight() {
        double total = 0.0d;
        for (double weight : edgeWeight) {
            total += weight;
        }
        return total;
    }

    // ========================================================================
    // NODE ACCESSORS
    // ========================================================================

    public int getNodeDegree(int nodeId) {
        checkNode(nodeId);
        return firstArc[nodeId + 1] - firstArc[nodeId];
    }

    /**
     * Sum of weights of edges incident to a node.
     */
    public double getWeightedDegree(int nodeId) {
        checkNode(nodeId);
        double degree = 0.0d;
        for (int arc = firstArc[nodeId]; arc < firstArc[nodeId + 1]; arc++) {
            degree += edgeWeight[arcEdge[arc]];
        }
        return degree;
    }

    public boolean isIsolated(int nodeId) {
        return getNodeDegree(nodeId) == 0;
    }

    /**
     * Returns a reusable neighbor iterator.
     */
    public NeighborIterator iterator() {
        return new NeighborIterator(this);
    }

    /**
     * Cursor over the arcs of one node. Reset per node to avoid allocation in hot loops.
     */
    public static final class NeighborIterator {
        private final WeightedGraph graph;
        private int current;
        private int end;
        private int arc = -1;

        NeighborIterator(WeightedGraph graph) {
            this.graph = graph;
        }

        public NeighborIterator resetForNode(int nodeId) {
            graph.checkNode(nodeId);
            this.current = graph.firstArc[nodeId];
            this.end = graph.firstArc[nodeId + 1];
            this.arc = -1;
            return this;
        }

        public boolean hasNext() {
            return current < end;
        }

        /**
         * Advances and returns the neighbor node id.
         */
        public int next() {
            if (current >= end) throw new NoSuchElementException();
            arc = current++;
            return graph.arcNeighbor[arc];
        }

        /**
         * Weight of the arc returned by the last {@link #next()}.
         */
        public double weight() {
            return graph.edgeWeight[edgeId()];
        }

        /**
         * Edge id of the arc returned by the last {@link #next()}.
         */
        public int edgeId() {
            if (arc < 0) throw new IllegalStateException("next() has not been called");
            return graph.arcEdge[arc];
        }
    }

    private void checkNode(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeCount) {
            throw new IndexOutOfBoundsException("Node " + nodeId + " out of bounds [0, " + nodeCount + ")");
        }
    }

    private void checkEdge(int edgeId) {
        if (edgeId < 0 || edgeId >= edgeCount) {
            throw new IndexOutOfBoundsException("Edge " + edgeId + " out of bounds [0, " + edgeCount + ")");
        }
    }

    @Override
    public String toString() {
        return String.format("WeightedGraph[nodes=%d, edges=%d, avgDegree=%.2f]",
                nodeCount, edgeCount, nodeCount > 0 ? 2.0d * edgeCount / nodeCount : 0.0d);
    }

    /**
     * Collects undirected edges. A pair that is already present is ignored, so repeated
     * proposals of the same pair keep the first weight.
     */
    public static final class Builder {
        private final int nodeCount;
        private final IntArrayList sources = new IntArrayList();
        private final IntArrayList targets = new IntArrayList();
        private final DoubleArrayList weights = new DoubleArrayList();
        private final LongOpenHashSet pairs = new LongOpenHashSet();

        private Builder(int nodeCount) {
            if (nodeCount < 0) {
                throw new IllegalArgumentException("nodeCount must be >= 0");
            }
            this.nodeCount = nodeCount;
        }

        /**
         * Adds an undirected edge.
         *
         * @return true when the pair was new, false when it already existed.
         */
        public boolean addEdge(int u, int v, double weight) {
            if (u < 0 || u >= nodeCount || v < 0 || v >= nodeCount) {
                throw new IndexOutOfBoundsException("Edge (" + u + ", " + v + ") out of bounds [0, " + nodeCount + ")");
            }
            if (u == v) {
                throw new IllegalArgumentException("Self-loops are not allowed: node " + u);
            }
            if (!Double.isFinite(weight) || weight <= 0.0d) {
                throw new IllegalArgumentException("Edge weight must be finite and > 0, got " + weight);
            }
            if (!pairs.add(pairKey(u, v))) {
                return false;
            }
            sources.add(u);
            targets.add(v);
            weights.add(weight);
            return true;
        }

        public boolean containsEdge(int u, int v) {
            return pairs.contains(pairKey(u, v));
        }

        public WeightedGraph build() {
            return new WeightedGraph(nodeCount, sources.toIntArray(), targets.toIntArray(), weights.toDoubleArray());
        }

        private static long pairKey(int u, int v) {
            int low = Math.min(u, v);
            int high = Math.max(u, v);
            return ((long) low << 32) | (high & 0xFFFFFFFFL);
        }
    }
}
