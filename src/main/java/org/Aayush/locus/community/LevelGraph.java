package org.Aayush.locus.community;

import it.unimi.dsi.fastutil.longs.Long2DoubleLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2DoubleMap;
import org.Aayush.locus.graph.WeightedGraph;

/**
 * One aggregation level of the Louvain hierarchy.
 *
 * <p>Unlike {@link WeightedGraph} a level node may carry a self-loop holding the weight
 * internal to the community it was contracted from. Degrees count a self-loop twice.</p>
 */
final class LevelGraph {
    private final int nodeCount;
    private final int[] firstArc;
    private final int[] arcNeighbor;
    private final double[] arcWeight;
    private final double[] loops;
    private final double[] degree;
    private final double totalWeight;

    private LevelGraph(int nodeCount, int[] firstArc, int[] arcNeighbor, double[] arcWeight, double[] loops) {
        this.nodeCount = nodeCount;
        this.firstArc = firstArc;
        this.arcNeighbor = arcNeighbor;
        this.arcWeight = arcWeight;
        this.loops = loops;
        this.degree = new double[nodeCount];

        double edgeWeight = 0.0d;
        double loopWeight = 0.0d;
        for (int node = 0; node < nodeCount; node++) {
            double d = 2.0d * loops[node];
            for (int arc = firstArc[node]; arc < firstArc[node + 1]; arc++) {
                d += arcWeight[arc];
                edgeWeight += arcWeight[arc];
            }
            degree[node] = d;
            loopWeight += loops[node];
        }
        // every non-loop edge was seen from both endpoints
        this.totalWeight = edgeWeight / 2.0d + loopWeight;
    }

    /**
     * Builds the base level from a location graph.
     */
    static LevelGraph from(WeightedGraph graph) {
        int nodeCount = graph.nodeCount();
        int[] firstArc = new int[nodeCount + 1];
        for (int node = 0; node < nodeCount; node++) {
            firstArc[node + 1] = firstArc[node] + graph.getNodeDegree(node);
        }
        int[] arcNeighbor = new int[firstArc[nodeCount]];
        double[] arcWeight = new double[firstArc[nodeCount]];
        WeightedGraph.NeighborIterator iterator = graph.iterator();
        for (int node = 0; node < nodeCount; node++) {
            int arc = firstArc[node];
            iterator.resetForNode(node);
            while (iterator.hasNext()) {
                arcNeighbor[arc] = iterator.next();
                arcWeight[arc] = iterator.weight();
                arc++;
            }
        }
        return new LevelGraph(nodeCount, firstArc, arcNeighbor, arcWeight, new double[nodeCount]);
    }

    /**
     * Contracts each community into one node. Intra-community weight becomes a self-loop,
     * inter-community weights between the same pair are summed.
     *
     * @param community contiguous community id per node.
     * @param communityCount number of distinct ids.
     */
    LevelGraph contract(int[] community, int communityCount) {
        double[] contractedLoops = new double[communityCount];
        Long2DoubleLinkedOpenHashMap pairWeights = new Long2DoubleLinkedOpenHashMap();
        for (int u = 0; u < nodeCount; u++) {
            int cu = community[u];
            contractedLoops[cu] += loops[u];
            for (int arc = firstArc[u]; arc < firstArc[u + 1]; arc++) {
                int v = arcNeighbor[arc];
                if (v < u) {
                    continue;
                }
                int cv = community[v];
                if (cu == cv) {
                    contractedLoops[cu] += arcWeight[arc];
                } else {
                    pairWeights.addTo(pairKey(cu, cv), arcWeight[arc]);
                }
            }
        }

        int[] contractedFirst = new int[communityCount + 1];
        for (Long2DoubleMap.Entry entry : pairWeights.long2DoubleEntrySet()) {
            contractedFirst[low(entry.getLongKey()) + 1]++;
            contractedFirst[high(entry.getLongKey()) + 1]++;
        }
        for (int c = 0; c < communityCount; c++) {
            contractedFirst[c + 1] += contractedFirst[c];
        }
        int[] neighbors = new int[contractedFirst[communityCount]];
        double[] weights = new double[contractedFirst[communityCount]];
        int[] cursor = new int[communityCount];
        for (Long2DoubleMap.Entry entry : pairWeights.long2DoubleEntrySet()) {
            int a = low(entry.getLongKey());
            int b = high(entry.getLongKey());
            double w = entry.getDoubleValue();
            int arcA = contractedFirst[a] + cursor[a]++;
            neighbors[arcA] = b;
            weights[arcA] = w;
            int arcB = contractedFirst[b] + cursor[b]++;
            neighbors[arcB] = a;
            weights[arcB] = w;
        }
        return new LevelGraph(communityCount, contractedFirst, neighbors, weights, contractedLoops);
    }

    /**
     * Modularity of an assignment at this level:
     * {@code sum_c [ in_c / m - resolution * (tot_c / 2m)^2 ]}.
     *
     * @param community community id per node, each id in [0, nodeCount).
     */
    double modularity(int[] community, double resolution) {
        if (totalWeight <= 0.0d) {
            return 0.0d;
        }
        double[] internal = new double[nodeCount];
        double[] total = new double[nodeCount];
        for (int u = 0; u < nodeCount; u++) {
            int c = community[u];
            total[c] += degree[u];
            internal[c] += loops[u];
            for (int arc = firstArc[u]; arc < firstArc[u + 1]; arc++) {
                int v = arcNeighbor[arc];
                if (v > u && community[v] == c) {
                    internal[c] += arcWeight[arc];
                }
            }
        }
        double q = 0.0d;
        double twoM = 2.0d * totalWeight;
        for (int c = 0; c < nodeCount; c++) {
            if (total[c] == 0.0d && internal[c] == 0.0d) {
                continue;
            }
            double share = total[c] / twoM;
            q += internal[c] / totalWeight - resolution * share * share;
        }
        return q;
    }

    int nodeCount() {
        return nodeCount;
    }

    int firstArc(int node) {
        return firstArc[node];
    }

    int arcEnd(int node) {
        return firstArc[node + 1];
    }

    int arcNeighbor(int arc) {
        return arcNeighbor[arc];
    }

    double arcWeight(int arc) {
        return arcWeight[arc];
    }

    double degree(int node) {
        return degree[node];
    }

    double totalWeight() {
        return totalWeight;
    }

    private static long pairKey(int a, int b) {
        int low = Math.min(a, b);
        int high = Math.max(a, b);
        return ((long) low << 32) | (high & 0xFFFFFFFFL);
    }

    private static int low(long key) {
        return (int) (key >>> 32);
    }

    private static int high(long key) {
        return (int) key;
    }
}
