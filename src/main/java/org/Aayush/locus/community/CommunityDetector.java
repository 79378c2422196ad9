package org.Aayush.locus.community;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.locus.graph.WeightedGraph;

import java.util.Arrays;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Stage 3: deterministic Louvain community detection.
 *
 * <p>Each level runs local moving (phase 1) followed by contraction (phase 2). The seed
 * drives the node visitation order of every pass; equal graph, resolution and seed give
 * an identical partition.</p>
 */
@Slf4j
@UtilityClass
public final class CommunityDetector {
    /**
     * Minimum modularity improvement that keeps a pass or a level going.
     */
    static final double MIN_GAIN = 1e-7;

    /**
     * Partitions the graph.
     *
     * @param graph weighted location graph.
     * @param config resolution and seed.
     * @return contiguous community assignment for every node.
     */
    public static Partition detect(WeightedGraph graph, CommunityDetectionConfig config) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(config, "config");
        validateConfig(config);

        int nodeCount = graph.nodeCount();
        if (graph.edgeCount() == 0) {
            log.debug("Graph has no edges; every one of {} nodes is its own community", nodeCount);
            return Partition.singletons(nodeCount);
        }

        double resolution = config.getResolution();
        SplittableRandom random = new SplittableRandom(config.getSeed());
        LevelGraph level = LevelGraph.from(graph);

        int[] assignment = new int[nodeCount];
        for (int node = 0; node < nodeCount; node++) {
            assignment[node] = node;
        }
        double modularity = level.modularity(assignment, resolution);

        int levels = 0;
        while (true) {
            int[] levelCommunities = moveNodes(level, resolution, random);
            double nextModularity = level.modularity(levelCommunities, resolution);
            if (levels > 0 && nextModularity - modularity < MIN_GAIN) {
                break;
            }
            for (int node = 0; node < nodeCount; node++) {
                assignment[node] = levelCommunities[assignment[node]];
            }
            levels++;
            modularity = nextModularity;

            int communityCount = countCommunities(levelCommunities);
            if (communityCount == level.nodeCount()) {
                break;
            }
            level = level.contract(levelCommunities, communityCount);
        }

        Partition partition = new Partition(renumber(assignment));
        log.debug("Louvain finished after {} level(s): {} communities, modularity={}",
                levels, partition.communityCount(), modularity);
        return partition;
    }

    /**
     * Validates detector configuration ranges.
     */
    public static void validateConfig(CommunityDetectionConfig config) {
        double resolution = config.getResolution();
        if (!Double.isFinite(resolution) || resolution <= 0.0d) {
            throw new IllegalArgumentException("resolution must be finite and > 0, got " + resolution);
        }
    }

    /**
     * Phase 1: greedy local moving until a full pass brings no modularity gain.
     *
     * @return contiguous community id per level node.
     */
    private static int[] moveNodes(LevelGraph level, double resolution, SplittableRandom random) {
        int n = level.nodeCount();
        double twoM = 2.0d * level.totalWeight();

        int[] community = new int[n];
        double[] total = new double[n];
        int[] order = new int[n];
        for (int node = 0; node < n; node++) {
            community[node] = node;
            total[node] = level.degree(node);
            order[node] = node;
        }

        // scratch: accumulated link weight per neighboring community, -1 = untouched
        double[] linkWeight = new double[n];
        Arrays.fill(linkWeight, -1.0d);
        int[] touched = new int[n];

        double current = level.modularity(community, resolution);
        boolean moved = true;
        while (moved) {
            moved = false;
            shuffle(order, random);
            for (int node : order) {
                int home = community[node];
                double k = level.degree(node);

                int touchedCount = 0;
                for (int arc = level.firstArc(node); arc < level.arcEnd(node); arc++) {
                    int c = community[level.arcNeighbor(arc)];
                    if (linkWeight[c] < 0.0d) {
                        linkWeight[c] = 0.0d;
                        touched[touchedCount++] = c;
                    }
                    linkWeight[c] += level.arcWeight(arc);
                }

                double homeLink = linkWeight[home] < 0.0d ? 0.0d : linkWeight[home];
                total[home] -= k;
                double removeCost = -homeLink + resolution * total[home] * k / twoM;

                int best = home;
                double bestGain = 0.0d;
                for (int t = 0; t < touchedCount; t++) {
                    int c = touched[t];
                    double gain = removeCost + linkWeight[c] - resolution * total[c] * k / twoM;
                    if (gain > bestGain) {
                        bestGain = gain;
                        best = c;
                    }
                }

                total[best] += k;
                community[node] = best;
                if (best != home) {
                    moved = true;
                }
                for (int t = 0; t < touchedCount; t++) {
                    linkWeight[touched[t]] = -1.0d;
                }
            }

            double next = level.modularity(community, resolution);
            if (next - current < MIN_GAIN) {
                break;
            }
            current = next;
        }
        return renumber(community);
    }

    /**
     * Maps ids to {@code 0..c-1} in order of first appearance.
     */
    static int[] renumber(int[] community) {
        int[] mapping = new int[community.length];
        Arrays.fill(mapping, -1);
        int[] result = new int[community.length];
        int next = 0;
        for (int node = 0; node < community.length; node++) {
            int c = community[node];
            if (mapping[c] < 0) {
                mapping[c] = next++;
            }
            result[node] = mapping[c];
        }
        return result;
    }

    private static int countCommunities(int[] contiguous) {
        int max = -1;
        for (int c : contiguous) {
            max = Math.max(max, c);
        }
        return max + 1;
    }

    /**
     * In-place deterministic Fisher-Yates shuffle.
     */
    private static void shuffle(int[] array, SplittableRandom random) {
        for (int i = array.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = array[i];
            array[i] = array[j];
            array[j] = tmp;
        }
    }
}
