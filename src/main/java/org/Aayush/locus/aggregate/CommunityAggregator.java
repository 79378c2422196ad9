package org.Aayush.locus.aggregate;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.locus.community.Partition;
import org.Aayush.locus.feature.LocationFeatures;
import org.Aayush.locus.graph.SimilarityGraph;
import org.Aayush.locus.graph.WeightedGraph;
import org.Aayush.locus.layout.PositionMap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Stage 6: derives the community-level graph from the location graph, its partition and
 * normalized positions.
 */
@Slf4j
@UtilityClass
public final class CommunityAggregator {

    /**
     * Builds community nodes (sums, member count, centroid) and inter-community edges.
     *
     * @param similarityGraph location graph with per-location statistics.
     * @param partition community per location node.
     * @param positions normalized location positions.
     * @return immutable community graph.
     */
    public static CommunityGraph aggregate(SimilarityGraph similarityGraph, Partition partition, PositionMap positions) {
        Objects.requireNonNull(similarityGraph, "similarityGraph");
        Objects.requireNonNull(partition, "partition");
        Objects.requireNonNull(positions, "positions");

        int nodeCount = similarityGraph.nodeCount();
        if (partition.nodeCount() != nodeCount || positions.nodeCount() != nodeCount) {
            throw new IllegalArgumentException(
                    "node count mismatch: graph=" + nodeCount
                            + ", partition=" + partition.nodeCount()
                            + ", positions=" + positions.nodeCount()
            );
        }

        int dims = positions.dimensions();
        List<CommunityNode> nodes = new ArrayList<>(partition.communityCount());
        for (int communityId = 0; communityId < partition.communityCount(); communityId++) {
            nodes.add(summarize(similarityGraph, positions, communityId, partition.membersOf(communityId), dims));
        }

        List<InterCommunityEdge> edges = crossingEdges(similarityGraph.graph(), partition);
        CommunityGraph communityGraph = new CommunityGraph(nodes, edges);
        log.debug("Community graph derived: {}", communityGraph);
        return communityGraph;
    }

    private static CommunityNode summarize(
            SimilarityGraph similarityGraph,
            PositionMap positions,
            int communityId,
            int[] members,
            int dims
    ) {
        double reach = 0.0d;
        double retweets = 0.0d;
        double likes = 0.0d;
        long tweets = 0L;
        double[] centroid = new double[dims];
        for (int member : members) {
            LocationFeatures location = similarityGraph.location(member);
            reach += location.getReachSum();
            retweets += location.getRetweetSum();
            likes += location.getLikesSum();
            tweets += location.getTweetCount();
            for (int axis = 0; axis < dims; axis++) {
                centroid[axis] += positions.get(member, axis);
            }
        }
        // an empty community keeps the origin
        if (members.length > 0) {
            for (int axis = 0; axis < dims; axis++) {
                centroid[axis] /= members.length;
            }
        }
        return CommunityNode.builder()
                .communityId(communityId)
                .memberCount(members.length)
                .reachSum(reach)
                .retweetSum(retweets)
                .likesSum(likes)
                .tweetCount(tweets)
                .centroid(centroid)
                .build();
    }

    private static List<InterCommunityEdge> crossingEdges(WeightedGraph graph, Partition partition) {
        Long2ObjectOpenHashMap<double[]> accumulators = new Long2ObjectOpenHashMap<>();
        for (int edgeId = 0; edgeId < graph.edgeCount(); edgeId++) {
            int a = partition.communityOf(graph.getEdgeSource(edgeId));
            int b = partition.communityOf(graph.getEdgeTarget(edgeId));
            if (a == b) {
                continue;
            }
            long key = ((long) Math.min(a, b) << 32) | (Math.max(a, b) & 0xFFFFFFFFL);
            double[] accumulator = accumulators.get(key);
            if (accumulator == null) {
                accumulator = new double[2];
                accumulators.put(key, accumulator);
            }
            accumulator[0] += graph.getEdgeWeight(edgeId);
            accumulator[1] += 1.0d;
        }

        List<InterCommunityEdge> edges = new ArrayList<>(accumulators.size());
        for (Long2ObjectMap.Entry<double[]> entry : accumulators.long2ObjectEntrySet()) {
            long key = entry.getLongKey();
            double[] accumulator = entry.getValue();
            edges.add(new InterCommunityEdge((int) (key >>> 32), (int) key, accumulator[0], (int) accumulator[1]));
        }
        edges.sort(Comparator.comparingInt(InterCommunityEdge::getCommunityA)
                .thenComparingInt(InterCommunityEdge::getCommunityB));
        return edges;
    }
}
