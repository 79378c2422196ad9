package org.Aayush.locus.pipeline;

import it.unimi.dsi.fastutil.ints.IntArrays;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.locus.aggregate.CommunityGraph;
import org.Aayush.locus.aggregate.CommunityNode;
import org.Aayush.locus.aggregate.InterCommunityEdge;
import org.Aayush.locus.community.Partition;
import org.Aayush.locus.core.id.LocationIdMapper;
import org.Aayush.locus.feature.LocationFeatures;
import org.Aayush.locus.graph.SimilarityGraph;
import org.Aayush.locus.graph.WeightedGraph;
import org.Aayush.locus.layout.PositionMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Output of one {@link NetworkPipeline} run.
 *
 * <p>Stage outputs are exposed as-is; the {@code *View} accessors project them onto the
 * renderer contract (location nodes/edges, community nodes/edges).</p>
 */
@Getter
@Accessors(fluent = true)
public final class NetworkResult {
    private final SimilarityGraph similarityGraph;
    private final Partition partition;
    private final PositionMap positions;
    private final CommunityGraph communityGraph;
    /** Stand-alone community layout, {@code null} when not requested. Indexed by community slot. */
    private final PositionMap communityLayoutPositions;

    NetworkResult(
            SimilarityGraph similarityGraph,
            Partition partition,
            PositionMap positions,
            CommunityGraph communityGraph,
            PositionMap communityLayoutPositions
    ) {
        this.similarityGraph = Objects.requireNonNull(similarityGraph, "similarityGraph");
        this.partition = Objects.requireNonNull(partition, "partition");
        this.positions = Objects.requireNonNull(positions, "positions");
        this.communityGraph = Objects.requireNonNull(communityGraph, "communityGraph");
        this.communityLayoutPositions = communityLayoutPositions;
    }

    public int locationCount() {
        return similarityGraph.nodeCount();
    }

    public int communityCount() {
        return communityGraph.communityCount();
    }

    public boolean hasCommunityLayout() {
        return communityLayoutPositions != null;
    }

    /**
     * Location nodes in node-id order.
     */
    public List<LocationNodeView> locationNodes() {
        List<LocationNodeView> views = new ArrayList<>(locationCount());
        for (int node = 0; node < locationCount(); node++) {
            views.add(nodeView(node));
        }
        return Collections.unmodifiableList(views);
    }

    public boolean containsLocation(String locationId) {
        return similarityGraph.idMapper().containsExternal(locationId);
    }

    /**
     * Looks up one location node by its key.
     *
     * @throws LocationIdMapper.UnknownLocationException when the key did not survive aggregation.
     */
    public LocationNodeView locationNode(String locationId) {
        return nodeView(similarityGraph.idMapper().toInternal(locationId));
    }

    /**
     * Community id of a location, by key.
     *
     * @throws LocationIdMapper.UnknownLocationException when the key did not survive aggregation.
     */
    public int communityOf(String locationId) {
        return partition.communityOf(similarityGraph.idMapper().toInternal(locationId));
    }

    /**
     * Location keys of one community's members in node order.
     */
    public List<String> communityMembers(int communityId) {
        int[] members = partition.membersOf(communityId);
        List<String> keys = new ArrayList<>(members.length);
        for (int member : members) {
            keys.add(similarityGraph.idMapper().toExternal(member));
        }
        return Collections.unmodifiableList(keys);
    }

    /**
     * Location edges in construction order.
     */
    public List<LocationEdgeView> locationEdges() {
        WeightedGraph graph = similarityGraph.graph();
        List<LocationEdgeView> views = new ArrayList<>(graph.edgeCount());
        for (int edgeId = 0; edgeId < graph.edgeCount(); edgeId++) {
            views.add(edgeView(graph, edgeId));
        }
        return Collections.unmodifiableList(views);
    }

    /**
     * Heaviest location edges, weight descending; equal weights keep construction order.
     *
     * @param maxEdges maximum edges to return, or -1 for all.
     */
    public List<LocationEdgeView> strongestLocationEdges(int maxEdges) {
        if (maxEdges < -1) {
            throw new IllegalArgumentException("maxEdges must be >= -1");
        }
        WeightedGraph graph = similarityGraph.graph();
        int[] order = new int[graph.edgeCount()];
        for (int edgeId = 0; edgeId < order.length; edgeId++) {
            order[edgeId] = edgeId;
        }
        IntArrays.mergeSort(order, (a, b) -> Double.compare(graph.getEdgeWeight(b), graph.getEdgeWeight(a)));

        int limit = maxEdges == -1 ? order.length : Math.min(maxEdges, order.length);
        List<LocationEdgeView> views = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            views.add(edgeView(graph, order[i]));
        }
        return Collections.unmodifiableList(views);
    }

    /**
     * Community nodes in ascending id order.
     */
    public List<CommunityNodeView> communityNodes() {
        List<CommunityNodeView> views = new ArrayList<>(communityGraph.communityCount());
        for (CommunityNode node : communityGraph.nodes()) {
            views.add(CommunityNodeView.builder()
                    .communityId(node.getCommunityId())
                    .centroid(node.getCentroid())
                    .memberCount(node.getMemberCount())
                    .reachSum(node.getReachSum())
                    .retweetSum(node.getRetweetSum())
                    .likesSum(node.getLikesSum())
                    .connections(communityGraph.connections(node.getCommunityId()))
                    .build());
        }
        return Collections.unmodifiableList(views);
    }

    /**
     * Inter-community edges ordered by {@code (communityA, communityB)}.
     */
    public List<CommunityEdgeView> communityEdges() {
        List<CommunityEdgeView> views = new ArrayList<>(communityGraph.edgeCount());
        for (InterCommunityEdge edge : communityGraph.edges()) {
            views.add(new CommunityEdgeView(
                    edge.getCommunityA(), edge.getCommunityB(), edge.getWeightSum(), edge.getCrossingCount()));
        }
        return Collections.unmodifiableList(views);
    }

    private LocationNodeView nodeView(int node) {
        LocationFeatures location = similarityGraph.location(node);
        return LocationNodeView.builder()
                .locationId(location.getLocationId())
                .reachSum(location.getReachSum())
                .retweetSum(location.getRetweetSum())
                .likesSum(location.getLikesSum())
                .tweetCount(location.getTweetCount())
                .dominantLanguage(location.getDominantLanguage())
                .communityId(partition.communityOf(node))
                .position(positions.positionCopy(node))
                .build();
    }

    private LocationEdgeView edgeView(WeightedGraph graph, int edgeId) {
        return new LocationEdgeView(
                similarityGraph.idMapper().toExternal(graph.getEdgeSource(edgeId)),
                similarityGraph.idMapper().toExternal(graph.getEdgeTarget(edgeId)),
                graph.getEdgeWeight(edgeId)
        );
    }
}
