package org.Aayush.locus.graph;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.locus.core.id.LocationIdMapper;
import org.Aayush.locus.feature.LocationFeatures;

import java.util.List;
import java.util.Objects;

/**
 * Immutable Stage 2 output: the location graph plus the metadata it was built from.
 *
 * <p>Node id {@code i} is location {@code locations().get(i)} and maps through
 * {@link #idMapper()}.</p>
 */
@Getter
@Accessors(fluent = true)
public final class SimilarityGraph {
    private final WeightedGraph graph;
    private final LocationIdMapper idMapper;
    private final List<LocationFeatures> locations;
    private final double weightThreshold;
    private final int effectiveNeighborCount;
    @Getter(AccessLevel.NONE)
    private final int[] proposalCounts;

    SimilarityGraph(
            WeightedGraph graph,
            LocationIdMapper idMapper,
            List<LocationFeatures> locations,
            double weightThreshold,
            int effectiveNeighborCount,
            int[] proposalCounts
    ) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.idMapper = Objects.requireNonNull(idMapper, "idMapper");
        this.locations = List.copyOf(locations);
        if (graph.nodeCount() != this.locations.size() || idMapper.size() != this.locations.size()) {
            throw new IllegalArgumentException(
                    "node count mismatch: graph=" + graph.nodeCount()
                            + ", mapper=" + idMapper.size()
                            + ", locations=" + this.locations.size()
            );
        }
        if (proposalCounts.length != this.locations.size()) {
            throw new IllegalArgumentException("proposalCounts length must equal node count");
        }
        this.weightThreshold = weightThreshold;
        this.effectiveNeighborCount = effectiveNeighborCount;
        this.proposalCounts = proposalCounts.clone();
    }

    public int nodeCount() {
        return graph.nodeCount();
    }

    public int edgeCount() {
        return graph.edgeCount();
    }

    /**
     * Returns features of one node.
     */
    public LocationFeatures location(int nodeId) {
        return locations.get(nodeId);
    }

    /**
     * Number of edges this node proposed itself (before union with other nodes' proposals).
     */
    public int proposalCount(int nodeId) {
        return proposalCounts[nodeId];
    }
}
