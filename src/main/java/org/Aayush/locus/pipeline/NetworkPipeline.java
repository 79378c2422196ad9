package org.Aayush.locus.pipeline;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.locus.aggregate.CommunityAggregator;
import org.Aayush.locus.aggregate.CommunityGraph;
import org.Aayush.locus.community.CommunityDetector;
import org.Aayush.locus.community.Partition;
import org.Aayush.locus.feature.EngagementRecord;
import org.Aayush.locus.feature.FeatureAggregator;
import org.Aayush.locus.feature.LocationFeatures;
import org.Aayush.locus.graph.SimilarityGraph;
import org.Aayush.locus.graph.SimilarityGraphBuilder;
import org.Aayush.locus.layout.CoordinateNormalizer;
import org.Aayush.locus.layout.PositionMap;
import org.Aayush.locus.layout.SpatialLayoutEngine;

import java.util.List;

/**
 * Batch pipeline entry point.
 *
 * <p>Configuration is validated once at construction. Each {@link #run(List)} executes the
 * stages strictly in sequence:</p>
 * <ul>
 * <li>Aggregate records per location and require at least two locations.</li>
 * <li>Build the k-nearest-neighbor similarity graph.</li>
 * <li>Detect communities (Louvain) on that graph.</li>
 * <li>Lay out the full location graph, then normalize positions in place.</li>
 * <li>Derive the community graph with centroids and crossing edges.</li>
 * <li>Optionally lay out the community graph on its own.</li>
 * </ul>
 * <p>Stages fail fast; no partial result is returned.</p>
 */
@Slf4j
public final class NetworkPipeline {
    public static final String REASON_RECORDS_REQUIRED = "LOCUS_RECORDS_REQUIRED";
    public static final String REASON_CONFIGURATION_INVALID = "LOCUS_CONFIGURATION_INVALID";
    public static final String REASON_INSUFFICIENT_LOCATIONS = "LOCUS_INSUFFICIENT_LOCATIONS";

    static final int MIN_LOCATIONS = 2;

    @Getter
    @Accessors(fluent = true)
    private final PipelineConfig config;

    /**
     * Creates a pipeline with validated configuration.
     *
     * @param config run configuration.
     * @throws NetworkPipelineException with {@link #REASON_CONFIGURATION_INVALID} on bad settings.
     */
    public NetworkPipeline(PipelineConfig config) {
        if (config == null) {
            throw new NetworkPipelineException(REASON_CONFIGURATION_INVALID, "config must be provided");
        }
        this.config = config;
        validate(config);
    }

    /**
     * Runs every stage over one input snapshot.
     *
     * @param records engagement records; incomplete rows are excluded.
     * @return location graph, partition, positions and community graph.
     * @throws NetworkPipelineException when input is missing or fewer than two locations remain.
     */
    public NetworkResult run(List<EngagementRecord> records) {
        if (records == null) {
            throw new NetworkPipelineException(REASON_RECORDS_REQUIRED, "records must be provided");
        }

        List<LocationFeatures> locations = FeatureAggregator.aggregate(records, config.getMinTweetsPerLocation());
        log.info("Aggregated {} records into {} locations", records.size(), locations.size());
        if (locations.size() < MIN_LOCATIONS) {
            throw new NetworkPipelineException(
                    REASON_INSUFFICIENT_LOCATIONS,
                    "at least " + MIN_LOCATIONS + " locations are required, got " + locations.size()
            );
        }

        SimilarityGraph similarityGraph = SimilarityGraphBuilder.build(locations, config.getSimilarity());
        if (similarityGraph.edgeCount() == 0) {
            log.warn("Similarity graph has no edge above threshold {}; every location becomes its own community",
                    similarityGraph.weightThreshold());
        } else {
            log.info("Similarity graph: {} nodes, {} edges (K={})",
                    similarityGraph.nodeCount(), similarityGraph.edgeCount(), similarityGraph.effectiveNeighborCount());
        }

        Partition partition = CommunityDetector.detect(similarityGraph.graph(), config.getCommunity());
        log.info("Detected {} communities", partition.communityCount());

        PositionMap positions = SpatialLayoutEngine.layout(similarityGraph.graph(), config.getLayout());
        CoordinateNormalizer.normalize(positions, config.getCoordinateRange());

        CommunityGraph communityGraph = CommunityAggregator.aggregate(similarityGraph, partition, positions);
        log.info("Community graph: {} communities, {} inter-community edges",
                communityGraph.communityCount(), communityGraph.edgeCount());

        PositionMap communityPositions = null;
        if (config.getCommunityLayout() != null) {
            communityPositions = SpatialLayoutEngine.layout(communityGraph.toWeightedGraph(), config.getCommunityLayout());
            CoordinateNormalizer.normalize(communityPositions, config.getCoordinateRange());
        }

        return new NetworkResult(similarityGraph, partition, positions, communityGraph, communityPositions);
    }

    private static void validate(PipelineConfig config) {
        try {
            if (config.getMinTweetsPerLocation() <= 0) {
                throw new IllegalArgumentException("minTweetsPerLocation must be > 0");
            }
            requireSection(config.getSimilarity(), "similarity");
            requireSection(config.getCommunity(), "community");
            requireSection(config.getLayout(), "layout");
            requireSection(config.getCoordinateRange(), "coordinateRange");
            SimilarityGraphBuilder.validateConfig(config.getSimilarity());
            CommunityDetector.validateConfig(config.getCommunity());
            SpatialLayoutEngine.validateConfig(config.getLayout());
            if (config.getCommunityLayout() != null) {
                SpatialLayoutEngine.validateConfig(config.getCommunityLayout());
            }
        } catch (IllegalArgumentException e) {
            throw new NetworkPipelineException(REASON_CONFIGURATION_INVALID, e.getMessage(), e);
        }
    }

    private static void requireSection(Object section, String name) {
        if (section == null) {
            throw new IllegalArgumentException(name + " configuration must be provided");
        }
    }
}
