package org.Aayush.locus.graph;

import lombok.Builder;
import lombok.Value;
import org.Aayush.locus.feature.LocationFeature;

import java.util.List;

/**
 * Stage 2 configuration for k-nearest-neighbor similarity graph construction.
 */
@Value
@Builder
public class SimilarityGraphConfig {
    /**
     * Requested neighbors per location. Effective count is clamped to {@code nodeCount - 1}.
     */
    @Builder.Default
    int neighborCount = 15;

    /**
     * Exclusive lower bound on kept similarities, in [0, 1).
     */
    @Builder.Default
    double weightThreshold = 0.3d;

    /**
     * Ordered feature columns used for standardization and cosine similarity.
     */
    @Builder.Default
    List<LocationFeature> featureColumns = LocationFeature.DEFAULT_COLUMNS;
}
