package org.Aayush.locus.community;

import lombok.Builder;
import lombok.Value;

/**
 * Stage 3 configuration for Louvain community detection.
 */
@Value
@Builder
public class CommunityDetectionConfig {
    /**
     * Null-model weight. Values above 1 favor more, smaller communities.
     */
    @Builder.Default
    double resolution = 0.8d;

    /**
     * Deterministic seed for node visitation order.
     */
    @Builder.Default
    long seed = 42L;
}
