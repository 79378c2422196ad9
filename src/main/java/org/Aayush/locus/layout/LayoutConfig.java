package org.Aayush.locus.layout;

import lombok.Builder;
import lombok.Value;

/**
 * Stage 4 configuration for force-directed layout.
 */
@Value
@Builder(toBuilder = true)
public class LayoutConfig {
    /**
     * Embedding dimensionality.
     */
    @Builder.Default
    int dimensions = 3;

    /**
     * Spacing constant k. Ideal edge length is {@code k / sqrt(nodeCount)}.
     */
    @Builder.Default
    double spacing = 0.35d;

    /**
     * Fixed number of force iterations.
     */
    @Builder.Default
    int iterations = 50;

    /**
     * Deterministic seed for initial placement.
     */
    @Builder.Default
    long seed = 42L;

    /**
     * Wider spacing and more iterations for laying out the community graph on its own.
     */
    public static LayoutConfig communityDefaults() {
        return LayoutConfig.builder()
                .spacing(2.0d)
                .iterations(100)
                .build();
    }
}
