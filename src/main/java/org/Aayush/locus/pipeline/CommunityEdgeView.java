package org.Aayush.locus.pipeline;

import lombok.Value;

/**
 * Renderer-facing inter-community edge.
 */
@Value
public class CommunityEdgeView {
    int communityA;
    int communityB;
    double weightSum;
    int crossingCount;
}
