package org.Aayush.locus.aggregate;

import lombok.Value;

/**
 * Accumulated location edges crossing an unordered community pair, keyed with
 * {@code communityA < communityB}.
 */
@Value
public class InterCommunityEdge {
    int communityA;
    int communityB;
    /** Sum of crossing location-edge weights. */
    double weightSum;
    /** Number of crossing location edges. */
    int crossingCount;
}
