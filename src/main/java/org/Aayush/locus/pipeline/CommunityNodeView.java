package org.Aayush.locus.pipeline;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

/**
 * Renderer-facing attributes of one community node.
 */
@Value
@Builder
public class CommunityNodeView {
    int communityId;
    /** Mean normalized position of the members. */
    @Getter(AccessLevel.NONE)
    double[] centroid;
    int memberCount;
    double reachSum;
    double retweetSum;
    double likesSum;
    /** Communities sharing at least one crossing edge, ascending. */
    @Getter(AccessLevel.NONE)
    int[] connections;

    public double[] getCentroid() {
        return centroid.clone();
    }

    public int[] getConnections() {
        return connections.clone();
    }
}
