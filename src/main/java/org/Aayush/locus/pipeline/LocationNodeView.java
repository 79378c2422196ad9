package org.Aayush.locus.pipeline;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

/**
 * Renderer-facing attributes of one location node.
 */
@Value
@Builder
public class LocationNodeView {
    String locationId;
    double reachSum;
    double retweetSum;
    double likesSum;
    int tweetCount;
    String dominantLanguage;
    int communityId;
    /** Normalized position. */
    @Getter(AccessLevel.NONE)
    double[] position;

    public double[] getPosition() {
        return position.clone();
    }
}
