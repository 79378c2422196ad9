package org.Aayush.locus.aggregate;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

/**
 * Aggregated attributes of one community.
 */
@Value
@Builder
public class CommunityNode {
    int communityId;
    int memberCount;
    double reachSum;
    double retweetSum;
    double likesSum;
    long tweetCount;
    /** Mean of member positions; origin when the community has no members. */
    @Getter(AccessLevel.NONE)
    double[] centroid;

    public double[] getCentroid() {
        return centroid.clone();
    }
}
