package org.Aayush.locus.feature;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated engagement profile of one location.
 */
@Value
@Builder
public class LocationFeatures {
    String locationId;

    double reachSum;
    double reachMean;
    /** Sample standard deviation (n - 1), 0 for single-record locations. */
    double reachStd;

    double retweetSum;
    double retweetMean;

    double likesSum;
    double likesMean;

    int tweetCount;

    /** Most frequent language, ties resolved by first occurrence. */
    String dominantLanguage;
    /** Most frequent weekday, ties resolved by first occurrence. */
    String dominantWeekday;
    /** Mean hour of day. */
    double meanHour;
}
