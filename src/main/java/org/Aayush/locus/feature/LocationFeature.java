package org.Aayush.locus.feature;

import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Numeric feature columns usable for location similarity.
 *
 * <p>Categorical attributes (language, weekday) are metadata only and have no column.</p>
 */
public enum LocationFeature {
    REACH_SUM(LocationFeatures::getReachSum),
    REACH_MEAN(LocationFeatures::getReachMean),
    REACH_STD(LocationFeatures::getReachStd),
    RETWEET_SUM(LocationFeatures::getRetweetSum),
    RETWEET_MEAN(LocationFeatures::getRetweetMean),
    LIKES_SUM(LocationFeatures::getLikesSum),
    LIKES_MEAN(LocationFeatures::getLikesMean),
    HOUR_MEAN(LocationFeatures::getMeanHour);

    /**
     * Default similarity column order.
     */
    public static final List<LocationFeature> DEFAULT_COLUMNS = List.of(values());

    private final ToDoubleFunction<LocationFeatures> extractor;

    LocationFeature(ToDoubleFunction<LocationFeatures> extractor) {
        this.extractor = extractor;
    }

    /**
     * Reads this column from one location.
     */
    public double valueOf(LocationFeatures features) {
        return extractor.applyAsDouble(features);
    }
}
