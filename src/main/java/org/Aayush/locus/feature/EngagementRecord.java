package org.Aayush.locus.feature;

import lombok.Builder;
import lombok.Value;

/**
 * One geotagged engagement event as delivered by the ingestion layer.
 *
 * <p>Numeric fields are boxed so that missing cells stay distinguishable from zero.
 * A record is usable only when location, language, reach, retweet count and likes are
 * all present and finite; weekday and hour are optional.</p>
 */
@Value
@Builder
public class EngagementRecord {
    /** External location key. */
    String locationId;
    /** Language tag of the post. */
    String language;
    /** Audience reach. */
    Double reach;
    /** Retweet count. */
    Double retweetCount;
    /** Like count. */
    Double likes;
    /** Weekday name, e.g. {@code "Thursday"}. */
    String weekday;
    /** Hour of day in [0, 23]; values outside that range are ignored by aggregation. */
    Integer hour;

    /**
     * Returns true when every field required for aggregation is present and numeric
     * fields are finite.
     */
    public boolean isComplete() {
        return hasText(locationId)
                && hasText(language)
                && isPresent(reach)
                && isPresent(retweetCount)
                && isPresent(likes);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean isPresent(Double value) {
        return value != null && Double.isFinite(value);
    }
}
