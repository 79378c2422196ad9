package org.Aayush.locus.feature;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Stage 1: collapses engagement records into one {@link LocationFeatures} per location.
 *
 * <p>Conventions:</p>
 * <ul>
 * <li>Incomplete records (see {@link EngagementRecord#isComplete()}) are excluded silently.</li>
 * <li>Reach standard deviation is the sample deviation (n - 1); groups of one yield 0.</li>
 * <li>Most-frequent categories break ties by first occurrence in input order.</li>
 * <li>Weekday falls back to {@value #DEFAULT_WEEKDAY}, hour to {@value #DEFAULT_HOUR}.
 * Hours outside [0, 23] count as missing.</li>
 * <li>Output is sorted by location key.</li>
 * </ul>
 */
@Slf4j
@UtilityClass
public final class FeatureAggregator {
    public static final String DEFAULT_WEEKDAY = "Monday";
    public static final double DEFAULT_HOUR = 12.0d;

    static final int MIN_HOUR = 0;
    static final int MAX_HOUR = 23;

    /**
     * Aggregates all complete records, keeping every location.
     *
     * @param records engagement records in input order.
     * @return one feature record per location key, sorted by key.
     */
    public static List<LocationFeatures> aggregate(List<EngagementRecord> records) {
        return aggregate(records, 1);
    }

    /**
     * Aggregates complete records and drops locations with fewer than {@code minTweetCount} records.
     *
     * @param records engagement records in input order.
     * @param minTweetCount minimum retained records per location (>= 1).
     * @return one feature record per surviving location key, sorted by key.
     */
    public static List<LocationFeatures> aggregate(List<EngagementRecord> records, int minTweetCount) {
        Objects.requireNonNull(records, "records");
        if (minTweetCount <= 0) {
            throw new IllegalArgumentException("minTweetCount must be > 0");
        }

        TreeMap<String, LocationAccumulator> groups = new TreeMap<>();
        int dropped = 0;
        for (EngagementRecord record : records) {
            if (record == null || !record.isComplete()) {
                dropped++;
                continue;
            }
            groups.computeIfAbsent(record.getLocationId(), LocationAccumulator::new).add(record);
        }

        List<LocationFeatures> features = new ArrayList<>(groups.size());
        int sparse = 0;
        for (Map.Entry<String, LocationAccumulator> entry : groups.entrySet()) {
            LocationAccumulator accumulator = entry.getValue();
            if (accumulator.count() < minTweetCount) {
                sparse++;
                continue;
            }
            features.add(accumulator.toFeatures());
        }

        log.debug("Aggregated {} records into {} locations (incomplete records dropped: {}, sparse locations dropped: {})",
                records.size(), features.size(), dropped, sparse);
        return features;
    }

    /**
     * Returns the most frequent key; ties go to the key seen first.
     */
    static String mostFrequent(Object2IntLinkedOpenHashMap<String> counts, String fallback) {
        String best = fallback;
        int bestCount = 0;
        for (Object2IntMap.Entry<String> entry : counts.object2IntEntrySet()) {
            if (entry.getIntValue() > bestCount) {
                bestCount = entry.getIntValue();
                best = entry.getKey();
            }
        }
        return best;
    }

    /**
     * Mutable per-location running state. Reach values are kept for the two-pass deviation.
     */
    private static final class LocationAccumulator {
        private final String locationId;
        private final DoubleArrayList reaches = new DoubleArrayList();
        private double reachSum;
        private double retweetSum;
        private double likesSum;
        private final Object2IntLinkedOpenHashMap<String> languageCounts = new Object2IntLinkedOpenHashMap<>();
        private final Object2IntLinkedOpenHashMap<String> weekdayCounts = new Object2IntLinkedOpenHashMap<>();
        private double hourSum;
        private int hourCount;

        private LocationAccumulator(String locationId) {
            this.locationId = locationId;
        }

        private void add(EngagementRecord record) {
            double reach = record.getReach();
            reaches.add(reach);
            reachSum += reach;
            retweetSum += record.getRetweetCount();
            likesSum += record.getLikes();
            languageCounts.addTo(record.getLanguage(), 1);

            String weekday = record.getWeekday();
            if (weekday != null && !weekday.isBlank()) {
                weekdayCounts.addTo(weekday, 1);
            }
            Integer hour = record.getHour();
            if (hour != null && hour >= MIN_HOUR && hour <= MAX_HOUR) {
                hourSum += hour;
                hourCount++;
            }
        }

        private int count() {
            return reaches.size();
        }

        private LocationFeatures toFeatures() {
            int n = count();
            double reachMean = reachSum / n;
            return LocationFeatures.builder()
                    .locationId(locationId)
                    .reachSum(reachSum)
                    .reachMean(reachMean)
                    .reachStd(sampleStd(reachMean))
                    .retweetSum(retweetSum)
                    .retweetMean(retweetSum / n)
                    .likesSum(likesSum)
                    .likesMean(likesSum / n)
                    .tweetCount(n)
                    .dominantLanguage(mostFrequent(languageCounts, null))
                    .dominantWeekday(mostFrequent(weekdayCounts, DEFAULT_WEEKDAY))
                    .meanHour(hourCount == 0 ? DEFAULT_HOUR : hourSum / hourCount)
                    .build();
        }

        private double sampleStd(double mean) {
            int n = count();
            if (n < 2) {
                return 0.0d;
            }
            double squares = 0.0d;
            for (int i = 0; i < n; i++) {
                double delta = reaches.getDouble(i) - mean;
                squares += delta * delta;
            }
            return Math.sqrt(squares / (n - 1));
        }
    }
}
