package org.Aayush.locus.pipeline;

import lombok.Builder;
import lombok.Value;
import org.Aayush.locus.community.CommunityDetectionConfig;
import org.Aayush.locus.feature.LocationFeature;
import org.Aayush.locus.graph.SimilarityGraphConfig;
import org.Aayush.locus.layout.CoordinateRange;
import org.Aayush.locus.layout.LayoutConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Complete configuration of one pipeline run.
 *
 * <p>Defaults match the bundled {@value #DEFAULTS_RESOURCE}. Stage-level
 * ranges are validated by {@link NetworkPipeline} before any stage runs.</p>
 */
@Value
@Builder(toBuilder = true)
public class PipelineConfig {
    public static final String DEFAULTS_RESOURCE = "locus-defaults.properties";

    static final String KEY_MIN_TWEETS = "locus.aggregation.min-tweets";
    static final String KEY_NEIGHBORS = "locus.similarity.neighbors";
    static final String KEY_THRESHOLD = "locus.similarity.threshold";
    static final String KEY_FEATURES = "locus.similarity.features";
    static final String KEY_RESOLUTION = "locus.community.resolution";
    static final String KEY_COMMUNITY_SEED = "locus.community.seed";
    static final String KEY_LAYOUT_DIMENSIONS = "locus.layout.dimensions";
    static final String KEY_LAYOUT_SPACING = "locus.layout.spacing";
    static final String KEY_LAYOUT_ITERATIONS = "locus.layout.iterations";
    static final String KEY_LAYOUT_SEED = "locus.layout.seed";
    static final String KEY_COORDINATE_MIN = "locus.coordinates.min";
    static final String KEY_COORDINATE_MAX = "locus.coordinates.max";
    static final String KEY_COMMUNITY_LAYOUT_ENABLED = "locus.community-layout.enabled";
    static final String KEY_COMMUNITY_LAYOUT_SPACING = "locus.community-layout.spacing";
    static final String KEY_COMMUNITY_LAYOUT_ITERATIONS = "locus.community-layout.iterations";
    static final String KEY_COMMUNITY_LAYOUT_SEED = "locus.community-layout.seed";

    /**
     * Locations with fewer retained records are dropped after grouping.
     */
    @Builder.Default
    int minTweetsPerLocation = 1;

    @Builder.Default
    SimilarityGraphConfig similarity = SimilarityGraphConfig.builder().build();

    @Builder.Default
    CommunityDetectionConfig community = CommunityDetectionConfig.builder().build();

    @Builder.Default
    LayoutConfig layout = LayoutConfig.builder().build();

    @Builder.Default
    CoordinateRange coordinateRange = CoordinateRange.DEFAULT;

    /**
     * Optional stand-alone layout of the community graph; {@code null} disables it.
     */
    LayoutConfig communityLayout;

    /**
     * Reads {@value #DEFAULTS_RESOURCE} from the classpath.
     *
     * @return configuration built from the bundled defaults.
     */
    public static PipelineConfig loadDefaults() {
        Properties properties = new Properties();
        try (InputStream in = PipelineConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
        return fromProperties(properties);
    }

    /**
     * Builds a configuration from {@code locus.*} properties. Absent keys keep their defaults.
     *
     * @param properties source properties.
     * @return parsed configuration.
     * @throws IllegalArgumentException when a value cannot be parsed or the coordinate range is malformed.
     */
    public static PipelineConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        PipelineConfig defaults = PipelineConfig.builder().build();

        SimilarityGraphConfig similarityDefaults = defaults.getSimilarity();
        SimilarityGraphConfig similarity = SimilarityGraphConfig.builder()
                .neighborCount(intValue(properties, KEY_NEIGHBORS, similarityDefaults.getNeighborCount()))
                .weightThreshold(doubleValue(properties, KEY_THRESHOLD, similarityDefaults.getWeightThreshold()))
                .featureColumns(features(properties, similarityDefaults.getFeatureColumns()))
                .build();

        CommunityDetectionConfig communityDefaults = defaults.getCommunity();
        CommunityDetectionConfig community = CommunityDetectionConfig.builder()
                .resolution(doubleValue(properties, KEY_RESOLUTION, communityDefaults.getResolution()))
                .seed(longValue(properties, KEY_COMMUNITY_SEED, communityDefaults.getSeed()))
                .build();

        LayoutConfig layoutDefaults = defaults.getLayout();
        LayoutConfig layout = LayoutConfig.builder()
                .dimensions(intValue(properties, KEY_LAYOUT_DIMENSIONS, layoutDefaults.getDimensions()))
                .spacing(doubleValue(properties, KEY_LAYOUT_SPACING, layoutDefaults.getSpacing()))
                .iterations(intValue(properties, KEY_LAYOUT_ITERATIONS, layoutDefaults.getIterations()))
                .seed(longValue(properties, KEY_LAYOUT_SEED, layoutDefaults.getSeed()))
                .build();

        CoordinateRange range = new CoordinateRange(
                doubleValue(properties, KEY_COORDINATE_MIN, CoordinateRange.DEFAULT.getMin()),
                doubleValue(properties, KEY_COORDINATE_MAX, CoordinateRange.DEFAULT.getMax())
        );

        LayoutConfig communityLayout = null;
        if (booleanValue(properties, KEY_COMMUNITY_LAYOUT_ENABLED, false)) {
            LayoutConfig communityLayoutDefaults = LayoutConfig.communityDefaults();
            communityLayout = communityLayoutDefaults.toBuilder()
                    .dimensions(layout.getDimensions())
                    .spacing(doubleValue(properties, KEY_COMMUNITY_LAYOUT_SPACING, communityLayoutDefaults.getSpacing()))
                    .iterations(intValue(properties, KEY_COMMUNITY_LAYOUT_ITERATIONS, communityLayoutDefaults.getIterations()))
                    .seed(longValue(properties, KEY_COMMUNITY_LAYOUT_SEED, communityLayoutDefaults.getSeed()))
                    .build();
        }

        return PipelineConfig.builder()
                .minTweetsPerLocation(intValue(properties, KEY_MIN_TWEETS, defaults.getMinTweetsPerLocation()))
                .similarity(similarity)
                .community(community)
                .layout(layout)
                .coordinateRange(range)
                .communityLayout(communityLayout)
                .build();
    }

    private static String raw(Properties properties, String key) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int intValue(Properties properties, String key, int fallback) {
        String value = raw(properties, key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static long longValue(Properties properties, String key, long fallback) {
        String value = raw(properties, key);
        if (value == null) {
            return fallback;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a long, got '" + value + "'", e);
        }
    }

    private static double doubleValue(Properties properties, String key, double fallback) {
        String value = raw(properties, key);
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got '" + value + "'", e);
        }
    }

    private static boolean booleanValue(Properties properties, String key, boolean fallback) {
        String value = raw(properties, key);
        if (value == null) {
            return fallback;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new IllegalArgumentException(key + " must be true or false, got '" + value + "'");
        }
    }

    private static List<LocationFeature> features(Properties properties, List<LocationFeature> fallback) {
        String value = raw(properties, KEY_FEATURES);
        if (value == null) {
            return fallback;
        }
        List<LocationFeature> columns = new ArrayList<>();
        for (String token : value.split(",")) {
            String name = token.trim();
            if (name.isEmpty()) {
                continue;
            }
            try {
                columns.add(LocationFeature.valueOf(name.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(KEY_FEATURES + " contains unknown feature '" + name + "'", e);
            }
        }
        return List.copyOf(columns);
    }
}
