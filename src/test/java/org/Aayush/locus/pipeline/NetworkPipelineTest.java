package org.Aayush.locus.pipeline;

import org.Aayush.locus.core.id.LocationIdMapper;
import org.Aayush.locus.feature.EngagementRecord;
import org.Aayush.locus.graph.SimilarityGraphConfig;
import org.Aayush.locus.layout.CoordinateRange;
import org.Aayush.locus.layout.LayoutConfig;
import org.Aayush.locus.layout.PositionMap;
import org.Aayush.locus.testutil.LocationFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Network Pipeline Tests")
class NetworkPipelineTest {

    private static PipelineConfig twoPairConfig() {
        return PipelineConfig.builder()
                .similarity(LocationFixtureFactory.twoPairSimilarity())
                .build();
    }

    @Test
    @DisplayName("Two similar pairs become two disconnected communities")
    void testTwoPairEndToEnd() {
        NetworkResult result = new NetworkPipeline(twoPairConfig()).run(LocationFixtureFactory.twoPairRecords());

        assertEquals(4, result.locationCount());
        assertEquals(2, result.communityCount());
        assertEquals(2, result.similarityGraph().edgeCount());
        assertArrayEquals(new int[]{0, 0, 1, 1}, result.partition().assignmentsCopy());
        assertTrue(result.communityEdges().isEmpty());
        assertFalse(result.hasCommunityLayout());

        List<LocationNodeView> nodes = result.locationNodes();
        assertEquals("A", nodes.get(0).getLocationId());
        assertEquals(1, nodes.get(3).getCommunityId());
        assertEquals(10.0d, nodes.get(0).getReachSum(), 1e-12);
        assertEquals("en", nodes.get(0).getDominantLanguage());

        List<LocationEdgeView> edges = result.locationEdges();
        assertEquals("A", edges.get(0).getSourceId());
        assertEquals("B", edges.get(0).getTargetId());
        assertEquals("C", edges.get(1).getSourceId());
        assertEquals("D", edges.get(1).getTargetId());

        List<CommunityNodeView> communities = result.communityNodes();
        assertEquals(2, communities.size());
        double[] a = nodes.get(0).getPosition();
        double[] b = nodes.get(1).getPosition();
        double[] centroid = communities.get(0).getCentroid();
        for (int axis = 0; axis < 3; axis++) {
            assertEquals((a[axis] + b[axis]) / 2.0d, centroid[axis], 1e-9);
        }
        assertEquals(2, communities.get(0).getMemberCount());
        assertEquals(21.0d, communities.get(0).getReachSum(), 1e-12);
        assertEquals(0, communities.get(1).getConnections().length);
    }

    @Test
    @DisplayName("Renderer lookups by location key resolve node, community and members")
    void testLookupByLocationKey() {
        NetworkResult result = new NetworkPipeline(twoPairConfig()).run(LocationFixtureFactory.twoPairRecords());

        LocationNodeView c = result.locationNode("C");
        assertEquals("C", c.getLocationId());
        assertEquals(1, c.getCommunityId());
        assertArrayEquals(result.positions().positionCopy(2), c.getPosition());
        assertEquals(result.locationNodes().get(2), c);

        assertEquals(0, result.communityOf("B"));
        assertEquals(List.of("C", "D"), result.communityMembers(1));
        assertTrue(result.containsLocation("D"));
        assertFalse(result.containsLocation("Atlantis"));

        assertThrows(LocationIdMapper.UnknownLocationException.class, () -> result.locationNode("Atlantis"));
        assertThrows(LocationIdMapper.UnknownLocationException.class, () -> result.communityOf(null));
    }

    @Test
    @DisplayName("Locations dropped during aggregation are unknown to lookups")
    void testLookupOfDroppedLocation() {
        List<EngagementRecord> records = new ArrayList<>(LocationFixtureFactory.twoPairRecords());
        records.add(EngagementRecord.builder().locationId("E").language("en").build());

        NetworkResult result = new NetworkPipeline(twoPairConfig()).run(records);

        assertFalse(result.containsLocation("E"));
        assertThrows(LocationIdMapper.UnknownLocationException.class, () -> result.locationNode("E"));
    }

    @Test
    @DisplayName("Normalized positions fill the configured range on every axis")
    void testPositionsNormalized() {
        NetworkResult result = new NetworkPipeline(twoPairConfig()).run(LocationFixtureFactory.twoPairRecords());

        PositionMap positions = result.positions();
        for (int axis = 0; axis < positions.dimensions(); axis++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int node = 0; node < positions.nodeCount(); node++) {
                double value = positions.get(node, axis);
                assertTrue(CoordinateRange.DEFAULT.contains(value));
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
            assertEquals(-10.0d, min, 1e-9);
            assertEquals(10.0d, max, 1e-9);
        }
    }

    @Test
    @DisplayName("Identical input and configuration give identical output")
    void testDeterminism() {
        NetworkPipeline pipeline = new NetworkPipeline(twoPairConfig());

        NetworkResult first = pipeline.run(LocationFixtureFactory.twoPairRecords());
        NetworkResult second = pipeline.run(LocationFixtureFactory.twoPairRecords());

        assertEquals(first.partition(), second.partition());
        assertArrayEquals(first.positions().coordinatesCopy(), second.positions().coordinatesCopy());
        assertEquals(first.communityEdges(), second.communityEdges());
    }

    @Test
    @DisplayName("Opposed locations with no edge stay separate communities")
    void testNoEdges() {
        List<EngagementRecord> records = List.of(
                LocationFixtureFactory.record("North", 10.0d, 1.0d, 0.0d),
                LocationFixtureFactory.record("South", 0.0d, 1.0d, 10.0d)
        );

        NetworkResult result = new NetworkPipeline(twoPairConfig()).run(records);

        assertEquals(0, result.similarityGraph().edgeCount());
        assertEquals(2, result.communityCount());
        assertTrue(result.locationEdges().isEmpty());
        assertTrue(result.strongestLocationEdges(-1).isEmpty());
    }

    @Test
    @DisplayName("Strongest edges are capped and keep construction order on ties")
    void testStrongestLocationEdges() {
        NetworkResult result = new NetworkPipeline(twoPairConfig()).run(LocationFixtureFactory.twoPairRecords());

        assertEquals(2, result.strongestLocationEdges(-1).size());
        assertEquals(2, result.strongestLocationEdges(10).size());
        assertTrue(result.strongestLocationEdges(0).isEmpty());

        List<LocationEdgeView> top = result.strongestLocationEdges(1);
        assertEquals(1, top.size());
        assertEquals("A", top.get(0).getSourceId());
        assertThrows(IllegalArgumentException.class, () -> result.strongestLocationEdges(-2));
    }

    @Test
    @DisplayName("Optional community layout is normalized into the same range")
    void testCommunityLayout() {
        PipelineConfig config = twoPairConfig().toBuilder()
                .communityLayout(LayoutConfig.communityDefaults())
                .build();

        NetworkResult result = new NetworkPipeline(config).run(LocationFixtureFactory.twoPairRecords());

        assertTrue(result.hasCommunityLayout());
        PositionMap communityPositions = result.communityLayoutPositions();
        assertEquals(result.communityCount(), communityPositions.nodeCount());
        for (double value : communityPositions.coordinatesCopy()) {
            assertTrue(CoordinateRange.DEFAULT.contains(value));
        }
    }

    @Test
    @DisplayName("Fewer than two locations fail with a reason code")
    void testInsufficientLocations() {
        NetworkPipeline pipeline = new NetworkPipeline(twoPairConfig());

        NetworkPipelineException single = assertThrows(NetworkPipelineException.class,
                () -> pipeline.run(List.of(LocationFixtureFactory.record("Only", 1.0d, 1.0d, 1.0d))));
        assertEquals(NetworkPipeline.REASON_INSUFFICIENT_LOCATIONS, single.getReasonCode());
        assertTrue(single.getMessage().startsWith("[" + NetworkPipeline.REASON_INSUFFICIENT_LOCATIONS + "]"));

        List<EngagementRecord> incomplete = new ArrayList<>();
        incomplete.add(EngagementRecord.builder().locationId("X").language("en").build());
        incomplete.add(EngagementRecord.builder().locationId("Y").language("en").build());
        NetworkPipelineException none = assertThrows(NetworkPipelineException.class, () -> pipeline.run(incomplete));
        assertEquals(NetworkPipeline.REASON_INSUFFICIENT_LOCATIONS, none.getReasonCode());

        NetworkPipelineException missing = assertThrows(NetworkPipelineException.class, () -> pipeline.run(null));
        assertEquals(NetworkPipeline.REASON_RECORDS_REQUIRED, missing.getReasonCode());
    }

    @Test
    @DisplayName("Rows with infinite engagement are filtered before the similarity stage")
    void testInfiniteReachFiltered() {
        List<EngagementRecord> records = new ArrayList<>(LocationFixtureFactory.twoPairRecords());
        records.add(LocationFixtureFactory.record("A", Double.POSITIVE_INFINITY, 1.0d, 0.0d));

        NetworkResult result = new NetworkPipeline(twoPairConfig()).run(records);

        assertEquals(4, result.locationCount());
        assertEquals(10.0d, result.locationNodes().get(0).getReachSum(), 1e-12);

        List<EngagementRecord> onlyInfinite = List.of(
                LocationFixtureFactory.record("X", Double.POSITIVE_INFINITY, 1.0d, 0.0d),
                LocationFixtureFactory.record("Y", 1.0d, 1.0d, 0.0d)
        );
        NetworkPipelineException ex = assertThrows(NetworkPipelineException.class,
                () -> new NetworkPipeline(twoPairConfig()).run(onlyInfinite));
        assertEquals(NetworkPipeline.REASON_INSUFFICIENT_LOCATIONS, ex.getReasonCode());
    }

    @Test
    @DisplayName("Minimum tweet count can push a run below two locations")
    void testMinTweetsFilter() {
        List<EngagementRecord> records = new ArrayList<>(LocationFixtureFactory.twoPairRecords());
        records.add(LocationFixtureFactory.record("A", 12.0d, 1.0d, 0.0d));
        records.add(LocationFixtureFactory.record("C", 0.0d, 1.0d, 12.0d));

        NetworkResult result = new NetworkPipeline(twoPairConfig().toBuilder().minTweetsPerLocation(2).build()).run(records);
        assertEquals(2, result.locationCount());
        assertEquals("A", result.locationNodes().get(0).getLocationId());
        assertEquals(2, result.locationNodes().get(0).getTweetCount());

        NetworkPipeline strict = new NetworkPipeline(twoPairConfig().toBuilder().minTweetsPerLocation(3).build());
        NetworkPipelineException ex = assertThrows(NetworkPipelineException.class, () -> strict.run(records));
        assertEquals(NetworkPipeline.REASON_INSUFFICIENT_LOCATIONS, ex.getReasonCode());
    }

    @Test
    @DisplayName("Invalid configuration is rejected at construction")
    void testConfigurationValidation() {
        assertConfigRejected(null);
        assertConfigRejected(PipelineConfig.builder().minTweetsPerLocation(0).build());
        assertConfigRejected(PipelineConfig.builder()
                .similarity(SimilarityGraphConfig.builder().neighborCount(0).build())
                .build());
        assertConfigRejected(PipelineConfig.builder()
                .similarity(SimilarityGraphConfig.builder().weightThreshold(1.5d).build())
                .build());
        assertConfigRejected(PipelineConfig.builder().layout(LayoutConfig.builder().iterations(0).build()).build());
        assertConfigRejected(PipelineConfig.builder()
                .communityLayout(LayoutConfig.communityDefaults().toBuilder().spacing(-1.0d).build())
                .build());
        assertConfigRejected(PipelineConfig.builder().coordinateRange(null).build());
    }

    private static void assertConfigRejected(PipelineConfig config) {
        NetworkPipelineException ex = assertThrows(NetworkPipelineException.class, () -> new NetworkPipeline(config));
        assertEquals(NetworkPipeline.REASON_CONFIGURATION_INVALID, ex.getReasonCode());
    }
}
