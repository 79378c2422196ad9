package org.Aayush.locus.community;

import org.Aayush.locus.graph.WeightedGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Louvain Community Detector Tests")
class CommunityDetectorTest {

    private static final CommunityDetectionConfig DEFAULT_CONFIG = CommunityDetectionConfig.builder().build();

    /**
     * Two 4-cliques joined by one weak bridge (3 - 4).
     */
    private static WeightedGraph twoCliques() {
        WeightedGraph.Builder builder = WeightedGraph.builder(8);
        for (int offset = 0; offset <= 4; offset += 4) {
            for (int u = 0; u < 4; u++) {
                for (int v = u + 1; v < 4; v++) {
                    builder.addEdge(offset + u, offset + v, 0.9d);
                }
            }
        }
        builder.addEdge(3, 4, 0.35d);
        return builder.build();
    }

    /**
     * {@code count} cliques of {@code size} nodes with unit weights; clique {@code i}'s last node
     * links to clique {@code i + 1}'s first node, closing a ring.
     */
    private static WeightedGraph ringOfCliques(int count, int size) {
        WeightedGraph.Builder builder = WeightedGraph.builder(count * size);
        for (int clique = 0; clique < count; clique++) {
            int base = clique * size;
            for (int u = 0; u < size; u++) {
                for (int v = u + 1; v < size; v++) {
                    builder.addEdge(base + u, base + v, 1.0d);
                }
            }
            int next = ((clique + 1) % count) * size;
            builder.addEdge(base + size - 1, next, 1.0d);
        }
        return builder.build();
    }

    private static int communityCount(WeightedGraph graph, double resolution) {
        return CommunityDetector.detect(graph, CommunityDetectionConfig.builder().resolution(resolution).build())
                .communityCount();
    }

    @Test
    @DisplayName("Disjoint pairs become two communities numbered by first appearance")
    void testTwoPairs() {
        WeightedGraph.Builder builder = WeightedGraph.builder(4);
        builder.addEdge(0, 1, 0.98d);
        builder.addEdge(2, 3, 0.98d);

        Partition partition = CommunityDetector.detect(builder.build(), DEFAULT_CONFIG);

        assertEquals(2, partition.communityCount());
        assertArrayEquals(new int[]{0, 0, 1, 1}, partition.assignmentsCopy());
    }

    @Test
    @DisplayName("Weakly bridged cliques are separated")
    void testBridgedCliques() {
        Partition partition = CommunityDetector.detect(twoCliques(), DEFAULT_CONFIG);

        assertEquals(2, partition.communityCount());
        assertArrayEquals(new int[]{0, 0, 0, 0, 1, 1, 1, 1}, partition.assignmentsCopy());
        assertArrayEquals(new int[]{4, 5, 6, 7}, partition.membersOf(1));
    }

    @Test
    @DisplayName("Edgeless graph yields singleton communities")
    void testEdgeless() {
        Partition partition = CommunityDetector.detect(WeightedGraph.edgeless(3), DEFAULT_CONFIG);

        assertEquals(3, partition.communityCount());
        assertArrayEquals(new int[]{0, 1, 2}, partition.assignmentsCopy());
    }

    @Test
    @DisplayName("Isolated node keeps its own community")
    void testIsolatedNode() {
        WeightedGraph.Builder builder = WeightedGraph.builder(4);
        builder.addEdge(0, 1, 0.8d);
        builder.addEdge(1, 2, 0.8d);
        builder.addEdge(0, 2, 0.8d);

        Partition partition = CommunityDetector.detect(builder.build(), DEFAULT_CONFIG);

        assertEquals(2, partition.communityCount());
        assertEquals(partition.communityOf(0), partition.communityOf(2));
        assertEquals(1, partition.communityOf(3));
        assertEquals(1, partition.communitySize(1));
    }

    @Test
    @DisplayName("Same graph, resolution and seed give the same partition")
    void testDeterminism() {
        CommunityDetectionConfig config = CommunityDetectionConfig.builder().resolution(1.0d).seed(7L).build();

        Partition first = CommunityDetector.detect(twoCliques(), config);
        Partition second = CommunityDetector.detect(twoCliques(), config);

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    @DisplayName("Community ids are contiguous and cover every node")
    void testContiguousIds() {
        Partition partition = CommunityDetector.detect(twoCliques(), DEFAULT_CONFIG);

        int covered = 0;
        for (int c = 0; c < partition.communityCount(); c++) {
            assertTrue(partition.communitySize(c) > 0);
            covered += partition.communitySize(c);
        }
        assertEquals(partition.nodeCount(), covered);
    }

    @Test
    @DisplayName("Renumbering follows first appearance")
    void testRenumber() {
        assertArrayEquals(new int[]{0, 1, 0, 2, 1}, CommunityDetector.renumber(new int[]{5, 2, 5, 0, 2}));
    }

    @Test
    @DisplayName("Resolution must be finite and positive")
    void testConfigValidation() {
        WeightedGraph graph = twoCliques();

        assertThrows(IllegalArgumentException.class, () -> CommunityDetector.detect(graph,
                CommunityDetectionConfig.builder().resolution(0.0d).build()));
        assertThrows(IllegalArgumentException.class, () -> CommunityDetector.detect(graph,
                CommunityDetectionConfig.builder().resolution(Double.POSITIVE_INFINITY).build()));
    }

    @Test
    @DisplayName("Higher resolution yields more, smaller communities")
    void testResolutionOrdering() {
        WeightedGraph ring = ringOfCliques(40, 3);

        int coarse = communityCount(ring, 0.2d);
        int standard = communityCount(ring, 1.0d);
        int fine = communityCount(ring, 3.0d);

        assertTrue(coarse < standard, "0.2 -> " + coarse + ", 1.0 -> " + standard);
        assertTrue(standard < fine, "1.0 -> " + standard + ", 3.0 -> " + fine);
        assertTrue(fine <= 40);
    }

    @Test
    @DisplayName("Ring of K5 cliques resolves to one whole community per clique")
    void testRingOfCliques() {
        Partition partition = CommunityDetector.detect(ringOfCliques(10, 5),
                CommunityDetectionConfig.builder().resolution(1.0d).build());

        assertEquals(10, partition.communityCount());
        for (int clique = 0; clique < 10; clique++) {
            int community = partition.communityOf(clique * 5);
            for (int member = 1; member < 5; member++) {
                assertEquals(community, partition.communityOf(clique * 5 + member), "clique " + clique + " split");
            }
            assertEquals(5, partition.communitySize(community));
        }
    }

    @Test
    @DisplayName("Low resolution merges beyond single cliques through contraction levels")
    void testMultiLevelMerge() {
        Partition partition = CommunityDetector.detect(ringOfCliques(40, 3),
                CommunityDetectionConfig.builder().resolution(0.2d).build());

        int largest = 0;
        for (int c = 0; c < partition.communityCount(); c++) {
            largest = Math.max(largest, partition.communitySize(c));
        }
        assertTrue(largest > 6, "largest community has " + largest + " nodes");
        assertTrue(partition.communityCount() < 40 / 2);
    }
}
