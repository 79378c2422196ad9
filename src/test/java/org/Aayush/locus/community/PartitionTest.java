package org.Aayush.locus.community;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PartitionTest {

    @Test
    @DisplayName("Members are grouped per community in node order")
    void testMembers() {
        Partition partition = new Partition(new int[]{1, 0, 1, 0, 2});

        assertEquals(5, partition.nodeCount());
        assertEquals(3, partition.communityCount());
        assertArrayEquals(new int[]{1, 3}, partition.membersOf(0));
        assertArrayEquals(new int[]{0, 2}, partition.membersOf(1));
        assertEquals(1, partition.communitySize(2));
        assertThrows(IndexOutOfBoundsException.class, () -> partition.membersOf(3));
    }

    @Test
    @DisplayName("Input array is copied")
    void testDefensiveCopy() {
        int[] raw = {0, 1};
        Partition partition = new Partition(raw);
        raw[0] = 1;

        assertEquals(0, partition.communityOf(0));
        partition.assignmentsCopy()[1] = 0;
        assertEquals(1, partition.communityOf(1));
    }

    @Test
    @DisplayName("Negative and non-contiguous ids are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Partition(null));
        assertThrows(IllegalArgumentException.class, () -> new Partition(new int[]{0, -1}));
        assertThrows(IllegalArgumentException.class, () -> new Partition(new int[]{0, 2}));
    }

    @Test
    @DisplayName("Singletons assign each node its own id")
    void testSingletons() {
        Partition partition = Partition.singletons(3);

        assertEquals(3, partition.communityCount());
        assertEquals(new Partition(new int[]{0, 1, 2}), partition);
        assertEquals(0, Partition.singletons(0).communityCount());
    }
}
