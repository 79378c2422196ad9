package org.Aayush.locus.community;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.Arrays;

/**
 * Immutable node-to-community assignment.
 *
 * <p>Community ids are contiguous in {@code [0, communityCount)} and numbered by first
 * appearance in node order.</p>
 */
public final class Partition {
    private final int[] communityOf;
    private final int communityCount;
    private final int[][] members;

    /**
     * Creates a partition from raw assignments.
     *
     * @param assignments community id per node; ids must be contiguous from 0.
     */
    public Partition(int[] assignments) {
        if (assignments == null) {
            throw new IllegalArgumentException("assignments cannot be null");
        }
        this.communityOf = assignments.clone();
        int max = -1;
        for (int node = 0; node < communityOf.length; node++) {
            int community = communityOf[node];
            if (community < 0) {
                throw new IllegalArgumentException("community id must be >= 0 for node " + node + ": " + community);
            }
            max = Math.max(max, community);
        }
        this.communityCount = max + 1;

        IntArrayList[] buckets = new IntArrayList[communityCount];
        for (int c = 0; c < communityCount; c++) {
            buckets[c] = new IntArrayList();
        }
        for (int node = 0; node < communityOf.length; node++) {
            buckets[communityOf[node]].add(node);
        }
        this.members = new int[communityCount][];
        for (int c = 0; c < communityCount; c++) {
            if (buckets[c].isEmpty()) {
                throw new IllegalArgumentException("community ids must be contiguous; id " + c + " has no members");
            }
            members[c] = buckets[c].toIntArray();
        }
    }

    /**
     * Returns a partition where every node is its own community.
     */
    public static Partition singletons(int nodeCount) {
        int[] assignments = new int[nodeCount];
        for (int node = 0; node < nodeCount; node++) {
            assignments[node] = node;
        }
        return new Partition(assignments);
    }

    public int nodeCount() {
        return communityOf.length;
    }

    public int communityCount() {
        return communityCount;
    }

    public int communityOf(int nodeId) {
        return communityOf[nodeId];
    }

    /**
     * Members of a community in ascending node order.
     */
    public int[] membersOf(int communityId) {
        if (communityId < 0 || communityId >= communityCount) {
            throw new IndexOutOfBoundsException("Community " + communityId + " out of bounds [0, " + communityCount + ")");
        }
        return members[communityId].clone();
    }

    public int communitySize(int communityId) {
        return members[communityId].length;
    }

    public int[] assignmentsCopy() {
        return communityOf.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Partition)) return false;
        return Arrays.equals(communityOf, ((Partition) o).communityOf);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(communityOf);
    }

    @Override
    public String toString() {
        return String.format("Partition[nodes=%d, communities=%d]", communityOf.length, communityCount);
    }
}
