package org.Aayush.locus.layout;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;

/**
 * Node positions stored as one flat array ({@code node * dimensions + axis}).
 *
 * <p>Written once by {@link SpatialLayoutEngine} and rescaled in place by
 * {@link CoordinateNormalizer}; read-only for everyone else.</p>
 */
public final class PositionMap {
    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int dimensions;
    private final double[] coordinates;

    PositionMap(int nodeCount, int dimensions, double[] coordinates) {
        if (nodeCount < 0 || dimensions <= 0) {
            throw new IllegalArgumentException("invalid shape: nodes=" + nodeCount + ", dimensions=" + dimensions);
        }
        if (coordinates.length != nodeCount * dimensions) {
            throw new IllegalArgumentException(
                    "coordinate length " + coordinates.length + " does not match " + nodeCount + "x" + dimensions
            );
        }
        this.nodeCount = nodeCount;
        this.dimensions = dimensions;
        this.coordinates = coordinates;
    }

    /**
     * Creates a position map from per-node vectors.
     */
    public static PositionMap of(double[][] positions) {
        if (positions == null || positions.length == 0) {
            throw new IllegalArgumentException("positions must be non-empty");
        }
        int dimensions = positions[0].length;
        double[] flat = new double[positions.length * dimensions];
        for (int node = 0; node < positions.length; node++) {
            if (positions[node].length != dimensions) {
                throw new IllegalArgumentException("node " + node + " has " + positions[node].length
                        + " coordinates, expected " + dimensions);
            }
            System.arraycopy(positions[node], 0, flat, node * dimensions, dimensions);
        }
        return new PositionMap(positions.length, dimensions, flat);
    }

    public double get(int nodeId, int axis) {
        return coordinates[index(nodeId, axis)];
    }

    void set(int nodeId, int axis, double value) {
        coordinates[index(nodeId, axis)] = value;
    }

    /**
     * Returns a copy of one node's position vector.
     */
    public double[] positionCopy(int nodeId) {
        checkNode(nodeId);
        return Arrays.copyOfRange(coordinates, nodeId * dimensions, (nodeId + 1) * dimensions);
    }

    public double[] coordinatesCopy() {
        return coordinates.clone();
    }

    private int index(int nodeId, int axis) {
        checkNode(nodeId);
        if (axis < 0 || axis >= dimensions) {
            throw new IndexOutOfBoundsException("Axis " + axis + " out of bounds [0, " + dimensions + ")");
        }
        return nodeId * dimensions + axis;
    }

    private void checkNode(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeCount) {
            throw new IndexOutOfBoundsException("Node " + nodeId + " out of bounds [0, " + nodeCount + ")");
        }
    }
}
