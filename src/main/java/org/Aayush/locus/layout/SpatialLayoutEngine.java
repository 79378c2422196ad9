package org.Aayush.locus.layout;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.locus.graph.WeightedGraph;

import java.util.Arrays;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Stage 4: seeded force-directed (spring) layout.
 *
 * <p>Forces, with ideal length {@code L = spacing / sqrt(n)}:</p>
 * <ul>
 * <li>Repulsion between every pair, magnitude {@code L^3 / d^2}.</li>
 * <li>Spring along every edge, magnitude {@code weight * (d - L)} (pulls when stretched).</li>
 * </ul>
 * <p>Each iteration reads an immutable snapshot, moves every node along its net force by at
 * most the current temperature, then cools the temperature linearly. The iteration count is
 * fixed; there is no convergence test.</p>
 */
@Slf4j
@UtilityClass
public final class SpatialLayoutEngine {
    private static final double INITIAL_TEMPERATURE_FRACTION = 0.1d;
    private static final double MIN_DISTANCE_FRACTION = 0.01d;

    /**
     * Computes raw (unnormalized) positions.
     *
     * @param graph graph to embed; edge weights scale spring strength.
     * @param config dimensionality, spacing, iterations and seed.
     * @return position per node.
     */
    public static PositionMap layout(WeightedGraph graph, LayoutConfig config) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(config, "config");
        validateConfig(config);

        int n = graph.nodeCount();
        int dims = config.getDimensions();
        double[] current = initialPositions(n, dims, config.getSeed());
        if (n == 0) {
            return new PositionMap(0, dims, current);
        }

        double ideal = config.getSpacing() / Math.sqrt(n);
        double minDistance = ideal * MIN_DISTANCE_FRACTION;
        double repulsionScale = ideal * ideal * ideal;

        double temperature = INITIAL_TEMPERATURE_FRACTION * maxExtent(current, n, dims);
        if (temperature <= 0.0d) {
            temperature = INITIAL_TEMPERATURE_FRACTION;
        }
        double cooling = temperature / (config.getIterations() + 1);

        double[] next = new double[current.length];
        double[] force = new double[dims];
        double[] delta = new double[dims];
        WeightedGraph.NeighborIterator neighbors = graph.iterator();

        for (int iteration = 0; iteration < config.getIterations(); iteration++) {
            for (int i = 0; i < n; i++) {
                Arrays.fill(force, 0.0d);

                for (int j = 0; j < n; j++) {
                    if (j == i) {
                        continue;
                    }
                    double distance = difference(current, i, j, dims, delta);
                    if (distance == 0.0d) {
                        continue;
                    }
                    double clamped = Math.max(distance, minDistance);
                    double magnitude = repulsionScale / (clamped * clamped);
                    for (int axis = 0; axis < dims; axis++) {
                        force[axis] += delta[axis] / distance * magnitude;
                    }
                }

                neighbors.resetForNode(i);
                while (neighbors.hasNext()) {
                    int j = neighbors.next();
                    double distance = difference(current, i, j, dims, delta);
                    if (distance == 0.0d) {
                        continue;
                    }
                    double magnitude = neighbors.weight() * (Math.max(distance, minDistance) - ideal);
                    for (int axis = 0; axis < dims; axis++) {
                        force[axis] -= delta[axis] / distance * magnitude;
                    }
                }

                double length = norm(force);
                int base = i * dims;
                if (length > 0.0d) {
                    double step = Math.min(length, temperature);
                    for (int axis = 0; axis < dims; axis++) {
                        next[base + axis] = current[base + axis] + force[axis] / length * step;
                    }
                } else {
                    System.arraycopy(current, base, next, base, dims);
                }
            }

            double[] swap = current;
            current = next;
            next = swap;
            temperature -= cooling;
        }

        log.debug("Layout finished: {} nodes, {} edges, {} iterations, ideal length {}",
                n, graph.edgeCount(), config.getIterations(), ideal);
        return new PositionMap(n, dims, current);
    }

    /**
     * Validates layout configuration ranges.
     */
    public static void validateConfig(LayoutConfig config) {
        if (config.getDimensions() <= 0) {
            throw new IllegalArgumentException("dimensions must be > 0");
        }
        double spacing = config.getSpacing();
        if (!Double.isFinite(spacing) || spacing <= 0.0d) {
            throw new IllegalArgumentException("spacing must be finite and > 0, got " + spacing);
        }
        if (config.getIterations() <= 0) {
            throw new IllegalArgumentException("iterations must be > 0");
        }
    }

    /**
     * Uniform positions in [0, 1) per axis, drawn in node-major order.
     */
    private static double[] initialPositions(int n, int dims, long seed) {
        SplittableRandom random = new SplittableRandom(seed);
        double[] positions = new double[n * dims];
        for (int k = 0; k < positions.length; k++) {
            positions[k] = random.nextDouble();
        }
        return positions;
    }

    private static double maxExtent(double[] positions, int n, int dims) {
        double extent = 0.0d;
        for (int axis = 0; axis < dims; axis++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int node = 0; node < n; node++) {
                double value = positions[node * dims + axis];
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
            extent = Math.max(extent, max - min);
        }
        return extent;
    }

    /**
     * Writes {@code p_i - p_j} into {@code delta} and returns its length.
     */
    private static double difference(double[] positions, int i, int j, int dims, double[] delta) {
        double squared = 0.0d;
        for (int axis = 0; axis < dims; axis++) {
            double d = positions[i * dims + axis] - positions[j * dims + axis];
            delta[axis] = d;
            squared += d * d;
        }
        return Math.sqrt(squared);
    }

    private static double norm(double[] vector) {
        double squared = 0.0d;
        for (double v : vector) {
            squared += v * v;
        }
        return Math.sqrt(squared);
    }
}
