package org.Aayush.locus.graph;

import it.unimi.dsi.fastutil.ints.IntArrays;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.locus.core.id.LocationIdMapper;
import org.Aayush.locus.feature.LocationFeature;
import org.Aayush.locus.feature.LocationFeatures;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Stage 2: sparse k-nearest-neighbor similarity graph over locations.
 *
 * <p>Each feature column is standardized (zero mean, unit population variance), pairwise
 * cosine similarity is computed on the standardized rows, and every location proposes an
 * edge to each of its top-K most similar peers whose similarity exceeds the threshold.
 * The graph is the union of all proposals.</p>
 */
@Slf4j
@UtilityClass
public final class SimilarityGraphBuilder {

    /**
     * Builds the similarity graph.
     *
     * @param locations aggregated locations; list position becomes node id.
     * @param config neighbor count, threshold and feature columns.
     * @return immutable similarity graph.
     */
    public static SimilarityGraph build(List<LocationFeatures> locations, SimilarityGraphConfig config) {
        Objects.requireNonNull(locations, "locations");
        Objects.requireNonNull(config, "config");
        validateConfig(config);

        int nodeCount = locations.size();
        List<String> ids = new ArrayList<>(nodeCount);
        for (LocationFeatures location : locations) {
            ids.add(Objects.requireNonNull(location, "location").getLocationId());
        }
        LocationIdMapper mapper = LocationIdMapper.fromOrderedIds(ids);

        int effectiveK = Math.max(0, Math.min(config.getNeighborCount(), nodeCount - 1));
        int[] proposalCounts = new int[nodeCount];
        if (nodeCount <= 1) {
            return new SimilarityGraph(
                    WeightedGraph.edgeless(nodeCount), mapper, locations,
                    config.getWeightThreshold(), effectiveK, proposalCounts
            );
        }

        double[][] standardized = standardize(featureMatrix(locations, config.getFeatureColumns()));
        double[][] similarity = cosineSimilarity(standardized);

        double threshold = config.getWeightThreshold();
        WeightedGraph.Builder builder = WeightedGraph.builder(nodeCount);
        int[] candidates = new int[nodeCount - 1];
        for (int node = 0; node < nodeCount; node++) {
            double[] row = similarity[node];
            int[] ranked = rankNeighbors(node, row, candidates);
            for (int rank = 0; rank < effectiveK; rank++) {
                int neighbor = ranked[rank];
                double weight = row[neighbor];
                if (weight > threshold) {
                    proposalCounts[node]++;
                    builder.addEdge(node, neighbor, Math.min(1.0d, weight));
                }
            }
        }

        WeightedGraph graph = builder.build();
        log.debug("Similarity graph built: {} (K={}, threshold={})", graph, effectiveK, threshold);
        return new SimilarityGraph(graph, mapper, locations, threshold, effectiveK, proposalCounts);
    }

    /**
     * Validates builder configuration ranges.
     */
    public static void validateConfig(SimilarityGraphConfig config) {
        if (config.getNeighborCount() <= 0) {
            throw new IllegalArgumentException("neighborCount must be > 0");
        }
        double threshold = config.getWeightThreshold();
        if (!Double.isFinite(threshold) || threshold < 0.0d || threshold >= 1.0d) {
            throw new IllegalArgumentException("weightThreshold must be in [0, 1), got " + threshold);
        }
        List<LocationFeature> columns = config.getFeatureColumns();
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("featureColumns must be non-empty");
        }
        for (LocationFeature column : columns) {
            if (column == null) {
                throw new IllegalArgumentException("featureColumns must not contain null");
            }
        }
    }

    private static double[][] featureMatrix(List<LocationFeatures> locations, List<LocationFeature> columns) {
        double[][] matrix = new double[locations.size()][columns.size()];
        for (int row = 0; row < locations.size(); row++) {
            LocationFeatures location = locations.get(row);
            for (int col = 0; col < columns.size(); col++) {
                double value = columns.get(col).valueOf(location);
                if (!Double.isFinite(value)) {
                    throw new IllegalArgumentException(
                            "feature " + columns.get(col) + " of location " + location.getLocationId()
                                    + " is not finite: " + value
                    );
                }
                matrix[row][col] = value;
            }
        }
        return matrix;
    }

    /**
     * Centers each column and divides by its population standard deviation.
     * Zero-variance columns keep scale 1 and therefore become all zeros.
     */
    static double[][] standardize(double[][] matrix) {
        int rows = matrix.length;
        int cols = rows == 0 ? 0 : matrix[0].length;
        double[][] result = new double[rows][cols];
        for (int col = 0; col < cols; col++) {
            double mean = 0.0d;
            for (double[] row : matrix) {
                mean += row[col];
            }
            mean /= rows;

            double variance = 0.0d;
            for (double[] row : matrix) {
                double delta = row[col] - mean;
                variance += delta * delta;
            }
            variance /= rows;
            double scale = variance > 0.0d ? Math.sqrt(variance) : 1.0d;

            for (int r = 0; r < rows; r++) {
                result[r][col] = (matrix[r][col] - mean) / scale;
            }
        }
        return result;
    }

    /**
     * Full symmetric cosine similarity matrix. Rows with zero norm have similarity 0 to every row.
     */
    static double[][] cosineSimilarity(double[][] rows) {
        int n = rows.length;
        double[] norms = new double[n];
        for (int i = 0; i < n; i++) {
            norms[i] = Math.sqrt(dot(rows[i], rows[i]));
        }
        double[][] similarity = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i; j < n; j++) {
                double value = norms[i] == 0.0d || norms[j] == 0.0d
                        ? 0.0d
                        : dot(rows[i], rows[j]) / (norms[i] * norms[j]);
                similarity[i][j] = value;
                similarity[j][i] = value;
            }
        }
        return similarity;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0d;
        for (int k = 0; k < a.length; k++) {
            sum += a[k] * b[k];
        }
        return sum;
    }

    /**
     * Orders all other nodes by similarity descending. Merge sort is stable, so equal
     * similarities keep ascending node order.
     */
    private static int[] rankNeighbors(int node, double[] row, int[] buffer) {
        int size = 0;
        for (int other = 0; other < row.length; other++) {
            if (other != node) {
                buffer[size++] = other;
            }
        }
        IntArrays.mergeSort(buffer, 0, size, (a, b) -> Double.compare(row[b], row[a]));
        return buffer;
    }
}
