package org.Aayush.locus.layout;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Stage 5: per-axis affine rescaling of layout positions into a {@link CoordinateRange}.
 */
@UtilityClass
public final class CoordinateNormalizer {

    /**
     * Rescales every axis independently, in place. An axis whose values all coincide uses a
     * range of 1, which places every node on {@code range.min} for that axis.
     *
     * @param positions positions to rescale.
     * @param range target interval.
     * @return the same {@code positions} instance.
     */
    public static PositionMap normalize(PositionMap positions, CoordinateRange range) {
        Objects.requireNonNull(positions, "positions");
        Objects.requireNonNull(range, "range");

        int n = positions.nodeCount();
        if (n == 0) {
            return positions;
        }

        double span = range.span();
        for (int axis = 0; axis < positions.dimensions(); axis++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int node = 0; node < n; node++) {
                double value = positions.get(node, axis);
                if (!Double.isFinite(value)) {
                    throw new IllegalArgumentException("position of node " + node + " on axis " + axis
                            + " is not finite: " + value);
                }
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
            double extent = max - min;
            if (extent == 0.0d) {
                extent = 1.0d;
            }

            for (int node = 0; node < n; node++) {
                double unit = (positions.get(node, axis) - min) / extent;
                double scaled = unit * span + range.getMin();
                // rounding guard only; the map is affine
                positions.set(node, axis, Math.max(range.getMin(), Math.min(range.getMax(), scaled)));
            }
        }
        return positions;
    }
}
