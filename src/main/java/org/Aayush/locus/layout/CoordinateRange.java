package org.Aayush.locus.layout;

import lombok.Value;

/**
 * Closed target interval applied to every axis by {@link CoordinateNormalizer}.
 */
@Value
public class CoordinateRange {
    /**
     * Default renderer cube, [-10, 10] per axis.
     */
    public static final CoordinateRange DEFAULT = new CoordinateRange(-10.0d, 10.0d);

    double min;
    double max;

    /**
     * @throws IllegalArgumentException when a bound is not finite or {@code min >= max}.
     */
    public CoordinateRange(double min, double max) {
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new IllegalArgumentException("coordinate range bounds must be finite: [" + min + ", " + max + "]");
        }
        if (min >= max) {
            throw new IllegalArgumentException("coordinate range min must be < max: [" + min + ", " + max + "]");
        }
        this.min = min;
        this.max = max;
    }

    public double span() {
        return max - min;
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
