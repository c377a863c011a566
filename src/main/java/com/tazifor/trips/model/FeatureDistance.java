package com.tazifor.trips.model;

/**
 * Outcome of comparing two feature points.
 * <p>
 * A distance is either <b>comparable</b> (a finite, non-negative value) or
 * <b>incomparable</b> (one side was absent or malformed). Incomparable
 * distances order after every comparable one, so they never win a
 * nearest-centroid search.
 * </p>
 */
public final class FeatureDistance implements Comparable<FeatureDistance> {

    private static final FeatureDistance INCOMPARABLE = new FeatureDistance(false, Double.NaN);

    private final boolean comparable;
    private final double value;

    private FeatureDistance(boolean comparable, double value) {
        this.comparable = comparable;
        this.value = value;
    }

    public static FeatureDistance of(double value) {
        if (!Double.isFinite(value) || value < 0) {
            return INCOMPARABLE;
        }
        return new FeatureDistance(true, value);
    }

    public static FeatureDistance incomparable() {
        return INCOMPARABLE;
    }

    public boolean isComparable() {
        return comparable;
    }

    /**
     * @throws IllegalStateException if this distance is incomparable
     */
    public double value() {
        if (!comparable) {
            throw new IllegalStateException("Incomparable distance has no value");
        }
        return value;
    }

    /** Comparable and strictly below {@code threshold}. */
    public boolean isBelow(double threshold) {
        return comparable && value < threshold;
    }

    @Override
    public int compareTo(FeatureDistance other) {
        if (comparable && other.comparable) {
            return Double.compare(value, other.value);
        }
        if (comparable) {
            return -1;
        }
        return other.comparable ? 1 : 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureDistance that)) return false;
        return comparable == that.comparable && (!comparable || Double.compare(value, that.value) == 0);
    }

    @Override
    public int hashCode() {
        return comparable ? Double.hashCode(value) : 0;
    }

    @Override
    public String toString() {
        return comparable ? "FeatureDistance[" + value + "]" : "FeatureDistance[incomparable]";
    }
}
