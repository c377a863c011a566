package com.tazifor.trips.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Clustering input: pickup latitude, pickup longitude and trip duration in seconds.
 * <p>
 * Components are nullable so that rows with missing columns can still be
 * carried through a clustering run. Such points are <i>malformed</i>; see
 * {@link #isComplete()}.
 * </p>
 */
public record FeaturePoint(Double lat, Double lon, Double duration) {

    public static FeaturePoint of(double lat, double lon, double duration) {
        return new FeaturePoint(lat, lon, duration);
    }

    /**
     * True when all three components are present and finite.
     */
    @JsonIgnore
    public boolean isComplete() {
        return isFinite(lat) && isFinite(lon) && isFinite(duration);
    }

    private static boolean isFinite(Double value) {
        return value != null && Double.isFinite(value);
    }
}
