package com.tazifor.trips.geo.util;

import com.tazifor.trips.exception.InvalidInputException;
import com.tazifor.trips.geo.model.LatLon;
import com.tazifor.trips.model.FeatureDistance;
import com.tazifor.trips.model.FeaturePoint;

/**
 * Distance measures used by enrichment and clustering.
 *
 * <h3>Great-circle distance</h3>
 * Haversine formula on a sphere (default radius 6371 km):
 * <pre>{@code
 * a = sin²(Δlat/2) + cos(lat1)·cos(lat2)·sin²(Δlon/2)
 * d = R · 2·atan2(√a, √(1−a))
 * }</pre>
 *
 * <h3>Feature distance</h3>
 * Plain Euclidean distance over {@code (lat, lon, duration / divisor)}.
 * Latitude and longitude stay in raw degrees and duration seconds are divided
 * by a fixed divisor (default 1000) so that a few minutes of duration weigh
 * about as much as a few hundredths of a degree. This is not a geometric
 * metric; it is the similarity measure the clustering is defined on.
 */
public class DistanceModel {

    public static final double DEFAULT_EARTH_RADIUS_KM = 6371.0;
    public static final double DEFAULT_DURATION_DIVISOR = 1000.0;

    private final double earthRadiusKm;
    private final double durationDivisor;

    public DistanceModel() {
        this(DEFAULT_EARTH_RADIUS_KM, DEFAULT_DURATION_DIVISOR);
    }

    public DistanceModel(double earthRadiusKm, double durationDivisor) {
        if (!(earthRadiusKm > 0) || !Double.isFinite(earthRadiusKm)) {
            throw new IllegalArgumentException("Earth radius must be positive, got " + earthRadiusKm);
        }
        if (!(durationDivisor > 0) || !Double.isFinite(durationDivisor)) {
            throw new IllegalArgumentException("Duration divisor must be positive, got " + durationDivisor);
        }
        this.earthRadiusKm = earthRadiusKm;
        this.durationDivisor = durationDivisor;
    }

    /**
     * Great-circle distance in kilometres between two coordinates given in degrees.
     *
     * @throws InvalidInputException if any coordinate is NaN or infinite
     */
    public double greatCircleDistanceKm(double lat1, double lon1, double lat2, double lon2) {
        requireFinite("lat1", lat1);
        requireFinite("lon1", lon1);
        requireFinite("lat2", lat2);
        requireFinite("lon2", lon2);

        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
            * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        // rounding can push a marginally outside [0, 1] for antipodal points
        a = Math.min(1.0, Math.max(0.0, a));
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return earthRadiusKm * c;
    }

    public double greatCircleDistanceKm(LatLon a, LatLon b) {
        return greatCircleDistanceKm(a.lat(), a.lon(), b.lat(), b.lon());
    }

    /**
     * Normalized Euclidean distance between two feature points.
     * Returns {@link FeatureDistance#incomparable()} when either point is
     * null or malformed; never throws.
     */
    public FeatureDistance featureDistance(FeaturePoint a, FeaturePoint b) {
        if (a == null || b == null || !a.isComplete() || !b.isComplete()) {
            return FeatureDistance.incomparable();
        }
        double latDiff = a.lat() - b.lat();
        double lonDiff = a.lon() - b.lon();
        double durationDiff = (a.duration() - b.duration()) / durationDivisor;
        return FeatureDistance.of(Math.sqrt(latDiff * latDiff + lonDiff * lonDiff + durationDiff * durationDiff));
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidInputException(name + " must be a finite number, got " + value);
        }
    }
}
