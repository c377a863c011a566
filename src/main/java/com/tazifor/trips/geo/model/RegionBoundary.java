package com.tazifor.trips.geo.model;

import java.util.Objects;

/**
 * A named rectangular geofence, e.g. a simplified borough outline.
 */
public record RegionBoundary(String name, BBox bounds) {

    public RegionBoundary {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(bounds, "bounds");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Region name must not be blank");
        }
    }

    public static RegionBoundary of(String name, double minLat, double maxLat, double minLon, double maxLon) {
        return new RegionBoundary(name, new BBox(minLat, minLon, maxLat, maxLon));
    }

    public boolean contains(double lat, double lon) {
        return bounds.contains(lat, lon);
    }
}
