package com.tazifor.trips.geo.service;

import com.tazifor.trips.geo.model.RegionBoundary;
import com.tazifor.trips.geo.model.RegionTable;

/**
 * Maps coordinates onto the configured {@link RegionTable}.
 * <p>
 * Both operations are total: they never throw, and non-finite input simply
 * fails every comparison (invalid coordinate, {@code "Unknown"} region).
 * </p>
 */
public class GeoClassifier {

    private final RegionTable regionTable;

    public GeoClassifier(RegionTable regionTable) {
        this.regionTable = regionTable;
    }

    /**
     * A coordinate is valid when neither component is exactly 0 and it lies
     * inside the global bounds (inclusive).
     */
    public boolean isValidCoordinate(double lat, double lon) {
        if (lat == 0 || lon == 0) {
            return false;
        }
        return regionTable.globalBounds().contains(lat, lon);
    }

    /**
     * Returns the name of the first region (in table order) containing the point,
     * or {@link RegionTable#UNKNOWN}.
     */
    public String classifyRegion(double lat, double lon) {
        for (RegionBoundary region : regionTable.regions()) {
            if (region.contains(lat, lon)) {
                return region.name();
            }
        }
        return RegionTable.UNKNOWN;
    }

    /**
     * True for a configured region name, false for {@link RegionTable#UNKNOWN} or {@code null}.
     */
    public boolean isKnownRegion(String label) {
        return regionTable.hasRegion(label);
    }
}
