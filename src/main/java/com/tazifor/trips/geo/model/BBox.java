package com.tazifor.trips.geo.model;

/**
 * Axis-aligned lat/lon rectangle. All four edges are inclusive.
 */
public record BBox(double minLat, double minLon, double maxLat, double maxLon) {

    public BBox {
        if (minLat > maxLat || minLon > maxLon) {
            throw new IllegalArgumentException(
                "Inverted bounding box: lat " + minLat + ".." + maxLat + ", lon " + minLon + ".." + maxLon);
        }
    }

    public boolean contains(LatLon p) {
        return contains(p.lat(), p.lon());
    }

    public boolean contains(double lat, double lon) {
        return lat >= minLat && lat <= maxLat && lon >= minLon && lon <= maxLon;
    }
}
