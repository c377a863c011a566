package com.tazifor.trips.geo.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable region configuration: the global validity rectangle plus an
 * ordered list of named region boundaries.
 * <p>
 * The list order is the classification priority. Where boundaries overlap,
 * the first one containing a point wins, so reordering the list changes the
 * labels assigned to points in the overlap.
 * </p>
 */
public final class RegionTable {

    public static final String UNKNOWN = "Unknown";

    private final BBox globalBounds;
    private final List<RegionBoundary> regions;
    private final Set<String> names;

    public RegionTable(BBox globalBounds, List<RegionBoundary> regions) {
        this.globalBounds = Objects.requireNonNull(globalBounds, "globalBounds");
        this.regions = List.copyOf(Objects.requireNonNull(regions, "regions"));

        Set<String> seen = new HashSet<>();
        for (RegionBoundary region : this.regions) {
            if (UNKNOWN.equalsIgnoreCase(region.name())) {
                throw new IllegalArgumentException("'" + UNKNOWN + "' is reserved and cannot name a region");
            }
            if (!seen.add(region.name())) {
                throw new IllegalArgumentException("Duplicate region name: " + region.name());
            }
        }
        this.names = Set.copyOf(seen);
    }

    public BBox globalBounds() {
        return globalBounds;
    }

    /** Regions in priority order. */
    public List<RegionBoundary> regions() {
        return regions;
    }

    public boolean hasRegion(String name) {
        return name != null && names.contains(name);
    }

    public List<String> regionNames() {
        return regions.stream().map(RegionBoundary::name).toList();
    }
}
