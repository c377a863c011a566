package com.tazifor.trips.model;

import java.util.function.Predicate;

/**
 * Binary trip classification derived from the pickup and dropoff regions.
 */
public enum TripType {
    WITHIN_REGION,   // same region, or at least one side Unknown
    CROSS_REGION;    // both regions known and different

    public static TripType of(String pickupRegion, String dropoffRegion, Predicate<String> isKnownRegion) {
        boolean bothKnown = isKnownRegion.test(pickupRegion) && isKnownRegion.test(dropoffRegion);
        if (bothKnown && !pickupRegion.equals(dropoffRegion)) {
            return CROSS_REGION;
        }
        return WITHIN_REGION;
    }
}
