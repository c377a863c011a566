package com.tazifor.trips.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A clustered pickup as returned to clients: the feature coordinates plus
 * the trip attributes needed to describe the cluster.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ClusterPoint(Double lat,
                           Double lon,
                           Integer duration,
                           double distanceKm,
                           double speedKmh,
                           String pickupBorough,
                           int hourOfDay) {

    public static ClusterPoint of(EnrichedTripRecord trip) {
        RawTripRecord raw = trip.getRaw();
        return new ClusterPoint(
            raw.getPickupLatitude(),
            raw.getPickupLongitude(),
            raw.getTripDuration(),
            trip.getDistanceKm(),
            trip.getSpeedKmh(),
            trip.getPickupRegion(),
            trip.getHourOfDay());
    }
}
