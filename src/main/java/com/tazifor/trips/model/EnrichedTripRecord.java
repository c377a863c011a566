package com.tazifor.trips.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Enriched Trip Record
 *
 * A validated {@link RawTripRecord} together with the attributes derived from it.
 * Serialized flat: the raw fields and the derived fields share one JSON object.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EnrichedTripRecord {

    @NonNull
    @JsonUnwrapped
    RawTripRecord raw;

    // ===== Geometry =====
    double distanceKm;
    double speedKmh;
    double farePerKm;               // seconds of trip per km

    // ===== Time buckets (pickup wall clock) =====
    int hourOfDay;                  // 0-23
    int dayOfWeek;                  // 0=Sun ... 6=Sat
    int month;                      // 1-12

    // ===== Regions =====
    @NonNull
    String pickupRegion;
    @NonNull
    String dropoffRegion;
    @NonNull
    TripType tripType;

    @JsonIgnore
    public String getId() {
        return raw.getId();
    }

    /**
     * Pickup coordinate and duration, the clustering view of this trip.
     */
    public FeaturePoint toFeaturePoint() {
        Integer duration = raw.getTripDuration();
        return new FeaturePoint(raw.getPickupLatitude(), raw.getPickupLongitude(),
            duration == null ? null : duration.doubleValue());
    }
}
