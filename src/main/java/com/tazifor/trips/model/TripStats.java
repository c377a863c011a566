package com.tazifor.trips.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Aggregate view over stored trips. Averages are {@code null} when there is
 * nothing to average.
 */
public record TripStats(Overall overall, List<RegionStats> boroughs, List<HourlyStats> hourly) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Overall(long totalTrips,
                          Double avgDuration,
                          Double avgDistance,
                          Double avgSpeed,
                          LocalDateTime earliestTrip,
                          LocalDateTime latestTrip) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RegionStats(String pickupBorough, long tripCount, Double avgDuration, Double avgDistance) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record HourlyStats(int hourOfDay, long tripCount, Double avgDuration, Double avgSpeed) {
    }
}
