package com.tazifor.trips.store;

import com.tazifor.trips.model.EnrichedTripRecord;
import com.tazifor.trips.model.TripType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Filter for trip listings. Null fields do not filter.
 */
@Value
@Builder
public class TripQuery {

    public static final int DEFAULT_LIMIT = 1000;

    String borough;          // pickup region
    Integer hour;            // pickup hour of day
    Integer minDuration;     // seconds, inclusive
    Integer maxDuration;     // seconds, inclusive
    TripType tripType;

    @Builder.Default
    int limit = DEFAULT_LIMIT;
    @Builder.Default
    int offset = 0;

    public boolean matches(EnrichedTripRecord trip) {
        if (borough != null && !borough.equals(trip.getPickupRegion())) {
            return false;
        }
        if (hour != null && hour != trip.getHourOfDay()) {
            return false;
        }
        Integer duration = trip.getRaw().getTripDuration();
        if (minDuration != null && (duration == null || duration < minDuration)) {
            return false;
        }
        if (maxDuration != null && (duration == null || duration > maxDuration)) {
            return false;
        }
        return tripType == null || tripType == trip.getTripType();
    }

    /**
     * Filters, orders by pickup time (newest first) and pages the given trips.
     */
    public List<EnrichedTripRecord> apply(Collection<EnrichedTripRecord> trips) {
        Comparator<EnrichedTripRecord> newestFirst = Comparator.comparing(
            (EnrichedTripRecord t) -> t.getRaw().getPickupDatetime(),
            Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()));

        return trips.stream()
            .filter(this::matches)
            .sorted(newestFirst)
            .skip(Math.max(0, offset))
            .limit(Math.max(0, limit))
            .toList();
    }
}
