package com.tazifor.trips.store;

import com.tazifor.trips.model.EnrichedTripRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-local store, the default backend ({@code trips.store=memory}).
 * Keeps insertion order so that sampling is stable across calls.
 */
@Component
@ConditionalOnProperty(name = "trips.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryTripStore implements TripStore {

    private final Map<String, EnrichedTripRecord> trips = new LinkedHashMap<>();

    @Override
    public synchronized int saveAll(Collection<EnrichedTripRecord> batch) {
        int inserted = 0;
        for (EnrichedTripRecord trip : batch) {
            if (trip.getId() == null) {
                continue;
            }
            if (trips.putIfAbsent(trip.getId(), trip) == null) {
                inserted++;
            }
        }
        return inserted;
    }

    @Override
    public synchronized List<EnrichedTripRecord> findAll() {
        return new ArrayList<>(trips.values());
    }

    @Override
    public String name() {
        return "memory";
    }
}
