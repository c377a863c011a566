package com.tazifor.trips.store;

import com.tazifor.trips.model.EnrichedTripRecord;

import java.util.Collection;
import java.util.List;

/**
 * Read/write data source for enriched trips.
 * <p>
 * Writes are insert-only by trip id: a trip whose id is already stored is
 * skipped, not overwritten.
 * </p>
 */
public interface TripStore {

    /**
     * @return number of trips actually inserted
     */
    int saveAll(Collection<EnrichedTripRecord> trips);

    /**
     * Every stored trip, in insertion order where the backend keeps one.
     */
    List<EnrichedTripRecord> findAll();

    default List<EnrichedTripRecord> find(TripQuery query) {
        return query.apply(findAll());
    }

    String name();
}
