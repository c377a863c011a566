package com.tazifor.trips.model;

import java.util.List;

/**
 * Outcome of enriching a batch: counts plus the records that passed validation.
 */
public record EnrichmentReport(long processed, long valid, long invalid, List<EnrichedTripRecord> records) {

    public EnrichmentReport {
        records = List.copyOf(records);
    }

    public double retentionRate() {
        return processed == 0 ? 0.0 : (double) valid / processed;
    }
}
