package com.tazifor.trips.model;

/**
 * Outcome of a bulk import.
 *
 * @param processed rows read from the source
 * @param valid     rows that passed validation and were enriched
 * @param invalid   rows rejected by validation
 * @param stored    enriched rows actually written (duplicates by id are skipped)
 * @param batches   number of store writes issued
 */
public record ImportReport(long processed, long valid, long invalid, long stored, int batches) {
}
