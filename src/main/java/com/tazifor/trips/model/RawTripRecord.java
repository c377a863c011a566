package com.tazifor.trips.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;

/**
 * Raw Trip Record
 *
 * One row of the source trip feed, as supplied by the caller. Numeric fields
 * are boxed: a missing or unparseable column is {@code null} and makes the
 * record fail validation.
 *
 * Timestamps are wall-clock values without a zone; enrichment reads their
 * fields directly and never converts between zones.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RawTripRecord {

    // ===== Identity =====
    String id;
    Integer vendorId;

    // ===== Timing =====
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    LocalDateTime pickupDatetime;
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    LocalDateTime dropoffDatetime;
    Integer tripDuration;            // seconds

    // ===== Passengers =====
    Integer passengerCount;

    // ===== Endpoints =====
    Double pickupLatitude;
    Double pickupLongitude;
    Double dropoffLatitude;
    Double dropoffLongitude;

    String storeAndFwdFlag;          // Y/N
}
