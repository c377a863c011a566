package com.tazifor.trips.service;

import com.tazifor.trips.config.TripInsightProperties;
import com.tazifor.trips.exception.InvalidInputException;
import com.tazifor.trips.geo.service.GeoClassifier;
import com.tazifor.trips.geo.util.DistanceModel;
import com.tazifor.trips.model.EnrichedTripRecord;
import com.tazifor.trips.model.EnrichmentReport;
import com.tazifor.trips.model.RawTripRecord;
import com.tazifor.trips.model.TripType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * TripEnricher - record validation and feature derivation
 *
 * VALIDATION ORDER (short-circuits on the first failure):
 * 1. Pickup coordinate inside the global bounds, not on a zero axis
 * 2. Dropoff coordinate, same rule
 * 3. Duration within [min, max] seconds
 * 4. Passenger count within [min, max]
 * 5. Great-circle distance within [min, max] km
 *
 * All bounds are inclusive. Validation never throws: a record with missing
 * fields is simply invalid.
 *
 * ENRICHMENT assumes the record already passed {@link #validate}. Nothing here
 * guards against a zero duration or distance; such a record produces an
 * infinite speed or fare-per-km.
 */
@Slf4j
@Service
public class TripEnricher {

    private static final double SECONDS_PER_HOUR = 3600.0;

    private final GeoClassifier geoClassifier;
    private final DistanceModel distanceModel;
    private final TripInsightProperties.Validation limits;

    public TripEnricher(GeoClassifier geoClassifier,
                        DistanceModel distanceModel,
                        TripInsightProperties properties) {
        this.geoClassifier = geoClassifier;
        this.distanceModel = distanceModel;
        this.limits = properties.getValidation();
    }

    /**
     * Composite validity check. Returns {@code false} on the first failing rule.
     */
    public boolean validate(RawTripRecord record) {
        if (record == null) {
            return false;
        }

        Double pickupLat = record.getPickupLatitude();
        Double pickupLon = record.getPickupLongitude();
        Double dropoffLat = record.getDropoffLatitude();
        Double dropoffLon = record.getDropoffLongitude();

        if (pickupLat == null || pickupLon == null
            || !geoClassifier.isValidCoordinate(pickupLat, pickupLon)) {
            return false;
        }
        if (dropoffLat == null || dropoffLon == null
            || !geoClassifier.isValidCoordinate(dropoffLat, dropoffLon)) {
            return false;
        }

        Integer duration = record.getTripDuration();
        if (duration == null
            || duration < limits.getMinDurationSeconds()
            || duration > limits.getMaxDurationSeconds()) {
            return false;
        }

        Integer passengers = record.getPassengerCount();
        if (passengers == null
            || passengers < limits.getMinPassengers()
            || passengers > limits.getMaxPassengers()) {
            return false;
        }

        // both endpoints passed the bounds check, so they are finite here
        double distance = distanceModel.greatCircleDistanceKm(pickupLat, pickupLon, dropoffLat, dropoffLon);
        return distance >= limits.getMinDistanceKm() && distance <= limits.getMaxDistanceKm();
    }

    /**
     * Derives distance, speed, time buckets, regions and trip type.
     * Pure: the same record always yields an equal result.
     *
     * @throws InvalidInputException if a field needed for derivation is missing
     *                               or a coordinate is not finite
     */
    public EnrichedTripRecord enrich(RawTripRecord record) {
        if (record == null) {
            throw new InvalidInputException("record must not be null");
        }
        double pickupLat = required(record.getPickupLatitude(), "pickup_latitude");
        double pickupLon = required(record.getPickupLongitude(), "pickup_longitude");
        double dropoffLat = required(record.getDropoffLatitude(), "dropoff_latitude");
        double dropoffLon = required(record.getDropoffLongitude(), "dropoff_longitude");
        int duration = required(record.getTripDuration(), "trip_duration");
        LocalDateTime pickup = required(record.getPickupDatetime(), "pickup_datetime");

        double distance = distanceModel.greatCircleDistanceKm(pickupLat, pickupLon, dropoffLat, dropoffLon);
        double speed = distance / (duration / SECONDS_PER_HOUR);
        double farePerKm = duration / distance;

        String pickupRegion = geoClassifier.classifyRegion(pickupLat, pickupLon);
        String dropoffRegion = geoClassifier.classifyRegion(dropoffLat, dropoffLon);

        return EnrichedTripRecord.builder()
            .raw(record)
            .distanceKm(round(distance, 3))
            .speedKmh(round(speed, 2))
            .farePerKm(round(farePerKm, 2))
            .hourOfDay(pickup.getHour())
            .dayOfWeek(pickup.getDayOfWeek().getValue() % 7)   // ISO Mon=1..Sun=7 -> Sun=0
            .month(pickup.getMonthValue())
            .pickupRegion(pickupRegion)
            .dropoffRegion(dropoffRegion)
            .tripType(TripType.of(pickupRegion, dropoffRegion, geoClassifier::isKnownRegion))
            .build();
    }

    /**
     * Validates and enriches a batch. Rejected records are counted and dropped.
     */
    public EnrichmentReport enrichAll(Iterable<RawTripRecord> records) {
        long processed = 0;
        long invalid = 0;
        List<EnrichedTripRecord> enriched = new ArrayList<>();

        for (RawTripRecord record : records) {
            processed++;
            EnrichedTripRecord result = tryEnrich(record);
            if (result == null) {
                invalid++;
            } else {
                enriched.add(result);
            }
        }

        log.debug("Enriched batch: processed={} valid={} invalid={}", processed, enriched.size(), invalid);
        return new EnrichmentReport(processed, enriched.size(), invalid, enriched);
    }

    /**
     * Validate-then-enrich for a single record; {@code null} when the record is rejected.
     * A record that validates but lacks a pickup timestamp is rejected as well.
     */
    EnrichedTripRecord tryEnrich(RawTripRecord record) {
        if (!validate(record)) {
            log.debug("Rejected trip {}", record == null ? null : record.getId());
            return null;
        }
        try {
            return enrich(record);
        } catch (InvalidInputException e) {
            log.warn("Rejected trip {} after validation: {}", record.getId(), e.getMessage());
            return null;
        }
    }

    private static <T> T required(T value, String field) {
        if (value == null) {
            throw new InvalidInputException(field + " is required");
        }
        return value;
    }

    /**
     * Half-up rounding to a fixed number of decimals. Non-finite values pass through.
     */
    static double round(double value, int places) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
