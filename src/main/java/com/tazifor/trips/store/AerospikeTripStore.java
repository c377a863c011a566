package com.tazifor.trips.store;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tazifor.trips.exception.TripStoreException;
import com.tazifor.trips.model.EnrichedTripRecord;
import com.tazifor.trips.model.RawTripRecord;
import com.tazifor.trips.model.TripType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Aerospike-backed store ({@code trips.store=aerospike}).
 *
 * RECORD LAYOUT (set "trips", key = trip id):
 * - data: the raw record as JSON
 * - one bin per derived attribute, so scans can read them without parsing
 *
 * Filtering happens client side after a full scan; this store is meant for
 * dataset-sized snapshots, not ad-hoc queries over billions of rows.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "trips.store", havingValue = "aerospike")
public class AerospikeTripStore implements TripStore {

    static final String TRIP_SET = "trips";

    private static final String BIN_DATA = "data";
    private static final String BIN_DISTANCE = "distanceKm";
    private static final String BIN_SPEED = "speedKmh";
    private static final String BIN_FARE = "farePerKm";
    private static final String BIN_HOUR = "hourOfDay";
    private static final String BIN_DAY = "dayOfWeek";
    private static final String BIN_MONTH = "month";
    private static final String BIN_PICKUP_REGION = "pickupRegion";
    private static final String BIN_DROPOFF_REGION = "dropoffRegion";
    private static final String BIN_TRIP_TYPE = "tripType";

    private final AerospikeClient client;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;
    private final String namespace;

    public AerospikeTripStore(AerospikeClient client,
                              @Qualifier("tripWritePolicy") WritePolicy writePolicy,
                              ObjectMapper objectMapper,
                              @Value("${aerospike.namespace}") String namespace) {
        this.client = client;
        this.writePolicy = writePolicy;
        this.objectMapper = objectMapper;
        this.namespace = namespace;
    }

    @Override
    public int saveAll(Collection<EnrichedTripRecord> trips) {
        int inserted = 0;
        for (EnrichedTripRecord trip : trips) {
            if (trip.getId() == null) {
                continue;
            }
            Key key = new Key(namespace, TRIP_SET, trip.getId());
            try {
                client.put(writePolicy, key, toBins(trip));
                inserted++;
            } catch (AerospikeException e) {
                if (e.getResultCode() != ResultCode.KEY_EXISTS_ERROR) {
                    throw new TripStoreException("Failed to store trip " + trip.getId(), e);
                }
                log.debug("Trip {} already stored, skipping", trip.getId());
            }
        }
        return inserted;
    }

    @Override
    public List<EnrichedTripRecord> findAll() {
        List<EnrichedTripRecord> trips = Collections.synchronizedList(new ArrayList<>());
        try {
            // the callback runs on one thread per node
            client.scanAll(null, namespace, TRIP_SET, (key, record) -> trips.add(fromRecord(record)));
        } catch (AerospikeException e) {
            throw new TripStoreException("Failed to scan trips", e);
        }
        return new ArrayList<>(trips);
    }

    @Override
    public String name() {
        return "aerospike";
    }

    private Bin[] toBins(EnrichedTripRecord trip) {
        String json;
        try {
            json = objectMapper.writeValueAsString(trip.getRaw());
        } catch (JsonProcessingException e) {
            throw new TripStoreException("Failed to serialize trip " + trip.getId(), e);
        }
        return new Bin[] {
            new Bin(BIN_DATA, json),
            new Bin(BIN_DISTANCE, trip.getDistanceKm()),
            new Bin(BIN_SPEED, trip.getSpeedKmh()),
            new Bin(BIN_FARE, trip.getFarePerKm()),
            new Bin(BIN_HOUR, trip.getHourOfDay()),
            new Bin(BIN_DAY, trip.getDayOfWeek()),
            new Bin(BIN_MONTH, trip.getMonth()),
            new Bin(BIN_PICKUP_REGION, trip.getPickupRegion()),
            new Bin(BIN_DROPOFF_REGION, trip.getDropoffRegion()),
            new Bin(BIN_TRIP_TYPE, trip.getTripType().name())
        };
    }

    private EnrichedTripRecord fromRecord(Record record) {
        RawTripRecord raw;
        try {
            raw = objectMapper.readValue(record.getString(BIN_DATA), RawTripRecord.class);
        } catch (JsonProcessingException e) {
            throw new TripStoreException("Corrupt trip record in set " + TRIP_SET, e);
        }
        return EnrichedTripRecord.builder()
            .raw(raw)
            .distanceKm(record.getDouble(BIN_DISTANCE))
            .speedKmh(record.getDouble(BIN_SPEED))
            .farePerKm(record.getDouble(BIN_FARE))
            .hourOfDay(record.getInt(BIN_HOUR))
            .dayOfWeek(record.getInt(BIN_DAY))
            .month(record.getInt(BIN_MONTH))
            .pickupRegion(record.getString(BIN_PICKUP_REGION))
            .dropoffRegion(record.getString(BIN_DROPOFF_REGION))
            .tripType(TripType.valueOf(record.getString(BIN_TRIP_TYPE)))
            .build();
    }
}
