package com.tazifor.trips.ingest;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.tazifor.trips.model.RawTripRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Reads the NYC trip-duration CSV layout into {@link RawTripRecord}s.
 *
 * EXPECTED HEADER:
 * id, vendor_id, pickup_datetime, dropoff_datetime, passenger_count,
 * pickup_longitude, pickup_latitude, dropoff_longitude, dropoff_latitude,
 * store_and_fwd_flag, trip_duration
 *
 * Cells are parsed leniently: blank or unparseable values become {@code null},
 * so a bad cell produces a record that fails validation instead of aborting
 * the whole file. Extra columns are ignored.
 */
@Component
public class TripCsvReader {

    private static final DateTimeFormatter CSV_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final CsvMapper csvMapper = new CsvMapper();

    /**
     * Streams every data row of {@code source} into {@code sink}, one record at a time.
     *
     * @return number of rows read
     */
    public long read(Reader source, Consumer<RawTripRecord> sink) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        long rows = 0;
        try (MappingIterator<Map<String, String>> it = csvMapper
                .readerForMapOf(String.class)
                .with(schema)
                .readValues(source)) {
            while (it.hasNextValue()) {
                sink.accept(toRecord(it.nextValue()));
                rows++;
            }
        }
        return rows;
    }

    RawTripRecord toRecord(Map<String, String> row) {
        return RawTripRecord.builder()
            .id(text(row.get("id")))
            .vendorId(parseInt(row.get("vendor_id")))
            .pickupDatetime(parseTimestamp(row.get("pickup_datetime")))
            .dropoffDatetime(parseTimestamp(row.get("dropoff_datetime")))
            .passengerCount(parseInt(row.get("passenger_count")))
            .pickupLongitude(parseDouble(row.get("pickup_longitude")))
            .pickupLatitude(parseDouble(row.get("pickup_latitude")))
            .dropoffLongitude(parseDouble(row.get("dropoff_longitude")))
            .dropoffLatitude(parseDouble(row.get("dropoff_latitude")))
            .storeAndFwdFlag(text(row.get("store_and_fwd_flag")))
            .tripDuration(parseInt(row.get("trip_duration")))
            .build();
    }

    private static String text(String cell) {
        if (cell == null || cell.isBlank()) {
            return null;
        }
        return cell.trim();
    }

    static Integer parseInt(String cell) {
        String value = text(cell);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Double parseDouble(String cell) {
        String value = text(cell);
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Accepts {@code yyyy-MM-dd HH:mm:ss} and ISO-8601 local timestamps.
     */
    static LocalDateTime parseTimestamp(String cell) {
        String value = text(cell);
        if (value == null) {
            return null;
        }
        try {
            return LocalDateTime.parse(value, CSV_TIMESTAMP);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }
}
