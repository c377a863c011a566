package com.tazifor.trips.exception;

/**
 * Base type for failures raised by the trip pipeline.
 */
public class TripInsightException extends RuntimeException {

    public TripInsightException(String message) {
        super(message);
    }

    public TripInsightException(String message, Throwable cause) {
        super(message, cause);
    }
}
