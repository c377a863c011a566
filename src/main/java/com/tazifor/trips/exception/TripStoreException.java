package com.tazifor.trips.exception;

public class TripStoreException extends TripInsightException {

    public TripStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
