package com.tazifor.trips.exception;

public class TripImportException extends TripInsightException {

    public TripImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
