package com.tazifor.trips.exception;

/**
 * Raised when numeric input is non-finite or a required field is missing.
 * Signals a caller contract violation rather than a dirty-but-parseable record.
 */
public class InvalidInputException extends TripInsightException {

    public InvalidInputException(String message) {
        super(message);
    }
}
