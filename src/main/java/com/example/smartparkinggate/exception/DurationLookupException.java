package com.example.smartparkinggate.exception;

/**
 * The entry record needed for the parking duration could not be read.
 */
public class DurationLookupException extends ParkingGateException {

    public DurationLookupException(String message) {
        super(message);
    }

    public DurationLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
