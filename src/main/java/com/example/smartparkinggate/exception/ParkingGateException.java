package com.example.smartparkinggate.exception;

/**
 * Base type for failures raised while handling a gate capture.
 */
public class ParkingGateException extends RuntimeException {

    public ParkingGateException(String message) {
        super(message);
    }

    public ParkingGateException(String message, Throwable cause) {
        super(message, cause);
    }
}
