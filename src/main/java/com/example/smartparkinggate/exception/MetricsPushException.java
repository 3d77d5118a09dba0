package com.example.smartparkinggate.exception;

public class MetricsPushException extends ParkingGateException {

    public MetricsPushException(String message) {
        super(message);
    }

    public MetricsPushException(String message, Throwable cause) {
        super(message, cause);
    }
}
