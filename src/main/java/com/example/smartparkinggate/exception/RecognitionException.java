package com.example.smartparkinggate.exception;

/**
 * The text recognition engine could not process the capture.
 */
public class RecognitionException extends ParkingGateException {

    public RecognitionException(String message) {
        super(message);
    }

    public RecognitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
