package com.example.smartparkinggate.exception;

/**
 * The request body could not be decoded into image bytes. Fatal to the request.
 */
public class ImageDecodeException extends ParkingGateException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
