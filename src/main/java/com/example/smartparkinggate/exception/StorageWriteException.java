package com.example.smartparkinggate.exception;

public class StorageWriteException extends ParkingGateException {

    public StorageWriteException(String message) {
        super(message);
    }

    public StorageWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
