package com.example.smartparkinggate.model;

/**
 * Gate instruction returned to the barrier controller as the response body.
 */
public enum GateMessage {
    IMAGE_DECODE_ERROR,
    INVALID_ACTION,
    FULL,
    DENIED_NO_TEXT,
    OPEN_GATE,
    EXIT_SUCCESS
}
