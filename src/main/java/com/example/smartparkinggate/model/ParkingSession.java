package com.example.smartparkinggate.model;

/**
 * Entry record of a parked vehicle, keyed by plate. A later entry of the same
 * plate replaces it.
 */
public record ParkingSession(
        String plate,
        long entryEpoch,
        String timestamp,
        String action,
        String imageUrl) {
}
