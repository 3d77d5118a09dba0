package com.example.smartparkinggate.service.store;

import com.example.smartparkinggate.model.ParkingSession;

import java.util.Optional;

public interface SessionStore {

    /**
     * Stores the session under its plate, replacing any earlier record.
     */
    void save(ParkingSession session);

    Optional<ParkingSession> findByPlate(String plate);
}
