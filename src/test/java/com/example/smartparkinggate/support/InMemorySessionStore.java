package com.example.smartparkinggate.support;

import com.example.smartparkinggate.model.ParkingSession;
import com.example.smartparkinggate.service.store.SessionStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySessionStore implements SessionStore {

    private final Map<String, ParkingSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void save(ParkingSession session) {
        sessions.put(session.plate(), session);
    }

    @Override
    public Optional<ParkingSession> findByPlate(String plate) {
        return Optional.ofNullable(sessions.get(plate));
    }

    public int size() {
        return sessions.size();
    }
}
