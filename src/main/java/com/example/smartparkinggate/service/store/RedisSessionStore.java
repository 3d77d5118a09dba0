package com.example.smartparkinggate.service.store;

import com.example.smartparkinggate.config.ParkingProperties;
import com.example.smartparkinggate.model.ParkingSession;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class RedisSessionStore implements SessionStore {

    private final RedisTemplate<String, ParkingSession> sessionRedisTemplate;
    private final ParkingProperties properties;

    public RedisSessionStore(RedisTemplate<String, ParkingSession> sessionRedisTemplate, ParkingProperties properties) {
        this.sessionRedisTemplate = sessionRedisTemplate;
        this.properties = properties;
    }

    @Override
    public void save(ParkingSession session) {
        sessionRedisTemplate.opsForValue().set(key(session.plate()), session);
    }

    @Override
    public Optional<ParkingSession> findByPlate(String plate) {
        return Optional.ofNullable(sessionRedisTemplate.opsForValue().get(key(plate)));
    }

    String key(String plate) {
        return properties.getSessionsTable() + ":" + plate;
    }
}
