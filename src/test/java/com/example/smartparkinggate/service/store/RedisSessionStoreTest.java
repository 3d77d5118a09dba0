package com.example.smartparkinggate.service.store;

import com.example.smartparkinggate.config.ParkingProperties;
import com.example.smartparkinggate.model.ParkingSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisSessionStoreTest {

    @Mock
    private RedisTemplate<String, ParkingSession> redisTemplate;

    @Mock
    private ValueOperations<String, ParkingSession> valueOperations;

    private RedisSessionStore store;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        ParkingProperties properties = new ParkingProperties();
        properties.setSessionsTable("Sessions");
        store = new RedisSessionStore(redisTemplate, properties);
    }

    @Test
    void savesUnderPlateKey() {
        ParkingSession session = new ParkingSession("ABC123", 1_700_000_000L, "2023-11-14 22:13:20", "ENTRY", "url");

        store.save(session);

        verify(valueOperations).set("Sessions:ABC123", session);
    }

    @Test
    void findsByPlate() {
        ParkingSession session = new ParkingSession("ABC123", 1_700_000_000L, "2023-11-14 22:13:20", "ENTRY", "url");
        when(valueOperations.get("Sessions:ABC123")).thenReturn(session);

        assertThat(store.findByPlate("ABC123")).contains(session);
    }

    @Test
    void unknownPlateHasNoSession() {
        assertThat(store.findByPlate("OTHER")).isEmpty();
    }
}
