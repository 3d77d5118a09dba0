package com.example.smartparkinggate.service.store;

import com.example.smartparkinggate.config.ParkingProperties;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

@Repository
public class RedisOccupancyStore implements OccupancyStore {

    // -1: counter missing, -2: no slot left
    static final RedisScript<Long> DECREMENT_IF_AVAILABLE = new DefaultRedisScript<>(
            "local current = tonumber(redis.call('GET', KEYS[1])) "
                    + "if current == nil then return -1 end "
                    + "if current <= 0 then return -2 end "
                    + "return redis.call('DECR', KEYS[1])",
            Long.class);

    static final RedisScript<Long> INCREMENT_OR_INITIALIZE = new DefaultRedisScript<>(
            "redis.call('SET', KEYS[1], ARGV[1], 'NX') "
                    + "return redis.call('INCR', KEYS[1])",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ParkingProperties properties;

    public RedisOccupancyStore(StringRedisTemplate redisTemplate, ParkingProperties properties) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
    }

    @Override
    public Optional<Long> findAvailableSlots(String lotId) {
        String value = redisTemplate.opsForValue().get(key(lotId));
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(Long.parseLong(value.trim()));
    }

    @Override
    public boolean initializeIfAbsent(String lotId, long initialSlots) {
        Boolean created = redisTemplate.opsForValue().setIfAbsent(key(lotId), Long.toString(initialSlots));
        return Boolean.TRUE.equals(created);
    }

    @Override
    public OptionalLong decrementIfAvailable(String lotId) {
        Long remaining = redisTemplate.execute(DECREMENT_IF_AVAILABLE, List.of(key(lotId)));
        if (remaining == null || remaining < 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(remaining);
    }

    @Override
    public long increment(String lotId, long initialSlots) {
        Long updated = redisTemplate.execute(INCREMENT_OR_INITIALIZE, List.of(key(lotId)), Long.toString(initialSlots));
        if (updated == null) {
            throw new IllegalStateException("Redis returned no value for INCR on " + key(lotId));
        }
        return updated;
    }

    String key(String lotId) {
        return properties.getOccupancyTable() + ":" + lotId;
    }
}
