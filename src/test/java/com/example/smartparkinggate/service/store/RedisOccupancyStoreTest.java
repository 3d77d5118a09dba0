package com.example.smartparkinggate.service.store;

import com.example.smartparkinggate.config.ParkingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.List;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisOccupancyStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisOccupancyStore store;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        store = new RedisOccupancyStore(redisTemplate, new ParkingProperties());
    }

    @Test
    void keysCounterByTableAndLot() {
        assertThat(store.key("lot1")).isEqualTo("ParkingLot:lot1");
    }

    @Test
    void readsStoredSlots() {
        when(valueOperations.get("ParkingLot:lot1")).thenReturn("17");

        assertThat(store.findAvailableSlots("lot1")).contains(17L);
    }

    @Test
    void missingCounterReadsAsEmpty() {
        when(valueOperations.get("ParkingLot:lot1")).thenReturn(null);

        assertThat(store.findAvailableSlots("lot1")).isEmpty();
    }

    @Test
    void initializesOnlyWhenAbsent() {
        when(valueOperations.setIfAbsent("ParkingLot:lot1", "30")).thenReturn(true, false);

        assertThat(store.initializeIfAbsent("lot1", 30)).isTrue();
        assertThat(store.initializeIfAbsent("lot1", 30)).isFalse();
    }

    @Test
    void decrementRunsGuardedScript() {
        when(redisTemplate.execute(eq(RedisOccupancyStore.DECREMENT_IF_AVAILABLE), eq(List.of("ParkingLot:lot1"))))
                .thenReturn(28L);

        assertThat(store.decrementIfAvailable("lot1")).isEqualTo(OptionalLong.of(28));
    }

    @Test
    void decrementOnEmptyLotReportsNothing() {
        when(redisTemplate.execute(eq(RedisOccupancyStore.DECREMENT_IF_AVAILABLE), eq(List.of("ParkingLot:lot1"))))
                .thenReturn(-2L);

        assertThat(store.decrementIfAvailable("lot1")).isEmpty();
    }

    @Test
    void decrementOnMissingCounterReportsNothing() {
        when(redisTemplate.execute(eq(RedisOccupancyStore.DECREMENT_IF_AVAILABLE), eq(List.of("ParkingLot:lot1"))))
                .thenReturn(-1L);

        assertThat(store.decrementIfAvailable("lot1")).isEmpty();
    }

    @Test
    void incrementInitializesMissingCounterInSameScript() {
        when(redisTemplate.execute(eq(RedisOccupancyStore.INCREMENT_OR_INITIALIZE), eq(List.of("ParkingLot:lot1")), eq("30")))
                .thenReturn(31L);

        assertThat(store.increment("lot1", 30)).isEqualTo(31L);
        verifyNoInteractions(valueOperations);
    }
}
