package com.example.smartparkinggate.service.store;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Slot counter of a lot. All mutations are atomic deltas against the stored
 * value so that concurrent entries and exits never lose an update.
 */
public interface OccupancyStore {

    Optional<Long> findAvailableSlots(String lotId);

    /**
     * Creates the counter with {@code initialSlots} unless it already exists.
     *
     * @return {@code true} when this call created the counter
     */
    boolean initializeIfAbsent(String lotId, long initialSlots);

    /**
     * Takes one slot if at least one is free.
     *
     * @return the remaining slots, or empty when the lot was full or the counter missing
     */
    OptionalLong decrementIfAvailable(String lotId);

    /**
     * Releases one slot without any upper bound and returns the new value. A
     * missing counter is first created with {@code initialSlots}, in the same
     * atomic step.
     */
    long increment(String lotId, long initialSlots);
}
