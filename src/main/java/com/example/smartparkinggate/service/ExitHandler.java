package com.example.smartparkinggate.service;

import com.example.smartparkinggate.config.ParkingProperties;
import com.example.smartparkinggate.exception.DurationLookupException;
import com.example.smartparkinggate.model.GateAction;
import com.example.smartparkinggate.model.GateDecision;
import com.example.smartparkinggate.model.GateMessage;
import com.example.smartparkinggate.model.ParkingSession;
import com.example.smartparkinggate.model.RecognizedPlate;
import com.example.smartparkinggate.service.metrics.MetricsEmitter;
import com.example.smartparkinggate.service.store.OccupancyStore;
import com.example.smartparkinggate.service.store.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

@Service
public class ExitHandler {

    private static final Logger log = LoggerFactory.getLogger(ExitHandler.class);

    private final OccupancyStore occupancyStore;
    private final SessionStore sessionStore;
    private final MetricsEmitter metricsEmitter;
    private final ParkingProperties properties;
    private final Clock clock;

    public ExitHandler(OccupancyStore occupancyStore,
                       SessionStore sessionStore,
                       MetricsEmitter metricsEmitter,
                       ParkingProperties properties,
                       Clock clock) {
        this.occupancyStore = occupancyStore;
        this.sessionStore = sessionStore;
        this.metricsEmitter = metricsEmitter;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Releases a slot and records how long the vehicle stayed. The gate always
     * opens on exit, whether or not a matching entry exists.
     */
    public GateDecision handle(RecognizedPlate plate) {
        String lotId = properties.getLotId();
        long slots = occupancyStore.increment(lotId, properties.getMaxSpots());
        if (slots > properties.getMaxSpots()) {
            log.warn("Lot {} reports {} free slots, above capacity {}", lotId, slots, properties.getMaxSpots());
        }

        long durationMinutes = 0;
        if (!plate.isUnknown()) {
            durationMinutes = lookupDuration(plate.text())
                    .orElse(0L, error -> log.warn("Duration calculation failed: {}", error.getMessage()));
        }

        metricsEmitter.emit(GateAction.EXIT, slots, durationMinutes)
                .error()
                .ifPresent(error -> log.warn("Metrics push failed: {}", error.getMessage()));

        return GateDecision.ok(GateMessage.EXIT_SUCCESS);
    }

    CollaboratorResult<Long> lookupDuration(String plate) {
        Optional<ParkingSession> session;
        try {
            session = sessionStore.findByPlate(plate);
        } catch (RuntimeException ex) {
            return CollaboratorResult.failure(
                    new DurationLookupException("Entry record lookup failed for " + plate + ": " + ex.getMessage(), ex));
        }
        if (session.isEmpty()) {
            log.info("No entry record for {}", plate);
            return CollaboratorResult.success(0L);
        }
        long minutes = durationMinutes(session.get().entryEpoch(), clock.instant().getEpochSecond());
        log.info("Car {} stayed for {} minutes.", plate, minutes);
        return CollaboratorResult.success(minutes);
    }

    /**
     * Whole minutes between entry and exit; a span that is negative because of
     * clock skew counts as zero.
     */
    static long durationMinutes(long entryEpoch, long exitEpoch) {
        return Math.max(0L, exitEpoch - entryEpoch) / 60;
    }
}
