package com.example.smartparkinggate.service;

import com.example.smartparkinggate.config.ParkingProperties;
import com.example.smartparkinggate.model.GateAction;
import com.example.smartparkinggate.model.GateDecision;
import com.example.smartparkinggate.model.GateMessage;
import com.example.smartparkinggate.model.ParkingSession;
import com.example.smartparkinggate.model.RecognizedPlate;
import com.example.smartparkinggate.service.image.ImageStore;
import com.example.smartparkinggate.service.metrics.MetricsEmitter;
import com.example.smartparkinggate.service.store.OccupancyStore;
import com.example.smartparkinggate.service.store.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.OptionalLong;

@Service
public class EntryHandler {

    private static final Logger log = LoggerFactory.getLogger(EntryHandler.class);

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final OccupancyStore occupancyStore;
    private final SessionStore sessionStore;
    private final ImageStore imageStore;
    private final MetricsEmitter metricsEmitter;
    private final ParkingProperties properties;
    private final Clock clock;

    public EntryHandler(OccupancyStore occupancyStore,
                        SessionStore sessionStore,
                        ImageStore imageStore,
                        MetricsEmitter metricsEmitter,
                        ParkingProperties properties,
                        Clock clock) {
        this.occupancyStore = occupancyStore;
        this.sessionStore = sessionStore;
        this.imageStore = imageStore;
        this.metricsEmitter = metricsEmitter;
        this.properties = properties;
        this.clock = clock;
    }

    public GateDecision handle(RecognizedPlate plate, String imageKey) {
        String lotId = properties.getLotId();
        long slots = occupancyStore.findAvailableSlots(lotId).orElseGet(() -> initialize(lotId));

        if (slots <= 0) {
            log.info("Lot {} is full, keeping gate closed for {}", lotId, plate.text());
            return GateDecision.ok(GateMessage.FULL);
        }
        if (plate.isUnknown()) {
            log.info("No plate recognized, entry denied");
            return GateDecision.ok(GateMessage.DENIED_NO_TEXT);
        }

        OptionalLong remaining = occupancyStore.decrementIfAvailable(lotId);
        if (remaining.isEmpty()) {
            // another entry took the last slot after our read
            log.info("Lot {} filled up before {} could enter", lotId, plate.text());
            return GateDecision.ok(GateMessage.FULL);
        }

        Instant now = clock.instant();
        ParkingSession session = new ParkingSession(
                plate.text(),
                now.getEpochSecond(),
                TIMESTAMP_FORMAT.format(now.atZone(clock.getZone())),
                GateAction.ENTRY.name(),
                imageStore.urlFor(imageKey));
        try {
            sessionStore.save(session);
        } catch (RuntimeException ex) {
            // slot was taken but no session exists for it; give it back before failing
            occupancyStore.increment(lotId, properties.getMaxSpots());
            log.error("Session write for {} failed, released the reserved slot", plate.text());
            throw ex;
        }

        metricsEmitter.emit(GateAction.ENTRY, remaining.getAsLong(), 0)
                .error()
                .ifPresent(error -> log.warn("Metrics push failed: {}", error.getMessage()));

        log.info("Gate opened for {} ({} slots left)", plate.text(), remaining.getAsLong());
        return GateDecision.ok(GateMessage.OPEN_GATE);
    }

    private long initialize(String lotId) {
        long maxSpots = properties.getMaxSpots();
        if (occupancyStore.initializeIfAbsent(lotId, maxSpots)) {
            log.info("Initialized lot {} with {} slots", lotId, maxSpots);
            return maxSpots;
        }
        return occupancyStore.findAvailableSlots(lotId).orElse(maxSpots);
    }
}
