package com.example.smartparkinggate.service;

import com.example.smartparkinggate.config.ParkingProperties;
import com.example.smartparkinggate.exception.MetricsPushException;
import com.example.smartparkinggate.model.GateAction;
import com.example.smartparkinggate.model.GateDecision;
import com.example.smartparkinggate.model.GateMessage;
import com.example.smartparkinggate.model.ParkingSession;
import com.example.smartparkinggate.model.RecognizedPlate;
import com.example.smartparkinggate.service.image.ImageStore;
import com.example.smartparkinggate.service.metrics.MetricsEmitter;
import com.example.smartparkinggate.service.store.OccupancyStore;
import com.example.smartparkinggate.service.store.SessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EntryHandlerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T08:15:30Z");

    @Mock
    private OccupancyStore occupancyStore;

    @Mock
    private SessionStore sessionStore;

    @Mock
    private ImageStore imageStore;

    @Mock
    private MetricsEmitter metricsEmitter;

    private EntryHandler handler;

    @BeforeEach
    void setUp() {
        ParkingProperties properties = new ParkingProperties();
        handler = new EntryHandler(occupancyStore, sessionStore, imageStore, metricsEmitter, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void opensGateAndRecordsSession() {
        when(occupancyStore.findAvailableSlots("lot1")).thenReturn(Optional.of(10L));
        when(occupancyStore.decrementIfAvailable("lot1")).thenReturn(OptionalLong.of(9));
        when(imageStore.urlFor("entry_1714551330.jpg")).thenReturn("https://bucket/entry_1714551330.jpg");
        when(metricsEmitter.emit(GateAction.ENTRY, 9, 0)).thenReturn(CollaboratorResult.done());

        GateDecision decision = handler.handle(new RecognizedPlate("WXY987"), "entry_1714551330.jpg");

        assertThat(decision).isEqualTo(GateDecision.ok(GateMessage.OPEN_GATE));
        ArgumentCaptor<ParkingSession> captor = ArgumentCaptor.forClass(ParkingSession.class);
        verify(sessionStore).save(captor.capture());
        assertThat(captor.getValue()).isEqualTo(new ParkingSession(
                "WXY987", NOW.getEpochSecond(), "2024-05-01 08:15:30", "ENTRY", "https://bucket/entry_1714551330.jpg"));
    }

    @Test
    void initializesMissingLotWithCapacity() {
        when(occupancyStore.findAvailableSlots("lot1")).thenReturn(Optional.empty());
        when(occupancyStore.initializeIfAbsent("lot1", 30)).thenReturn(true);
        when(occupancyStore.decrementIfAvailable("lot1")).thenReturn(OptionalLong.of(29));
        when(metricsEmitter.emit(GateAction.ENTRY, 29, 0)).thenReturn(CollaboratorResult.done());

        GateDecision decision = handler.handle(new RecognizedPlate("ABC123"), "entry_1.jpg");

        assertThat(decision.message()).isEqualTo(GateMessage.OPEN_GATE);
        verify(occupancyStore).initializeIfAbsent("lot1", 30);
    }

    @Test
    void fullLotRefusesEntryWithoutMutation() {
        when(occupancyStore.findAvailableSlots("lot1")).thenReturn(Optional.of(0L));

        GateDecision decision = handler.handle(new RecognizedPlate("ABC123"), "entry_1.jpg");

        assertThat(decision).isEqualTo(GateDecision.ok(GateMessage.FULL));
        verify(occupancyStore, never()).decrementIfAvailable(any());
        verifyNoInteractions(sessionStore, metricsEmitter);
    }

    @Test
    void fullCheckTakesPrecedenceOverUnknownPlate() {
        when(occupancyStore.findAvailableSlots("lot1")).thenReturn(Optional.of(0L));

        GateDecision decision = handler.handle(RecognizedPlate.unknown(), "entry_1.jpg");

        assertThat(decision.message()).isEqualTo(GateMessage.FULL);
    }

    @Test
    void unknownPlateIsDeniedWithoutSideEffects() {
        when(occupancyStore.findAvailableSlots("lot1")).thenReturn(Optional.of(4L));

        GateDecision decision = handler.handle(RecognizedPlate.unknown(), "entry_1.jpg");

        assertThat(decision).isEqualTo(GateDecision.ok(GateMessage.DENIED_NO_TEXT));
        verify(occupancyStore, never()).decrementIfAvailable(any());
        verifyNoInteractions(sessionStore, metricsEmitter);
    }

    @Test
    void lastSlotTakenConcurrentlyReportsFull() {
        when(occupancyStore.findAvailableSlots("lot1")).thenReturn(Optional.of(1L));
        when(occupancyStore.decrementIfAvailable("lot1")).thenReturn(OptionalLong.empty());

        GateDecision decision = handler.handle(new RecognizedPlate("ABC123"), "entry_1.jpg");

        assertThat(decision.message()).isEqualTo(GateMessage.FULL);
        verifyNoInteractions(sessionStore, metricsEmitter);
    }

    @Test
    void metricsFailureDoesNotAffectDecision() {
        when(occupancyStore.findAvailableSlots("lot1")).thenReturn(Optional.of(3L));
        when(occupancyStore.decrementIfAvailable("lot1")).thenReturn(OptionalLong.of(2));
        when(metricsEmitter.emit(any(), anyLong(), anyLong()))
                .thenReturn(CollaboratorResult.failure(new MetricsPushException("sink down")));

        GateDecision decision = handler.handle(new RecognizedPlate("ABC123"), "entry_1.jpg");

        assertThat(decision).isEqualTo(GateDecision.ok(GateMessage.OPEN_GATE));
    }

    @Test
    void failedSessionWriteReleasesReservedSlot() {
        when(occupancyStore.findAvailableSlots("lot1")).thenReturn(Optional.of(3L));
        when(occupancyStore.decrementIfAvailable("lot1")).thenReturn(OptionalLong.of(2));
        doThrow(new QueryTimeoutException("redis timeout")).when(sessionStore).save(any());

        assertThatThrownBy(() -> handler.handle(new RecognizedPlate("ABC123"), "entry_1.jpg"))
                .isInstanceOf(QueryTimeoutException.class);
        verify(occupancyStore).increment("lot1", 30);
        verifyNoInteractions(metricsEmitter);
    }
}
