package com.example.smartparkinggate.service.metrics;

import com.example.smartparkinggate.config.ParkingProperties;
import com.example.smartparkinggate.exception.MetricsPushException;
import com.example.smartparkinggate.model.GateAction;
import com.example.smartparkinggate.service.CollaboratorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class MetricsEmitter {

    private static final Logger log = LoggerFactory.getLogger(MetricsEmitter.class);

    public static final String AVAILABLE_SLOTS = "AvailableSlots";
    public static final String DAILY_CAR_COUNT = "DailyCarCount";
    public static final String PARKING_DURATION = "ParkingDuration";

    private final MetricsSink sink;
    private final ParkingProperties properties;

    public MetricsEmitter(MetricsSink sink, ParkingProperties properties) {
        this.sink = sink;
        this.properties = properties;
    }

    /**
     * Pushes the samples of one gate event. Never throws; a failed push is
     * returned as a {@link MetricsPushException}.
     */
    public CollaboratorResult<Void> emit(GateAction action, long slotsLeft, long durationMinutes) {
        List<MetricSample> samples = samplesFor(action, slotsLeft, durationMinutes);
        String namespace = properties.getMetrics().getNamespace();
        try {
            sink.push(namespace, samples);
            log.debug("Pushed {} samples to namespace {}", samples.size(), namespace);
            return CollaboratorResult.done();
        } catch (RuntimeException ex) {
            return CollaboratorResult.failure(new MetricsPushException("Metrics push failed: " + ex.getMessage(), ex));
        }
    }

    List<MetricSample> samplesFor(GateAction action, long slotsLeft, long durationMinutes) {
        List<MetricSample> samples = new ArrayList<>(2);
        samples.add(new MetricSample(AVAILABLE_SLOTS, slotsLeft, MetricSample.Unit.COUNT, MetricSample.Kind.GAUGE));
        if (action == GateAction.ENTRY) {
            samples.add(new MetricSample(DAILY_CAR_COUNT, 1, MetricSample.Unit.COUNT, MetricSample.Kind.COUNTER));
        } else if (action == GateAction.EXIT && durationMinutes > 0) {
            samples.add(new MetricSample(PARKING_DURATION, durationMinutes, MetricSample.Unit.MINUTES, MetricSample.Kind.SUMMARY));
        }
        return samples;
    }
}
