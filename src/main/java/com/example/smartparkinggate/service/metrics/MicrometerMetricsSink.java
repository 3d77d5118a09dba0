package com.example.smartparkinggate.service.metrics;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes samples as Micrometer meters named {@code <namespace>.<name>}.
 * Aggregation across requests (daily totals, averages) is left to the
 * registry and whatever backend it exports to.
 */
@Component
public class MicrometerMetricsSink implements MetricsSink {

    private final MeterRegistry registry;
    private final Map<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsSink(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void push(String namespace, List<MetricSample> samples) {
        for (MetricSample sample : samples) {
            String meterName = namespace + "." + sample.name();
            String baseUnit = sample.unit().label().toLowerCase(Locale.ROOT);
            if (sample.kind() == MetricSample.Kind.GAUGE) {
                gauges.computeIfAbsent(meterName, this::registerGauge).set(Math.round(sample.value()));
            } else if (sample.kind() == MetricSample.Kind.COUNTER) {
                registry.counter(meterName).increment(sample.value());
            } else {
                DistributionSummary.builder(meterName)
                        .baseUnit(baseUnit)
                        .register(registry)
                        .record(sample.value());
            }
        }
    }

    private AtomicLong registerGauge(String meterName) {
        AtomicLong holder = new AtomicLong();
        registry.gauge(meterName, holder);
        return holder;
    }
}
