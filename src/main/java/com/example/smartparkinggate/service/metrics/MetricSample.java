package com.example.smartparkinggate.service.metrics;

import java.util.Objects;

/**
 * One named measurement of a batch.
 *
 * @param kind how the sink should aggregate repeated samples of this name
 */
public record MetricSample(String name, double value, Unit unit, Kind kind) {

    public MetricSample {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(kind, "kind");
    }

    public enum Unit {
        COUNT("Count"),
        MINUTES("Minutes");

        private final String label;

        Unit(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public enum Kind {
        /** Latest value wins. */
        GAUGE,
        /** Values add up. */
        COUNTER,
        /** Each value is one observation of a distribution. */
        SUMMARY
    }
}
