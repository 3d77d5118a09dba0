package com.example.smartparkinggate.service.metrics;

import java.util.List;

/**
 * Monitoring backend that accepts batches of samples under a namespace.
 */
public interface MetricsSink {

    void push(String namespace, List<MetricSample> samples);
}
