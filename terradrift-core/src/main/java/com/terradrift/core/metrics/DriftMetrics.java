package com.terradrift.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Objects;

/**
 * Micrometer meters for drift detection.
 *
 * <p>Naming: {@code terradrift_{subsystem}_{metric}_{unit}}.
 * <ul>
 *   <li>{@code terradrift_aws_api_calls_total{api,status}}</li>
 *   <li>{@code terradrift_aws_api_latency_seconds{api}}</li>
 *   <li>{@code terradrift_drift_checks_total}</li>
 *   <li>{@code terradrift_drift_check_latency_seconds}</li>
 *   <li>{@code terradrift_drift_detected_total{attribute}}</li>
 * </ul>
 */
public class DriftMetrics {

    public static final String AWS_API_CALLS = "terradrift_aws_api_calls_total";
    public static final String AWS_API_LATENCY = "terradrift_aws_api_latency_seconds";
    public static final String DRIFT_CHECKS = "terradrift_drift_checks_total";
    public static final String DRIFT_CHECK_LATENCY = "terradrift_drift_check_latency_seconds";
    public static final String DRIFT_DETECTED = "terradrift_drift_detected_total";

    private final MeterRegistry registry;
    private final Counter driftChecksTotal;
    private final Timer driftCheckLatency;

    public DriftMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");

        driftChecksTotal = Counter.builder(DRIFT_CHECKS)
            .description("Total number of drift checks performed")
            .register(registry);

        driftCheckLatency = Timer.builder(DRIFT_CHECK_LATENCY)
            .description("Latency of drift checks")
            .register(registry);
    }

    /**
     * Metrics backed by a private in-memory registry.
     *
     * @return metrics that record but are not exported
     */
    public static DriftMetrics inMemory() {
        return new DriftMetrics(new SimpleMeterRegistry());
    }

    /**
     * Records one AWS API call.
     *
     * @param api API name, e.g. "DescribeInstances"
     * @param success whether the call succeeded
     * @param latency call latency including retries
     */
    public void recordAwsApiCall(String api, boolean success, Duration latency) {
        Counter.builder(AWS_API_CALLS)
            .description("Total number of AWS API calls")
            .tag("api", api)
            .tag("status", success ? "success" : "error")
            .register(registry)
            .increment();

        Timer.builder(AWS_API_LATENCY)
            .description("Latency of AWS API calls")
            .tag("api", api)
            .register(registry)
            .record(latency);
    }

    /**
     * Records one completed resource comparison.
     *
     * @param latency comparison latency including fetch and parse
     */
    public void recordDriftCheck(Duration latency) {
        driftChecksTotal.increment();
        driftCheckLatency.record(latency);
    }

    /**
     * Records one drifted attribute.
     *
     * @param attribute attribute expression
     */
    public void recordDriftDetected(String attribute) {
        Counter.builder(DRIFT_DETECTED)
            .description("Total number of drifts detected")
            .tag("attribute", attribute)
            .register(registry)
            .increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
