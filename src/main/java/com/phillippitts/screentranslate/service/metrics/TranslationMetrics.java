package com.phillippitts.screentranslate.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for translation and flow operations.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Translation latency per engine</li>
 *   <li>Success/failure rates per engine, failures tagged by error kind</li>
 *   <li>Provider fallback counts</li>
 *   <li>Flow outcomes (completed, failed phase, cancelled)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class TranslationMetrics {

    private static final String METRIC_PREFIX = "screentranslate.translation";
    private static final String FLOW_PREFIX = "screentranslate.flow";

    private final MeterRegistry registry;

    public TranslationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records translation latency for a specific engine.
     *
     * @param engineId engine identifier (local, openai, custom:0, ...)
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String engineId, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to translate a batch of segments")
                .tag("engine", engineId)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String engineId) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful translation calls")
                .tag("engine", engineId)
                .register(registry)
                .increment();
    }

    /**
     * @param engineId engine identifier
     * @param reason failure category (invalid_configuration, rate_limited, ...)
     */
    public void incrementFailure(String engineId, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed translation calls")
                .tag("engine", engineId)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementFallback(String fromEngine, String toEngine) {
        Counter.builder(METRIC_PREFIX + ".fallback")
                .description("Number of times a fallback engine replaced the preferred engine")
                .tag("from", fromEngine)
                .tag("to", toEngine)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome completed, or the lower-cased failure kind
     */
    public void incrementFlowOutcome(String outcome) {
        Counter.builder(FLOW_PREFIX + ".outcome")
                .description("Number of finished flows by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
