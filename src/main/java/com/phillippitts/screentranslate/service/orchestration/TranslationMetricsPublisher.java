package com.phillippitts.screentranslate.service.orchestration;

import com.phillippitts.screentranslate.service.metrics.TranslationMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Null-safe facade over {@link TranslationMetrics} for the orchestrator and flow controller.
 *
 * <p>{@link #NOOP} lets both run without a meter registry in tests.
 */
@Component
public final class TranslationMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(TranslationMetricsPublisher.class);

    /**
     * No-op instance for tests; never throws and records nothing.
     */
    public static final TranslationMetricsPublisher NOOP = new TranslationMetricsPublisher(null);

    private final TranslationMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public TranslationMetricsPublisher(TranslationMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("TranslationMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordSuccess(String engineId, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(engineId, durationNanos);
        metrics.incrementSuccess(engineId);
    }

    /**
     * @param engineId engine that failed
     * @param kind failure kind; recorded lower-case
     */
    public void recordFailure(String engineId, Enum<?> kind) {
        if (metrics == null) {
            return;
        }
        metrics.incrementFailure(engineId, kind.name().toLowerCase(Locale.ROOT));
    }

    public void recordFallback(String fromEngine, String toEngine) {
        if (metrics == null) {
            return;
        }
        metrics.incrementFallback(fromEngine, toEngine);
    }

    public void recordFlowOutcome(String outcome) {
        if (metrics == null) {
            return;
        }
        metrics.incrementFlowOutcome(outcome.toLowerCase(Locale.ROOT));
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
