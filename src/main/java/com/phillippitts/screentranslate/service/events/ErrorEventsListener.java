package com.phillippitts.screentranslate.service.events;

import com.phillippitts.screentranslate.service.orchestration.event.FlowFailedEvent;
import com.phillippitts.screentranslate.service.orchestration.event.ProviderFallbackEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onFlowFailed(FlowFailedEvent e) {
        String key = "flow-" + e.error().kind();
        if (shouldLog(key)) {
            String suggestion = e.error().recoverySuggestion();
            LOG.warn("Translation flow failed: {}{}", e.error().message(),
                    suggestion != null ? ". " + suggestion : "");
        }
    }

    @EventListener
    void onProviderFallback(ProviderFallbackEvent e) {
        String key = "fallback-" + e.fromEngine() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Engine {} failed ({}); using fallback {}. Check translation.* settings and credentials.",
                    e.fromEngine(), e.reason(), e.toEngine());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
