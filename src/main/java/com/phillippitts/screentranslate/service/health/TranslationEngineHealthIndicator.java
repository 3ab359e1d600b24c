package com.phillippitts.screentranslate.service.health;

import com.phillippitts.screentranslate.config.properties.TranslationProperties;
import com.phillippitts.screentranslate.service.translation.EngineType;
import com.phillippitts.screentranslate.service.translation.ProviderRegistry;
import com.phillippitts.screentranslate.service.translation.TranslationProvider;
import com.phillippitts.screentranslate.service.translation.llm.CompatibleEndpoint;
import com.phillippitts.screentranslate.service.vision.TextExtractionEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health indicator for the translation pipeline.
 *
 * <ul>
 *   <li>UP: the preferred engine is available and the vision provider is configured</li>
 *   <li>DEGRADED: some engine is available, but not the preferred one, or vision lacks credentials</li>
 *   <li>DOWN: no translation engine is available</li>
 * </ul>
 *
 * <p>Only registered engines are probed; nothing is created here. Exposed via /actuator/health.
 */
@Component
public class TranslationEngineHealthIndicator implements HealthIndicator {

    private final ProviderRegistry registry;
    private final TranslationProperties properties;
    private final TextExtractionEngine extractionEngine;

    public TranslationEngineHealthIndicator(ProviderRegistry registry,
                                            TranslationProperties properties,
                                            TextExtractionEngine extractionEngine) {
        this.registry = registry;
        this.properties = properties;
        this.extractionEngine = extractionEngine;
    }

    @Override
    public Health health() {
        List<EngineType> available = registry.availableEngines();
        String preferred = properties.preferredEngineId();
        boolean preferredReady = isReady(preferred, available);
        boolean visionReady = extractionEngine.isConfigured();

        Health.Builder builder = new Health.Builder();
        if (preferredReady && visionReady) {
            builder.up().withDetail("status", "Translation pipeline operational");
        } else if (!available.isEmpty() || preferredReady) {
            builder.status("DEGRADED").withDetail("status", visionReady
                    ? "Preferred engine unavailable"
                    : "Vision provider not configured");
        } else {
            builder.down().withDetail("status", "No translation engines available");
        }

        return builder
                .withDetail("preferredEngine", preferred)
                .withDetail("availableEngines", available.stream().map(EngineType::id).toList())
                .withDetail("vision", extractionEngine.providerId() + (visionReady ? " (ready)" : " (not configured)"))
                .build();
    }

    private boolean isReady(String engineId, List<EngineType> available) {
        if (CompatibleEndpoint.isCompositeId(engineId)) {
            return registry.compatibleProvider(engineId).map(TranslationProvider::isAvailable)
                    .orElseGet(() -> isConfiguredEndpoint(engineId));
        }
        EngineType type = EngineType.fromId(engineId);
        return available.contains(type)
                || (!registry.registeredEngines().contains(type) && registry.isEngineConfigured(type));
    }

    private boolean isConfiguredEndpoint(String compositeId) {
        try {
            int index = CompatibleEndpoint.indexOf(compositeId);
            return index >= 0 && index < properties.compatibleEndpoints().size();
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
