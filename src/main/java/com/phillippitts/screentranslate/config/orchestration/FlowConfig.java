package com.phillippitts.screentranslate.config.orchestration;

import com.phillippitts.screentranslate.config.properties.OverlayProperties;
import com.phillippitts.screentranslate.config.properties.TranslationProperties;
import com.phillippitts.screentranslate.service.orchestration.FlowController;
import com.phillippitts.screentranslate.service.orchestration.TranslationMetricsPublisher;
import com.phillippitts.screentranslate.service.orchestration.TranslationOrchestrator;
import com.phillippitts.screentranslate.service.rendering.OverlayRenderer;
import com.phillippitts.screentranslate.service.vision.TextExtractionEngine;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the flow controller explicitly, on the dedicated flow executor.
 */
@Configuration
public class FlowConfig {

    private final ApplicationEventPublisher publisher;
    private final TranslationMetricsPublisher metricsPublisher;

    public FlowConfig(ApplicationEventPublisher publisher, TranslationMetricsPublisher metricsPublisher) {
        this.publisher = publisher;
        this.metricsPublisher = metricsPublisher;
    }

    @Bean
    public OverlayRenderer overlayRenderer() {
        return new OverlayRenderer();
    }

    @Bean
    public FlowController flowController(TextExtractionEngine textExtractionEngine,
                                         TranslationOrchestrator translationOrchestrator,
                                         OverlayRenderer overlayRenderer,
                                         @Qualifier("flowExecutor") Executor flowExecutor,
                                         TranslationProperties translationProperties,
                                         OverlayProperties overlayProperties) {
        return new FlowController(textExtractionEngine, translationOrchestrator, overlayRenderer,
                flowExecutor, publisher, metricsPublisher, translationProperties, overlayProperties.toStyle());
    }
}
