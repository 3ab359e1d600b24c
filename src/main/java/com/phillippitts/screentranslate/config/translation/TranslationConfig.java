package com.phillippitts.screentranslate.config.translation;

import com.phillippitts.screentranslate.config.properties.TranslationProperties;
import com.phillippitts.screentranslate.service.credentials.CredentialStore;
import com.phillippitts.screentranslate.service.orchestration.TranslationMetricsPublisher;
import com.phillippitts.screentranslate.service.orchestration.TranslationOrchestrator;
import com.phillippitts.screentranslate.service.translation.ProviderRegistry;
import com.phillippitts.screentranslate.service.translation.local.GlossaryTranslationEngine;
import com.phillippitts.screentranslate.service.translation.local.OfflineTranslationEngine;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the provider registry and the translation orchestrator. The registry is the only
 * owner of provider instances; everything else looks providers up through it.
 */
@Configuration
public class TranslationConfig {

    private final TranslationProperties translationProperties;
    private final CredentialStore credentialStore;

    public TranslationConfig(TranslationProperties translationProperties, CredentialStore credentialStore) {
        this.translationProperties = translationProperties;
        this.credentialStore = credentialStore;
    }

    @Bean
    public OfflineTranslationEngine offlineTranslationEngine() {
        return new GlossaryTranslationEngine();
    }

    @Bean
    public ProviderRegistry providerRegistry(RestTemplateBuilder restTemplateBuilder,
                                             OfflineTranslationEngine offlineTranslationEngine) {
        return new ProviderRegistry(credentialStore, restTemplateBuilder, offlineTranslationEngine,
                translationProperties.selfHostedConfig());
    }

    @Bean
    public TranslationOrchestrator translationOrchestrator(ProviderRegistry providerRegistry,
                                                           ApplicationEventPublisher publisher,
                                                           TranslationMetricsPublisher metricsPublisher,
                                                           @Qualifier("translationExecutor") Executor translationExecutor) {
        return new TranslationOrchestrator(providerRegistry, translationProperties, publisher, metricsPublisher,
                translationExecutor);
    }
}
