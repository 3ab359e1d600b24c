package com.phillippitts.screentranslate.config.vision;

import com.phillippitts.screentranslate.config.properties.VisionProperties;
import com.phillippitts.screentranslate.service.credentials.CredentialStore;
import com.phillippitts.screentranslate.service.vision.ClaudeVisionProvider;
import com.phillippitts.screentranslate.service.vision.OllamaVisionProvider;
import com.phillippitts.screentranslate.service.vision.OpenAiVisionProvider;
import com.phillippitts.screentranslate.service.vision.TextExtractionEngine;
import com.phillippitts.screentranslate.service.vision.VisionProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Selects the vision backend named by {@code vision.provider}.
 */
@Configuration
public class VisionConfig {

    private static final Logger LOG = LogManager.getLogger(VisionConfig.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final VisionProperties visionProperties;

    public VisionConfig(VisionProperties visionProperties) {
        this.visionProperties = visionProperties;
    }

    @Bean
    public VisionProvider visionProvider(RestTemplateBuilder restTemplateBuilder, CredentialStore credentialStore) {
        RestTemplate restTemplate = restTemplateBuilder
                .setConnectTimeout(CONNECT_TIMEOUT)
                .setReadTimeout(Duration.ofSeconds(visionProperties.timeoutSeconds()))
                .build();
        VisionProvider provider = switch (visionProperties.provider()) {
            case OPENAI -> new OpenAiVisionProvider(restTemplate, visionProperties, credentialStore);
            case CLAUDE -> new ClaudeVisionProvider(restTemplate, visionProperties, credentialStore);
            case OLLAMA -> new OllamaVisionProvider(restTemplate, visionProperties, credentialStore);
        };
        LOG.info("Vision provider {} (model={}, baseUrl={})", provider.id(),
                visionProperties.modelNameOrDefault(), visionProperties.baseUrlOrDefault());
        return provider;
    }

    @Bean
    public TextExtractionEngine textExtractionEngine(VisionProvider visionProvider) {
        return new TextExtractionEngine(visionProvider, visionProperties.jpegQuality(),
                visionProperties.minimumConfidence());
    }
}
