package com.phillippitts.screentranslate.config.properties;

import com.phillippitts.screentranslate.service.vision.VisionProviderType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the vision backend that extracts text from captured images.
 * Binds to properties prefixed with "vision".
 *
 * <p>Example application.properties:
 * <pre>
 * vision.provider=openai
 * vision.base-url=https://api.openai.com/v1
 * vision.model-name=gpt-4o
 * vision.timeout-seconds=60
 * vision.max-continuations=3
 * vision.jpeg-quality=0.85
 * vision.minimum-confidence=0.0
 * </pre>
 *
 * @param provider vision backend family
 * @param baseUrl API root; blank for the provider default
 * @param modelName model identifier; blank for the provider default
 * @param timeoutSeconds per-request timeout
 * @param maxTokens completion token limit per request
 * @param maxContinuations how many times a length-truncated reply may be continued
 * @param jpegQuality JPEG quality used when uploading the image
 * @param minimumConfidence segments below this confidence are discarded
 */
@ConfigurationProperties(prefix = "vision")
@Validated
public record VisionProperties(
        @NotNull(message = "Vision provider must be set")
        @DefaultValue("openai")
        VisionProviderType provider,

        String baseUrl,

        String modelName,

        @Positive(message = "Vision timeout must be positive")
        @DefaultValue("60")
        int timeoutSeconds,

        @Positive(message = "Vision max tokens must be positive")
        @DefaultValue("8192")
        int maxTokens,

        @PositiveOrZero(message = "Max continuations must not be negative")
        @DefaultValue("3")
        int maxContinuations,

        @DecimalMin(value = "0.1", message = "JPEG quality must be at least 0.1")
        @DecimalMax(value = "1.0", message = "JPEG quality must be at most 1.0")
        @DefaultValue("0.85")
        float jpegQuality,

        @DecimalMin(value = "0.0", message = "Minimum confidence must be within [0, 1]")
        @DecimalMax(value = "1.0", message = "Minimum confidence must be within [0, 1]")
        @DefaultValue("0.0")
        double minimumConfidence
) {
    public String baseUrlOrDefault() {
        return (baseUrl == null || baseUrl.isBlank()) ? provider.defaultBaseUrl() : baseUrl;
    }

    public String modelNameOrDefault() {
        return (modelName == null || modelName.isBlank()) ? provider.defaultModel() : modelName;
    }
}
