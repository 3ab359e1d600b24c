package com.phillippitts.screentranslate.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable per-provider settings captured when a provider is created.
 *
 * @param baseUrl endpoint root, or {@code null} for the provider's built-in default
 * @param modelName model identifier, or {@code null} for the provider's default
 * @param timeout per-request timeout
 * @param temperature sampling temperature for generative backends
 * @param maxTokens completion token limit for generative backends
 * @param promptTemplate custom prompt using {@code {source_language}}, {@code {target_language}}
 *                       and {@code {text}} placeholders; {@code null} for the built-in prompt
 */
public record ProviderConfig(String baseUrl, String modelName, Duration timeout,
                             double temperature, int maxTokens, String promptTemplate) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final double DEFAULT_TEMPERATURE = 0.3;
    public static final int DEFAULT_MAX_TOKENS = 2048;

    public ProviderConfig {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got " + maxTokens);
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be within [0, 2], got " + temperature);
        }
    }

    public static ProviderConfig defaults() {
        return new ProviderConfig(null, null, DEFAULT_TIMEOUT, DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS, null);
    }

    public static ProviderConfig of(String baseUrl, String modelName) {
        return new ProviderConfig(baseUrl, modelName, DEFAULT_TIMEOUT, DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS, null);
    }

    public ProviderConfig withTimeout(Duration newTimeout) {
        return new ProviderConfig(baseUrl, modelName, newTimeout, temperature, maxTokens, promptTemplate);
    }

    public ProviderConfig withPromptTemplate(String template) {
        return new ProviderConfig(baseUrl, modelName, timeout, temperature, maxTokens, template);
    }

    public String baseUrlOr(String fallback) {
        return (baseUrl == null || baseUrl.isBlank()) ? fallback : baseUrl;
    }

    public String modelNameOr(String fallback) {
        return (modelName == null || modelName.isBlank()) ? fallback : modelName;
    }

    public boolean hasCustomPrompt() {
        return promptTemplate != null && !promptTemplate.isBlank();
    }
}
