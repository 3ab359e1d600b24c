package com.phillippitts.screentranslate.config.properties;

import com.phillippitts.screentranslate.domain.ProviderConfig;
import com.phillippitts.screentranslate.service.orchestration.EngineSelectionMode;
import com.phillippitts.screentranslate.service.orchestration.SceneEngineBinding;
import com.phillippitts.screentranslate.service.orchestration.TranslationScene;
import com.phillippitts.screentranslate.service.translation.EngineType;
import com.phillippitts.screentranslate.service.translation.llm.CompatibleEndpoint;
import com.phillippitts.screentranslate.service.translation.selfhosted.SelfHostedTranslationProvider;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translation engine selection and per-engine settings.
 *
 * <p>Example application.properties:
 * <pre>
 * translation.preferred-engine=self-hosted
 * translation.fallback-engine=local
 * translation.selection-mode=scene-binding
 * translation.parallel-engines=deepl,openai
 * translation.scenes.text-selection.primary-engine=openai
 * translation.scenes.text-selection.fallback-enabled=false
 * translation.scenes.text-selection.prompt-template=Translate to {target_language}: {text}
 * translation.target-language=zh-Hans
 * translation.engines.openai.model-name=gpt-4o-mini
 * translation.engines.openai.timeout-seconds=30
 * translation.engines.openai.prompt-template=Translate to {target_language}: {text}
 * translation.self-hosted.host=localhost
 * translation.self-hosted.port=8989
 * translation.compatible[0].display-name=LM Studio
 * translation.compatible[0].base-url=http://localhost:1234/v1
 * </pre>
 *
 * <p>Engine ids are built-in ids ({@code openai}, {@code local}) or {@code custom:<index>} for
 * an entry of {@code translation.compatible}.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "translation")
public class TranslationProperties {

    @NotBlank(message = "Preferred engine must not be blank")
    private String preferredEngine = EngineType.SELF_HOSTED.id();

    private String fallbackEngine = EngineType.LOCAL.id();

    @NotNull(message = "Selection mode must not be null")
    private EngineSelectionMode selectionMode = EngineSelectionMode.PRIMARY_WITH_FALLBACK;

    private List<String> parallelEngines = new ArrayList<>();

    @Positive(message = "Parallel timeout must be positive")
    private int parallelTimeoutSeconds = 60;

    private Map<String, Scene> scenes = new HashMap<>();

    private String sourceLanguage = "auto";

    @NotBlank(message = "Target language must not be blank")
    private String targetLanguage = "zh-Hans";

    private Map<String, EngineSettings> engines = new HashMap<>();
    @Valid
    private SelfHosted selfHosted = new SelfHosted();
    private List<Compatible> compatible = new ArrayList<>();

    public String preferredEngineId() {
        return preferredEngine.trim();
    }

    /**
     * @return configured fallback engine id, empty when unset or equal to the preferred engine
     */
    public Optional<String> fallbackEngineId() {
        if (fallbackEngine == null || fallbackEngine.isBlank()
                || fallbackEngine.trim().equalsIgnoreCase(preferredEngineId())) {
            return Optional.empty();
        }
        return Optional.of(fallbackEngine.trim());
    }

    /**
     * Engines run by {@link EngineSelectionMode#PARALLEL}, in order. Falls back to the
     * preferred engine alone when none are listed.
     */
    public List<String> parallelEngineIds() {
        List<String> ids = parallelEngines.stream()
                .filter(id -> id != null && !id.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
        return ids.isEmpty() ? List.of(preferredEngineId()) : ids;
    }

    /**
     * Resolves the binding for a scene. Unset scene values inherit the preferred engine, the
     * configured fallback and the engine's own prompt.
     */
    public SceneEngineBinding bindingFor(TranslationScene scene) {
        Scene settings = scenes.get(scene.id());
        if (settings == null) {
            return new SceneEngineBinding(scene, preferredEngineId(), fallbackEngineId().orElse(null), true, null);
        }
        String primary = isBlank(settings.getPrimaryEngine()) ? preferredEngineId() : settings.getPrimaryEngine().trim();
        String fallback = isBlank(settings.getFallbackEngine())
                ? fallbackEngineId().orElse(null)
                : settings.getFallbackEngine().trim();
        return new SceneEngineBinding(scene, primary, fallback, settings.isFallbackEnabled(),
                settings.getPromptTemplate());
    }

    /**
     * @return source language, or {@code null} for auto-detect
     */
    public String sourceLanguageOrNull() {
        return (sourceLanguage == null || sourceLanguage.isBlank() || "auto".equalsIgnoreCase(sourceLanguage))
                ? null : sourceLanguage;
    }

    /**
     * Builds the immutable provider configuration for an engine.
     */
    public ProviderConfig configFor(EngineType type) {
        if (type == EngineType.SELF_HOSTED) {
            return selfHostedConfig();
        }
        EngineSettings settings = engines.getOrDefault(type.id(), new EngineSettings());
        String baseUrl = settings.getBaseUrl();
        String model = settings.getModelName();
        if (type == EngineType.CUSTOM && !compatible.isEmpty()) {
            CompatibleEndpoint first = compatibleEndpoints().get(0);
            baseUrl = baseUrl != null ? baseUrl : first.baseUrl();
            model = model != null ? model : first.modelName();
        }
        Duration timeout = settings.getTimeoutSeconds() != null
                ? Duration.ofSeconds(settings.getTimeoutSeconds())
                : type.defaultTimeout();
        return new ProviderConfig(baseUrl, model, timeout,
                settings.getTemperature() != null ? settings.getTemperature() : ProviderConfig.DEFAULT_TEMPERATURE,
                settings.getMaxTokens() != null ? settings.getMaxTokens() : ProviderConfig.DEFAULT_MAX_TOKENS,
                settings.getPromptTemplate());
    }

    public ProviderConfig selfHostedConfig() {
        return ProviderConfig.of(SelfHostedTranslationProvider.baseUrlFor(selfHosted.getHost(), selfHosted.getPort()), null)
                .withTimeout(Duration.ofSeconds(selfHosted.getTimeoutSeconds()));
    }

    public List<CompatibleEndpoint> compatibleEndpoints() {
        return compatible.stream()
                .map(c -> new CompatibleEndpoint(
                        c.getDisplayName() != null ? c.getDisplayName() : EngineType.CUSTOM.displayName(),
                        c.getBaseUrl(), c.getModelName(), c.isRequiresApiKey()))
                .toList();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getPreferredEngine() {
        return preferredEngine;
    }

    public void setPreferredEngine(String preferredEngine) {
        this.preferredEngine = preferredEngine;
    }

    public String getFallbackEngine() {
        return fallbackEngine;
    }

    public void setFallbackEngine(String fallbackEngine) {
        this.fallbackEngine = fallbackEngine;
    }

    public EngineSelectionMode getSelectionMode() {
        return selectionMode;
    }

    public void setSelectionMode(EngineSelectionMode selectionMode) {
        this.selectionMode = selectionMode;
    }

    public List<String> getParallelEngines() {
        return parallelEngines;
    }

    public void setParallelEngines(List<String> parallelEngines) {
        this.parallelEngines = parallelEngines;
    }

    public int getParallelTimeoutSeconds() {
        return parallelTimeoutSeconds;
    }

    public void setParallelTimeoutSeconds(int parallelTimeoutSeconds) {
        this.parallelTimeoutSeconds = parallelTimeoutSeconds;
    }

    public Map<String, Scene> getScenes() {
        return scenes;
    }

    public void setScenes(Map<String, Scene> scenes) {
        this.scenes = scenes;
    }

    public String getSourceLanguage() {
        return sourceLanguage;
    }

    public void setSourceLanguage(String sourceLanguage) {
        this.sourceLanguage = sourceLanguage;
    }

    public String getTargetLanguage() {
        return targetLanguage;
    }

    public void setTargetLanguage(String targetLanguage) {
        this.targetLanguage = targetLanguage;
    }

    public Map<String, EngineSettings> getEngines() {
        return engines;
    }

    public void setEngines(Map<String, EngineSettings> engines) {
        this.engines = engines;
    }

    public SelfHosted getSelfHosted() {
        return selfHosted;
    }

    public void setSelfHosted(SelfHosted selfHosted) {
        this.selfHosted = selfHosted;
    }

    public List<Compatible> getCompatible() {
        return compatible;
    }

    public void setCompatible(List<Compatible> compatible) {
        this.compatible = compatible;
    }

    /**
     * Optional overrides for one engine; unset values fall back to the engine's defaults.
     */
    public static class EngineSettings {
        private String baseUrl;
        private String modelName;
        private Integer timeoutSeconds;
        private Double temperature;
        private Integer maxTokens;
        private String promptTemplate;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }

        public Integer getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(Integer timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public Double getTemperature() {
            return temperature;
        }

        public void setTemperature(Double temperature) {
            this.temperature = temperature;
        }

        public Integer getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
        }

        public String getPromptTemplate() {
            return promptTemplate;
        }

        public void setPromptTemplate(String promptTemplate) {
            this.promptTemplate = promptTemplate;
        }
    }

    /**
     * Self-hosted translation server location.
     */
    public static class SelfHosted {
        private String host = "localhost";

        @Positive(message = "Self-hosted port must be positive")
        private int port = 8989;

        @Positive(message = "Self-hosted timeout must be positive")
        private int timeoutSeconds = 10;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    /**
     * One OpenAI-compatible endpoint.
     */
    public static class Compatible {
        private String displayName;
        private String baseUrl;
        private String modelName;
        private boolean requiresApiKey;

        public String getDisplayName() {
            return displayName;
        }

        public void setDisplayName(String displayName) {
            this.displayName = displayName;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }

        public boolean isRequiresApiKey() {
            return requiresApiKey;
        }

        public void setRequiresApiKey(boolean requiresApiKey) {
            this.requiresApiKey = requiresApiKey;
        }
    }

    /**
     * Engine binding for one scene, keyed by scene id ({@code screenshot}, {@code text-selection},
     * {@code translate-and-insert}).
     */
    public static class Scene {
        private String primaryEngine;
        private String fallbackEngine;
        private boolean fallbackEnabled = true;
        private String promptTemplate;

        public String getPrimaryEngine() {
            return primaryEngine;
        }

        public void setPrimaryEngine(String primaryEngine) {
            this.primaryEngine = primaryEngine;
        }

        public String getFallbackEngine() {
            return fallbackEngine;
        }

        public void setFallbackEngine(String fallbackEngine) {
            this.fallbackEngine = fallbackEngine;
        }

        public boolean isFallbackEnabled() {
            return fallbackEnabled;
        }

        public void setFallbackEnabled(boolean fallbackEnabled) {
            this.fallbackEnabled = fallbackEnabled;
        }

        public String getPromptTemplate() {
            return promptTemplate;
        }

        public void setPromptTemplate(String promptTemplate) {
            this.promptTemplate = promptTemplate;
        }
    }
}
