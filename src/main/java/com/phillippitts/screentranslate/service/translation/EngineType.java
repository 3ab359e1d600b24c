package com.phillippitts.screentranslate.service.translation;

import java.time.Duration;
import java.util.Arrays;

/**
 * Translation backends known to the {@link ProviderRegistry}.
 *
 * <p>The id doubles as the credential key and the configuration key under
 * {@code translation.engines.<id>}.
 */
public enum EngineType {
    LOCAL("local", "Local Offline", false, null, null, Duration.ofSeconds(10)),
    SELF_HOSTED("self-hosted", "Self-hosted Server", false, "http://127.0.0.1:8989", null, Duration.ofSeconds(10)),
    BAIDU("baidu", "Baidu Translate", true,
            "https://fanyi-api.baidu.com/api/trans/vip/translate", null, Duration.ofSeconds(30)),
    DEEPL("deepl", "DeepL", true, "https://api.deepl.com/v2/translate", null, Duration.ofSeconds(30)),
    GOOGLE("google", "Google Translate", true,
            "https://translation.googleapis.com/language/translate/v2", null, Duration.ofSeconds(30)),
    OPENAI("openai", "OpenAI", true, "https://api.openai.com/v1", "gpt-4o-mini", Duration.ofSeconds(30)),
    CLAUDE("claude", "Claude", true, "https://api.anthropic.com", "claude-sonnet-4-20250514", Duration.ofSeconds(30)),
    OLLAMA("ollama", "Ollama", false, "http://localhost:11434/v1", "llama3", Duration.ofSeconds(60)),
    CUSTOM("custom", "OpenAI Compatible", false, "http://localhost:8000/v1", "default", Duration.ofSeconds(60));

    private final String id;
    private final String displayName;
    private final boolean requiresApiKey;
    private final String defaultBaseUrl;
    private final String defaultModel;
    private final Duration defaultTimeout;

    EngineType(String id, String displayName, boolean requiresApiKey,
               String defaultBaseUrl, String defaultModel, Duration defaultTimeout) {
        this.id = id;
        this.displayName = displayName;
        this.requiresApiKey = requiresApiKey;
        this.defaultBaseUrl = defaultBaseUrl;
        this.defaultModel = defaultModel;
        this.defaultTimeout = defaultTimeout;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public boolean requiresApiKey() {
        return requiresApiKey;
    }

    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    /**
     * @return whether the engine is a generative model driven by a prompt template
     */
    public boolean isPromptDriven() {
        return defaultModel != null;
    }

    /**
     * Looks up a type by id or enum name, case-insensitively.
     *
     * @throws IllegalArgumentException if no type matches
     */
    public static EngineType fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Engine id must not be blank");
        }
        String v = value.trim();
        return Arrays.stream(values())
                .filter(t -> t.id.equalsIgnoreCase(v) || t.name().equalsIgnoreCase(v.replace('-', '_')))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown translation engine: " + value
                        + " (expected one of " + Arrays.toString(Arrays.stream(values()).map(EngineType::id).toArray())
                        + ")"));
    }

    @Override
    public String toString() {
        return id;
    }
}
