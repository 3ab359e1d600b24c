package com.phillippitts.screentranslate.service.vision;

/**
 * Supported vision backend families.
 */
public enum VisionProviderType {
    OPENAI("openai", "https://api.openai.com/v1", "gpt-4o", true),
    CLAUDE("claude", "https://api.anthropic.com", "claude-sonnet-4-20250514", true),
    OLLAMA("ollama", "http://localhost:11434", "llava", false);

    private final String id;
    private final String defaultBaseUrl;
    private final String defaultModel;
    private final boolean requiresApiKey;

    VisionProviderType(String id, String defaultBaseUrl, String defaultModel, boolean requiresApiKey) {
        this.id = id;
        this.defaultBaseUrl = defaultBaseUrl;
        this.defaultModel = defaultModel;
        this.requiresApiKey = requiresApiKey;
    }

    public String id() {
        return id;
    }

    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public boolean requiresApiKey() {
        return requiresApiKey;
    }
}
