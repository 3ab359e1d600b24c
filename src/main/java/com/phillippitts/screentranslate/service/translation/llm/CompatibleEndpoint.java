package com.phillippitts.screentranslate.service.translation.llm;

import java.util.Objects;

/**
 * User-defined OpenAI-compatible endpoint.
 *
 * @param displayName name shown to users
 * @param baseUrl API root, e.g. {@code http://localhost:1234/v1}
 * @param modelName model to request
 * @param requiresApiKey whether a bearer token must be configured
 */
public record CompatibleEndpoint(String displayName, String baseUrl, String modelName, boolean requiresApiKey) {

    public static final String ID_PREFIX = "custom:";
    public static final String DEFAULT_BASE_URL = "http://localhost:8000/v1";
    public static final String DEFAULT_MODEL = "default";

    public CompatibleEndpoint {
        Objects.requireNonNull(displayName, "displayName");
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URL;
        }
        if (modelName == null || modelName.isBlank()) {
            modelName = DEFAULT_MODEL;
        }
    }

    /**
     * @return composite provider/credential id for the endpoint at {@code index}
     */
    public static String compositeId(int index) {
        return ID_PREFIX + index;
    }

    public static boolean isCompositeId(String engineId) {
        return engineId != null && engineId.startsWith(ID_PREFIX);
    }

    /**
     * @return endpoint index encoded in a composite id
     * @throws IllegalArgumentException if the id is not of the form {@code custom:<index>}
     */
    public static int indexOf(String compositeId) {
        if (!isCompositeId(compositeId)) {
            throw new IllegalArgumentException("Not a custom engine id: " + compositeId);
        }
        try {
            return Integer.parseInt(compositeId.substring(ID_PREFIX.length()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed custom engine id: " + compositeId, e);
        }
    }
}
