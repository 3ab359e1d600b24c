package com.phillippitts.screentranslate.domain;

import java.util.Map;
import java.util.Objects;

/**
 * Secret material for one provider. {@link #toString()} never reveals the values.
 *
 * @param apiKey API key or bearer token
 * @param appId application id for backends that sign requests with one, otherwise {@code null}
 * @param additional extra provider-specific secrets
 */
public record StoredCredentials(String apiKey, String appId, Map<String, String> additional) {

    public StoredCredentials {
        Objects.requireNonNull(apiKey, "apiKey");
        additional = additional == null ? Map.of() : Map.copyOf(additional);
    }

    public StoredCredentials(String apiKey) {
        this(apiKey, null, Map.of());
    }

    public StoredCredentials(String apiKey, String appId) {
        this(apiKey, appId, Map.of());
    }

    public boolean hasAppId() {
        return appId != null && !appId.isBlank();
    }

    @Override
    public String toString() {
        return "StoredCredentials[apiKey=****, appId=" + (hasAppId() ? "****" : "none")
                + ", additional=" + additional.keySet() + "]";
    }
}
