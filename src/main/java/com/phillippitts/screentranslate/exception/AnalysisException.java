package com.phillippitts.screentranslate.exception;

import java.util.Objects;

/**
 * Thrown when a vision backend cannot turn a captured image into text segments.
 */
public class AnalysisException extends ScreenTranslateException {

    public enum Kind {
        INVALID_CONFIGURATION,
        AUTHENTICATION,
        NETWORK,
        RATE_LIMITED,
        MODEL_UNAVAILABLE,
        INVALID_RESPONSE,
        IMAGE_ENCODING,
        PARSING
    }

    private final Kind kind;
    private final String providerId;

    public AnalysisException(Kind kind, String providerId, String message) {
        this(kind, providerId, message, null);
    }

    public AnalysisException(Kind kind, String providerId, String message, Throwable cause) {
        super(message + " (vision: " + (providerId != null ? providerId : "unknown") + ")", cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.providerId = providerId != null ? providerId : "unknown";
    }

    public Kind getKind() {
        return kind;
    }

    public String getProviderId() {
        return providerId;
    }
}
