package com.phillippitts.screentranslate.exception;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Thrown when a translation backend cannot produce a translation.
 *
 * <p>The {@link Kind} is the only thing callers should branch on; the message is diagnostic
 * detail. The message always ends with {@code (engine: <id>)} so log lines identify the backend.
 */
public class TranslationProviderException extends ScreenTranslateException {

    /**
     * Provider failure categories.
     */
    public enum Kind {
        EMPTY_INPUT("Enter some text to translate."),
        INVALID_CONFIGURATION("Check the engine settings and configure an API key."),
        CONNECTION_FAILED("Check your network connection or that the translation server is running."),
        TRANSLATION_FAILED("Try again or choose another translation engine."),
        RATE_LIMITED("Wait a moment before translating again."),
        NOT_AVAILABLE("Select a different translation engine.");

        private final String recoverySuggestion;

        Kind(String recoverySuggestion) {
            this.recoverySuggestion = recoverySuggestion;
        }

        public String recoverySuggestion() {
            return recoverySuggestion;
        }
    }

    private final Kind kind;
    private final String engineId;
    private final String reason;
    private final Duration retryAfter;

    public TranslationProviderException(Kind kind, String engineId, String reason,
                                        Duration retryAfter, Throwable cause) {
        super(reason + " (engine: " + (engineId != null ? engineId : "unknown") + ")", cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.engineId = engineId != null ? engineId : "unknown";
        this.reason = reason;
        this.retryAfter = retryAfter;
    }

    public static TranslationProviderException emptyInput(String engineId) {
        return new TranslationProviderException(Kind.EMPTY_INPUT, engineId,
                "Cannot translate empty text.", null, null);
    }

    public static TranslationProviderException invalidConfiguration(String engineId, String reason) {
        return new TranslationProviderException(Kind.INVALID_CONFIGURATION, engineId,
                "Invalid configuration: " + reason, null, null);
    }

    public static TranslationProviderException connectionFailed(String engineId, String reason, Throwable cause) {
        return new TranslationProviderException(Kind.CONNECTION_FAILED, engineId,
                "Connection failed: " + reason, null, cause);
    }

    public static TranslationProviderException translationFailed(String engineId, String reason) {
        return translationFailed(engineId, reason, null);
    }

    public static TranslationProviderException translationFailed(String engineId, String reason, Throwable cause) {
        return new TranslationProviderException(Kind.TRANSLATION_FAILED, engineId,
                "Translation failed: " + reason, null, cause);
    }

    /**
     * @param retryAfter server-suggested wait, or {@code null} if none was given
     */
    public static TranslationProviderException rateLimited(String engineId, Duration retryAfter) {
        String reason = retryAfter != null
                ? "Rate limited. Retry after " + retryAfter.toSeconds() + " seconds."
                : "Rate limited. Please try again later.";
        return new TranslationProviderException(Kind.RATE_LIMITED, engineId, reason, retryAfter, null);
    }

    public static TranslationProviderException notAvailable(String engineId) {
        return new TranslationProviderException(Kind.NOT_AVAILABLE, engineId,
                "Translation engine is not available", null, null);
    }

    public Kind getKind() {
        return kind;
    }

    public String getEngineId() {
        return engineId;
    }

    /**
     * @return the failure reason without the engine suffix
     */
    public String getReason() {
        return reason;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public String getRecoverySuggestion() {
        return kind.recoverySuggestion();
    }
}
