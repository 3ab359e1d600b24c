package com.phillippitts.screentranslate.domain;

import java.util.Objects;

/**
 * Phase-scoped failure reported to the presentation layer.
 *
 * @param kind failure category
 * @param message short description, carrying the lower-level message where there was one
 * @param recoverySuggestion what the user can do about it, or {@code null}
 */
public record FlowError(Kind kind, String message, String recoverySuggestion) {

    public enum Kind {
        ANALYSIS_FAILURE,
        NO_TEXT_FOUND,
        TRANSLATION_FAILURE,
        RENDERING_FAILURE,
        CANCELLED
    }

    public FlowError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static FlowError analysisFailure(String detail) {
        return new FlowError(Kind.ANALYSIS_FAILURE, "Text analysis failed: " + detail,
                "Check the vision model configuration and try again.");
    }

    public static FlowError noTextFound() {
        return new FlowError(Kind.NO_TEXT_FOUND, "No text found in the selected area",
                "Try selecting an area that contains readable text.");
    }

    public static FlowError translationFailure(String detail, String suggestion) {
        return new FlowError(Kind.TRANSLATION_FAILURE, "Translation failed: " + detail,
                suggestion != null ? suggestion : "Check the translation engine settings or choose another engine.");
    }

    public static FlowError renderingFailure(String detail) {
        return new FlowError(Kind.RENDERING_FAILURE, "Failed to render overlay: " + detail,
                "Try again with a smaller selection.");
    }

    public static FlowError cancelled() {
        return new FlowError(Kind.CANCELLED, "Translation cancelled", null);
    }

    /**
     * @return {@code true} if the error should be shown to the user; cancellation is silent
     */
    public boolean isUserVisible() {
        return kind != Kind.CANCELLED;
    }
}
