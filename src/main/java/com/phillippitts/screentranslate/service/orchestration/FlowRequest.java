package com.phillippitts.screentranslate.service.orchestration;

import com.phillippitts.screentranslate.service.rendering.OverlayStyle;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Input of one flow run.
 *
 * @param image captured image, treated as immutable
 * @param targetLanguage language to translate into
 * @param sourceLanguage source language, or {@code null} to auto-detect
 * @param preferredEngine id of the engine tried first ({@code openai}, {@code custom:0}), or {@code null}
 *        to use the configured selection
 * @param style overlay appearance
 */
public record FlowRequest(BufferedImage image, String targetLanguage, String sourceLanguage,
                          String preferredEngine, OverlayStyle style) {

    public FlowRequest {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(style, "style");
        if (targetLanguage == null || targetLanguage.isBlank()) {
            throw new IllegalArgumentException("targetLanguage must not be blank");
        }
        if (sourceLanguage != null && (sourceLanguage.isBlank() || "auto".equalsIgnoreCase(sourceLanguage))) {
            sourceLanguage = null;
        }
        if (preferredEngine != null) {
            preferredEngine = preferredEngine.isBlank() ? null : preferredEngine.trim();
        }
    }
}
