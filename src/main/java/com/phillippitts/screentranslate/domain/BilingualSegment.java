package com.phillippitts.screentranslate.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * A recognised segment paired with its translation.
 *
 * @param original the segment as extracted from the image
 * @param translatedText translated text
 * @param sourceLanguage resolved source language code, or {@code null} if the backend did not report one
 * @param targetLanguage target language code
 */
public record BilingualSegment(TextSegment original, String translatedText,
                               String sourceLanguage, String targetLanguage) {

    public BilingualSegment {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(translatedText, "translatedText");
        Objects.requireNonNull(targetLanguage, "targetLanguage");
    }

    public UUID id() {
        return original.id();
    }

    public String originalText() {
        return original.text();
    }

    public BoundingBox boundingBox() {
        return original.boundingBox();
    }
}
