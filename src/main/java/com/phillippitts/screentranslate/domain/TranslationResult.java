package com.phillippitts.screentranslate.domain;

import java.util.Objects;

/**
 * Provider-neutral translation of a single string.
 *
 * @param sourceText text that was translated
 * @param translatedText translation
 * @param sourceLanguage source language code as requested or detected; {@code null} when unknown
 * @param targetLanguage target language code
 */
public record TranslationResult(String sourceText, String translatedText,
                                String sourceLanguage, String targetLanguage) {

    public TranslationResult {
        Objects.requireNonNull(sourceText, "sourceText");
        Objects.requireNonNull(translatedText, "translatedText");
        Objects.requireNonNull(targetLanguage, "targetLanguage");
    }
}
