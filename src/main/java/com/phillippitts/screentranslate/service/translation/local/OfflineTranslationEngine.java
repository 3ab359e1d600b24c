package com.phillippitts.screentranslate.service.translation.local;

import java.util.List;
import java.util.Optional;

/**
 * In-process translation engine that needs no network and no credentials.
 */
public interface OfflineTranslationEngine {

    /**
     * Translation produced by the engine.
     *
     * @param text translated text
     * @param sourceLanguage language the engine translated from (detected when not given)
     */
    record OfflineTranslation(String text, String sourceLanguage) {}

    /**
     * @return {@code true} once language data is loaded
     */
    boolean isReady();

    /**
     * @param text text to translate (non-blank)
     * @param from source language, or {@code null} to detect
     * @param to target language
     * @return translation, or empty if the engine has no translation for this text
     * @throws IllegalArgumentException if the language pair is not installed
     */
    Optional<OfflineTranslation> translate(String text, String from, String to);

    /**
     * Batch variant; the result list is index-aligned with {@code texts}.
     */
    default List<Optional<OfflineTranslation>> translateAll(List<String> texts, String from, String to) {
        return texts.stream().map(t -> translate(t, from, to)).toList();
    }
}
