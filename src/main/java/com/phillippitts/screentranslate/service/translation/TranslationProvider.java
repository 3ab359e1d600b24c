package com.phillippitts.screentranslate.service.translation;

import com.phillippitts.screentranslate.domain.TranslationResult;
import com.phillippitts.screentranslate.exception.TranslationProviderException;

import java.util.List;

/**
 * Contract for translation backends.
 *
 * <p>Implementations wrap one backend family (offline engine, self-hosted server, keyed cloud
 * API, or prompt-driven model) behind a uniform interface. All failures surface as
 * {@link TranslationProviderException}; callers branch on its {@code Kind}.
 *
 * <p>Thread Safety: implementations must be safe for concurrent use; instances are shared
 * through the {@link ProviderRegistry} for the lifetime of the process.
 *
 * <p>Language codes are BCP-47 style ({@code en}, {@code zh-Hans}, {@code ja}). A {@code null}
 * source language means auto-detect.
 */
public interface TranslationProvider {

    /**
     * @return stable identifier, used for credentials, metrics and logs
     */
    String id();

    /**
     * @return human-readable name
     */
    String name();

    /**
     * Whether the backend is usable now: credentials present, or none required and the
     * backend reachable. Must not throw.
     */
    boolean isAvailable();

    /**
     * Translates a single string.
     *
     * @param text text to translate
     * @param from source language, or {@code null} to auto-detect
     * @param to target language
     * @return translation
     * @throws TranslationProviderException with {@code EMPTY_INPUT} if text is blank, or
     *         another kind if the backend fails
     */
    TranslationResult translate(String text, String from, String to);

    /**
     * Translates a batch of strings.
     *
     * <p>Returns exactly {@code texts.size()} results in input order, or throws. A shorter or
     * reordered list is never returned.
     *
     * @param texts texts to translate
     * @param from source language, or {@code null} to auto-detect
     * @param to target language
     * @return one result per input, in order
     * @throws TranslationProviderException if any item cannot be translated
     */
    List<TranslationResult> translate(List<String> texts, String from, String to);

    /**
     * Performs a minimal live probe by translating a short sentinel.
     *
     * @return {@code true} if the probe succeeded; never throws
     */
    boolean checkConnection();
}
