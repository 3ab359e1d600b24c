package com.phillippitts.screentranslate.service.translation.local;

import com.phillippitts.screentranslate.domain.TranslationResult;
import com.phillippitts.screentranslate.exception.TranslationProviderException;
import com.phillippitts.screentranslate.service.translation.AbstractTranslationProvider;
import com.phillippitts.screentranslate.service.translation.EngineType;
import com.phillippitts.screentranslate.service.translation.local.OfflineTranslationEngine.OfflineTranslation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Provider backed by an in-process {@link OfflineTranslationEngine}. Needs no configuration,
 * so the registry creates it eagerly. Batches are passed to the engine in one call.
 */
public class LocalTranslationProvider extends AbstractTranslationProvider {

    private final OfflineTranslationEngine engine;

    public LocalTranslationProvider(OfflineTranslationEngine engine) {
        super(EngineType.LOCAL.id(), EngineType.LOCAL.displayName());
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    @Override
    public boolean isAvailable() {
        return engine.isReady();
    }

    @Override
    protected TranslationResult doTranslate(String text, String from, String to) {
        return toResult(text, to, lookup(text, from, to));
    }

    @Override
    protected List<TranslationResult> doTranslateBatch(List<String> texts, String from, String to) {
        List<Optional<OfflineTranslation>> translated;
        try {
            translated = engine.translateAll(texts, from, to);
        } catch (IllegalArgumentException e) {
            throw TranslationProviderException.translationFailed(id(), e.getMessage());
        }
        List<TranslationResult> results = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size() && i < translated.size(); i++) {
            OfflineTranslation t = translated.get(i).orElseThrow(() -> noTranslation());
            results.add(toResult(texts.get(i), to, t));
        }
        return results;
    }

    private OfflineTranslation lookup(String text, String from, String to) {
        try {
            return engine.translate(text, from, to).orElseThrow(() -> noTranslation());
        } catch (IllegalArgumentException e) {
            throw TranslationProviderException.translationFailed(id(), e.getMessage());
        }
    }

    private TranslationProviderException noTranslation() {
        return TranslationProviderException.translationFailed(id(), "No offline translation available for this text");
    }

    private static TranslationResult toResult(String source, String to, OfflineTranslation t) {
        return new TranslationResult(source, t.text(), t.sourceLanguage(), to);
    }
}
