package com.phillippitts.screentranslate.service.translation;

import com.phillippitts.screentranslate.domain.TranslationResult;
import com.phillippitts.screentranslate.exception.TranslationProviderException;
import com.phillippitts.screentranslate.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base class for translation providers implementing the input checks and result-count
 * contract shared by all backends.
 *
 * <p>This class implements the Template Method pattern:
 * <ul>
 *   <li>{@link #translate(String, String, String)} rejects blank input, then calls
 *       {@link #doTranslate(String, String, String)}</li>
 *   <li>{@link #translate(List, String, String)} rejects blank items, calls
 *       {@link #doTranslateBatch(List, String, String)} and verifies the result count</li>
 *   <li>Any exception other than {@link TranslationProviderException} is wrapped with the
 *       provider id via {@link #handleProviderError(Exception)}</li>
 * </ul>
 *
 * <p>The default batch implementation translates item by item. Backends with a native batch
 * call override {@link #doTranslateBatch(List, String, String)}.
 */
public abstract class AbstractTranslationProvider implements TranslationProvider {

    private static final Logger LOG = LogManager.getLogger(AbstractTranslationProvider.class);

    static final String PROBE_TEXT = "Hello";
    static final String PROBE_SOURCE = "en";
    static final String PROBE_TARGET = "zh";

    private final String id;
    private final String name;

    protected AbstractTranslationProvider(String id, String name) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public final String id() {
        return id;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final TranslationResult translate(String text, String from, String to) {
        if (text == null || text.isBlank()) {
            throw TranslationProviderException.emptyInput(id);
        }
        requireTarget(to);
        try {
            return doTranslate(text, normalizeSource(from), to);
        } catch (Exception e) {
            throw handleProviderError(e);
        }
    }

    @Override
    public final List<TranslationResult> translate(List<String> texts, String from, String to) {
        Objects.requireNonNull(texts, "texts must not be null");
        if (texts.isEmpty()) {
            return List.of();
        }
        for (String text : texts) {
            if (text == null || text.isBlank()) {
                throw TranslationProviderException.emptyInput(id);
            }
        }
        requireTarget(to);

        List<TranslationResult> results;
        try {
            results = doTranslateBatch(List.copyOf(texts), normalizeSource(from), to);
        } catch (Exception e) {
            throw handleProviderError(e);
        }
        if (results == null || results.size() != texts.size()) {
            throw TranslationProviderException.translationFailed(id, "expected " + texts.size()
                    + " results but got " + (results == null ? 0 : results.size()));
        }
        return List.copyOf(results);
    }

    @Override
    public boolean checkConnection() {
        try {
            TranslationResult result = translate(PROBE_TEXT, PROBE_SOURCE, PROBE_TARGET);
            return !result.translatedText().isBlank();
        } catch (Exception e) {
            LOG.debug("Connection check failed for {}: {}", id, e.getMessage());
            return false;
        }
    }

    /**
     * Backend-specific single translation. Input is non-blank; {@code from} is {@code null}
     * for auto-detect.
     */
    protected abstract TranslationResult doTranslate(String text, String from, String to) throws Exception;

    /**
     * Backend-specific batch translation. Default: one {@link #doTranslate} call per item, in order.
     */
    protected List<TranslationResult> doTranslateBatch(List<String> texts, String from, String to) throws Exception {
        List<TranslationResult> results = new ArrayList<>(texts.size());
        for (String text : texts) {
            results.add(doTranslate(text, from, to));
        }
        return results;
    }

    /**
     * Preserves {@link TranslationProviderException} instances and wraps everything else with
     * the provider id.
     *
     * @param exception failure raised by the backend call
     * @return never returns normally
     * @throws TranslationProviderException always
     */
    protected final TranslationProviderException handleProviderError(Exception exception) {
        if (exception instanceof TranslationProviderException tpe) {
            throw tpe;
        }
        LOG.warn("{} translation failed: {}", id, LogSanitizer.truncate(exception.toString(), 200));
        throw TranslationProviderException.translationFailed(id, String.valueOf(exception.getMessage()), exception);
    }

    private static String normalizeSource(String from) {
        if (from == null || from.isBlank() || "auto".equalsIgnoreCase(from.trim())) {
            return null;
        }
        return from.trim();
    }

    private void requireTarget(String to) {
        if (to == null || to.isBlank()) {
            throw TranslationProviderException.invalidConfiguration(id, "target language must be set");
        }
    }
}
