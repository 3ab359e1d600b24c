package com.phillippitts.screentranslate.service.translation.llm;

import com.phillippitts.screentranslate.domain.ProviderConfig;
import com.phillippitts.screentranslate.domain.TranslationResult;
import com.phillippitts.screentranslate.exception.TranslationProviderException;
import com.phillippitts.screentranslate.service.credentials.CredentialStore;
import com.phillippitts.screentranslate.service.translation.AbstractHttpTranslationProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Base class for prompt-driven generative backends.
 *
 * <p>These backends have no batch API. A batch is joined with {@link #SEGMENT_SEPARATOR} into a
 * single prompt, sent as one completion, and split back on the separator. When the split count
 * differs from the input count the whole batch is re-translated one item per call, so segments
 * are never dropped or shifted. Errors from the joined call itself are not absorbed.
 */
public abstract class LlmTranslationProvider extends AbstractHttpTranslationProvider {

    private static final Logger LOG = LogManager.getLogger(LlmTranslationProvider.class);

    public static final String SEGMENT_SEPARATOR = "\n---\n";
    private static final Pattern SEPARATOR_LINE = Pattern.compile("\\r?\\n[ \\t]*---[ \\t]*\\r?\\n");

    protected LlmTranslationProvider(String id, String name, RestTemplate restTemplate, ProviderConfig config,
                                     CredentialStore credentialStore, String credentialsId, boolean requiresApiKey) {
        super(id, name, restTemplate, config, credentialStore, credentialsId, requiresApiKey);
    }

    /**
     * Sends one prompt and returns the model's text reply.
     *
     * @throws TranslationProviderException on HTTP or response-format failure
     */
    protected abstract String complete(String prompt);

    @Override
    protected TranslationResult doTranslate(String text, String from, String to) {
        String reply = complete(PromptTemplate.render(config.promptTemplate(), from, to, text)).trim();
        if (reply.isEmpty()) {
            throw TranslationProviderException.translationFailed(id(), "Model returned an empty translation");
        }
        return new TranslationResult(text, reply, from, to);
    }

    @Override
    protected List<TranslationResult> doTranslateBatch(List<String> texts, String from, String to) {
        if (texts.size() == 1) {
            return List.of(doTranslate(texts.get(0), from, to));
        }
        String joined = String.join(SEGMENT_SEPARATOR, texts);
        String prompt = PromptTemplate.renderBatch(config.promptTemplate(), from, to, joined, texts.size());
        List<String> parts = split(complete(prompt));

        if (parts.size() != texts.size() || parts.stream().anyMatch(String::isEmpty)) {
            LOG.warn("{} batch split mismatch: expected {} segments, got {}; translating sequentially",
                    id(), texts.size(), parts.size());
            return translateSequentially(texts, from, to);
        }
        List<TranslationResult> results = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            results.add(new TranslationResult(texts.get(i), parts.get(i), from, to));
        }
        return results;
    }

    static List<String> split(String reply) {
        String normalized = "\n" + reply.trim() + "\n";
        return Arrays.stream(SEPARATOR_LINE.split(normalized, -1))
                .map(String::trim)
                .toList();
    }

    private List<TranslationResult> translateSequentially(List<String> texts, String from, String to) {
        List<TranslationResult> results = new ArrayList<>(texts.size());
        for (String text : texts) {
            results.add(doTranslate(text, from, to));
        }
        return results;
    }
}
