package com.phillippitts.screentranslate.service.translation.cloud;

import com.phillippitts.screentranslate.domain.ProviderConfig;
import com.phillippitts.screentranslate.domain.StoredCredentials;
import com.phillippitts.screentranslate.domain.TranslationResult;
import com.phillippitts.screentranslate.exception.TranslationProviderException;
import com.phillippitts.screentranslate.service.credentials.CredentialStore;
import com.phillippitts.screentranslate.service.translation.AbstractHttpTranslationProvider;
import com.phillippitts.screentranslate.service.translation.EngineType;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Keyed cloud provider for the DeepL v2 API. Batches are sent natively as a {@code text} array.
 *
 * <p>Keys ending in {@code :fx} belong to the free plan and are routed to the free endpoint
 * unless a base URL is configured explicitly.
 */
public class DeepLTranslationProvider extends AbstractHttpTranslationProvider {

    static final String FREE_ENDPOINT = "https://api-free.deepl.com/v2/translate";
    private static final int QUOTA_EXCEEDED = 456;

    public DeepLTranslationProvider(RestTemplate restTemplate, ProviderConfig config,
                                    CredentialStore credentialStore) {
        super(EngineType.DEEPL.id(), EngineType.DEEPL.displayName(), restTemplate, config,
                credentialStore, EngineType.DEEPL.id(), true);
    }

    @Override
    protected TranslationResult doTranslate(String text, String from, String to) {
        return doTranslateBatch(List.of(text), from, to).get(0);
    }

    @Override
    protected List<TranslationResult> doTranslateBatch(List<String> texts, String from, String to) {
        StoredCredentials credentials = requireCredentials();

        JSONObject payload = new JSONObject()
                .put("text", new JSONArray(texts))
                .put("target_lang", toTargetCode(to));
        if (from != null) {
            payload.put("source_lang", toSourceCode(from));
        }

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "DeepL-Auth-Key " + credentials.apiKey());
        RequestEntity<String> request = RequestEntity.post(URI.create(endpointFor(credentials.apiKey())))
                .headers(headers)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(payload.toString());

        JSONArray translations = parseObject(exchange(request)).optJSONArray("translations");
        if (translations == null || translations.length() != texts.size()) {
            throw TranslationProviderException.translationFailed(id(), "expected " + texts.size()
                    + " translations but got " + (translations == null ? 0 : translations.length()));
        }
        List<TranslationResult> results = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            JSONObject t = translations.getJSONObject(i);
            String detected = t.optString("detected_source_language", null);
            results.add(new TranslationResult(texts.get(i), t.optString("text", ""),
                    detected != null ? detected.toLowerCase(Locale.ROOT) : from, to));
        }
        return results;
    }

    @Override
    protected TranslationProviderException mapStatus(int status, HttpHeaders headers, String body) {
        if (status == QUOTA_EXCEEDED) {
            return TranslationProviderException.translationFailed(id(), "Quota exceeded");
        }
        return super.mapStatus(status, headers, body);
    }

    private String endpointFor(String apiKey) {
        if (config.baseUrl() != null && !config.baseUrl().isBlank()) {
            return config.baseUrl();
        }
        return apiKey.endsWith(":fx") ? FREE_ENDPOINT : EngineType.DEEPL.defaultBaseUrl();
    }

    static String toTargetCode(String language) {
        String upper = language.trim().toUpperCase(Locale.ROOT).replace('_', '-');
        return switch (upper) {
            case "ZH", "ZH-CN" -> "ZH-HANS";
            case "ZH-TW", "ZH-HK" -> "ZH-HANT";
            case "EN" -> "EN-US";
            case "PT" -> "PT-PT";
            default -> upper;
        };
    }

    static String toSourceCode(String language) {
        String upper = language.trim().toUpperCase(Locale.ROOT).replace('_', '-');
        int dash = upper.indexOf('-');
        return dash > 0 ? upper.substring(0, dash) : upper;
    }
}
