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
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Keyed cloud provider for the Google Cloud Translation v2 API.
 *
 * <p>The API key travels as the {@code key} query parameter; batches are sent natively as a
 * multi-valued {@code q} and the response count is checked against the request.
 */
public class GoogleTranslationProvider extends AbstractHttpTranslationProvider {

    public GoogleTranslationProvider(RestTemplate restTemplate, ProviderConfig config,
                                     CredentialStore credentialStore) {
        super(EngineType.GOOGLE.id(), EngineType.GOOGLE.displayName(), restTemplate, config,
                credentialStore, EngineType.GOOGLE.id(), true);
    }

    @Override
    protected TranslationResult doTranslate(String text, String from, String to) {
        return doTranslateBatch(List.of(text), from, to).get(0);
    }

    @Override
    protected List<TranslationResult> doTranslateBatch(List<String> texts, String from, String to) {
        StoredCredentials credentials = requireCredentials();

        JSONObject payload = new JSONObject()
                .put("q", new JSONArray(texts))
                .put("target", toGoogleCode(to))
                .put("format", "text");
        if (from != null) {
            payload.put("source", toGoogleCode(from));
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(config.baseUrlOr(EngineType.GOOGLE.defaultBaseUrl()))
                .queryParam("key", "{key}")
                .encode()
                .buildAndExpand(credentials.apiKey())
                .toUri();
        RequestEntity<String> request = RequestEntity.post(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(payload.toString());

        JSONObject data = parseObject(exchange(request)).optJSONObject("data");
        JSONArray translations = data != null ? data.optJSONArray("translations") : null;
        if (translations == null || translations.length() != texts.size()) {
            throw TranslationProviderException.translationFailed(id(), "expected " + texts.size()
                    + " translations but got " + (translations == null ? 0 : translations.length()));
        }
        List<TranslationResult> results = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            JSONObject t = translations.getJSONObject(i);
            results.add(new TranslationResult(texts.get(i), t.optString("translatedText", ""),
                    t.optString("detectedSourceLanguage", from), to));
        }
        return results;
    }

    static String toGoogleCode(String language) {
        String lang = language.trim().replace('_', '-');
        return switch (lang.toLowerCase(Locale.ROOT)) {
            case "zh", "zh-hans", "zh-cn" -> "zh-CN";
            case "zh-hant", "zh-tw", "zh-hk" -> "zh-TW";
            default -> lang;
        };
    }
}
