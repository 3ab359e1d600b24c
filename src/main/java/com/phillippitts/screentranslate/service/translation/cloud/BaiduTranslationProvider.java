package com.phillippitts.screentranslate.service.translation.cloud;

import com.phillippitts.screentranslate.domain.ProviderConfig;
import com.phillippitts.screentranslate.domain.StoredCredentials;
import com.phillippitts.screentranslate.domain.TranslationResult;
import com.phillippitts.screentranslate.exception.TranslationProviderException;
import com.phillippitts.screentranslate.service.credentials.CredentialStore;
import com.phillippitts.screentranslate.service.translation.AbstractHttpTranslationProvider;
import com.phillippitts.screentranslate.service.translation.EngineType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.util.DigestUtils;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntSupplier;

/**
 * Keyed cloud provider using a signed GET query (Baidu general translation API).
 *
 * <p>Each request carries {@code appid}, a random {@code salt} and
 * {@code sign = md5(appid + q + salt + key)}. The API reports failures in the body as
 * {@code error_code}; signature and account errors map to {@code INVALID_CONFIGURATION}.
 * Batches are translated one item at a time.
 */
public class BaiduTranslationProvider extends AbstractHttpTranslationProvider {

    private static final Logger LOG = LogManager.getLogger(BaiduTranslationProvider.class);

    private static final Map<String, String> LANGUAGE_CODES = Map.ofEntries(
            Map.entry("zh", "zh"),
            Map.entry("zh-hans", "zh"),
            Map.entry("zh-cn", "zh"),
            Map.entry("zh-hant", "cht"),
            Map.entry("zh-tw", "cht"),
            Map.entry("zh-hk", "cht"),
            Map.entry("en", "en"),
            Map.entry("ja", "jp"),
            Map.entry("ko", "kor"),
            Map.entry("fr", "fra"),
            Map.entry("es", "spa"),
            Map.entry("de", "de"),
            Map.entry("pt", "pt"),
            Map.entry("ru", "ru"),
            Map.entry("it", "it"),
            Map.entry("ar", "ara"),
            Map.entry("vi", "vie"),
            Map.entry("th", "th"));

    private final String endpoint;
    private final IntSupplier saltSource;

    public BaiduTranslationProvider(RestTemplate restTemplate, ProviderConfig config,
                                    CredentialStore credentialStore) {
        this(restTemplate, config, credentialStore, () -> ThreadLocalRandom.current().nextInt(100000, 1000000));
    }

    BaiduTranslationProvider(RestTemplate restTemplate, ProviderConfig config,
                             CredentialStore credentialStore, IntSupplier saltSource) {
        super(EngineType.BAIDU.id(), EngineType.BAIDU.displayName(), restTemplate, config,
                credentialStore, EngineType.BAIDU.id(), true);
        this.endpoint = config.baseUrlOr(EngineType.BAIDU.defaultBaseUrl());
        this.saltSource = saltSource;
    }

    @Override
    protected TranslationResult doTranslate(String text, String from, String to) {
        StoredCredentials credentials = requireCredentials();
        if (!credentials.hasAppId()) {
            throw TranslationProviderException.invalidConfiguration(id(), "App ID not configured");
        }
        String salt = Integer.toString(saltSource.getAsInt());
        String sign = sign(credentials.appId(), text, salt, credentials.apiKey());

        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", text);
        params.put("from", toBaiduCode(from));
        params.put("to", toBaiduCode(to));
        params.put("appid", credentials.appId());
        params.put("salt", salt);
        params.put("sign", sign);

        URI uri = UriComponentsBuilder.fromHttpUrl(endpoint)
                .queryParam("q", "{q}")
                .queryParam("from", "{from}")
                .queryParam("to", "{to}")
                .queryParam("appid", "{appid}")
                .queryParam("salt", "{salt}")
                .queryParam("sign", "{sign}")
                .encode()
                .buildAndExpand(params)
                .toUri();

        JSONObject response = parseObject(exchange(RequestEntity.get(uri).accept(MediaType.APPLICATION_JSON).build()));
        if (response.has("error_code")) {
            throw mapErrorCode(response.optString("error_code"), response.optString("error_msg", ""));
        }
        JSONArray results = response.optJSONArray("trans_result");
        if (results == null || results.isEmpty()) {
            throw TranslationProviderException.translationFailed(id(), "Response missing 'trans_result'");
        }
        StringBuilder translated = new StringBuilder();
        for (int i = 0; i < results.length(); i++) {
            if (i > 0) {
                translated.append('\n');
            }
            translated.append(results.getJSONObject(i).optString("dst", ""));
        }
        return new TranslationResult(text, translated.toString(), response.optString("from", from), to);
    }

    static String sign(String appId, String query, String salt, String secret) {
        String raw = appId + query + salt + secret;
        return DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Maps a BCP-47 style code to the API's own codes; {@code null} becomes {@code auto}.
     */
    static String toBaiduCode(String language) {
        if (language == null || language.isBlank()) {
            return "auto";
        }
        String key = language.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        String code = LANGUAGE_CODES.get(key);
        if (code != null) {
            return code;
        }
        int dash = key.indexOf('-');
        return dash > 0 ? LANGUAGE_CODES.getOrDefault(key.substring(0, dash), key.substring(0, dash)) : key;
    }

    private TranslationProviderException mapErrorCode(String code, String message) {
        LOG.warn("Baidu API error code {}", code);
        return switch (code) {
            case "52003", "54001", "58000", "58002" ->
                    TranslationProviderException.invalidConfiguration(id(), "API error " + code + ": " + message);
            case "54003", "54005" -> TranslationProviderException.rateLimited(id(), null);
            case "52001" -> TranslationProviderException.connectionFailed(id(), "Request timed out", null);
            default -> TranslationProviderException.translationFailed(id(), "API error " + code + ": " + message);
        };
    }
}
