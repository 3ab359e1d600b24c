package com.phillippitts.screentranslate.service.translation.llm;

import com.phillippitts.screentranslate.domain.ProviderConfig;
import com.phillippitts.screentranslate.domain.StoredCredentials;
import com.phillippitts.screentranslate.exception.TranslationProviderException;
import com.phillippitts.screentranslate.service.credentials.CredentialStore;
import com.phillippitts.screentranslate.service.translation.EngineType;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.web.client.RestTemplate;

import java.net.URI;

/**
 * Generative provider for the Anthropic Messages API
 * ({@code POST {base}/v1/messages}, {@code x-api-key} header, reply in the first text block).
 */
public class ClaudeTranslationProvider extends LlmTranslationProvider {

    static final String API_VERSION = "2023-06-01";

    private final String endpoint;
    private final String model;

    public ClaudeTranslationProvider(RestTemplate restTemplate, ProviderConfig config,
                                     CredentialStore credentialStore) {
        super(EngineType.CLAUDE.id(), EngineType.CLAUDE.displayName(), restTemplate, config,
                credentialStore, EngineType.CLAUDE.id(), true);
        this.endpoint = trimTrailingSlash(config.baseUrlOr(EngineType.CLAUDE.defaultBaseUrl())) + "/v1/messages";
        this.model = config.modelNameOr(EngineType.CLAUDE.defaultModel());
    }

    @Override
    protected String complete(String prompt) {
        StoredCredentials credentials = requireCredentials();

        JSONObject payload = new JSONObject()
                .put("model", model)
                .put("max_tokens", config.maxTokens())
                .put("temperature", config.temperature())
                .put("messages", new JSONArray().put(new JSONObject()
                        .put("role", "user")
                        .put("content", prompt)));

        HttpHeaders headers = new HttpHeaders();
        headers.set("x-api-key", credentials.apiKey());
        headers.set("anthropic-version", API_VERSION);
        RequestEntity<String> request = RequestEntity.post(URI.create(endpoint))
                .headers(headers)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(payload.toString());

        JSONArray content = parseObject(exchange(request)).optJSONArray("content");
        if (content != null) {
            for (int i = 0; i < content.length(); i++) {
                JSONObject block = content.optJSONObject(i);
                if (block != null && "text".equals(block.optString("type"))) {
                    return block.optString("text", "");
                }
            }
        }
        throw TranslationProviderException.translationFailed(id(), "Response contains no text block");
    }
}
