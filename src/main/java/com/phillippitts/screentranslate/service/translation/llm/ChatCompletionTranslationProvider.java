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
import java.util.Optional;

/**
 * Generative provider speaking the OpenAI chat-completions protocol:
 * {@code POST {base}/chat/completions {"model","messages","temperature","max_tokens"}}, reply in
 * {@code choices[0].message.content}.
 *
 * <p>Used for OpenAI itself and for local servers exposing the same protocol (Ollama). The
 * bearer token is sent whenever one is stored, and required only when the engine requires a key.
 */
public class ChatCompletionTranslationProvider extends LlmTranslationProvider {

    private final String endpoint;
    private final String model;

    public ChatCompletionTranslationProvider(EngineType type, RestTemplate restTemplate, ProviderConfig config,
                                             CredentialStore credentialStore) {
        this(type.id(), type.displayName(), type.id(), type.requiresApiKey(),
                type.defaultBaseUrl(), type.defaultModel(), restTemplate, config, credentialStore);
    }

    protected ChatCompletionTranslationProvider(String id, String name, String credentialsId, boolean requiresApiKey,
                                                String defaultBaseUrl, String defaultModel,
                                                RestTemplate restTemplate, ProviderConfig config,
                                                CredentialStore credentialStore) {
        super(id, name, restTemplate, config, credentialStore, credentialsId, requiresApiKey);
        this.endpoint = trimTrailingSlash(config.baseUrlOr(defaultBaseUrl)) + "/chat/completions";
        this.model = config.modelNameOr(defaultModel);
    }

    @Override
    protected String complete(String prompt) {
        JSONObject payload = new JSONObject()
                .put("model", model)
                .put("messages", new JSONArray().put(new JSONObject()
                        .put("role", "user")
                        .put("content", prompt)))
                .put("temperature", config.temperature())
                .put("max_tokens", config.maxTokens());

        HttpHeaders headers = new HttpHeaders();
        Optional<StoredCredentials> credentials = requiresApiKey()
                ? Optional.of(requireCredentials())
                : optionalCredentials();
        credentials.ifPresent(c -> headers.setBearerAuth(c.apiKey()));

        RequestEntity<String> request = RequestEntity.post(URI.create(endpoint))
                .headers(headers)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(payload.toString());

        JSONObject response = parseObject(exchange(request));
        JSONArray choices = response.optJSONArray("choices");
        JSONObject message = (choices != null && !choices.isEmpty())
                ? choices.getJSONObject(0).optJSONObject("message")
                : null;
        if (message == null || !message.has("content")) {
            throw TranslationProviderException.translationFailed(id(), "Response missing choices[0].message.content");
        }
        return message.optString("content", "");
    }

    public String model() {
        return model;
    }
}
