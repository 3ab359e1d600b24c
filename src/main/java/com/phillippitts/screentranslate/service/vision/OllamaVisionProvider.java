package com.phillippitts.screentranslate.service.vision;

import com.phillippitts.screentranslate.config.properties.VisionProperties;
import com.phillippitts.screentranslate.exception.AnalysisException;
import com.phillippitts.screentranslate.service.credentials.CredentialStore;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.web.client.RestTemplate;

import java.net.URI;

/**
 * Vision provider for a local Ollama server ({@code POST /api/chat} with an {@code images} array).
 * Needs no credentials.
 */
public class OllamaVisionProvider extends AbstractVisionProvider {

    public OllamaVisionProvider(RestTemplate restTemplate, VisionProperties properties,
                                CredentialStore credentialStore) {
        super(VisionProviderType.OLLAMA, restTemplate, properties, credentialStore);
    }

    @Override
    public String extractText(String base64Jpeg, String systemPrompt, String userPrompt) {
        JSONObject payload = new JSONObject()
                .put("model", model())
                .put("stream", false)
                .put("format", "json")
                .put("options", new JSONObject().put("temperature", OpenAiVisionProvider.TEMPERATURE))
                .put("messages", new JSONArray()
                        .put(new JSONObject().put("role", "system").put("content", systemPrompt))
                        .put(new JSONObject()
                                .put("role", "user")
                                .put("content", userPrompt)
                                .put("images", new JSONArray().put(base64Jpeg))));

        RequestEntity<String> request = RequestEntity.post(URI.create(baseUrl() + "/api/chat"))
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(payload.toString());

        JSONObject message = exchangeForJson(request).optJSONObject("message");
        if (message == null) {
            throw new AnalysisException(AnalysisException.Kind.INVALID_RESPONSE, id(), "Response has no message");
        }
        return message.optString("content", "");
    }
}
