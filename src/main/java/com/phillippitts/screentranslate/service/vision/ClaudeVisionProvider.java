package com.phillippitts.screentranslate.service.vision;

import com.phillippitts.screentranslate.config.properties.VisionProperties;
import com.phillippitts.screentranslate.exception.AnalysisException;
import com.phillippitts.screentranslate.service.credentials.CredentialStore;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.web.client.RestTemplate;

import java.net.URI;

/**
 * Vision provider for the Anthropic Messages API with a base64 image block.
 */
public class ClaudeVisionProvider extends AbstractVisionProvider {

    static final String API_VERSION = "2023-06-01";

    public ClaudeVisionProvider(RestTemplate restTemplate, VisionProperties properties,
                                CredentialStore credentialStore) {
        super(VisionProviderType.CLAUDE, restTemplate, properties, credentialStore);
    }

    @Override
    public String extractText(String base64Jpeg, String systemPrompt, String userPrompt) {
        String apiKey = requireCredentials().apiKey();
        JSONObject image = new JSONObject()
                .put("type", "image")
                .put("source", new JSONObject()
                        .put("type", "base64")
                        .put("media_type", "image/jpeg")
                        .put("data", base64Jpeg));
        JSONObject payload = new JSONObject()
                .put("model", model())
                .put("max_tokens", properties.maxTokens())
                .put("system", systemPrompt)
                .put("messages", new JSONArray().put(new JSONObject()
                        .put("role", "user")
                        .put("content", new JSONArray()
                                .put(image)
                                .put(new JSONObject().put("type", "text").put("text", userPrompt)))));

        HttpHeaders headers = new HttpHeaders();
        headers.set("x-api-key", apiKey);
        headers.set("anthropic-version", API_VERSION);
        RequestEntity<String> request = RequestEntity.post(URI.create(baseUrl() + "/v1/messages"))
                .headers(headers)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(payload.toString());

        JSONArray content = exchangeForJson(request).optJSONArray("content");
        StringBuilder reply = new StringBuilder();
        if (content != null) {
            for (int i = 0; i < content.length(); i++) {
                JSONObject block = content.optJSONObject(i);
                if (block != null && "text".equals(block.optString("type"))) {
                    reply.append(block.optString("text", ""));
                }
            }
        }
        if (reply.isEmpty()) {
            throw new AnalysisException(AnalysisException.Kind.INVALID_RESPONSE, id(), "Response contains no text");
        }
        return reply.toString();
    }
}
