package com.phillippitts.screentranslate.service.vision;

import com.phillippitts.screentranslate.config.properties.VisionProperties;
import com.phillippitts.screentranslate.exception.AnalysisException;
import com.phillippitts.screentranslate.service.credentials.CredentialStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.web.client.RestTemplate;

import java.net.URI;

/**
 * Vision provider for OpenAI chat completions with an inline {@code image_url}.
 *
 * <p>When a reply stops with {@code finish_reason=length}, the partial reply is added to the
 * conversation and the model is asked to continue, up to {@code vision.max-continuations} times.
 * The parts are concatenated in order.
 */
public class OpenAiVisionProvider extends AbstractVisionProvider {

    private static final Logger LOG = LogManager.getLogger(OpenAiVisionProvider.class);
    static final double TEMPERATURE = 0.1;

    public OpenAiVisionProvider(RestTemplate restTemplate, VisionProperties properties,
                                CredentialStore credentialStore) {
        super(VisionProviderType.OPENAI, restTemplate, properties, credentialStore);
    }

    @Override
    public String extractText(String base64Jpeg, String systemPrompt, String userPrompt) {
        String apiKey = requireCredentials().apiKey();
        JSONArray messages = new JSONArray()
                .put(new JSONObject().put("role", "system").put("content", systemPrompt))
                .put(new JSONObject().put("role", "user").put("content", new JSONArray()
                        .put(new JSONObject().put("type", "text").put("text", userPrompt))
                        .put(new JSONObject().put("type", "image_url").put("image_url", new JSONObject()
                                .put("url", "data:image/jpeg;base64," + base64Jpeg)
                                .put("detail", "high")))));

        StringBuilder reply = new StringBuilder();
        for (int attempt = 0; ; attempt++) {
            JSONObject choice = complete(messages, apiKey);
            String content = choice.optJSONObject("message") != null
                    ? choice.getJSONObject("message").optString("content", "")
                    : "";
            reply.append(content);

            boolean truncated = "length".equals(choice.optString("finish_reason"));
            if (!truncated || attempt >= properties.maxContinuations()) {
                if (truncated) {
                    LOG.warn("Vision reply still truncated after {} continuations", attempt);
                }
                return reply.toString();
            }
            LOG.debug("Vision reply truncated; requesting continuation {}", attempt + 1);
            messages.put(new JSONObject().put("role", "assistant").put("content", content));
            messages.put(new JSONObject().put("role", "user").put("content", VisionPrompts.CONTINUE_PROMPT));
        }
    }

    private JSONObject complete(JSONArray messages, String apiKey) {
        JSONObject payload = new JSONObject()
                .put("model", model())
                .put("messages", messages)
                .put("temperature", TEMPERATURE)
                .put("max_tokens", properties.maxTokens());

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        RequestEntity<String> request = RequestEntity.post(URI.create(baseUrl() + "/chat/completions"))
                .headers(headers)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(payload.toString());

        JSONArray choices = exchangeForJson(request).optJSONArray("choices");
        if (choices == null || choices.isEmpty()) {
            throw new AnalysisException(AnalysisException.Kind.INVALID_RESPONSE, id(), "Response has no choices");
        }
        return choices.getJSONObject(0);
    }
}
