package com.phillippitts.screentranslate.service.translation.llm;

import com.phillippitts.screentranslate.domain.ProviderConfig;
import com.phillippitts.screentranslate.service.credentials.CredentialStore;
import org.springframework.web.client.RestTemplate;

/**
 * Chat-completions provider for a user-defined OpenAI-compatible endpoint. Identified by a
 * composite id ({@code custom:<index>}) so several endpoints can be configured side by side;
 * credentials are stored under the same id.
 */
public class CompatibleTranslationProvider extends ChatCompletionTranslationProvider {

    private final CompatibleEndpoint endpoint;

    public CompatibleTranslationProvider(String compositeId, CompatibleEndpoint endpoint, RestTemplate restTemplate,
                                         ProviderConfig config, CredentialStore credentialStore) {
        super(compositeId, endpoint.displayName(), compositeId, endpoint.requiresApiKey(),
                endpoint.baseUrl(), endpoint.modelName(), restTemplate, config, credentialStore);
        this.endpoint = endpoint;
    }

    public CompatibleEndpoint endpoint() {
        return endpoint;
    }
}
