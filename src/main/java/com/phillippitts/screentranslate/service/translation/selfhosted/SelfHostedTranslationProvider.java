package com.phillippitts.screentranslate.service.translation.selfhosted;

import com.phillippitts.screentranslate.domain.ProviderConfig;
import com.phillippitts.screentranslate.domain.TranslationResult;
import com.phillippitts.screentranslate.exception.TranslationProviderException;
import com.phillippitts.screentranslate.service.credentials.CredentialStore;
import com.phillippitts.screentranslate.service.translation.AbstractHttpTranslationProvider;
import com.phillippitts.screentranslate.service.translation.EngineType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * Provider for a self-hosted translation server.
 *
 * <p>Wire format: {@code POST /translate {"text","source_lang","target_lang"} -> {"translation"}}.
 * The server has no batch endpoint, so batches are translated one item at a time. If a shared
 * secret is stored under the {@code self-hosted} credential id it is sent as a bearer token.
 *
 * <p>Availability is a reachability probe: {@code /health}, {@code /} and {@code /translate} are
 * tried in turn with a short timeout and any HTTP response counts as reachable.
 */
public class SelfHostedTranslationProvider extends AbstractHttpTranslationProvider {

    private static final Logger LOG = LogManager.getLogger(SelfHostedTranslationProvider.class);
    private static final List<String> PROBE_PATHS = List.of("/health", "/", "/translate");

    private final RestTemplate healthTemplate;
    private final String baseUrl;

    /**
     * @param restTemplate client for translation calls, configured with the request timeout
     * @param healthTemplate client for availability probes, configured with a short timeout
     * @param config provider settings; {@code baseUrl} is the server root
     * @param credentialStore optional shared secret source
     */
    public SelfHostedTranslationProvider(RestTemplate restTemplate, RestTemplate healthTemplate,
                                         ProviderConfig config, CredentialStore credentialStore) {
        super(EngineType.SELF_HOSTED.id(), EngineType.SELF_HOSTED.displayName(), restTemplate, config,
                credentialStore, EngineType.SELF_HOSTED.id(), false);
        this.healthTemplate = Objects.requireNonNull(healthTemplate, "healthTemplate must not be null");
        this.baseUrl = trimTrailingSlash(config.baseUrlOr(EngineType.SELF_HOSTED.defaultBaseUrl()));
    }

    /**
     * Server root for a host/port pair. {@code localhost} is pinned to IPv4 loopback since
     * servers commonly bind only to {@code 127.0.0.1}.
     */
    public static String baseUrlFor(String host, int port) {
        String h = (host == null || host.isBlank() || "localhost".equalsIgnoreCase(host.trim()))
                ? "127.0.0.1" : host.trim();
        return "http://" + h + ":" + port;
    }

    @Override
    public boolean isAvailable() {
        for (String path : PROBE_PATHS) {
            try {
                healthTemplate.getForEntity(URI.create(baseUrl + path), String.class);
                return true;
            } catch (HttpStatusCodeException e) {
                return true;
            } catch (RestClientException e) {
                LOG.debug("Self-hosted health check {} failed: {}", path, e.getMessage());
            }
        }
        return false;
    }

    @Override
    protected TranslationResult doTranslate(String text, String from, String to) {
        JSONObject payload = new JSONObject()
                .put("text", text)
                .put("source_lang", from != null ? from : "auto")
                .put("target_lang", to);

        HttpHeaders headers = new HttpHeaders();
        optionalCredentials().ifPresent(c -> headers.setBearerAuth(c.apiKey()));
        RequestEntity<String> request = RequestEntity.post(URI.create(baseUrl + "/translate"))
                .headers(headers)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(payload.toString());

        JSONObject response = parseObject(exchange(request));
        String translation = response.optString("translation", null);
        if (translation == null) {
            throw TranslationProviderException.translationFailed(id(), "Response missing 'translation'");
        }
        return new TranslationResult(text, translation, from, to);
    }
}
