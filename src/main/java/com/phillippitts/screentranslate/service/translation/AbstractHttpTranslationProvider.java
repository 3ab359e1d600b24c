package com.phillippitts.screentranslate.service.translation;

import com.phillippitts.screentranslate.domain.ProviderConfig;
import com.phillippitts.screentranslate.domain.StoredCredentials;
import com.phillippitts.screentranslate.exception.TranslationProviderException;
import com.phillippitts.screentranslate.service.credentials.CredentialStore;
import com.phillippitts.screentranslate.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for providers that talk to a backend over HTTP.
 *
 * <p>Centralizes credential lookup and the mapping of HTTP failures onto
 * {@link TranslationProviderException} kinds:
 * <ul>
 *   <li>401 / 403 - {@code INVALID_CONFIGURATION}</li>
 *   <li>429 - {@code RATE_LIMITED}, with {@code Retry-After} seconds when the server sends them</li>
 *   <li>other error statuses - {@code TRANSLATION_FAILED} (subclasses may refine via {@link #mapStatus})</li>
 *   <li>connection refused, DNS failure or timeout - {@code CONNECTION_FAILED}</li>
 * </ul>
 *
 * <p>Credentials are fetched from the {@link CredentialStore} for each request and never kept.
 * Response bodies are logged at DEBUG only, truncated.
 */
public abstract class AbstractHttpTranslationProvider extends AbstractTranslationProvider {

    private static final Logger LOG = LogManager.getLogger(AbstractHttpTranslationProvider.class);
    private static final int MAX_LOGGED_BODY = 200;

    protected final RestTemplate restTemplate;
    protected final ProviderConfig config;
    private final CredentialStore credentialStore;
    private final String credentialsId;
    private final boolean requiresApiKey;

    protected AbstractHttpTranslationProvider(String id, String name, RestTemplate restTemplate,
                                              ProviderConfig config, CredentialStore credentialStore,
                                              String credentialsId, boolean requiresApiKey) {
        super(id, name);
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.credentialStore = Objects.requireNonNull(credentialStore, "credentialStore must not be null");
        this.credentialsId = Objects.requireNonNull(credentialsId, "credentialsId must not be null");
        this.requiresApiKey = requiresApiKey;
    }

    @Override
    public boolean isAvailable() {
        return !requiresApiKey || credentialStore.hasCredentials(credentialsId);
    }

    public ProviderConfig config() {
        return config;
    }

    /**
     * @throws TranslationProviderException {@code INVALID_CONFIGURATION} if no API key is stored
     */
    protected final StoredCredentials requireCredentials() {
        return credentialStore.getCredentials(credentialsId)
                .orElseThrow(() -> TranslationProviderException.invalidConfiguration(id(),
                        "API key not configured"));
    }

    protected final Optional<StoredCredentials> optionalCredentials() {
        return credentialStore.getCredentials(credentialsId);
    }

    protected final boolean requiresApiKey() {
        return requiresApiKey;
    }

    /**
     * Executes the request and returns the response body.
     *
     * @throws TranslationProviderException mapped from the HTTP failure
     */
    protected final String exchange(RequestEntity<?> request) {
        try {
            ResponseEntity<String> response = restTemplate.exchange(request, String.class);
            String body = response.getBody();
            if (body == null || body.isBlank()) {
                throw TranslationProviderException.translationFailed(id(), "Empty response from server");
            }
            return body;
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            LOG.warn("{} request failed with HTTP {}", id(), status);
            LOG.debug("{} error body: {}", id(), LogSanitizer.truncate(e.getResponseBodyAsString(), MAX_LOGGED_BODY));
            throw mapStatus(status, e.getResponseHeaders(), e.getResponseBodyAsString());
        } catch (ResourceAccessException e) {
            throw TranslationProviderException.connectionFailed(id(), String.valueOf(e.getMessage()), e);
        } catch (RestClientException e) {
            throw TranslationProviderException.translationFailed(id(), String.valueOf(e.getMessage()), e);
        }
    }

    /**
     * Maps an HTTP error status to a provider exception.
     *
     * @param status HTTP status code
     * @param headers response headers (may be null)
     * @param body response body (may be empty)
     */
    protected TranslationProviderException mapStatus(int status, HttpHeaders headers, String body) {
        if (status == 401 || status == 403) {
            return TranslationProviderException.invalidConfiguration(id(), "Invalid API key");
        }
        if (status == 429) {
            return TranslationProviderException.rateLimited(id(), parseRetryAfter(headers));
        }
        return TranslationProviderException.translationFailed(id(), "API error: " + status);
    }

    protected final JSONObject parseObject(String body) {
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            LOG.debug("{} returned non-JSON body: {}", id(), LogSanitizer.truncate(body, MAX_LOGGED_BODY));
            throw TranslationProviderException.translationFailed(id(), "Invalid response format", e);
        }
    }

    /**
     * @return wait suggested by a numeric {@code Retry-After} header, or {@code null}
     */
    static Duration parseRetryAfter(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            // HTTP-date form is not used by the supported backends
            return null;
        }
    }

    protected static String trimTrailingSlash(String url) {
        String u = url.trim();
        while (u.endsWith("/")) {
            u = u.substring(0, u.length() - 1);
        }
        return u;
    }
}
