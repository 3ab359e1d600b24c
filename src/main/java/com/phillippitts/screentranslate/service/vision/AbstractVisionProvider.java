package com.phillippitts.screentranslate.service.vision;

import com.phillippitts.screentranslate.config.properties.VisionProperties;
import com.phillippitts.screentranslate.domain.StoredCredentials;
import com.phillippitts.screentranslate.exception.AnalysisException;
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

import java.util.Objects;
import java.util.Optional;

/**
 * Base class for HTTP vision providers: credential lookup and HTTP-to-{@link AnalysisException}
 * mapping.
 *
 * <ul>
 *   <li>401 / 403 - {@code AUTHENTICATION}</li>
 *   <li>429 - {@code RATE_LIMITED}</li>
 *   <li>404 - {@code MODEL_UNAVAILABLE}</li>
 *   <li>400 - {@code INVALID_CONFIGURATION}</li>
 *   <li>5xx, timeouts and refused connections - {@code NETWORK}</li>
 * </ul>
 */
public abstract class AbstractVisionProvider implements VisionProvider {

    private static final Logger LOG = LogManager.getLogger(AbstractVisionProvider.class);

    protected final RestTemplate restTemplate;
    protected final VisionProperties properties;
    private final CredentialStore credentialStore;
    private final VisionProviderType type;

    protected AbstractVisionProvider(VisionProviderType type, RestTemplate restTemplate,
                                     VisionProperties properties, CredentialStore credentialStore) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.credentialStore = Objects.requireNonNull(credentialStore, "credentialStore must not be null");
    }

    @Override
    public String id() {
        return type.id();
    }

    @Override
    public boolean isConfigured() {
        return !type.requiresApiKey() || credentialStore.hasCredentials(type.id());
    }

    protected final String baseUrl() {
        String url = properties.baseUrlOrDefault().trim();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    protected final String model() {
        return properties.modelNameOrDefault();
    }

    protected final StoredCredentials requireCredentials() {
        return credentialStore.getCredentials(type.id())
                .orElseThrow(() -> new AnalysisException(AnalysisException.Kind.INVALID_CONFIGURATION, id(),
                        "API key not configured"));
    }

    protected final Optional<StoredCredentials> optionalCredentials() {
        return credentialStore.getCredentials(type.id());
    }

    /**
     * Executes the request and parses the JSON response body.
     *
     * @throws AnalysisException mapped from the HTTP failure or an unparseable body
     */
    protected final JSONObject exchangeForJson(RequestEntity<String> request) {
        String body;
        try {
            ResponseEntity<String> response = restTemplate.exchange(request, String.class);
            body = response.getBody();
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            LOG.warn("Vision provider {} failed with HTTP {}", id(), status);
            LOG.debug("Vision error body: {}", LogSanitizer.truncate(e.getResponseBodyAsString(), 200));
            throw mapStatus(status, e.getResponseHeaders(), e);
        } catch (ResourceAccessException e) {
            throw new AnalysisException(AnalysisException.Kind.NETWORK, id(),
                    "Network error: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new AnalysisException(AnalysisException.Kind.INVALID_RESPONSE, id(),
                    "Request failed: " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new AnalysisException(AnalysisException.Kind.INVALID_RESPONSE, id(), "Empty response");
        }
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw new AnalysisException(AnalysisException.Kind.INVALID_RESPONSE, id(),
                    "Response is not JSON", e);
        }
    }

    private AnalysisException mapStatus(int status, HttpHeaders headers, Exception cause) {
        return switch (status) {
            case 401, 403 -> new AnalysisException(AnalysisException.Kind.AUTHENTICATION, id(),
                    "Authentication failed", cause);
            case 429 -> new AnalysisException(AnalysisException.Kind.RATE_LIMITED, id(),
                    "Rate limited" + retryAfterSuffix(headers), cause);
            case 404 -> new AnalysisException(AnalysisException.Kind.MODEL_UNAVAILABLE, id(),
                    "Model " + model() + " is not available", cause);
            case 400 -> new AnalysisException(AnalysisException.Kind.INVALID_CONFIGURATION, id(),
                    "Request rejected (HTTP 400)", cause);
            default -> new AnalysisException(AnalysisException.Kind.NETWORK, id(),
                    "Server error (HTTP " + status + ")", cause);
        };
    }

    private static String retryAfterSuffix(HttpHeaders headers) {
        String retryAfter = headers != null ? headers.getFirst(HttpHeaders.RETRY_AFTER) : null;
        return (retryAfter == null || retryAfter.isBlank()) ? "" : ", retry after " + retryAfter.trim() + " seconds";
    }
}
