package com.phillippitts.screentranslate.service.credentials;

import com.phillippitts.screentranslate.domain.StoredCredentials;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves credentials from the Spring {@link Environment} on every call.
 *
 * <p>Keys are {@code credentials.<provider>.api-key} and {@code credentials.<provider>.app-id}.
 * A provider id such as {@code custom:1} is looked up as {@code credentials.custom-1.*}, so the
 * usual relaxed binding lets {@code CREDENTIALS_CUSTOM_1_API_KEY} supply it from the OS environment.
 */
@Component
public class EnvironmentCredentialStore implements CredentialStore {

    private static final Logger LOG = LogManager.getLogger(EnvironmentCredentialStore.class);
    private static final String PREFIX = "credentials.";

    private final Environment environment;

    public EnvironmentCredentialStore(Environment environment) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    @Override
    public boolean hasCredentials(String providerId) {
        String apiKey = environment.getProperty(key(providerId, "api-key"));
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Optional<StoredCredentials> getCredentials(String providerId) {
        String apiKey = environment.getProperty(key(providerId, "api-key"));
        if (apiKey == null || apiKey.isBlank()) {
            LOG.debug("No credentials configured for provider {}", providerId);
            return Optional.empty();
        }
        String appId = environment.getProperty(key(providerId, "app-id"));
        return Optional.of(new StoredCredentials(apiKey.trim(), appId == null ? null : appId.trim()));
    }

    static String key(String providerId, String field) {
        Objects.requireNonNull(providerId, "providerId must not be null");
        String normalized = providerId.toLowerCase(Locale.ROOT).replace(':', '-').replace('_', '-');
        return PREFIX + normalized + '.' + field;
    }
}
