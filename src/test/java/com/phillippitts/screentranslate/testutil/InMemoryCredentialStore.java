package com.phillippitts.screentranslate.testutil;

import com.phillippitts.screentranslate.domain.StoredCredentials;
import com.phillippitts.screentranslate.service.credentials.CredentialStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed credential store for tests.
 */
public class InMemoryCredentialStore implements CredentialStore {
    private final Map<String, StoredCredentials> credentials = new ConcurrentHashMap<>();

    public InMemoryCredentialStore put(String providerId, StoredCredentials stored) {
        credentials.put(providerId, stored);
        return this;
    }

    public InMemoryCredentialStore putKey(String providerId, String apiKey) {
        return put(providerId, new StoredCredentials(apiKey));
    }

    public void remove(String providerId) {
        credentials.remove(providerId);
    }

    @Override
    public boolean hasCredentials(String providerId) {
        return credentials.containsKey(providerId);
    }

    @Override
    public Optional<StoredCredentials> getCredentials(String providerId) {
        return Optional.ofNullable(credentials.get(providerId));
    }
}
