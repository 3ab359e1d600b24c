package com.phillippitts.screentranslate.service.credentials;

import com.phillippitts.screentranslate.domain.StoredCredentials;

import java.util.Optional;

/**
 * Read-only access to provider secrets.
 *
 * <p>Implementations must not cache decrypted material: every call reads from the backing
 * store, and callers keep the returned value only for the request that needs it.
 */
public interface CredentialStore {

    /**
     * @param providerId provider identifier, e.g. {@code openai} or {@code custom:1}
     * @return {@code true} if an API key is stored for the provider
     */
    boolean hasCredentials(String providerId);

    /**
     * @param providerId provider identifier
     * @return stored credentials, or empty if none are configured
     */
    Optional<StoredCredentials> getCredentials(String providerId);
}
