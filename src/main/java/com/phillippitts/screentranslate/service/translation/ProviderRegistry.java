package com.phillippitts.screentranslate.service.translation;

import com.phillippitts.screentranslate.domain.ProviderConfig;
import com.phillippitts.screentranslate.service.credentials.CredentialStore;
import com.phillippitts.screentranslate.service.translation.cloud.BaiduTranslationProvider;
import com.phillippitts.screentranslate.service.translation.cloud.DeepLTranslationProvider;
import com.phillippitts.screentranslate.service.translation.cloud.GoogleTranslationProvider;
import com.phillippitts.screentranslate.service.translation.llm.ChatCompletionTranslationProvider;
import com.phillippitts.screentranslate.service.translation.llm.ClaudeTranslationProvider;
import com.phillippitts.screentranslate.service.translation.llm.CompatibleEndpoint;
import com.phillippitts.screentranslate.service.translation.llm.CompatibleTranslationProvider;
import com.phillippitts.screentranslate.service.translation.local.LocalTranslationProvider;
import com.phillippitts.screentranslate.service.translation.local.OfflineTranslationEngine;
import com.phillippitts.screentranslate.service.translation.selfhosted.SelfHostedTranslationProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns every live {@link TranslationProvider} for the lifetime of the process.
 *
 * <p>The two backends that need no configuration ({@link EngineType#LOCAL} and
 * {@link EngineType#SELF_HOSTED}) are registered at construction; all others are created on
 * first use through {@link #createProvider(EngineType, ProviderConfig)}, which is the only place
 * that maps an engine type to a provider class.
 *
 * <p><b>Thread Safety:</b> registration, lookup and creation are serialized by a
 * {@link ReentrantLock}, so a provider is never constructed twice for the same type.
 * {@link #availableEngines()} copies the map under the lock and probes availability outside it,
 * so slow probes do not block other callers.
 *
 * <p>OpenAI-compatible custom endpoints are cached separately under composite ids
 * ({@code custom:<index>}).
 */
public class ProviderRegistry {

    private static final Logger LOG = LogManager.getLogger(ProviderRegistry.class);
    static final Duration PROBE_TIMEOUT = Duration.ofSeconds(2);

    private final Lock lock = new ReentrantLock();
    private final Map<EngineType, TranslationProvider> providers = new EnumMap<>(EngineType.class);
    private final Map<String, CompatibleTranslationProvider> compatibleProviders = new LinkedHashMap<>();

    private final CredentialStore credentialStore;
    private final RestTemplateBuilder restTemplateBuilder;
    private final OfflineTranslationEngine offlineEngine;

    /**
     * Creates the registry and registers the configuration-free backends.
     *
     * @param credentialStore secret source for keyed backends
     * @param restTemplateBuilder builder for per-provider HTTP clients
     * @param offlineEngine engine behind {@link EngineType#LOCAL}
     * @param selfHostedConfig settings for {@link EngineType#SELF_HOSTED}
     */
    public ProviderRegistry(CredentialStore credentialStore, RestTemplateBuilder restTemplateBuilder,
                            OfflineTranslationEngine offlineEngine, ProviderConfig selfHostedConfig) {
        this.credentialStore = Objects.requireNonNull(credentialStore, "credentialStore must not be null");
        this.restTemplateBuilder = Objects.requireNonNull(restTemplateBuilder, "restTemplateBuilder must not be null");
        this.offlineEngine = Objects.requireNonNull(offlineEngine, "offlineEngine must not be null");
        createProvider(EngineType.LOCAL, ProviderConfig.defaults().withTimeout(EngineType.LOCAL.defaultTimeout()));
        createProvider(EngineType.SELF_HOSTED, Objects.requireNonNull(selfHostedConfig, "selfHostedConfig"));
    }

    /**
     * Registers a provider, replacing any existing one for the type.
     */
    public void register(TranslationProvider provider, EngineType type) {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(type, "type must not be null");
        lock.lock();
        try {
            TranslationProvider previous = providers.put(type, provider);
            if (previous != null && previous != provider) {
                LOG.info("Replaced translation provider for {} ({} -> {})", type, previous.id(), provider.id());
            } else {
                LOG.info("Registered translation provider {} for {}", provider.id(), type);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} if a provider was registered for the type
     */
    public boolean unregister(EngineType type) {
        lock.lock();
        try {
            boolean removed = providers.remove(type) != null;
            if (removed) {
                LOG.info("Unregistered translation provider for {}", type);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public Optional<TranslationProvider> provider(EngineType type) {
        lock.lock();
        try {
            return Optional.ofNullable(providers.get(type));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return registered engine types in declaration order
     */
    public List<EngineType> registeredEngines() {
        lock.lock();
        try {
            return List.copyOf(providers.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Probes {@link TranslationProvider#isAvailable()} on every registered provider.
     *
     * @return available engine types, sorted by id
     */
    public List<EngineType> availableEngines() {
        Map<EngineType, TranslationProvider> snapshot;
        lock.lock();
        try {
            snapshot = new EnumMap<>(providers);
        } finally {
            lock.unlock();
        }
        List<EngineType> available = new ArrayList<>();
        snapshot.forEach((type, provider) -> {
            if (isAvailableSafely(provider)) {
                available.add(type);
            }
        });
        available.sort(Comparator.comparing(EngineType::id));
        return available;
    }

    /**
     * @return {@code true} if a provider is registered for the type and reports itself available
     */
    public boolean isEngineAvailable(EngineType type) {
        return provider(type).map(ProviderRegistry::isAvailableSafely).orElse(false);
    }

    /**
     * Whether the engine has the configuration it needs, checked against the credential store
     * without creating a provider or touching the network. Engines without an API key
     * requirement are always configured.
     */
    public boolean isEngineConfigured(EngineType type) {
        if (!type.requiresApiKey()) {
            return true;
        }
        if (type == EngineType.BAIDU) {
            return credentialStore.getCredentials(type.id()).map(c -> c.hasAppId()).orElse(false);
        }
        return credentialStore.hasCredentials(type.id());
    }

    /**
     * Returns the provider registered for the type, creating and registering one if absent.
     */
    public TranslationProvider createProvider(EngineType type, ProviderConfig config) {
        return createProvider(type, config, false);
    }

    /**
     * @param forceRefresh rebuild the provider even if one is registered
     */
    public TranslationProvider createProvider(EngineType type, ProviderConfig config, boolean forceRefresh) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");
        lock.lock();
        try {
            TranslationProvider existing = providers.get(type);
            if (existing != null && !forceRefresh) {
                return existing;
            }
            TranslationProvider created = newProvider(type, config);
            providers.put(type, created);
            LOG.info("Created translation provider {} (refresh={})", created.id(), forceRefresh);
            return created;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Builds a provider that is neither registered nor cached, for one-off settings such as a
     * scene-specific prompt. Callers own the returned instance.
     */
    public TranslationProvider createDetachedProvider(EngineType type, ProviderConfig config) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");
        return newProvider(type, config);
    }

    /**
     * Returns the cached provider for a custom endpoint, creating it if absent.
     *
     * @param endpoint endpoint definition
     * @param index position in the configured endpoint list
     * @param forceRefresh rebuild even if cached
     */
    public CompatibleTranslationProvider createCompatibleProvider(CompatibleEndpoint endpoint, int index,
                                                                  boolean forceRefresh) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        String compositeId = CompatibleEndpoint.compositeId(index);
        lock.lock();
        try {
            CompatibleTranslationProvider existing = compatibleProviders.get(compositeId);
            if (existing != null && !forceRefresh) {
                return existing;
            }
            ProviderConfig config = ProviderConfig.of(endpoint.baseUrl(), endpoint.modelName())
                    .withTimeout(EngineType.CUSTOM.defaultTimeout());
            CompatibleTranslationProvider created = new CompatibleTranslationProvider(compositeId, endpoint,
                    restTemplateFor(config.timeout()), config, credentialStore);
            compatibleProviders.put(compositeId, created);
            LOG.info("Created compatible provider {} ({})", compositeId, endpoint.displayName());
            return created;
        } finally {
            lock.unlock();
        }
    }

    public Optional<CompatibleTranslationProvider> compatibleProvider(String compositeId) {
        lock.lock();
        try {
            return Optional.ofNullable(compatibleProviders.get(compositeId));
        } finally {
            lock.unlock();
        }
    }

    public boolean removeCompatibleProvider(String compositeId) {
        lock.lock();
        try {
            return compatibleProviders.remove(compositeId) != null;
        } finally {
            lock.unlock();
        }
    }

    public void clearCompatibleProviders() {
        lock.lock();
        try {
            compatibleProviders.clear();
        } finally {
            lock.unlock();
        }
    }

    public List<String> compatibleProviderIds() {
        lock.lock();
        try {
            return List.copyOf(compatibleProviders.keySet());
        } finally {
            lock.unlock();
        }
    }

    private TranslationProvider newProvider(EngineType type, ProviderConfig config) {
        RestTemplate restTemplate = restTemplateFor(config.timeout());
        return switch (type) {
            case LOCAL -> new LocalTranslationProvider(offlineEngine);
            case SELF_HOSTED -> new SelfHostedTranslationProvider(restTemplate, restTemplateFor(PROBE_TIMEOUT),
                    config, credentialStore);
            case BAIDU -> new BaiduTranslationProvider(restTemplate, config, credentialStore);
            case DEEPL -> new DeepLTranslationProvider(restTemplate, config, credentialStore);
            case GOOGLE -> new GoogleTranslationProvider(restTemplate, config, credentialStore);
            case OPENAI, OLLAMA -> new ChatCompletionTranslationProvider(type, restTemplate, config, credentialStore);
            case CLAUDE -> new ClaudeTranslationProvider(restTemplate, config, credentialStore);
            case CUSTOM -> new CompatibleTranslationProvider(type.id(),
                    new CompatibleEndpoint(type.displayName(), config.baseUrl(), config.modelName(), false),
                    restTemplate, config, credentialStore);
        };
    }

    private RestTemplate restTemplateFor(Duration timeout) {
        return restTemplateBuilder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    private static boolean isAvailableSafely(TranslationProvider provider) {
        try {
            return provider.isAvailable();
        } catch (RuntimeException e) {
            LOG.warn("Availability check failed for {}: {}", provider.id(), e.toString());
            return false;
        }
    }
}
