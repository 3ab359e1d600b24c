package com.phillippitts.screentranslate.service.translation;

import com.phillippitts.screentranslate.domain.ProviderConfig;
import com.phillippitts.screentranslate.domain.StoredCredentials;
import com.phillippitts.screentranslate.service.translation.cloud.DeepLTranslationProvider;
import com.phillippitts.screentranslate.service.translation.llm.ChatCompletionTranslationProvider;
import com.phillippitts.screentranslate.service.translation.llm.CompatibleEndpoint;
import com.phillippitts.screentranslate.service.translation.llm.CompatibleTranslationProvider;
import com.phillippitts.screentranslate.service.translation.local.GlossaryTranslationEngine;
import com.phillippitts.screentranslate.service.translation.local.LocalTranslationProvider;
import com.phillippitts.screentranslate.service.translation.selfhosted.SelfHostedTranslationProvider;
import com.phillippitts.screentranslate.testutil.FakeTranslationProvider;
import com.phillippitts.screentranslate.testutil.InMemoryCredentialStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderRegistryTest {

    private InMemoryCredentialStore credentials;
    private ProviderRegistry registry;

    @BeforeEach
    void setUp() {
        credentials = new InMemoryCredentialStore();
        registry = new ProviderRegistry(credentials, new RestTemplateBuilder(), new GlossaryTranslationEngine(),
                ProviderConfig.of("http://127.0.0.1:8989", null));
    }

    @Test
    void registersConfigurationFreeBackendsEagerly() {
        assertThat(registry.registeredEngines()).containsExactly(EngineType.LOCAL, EngineType.SELF_HOSTED);
        assertThat(registry.provider(EngineType.LOCAL)).get().isInstanceOf(LocalTranslationProvider.class);
        assertThat(registry.provider(EngineType.SELF_HOSTED)).get().isInstanceOf(SelfHostedTranslationProvider.class);
    }

    @Test
    void createProviderIsIdempotent() {
        TranslationProvider first = registry.createProvider(EngineType.DEEPL, ProviderConfig.defaults());
        TranslationProvider second = registry.createProvider(EngineType.DEEPL, ProviderConfig.of("http://other", null));

        assertThat(first).isInstanceOf(DeepLTranslationProvider.class);
        assertThat(second).isSameAs(first);
    }

    @Test
    void forceRefreshRebuildsProvider() {
        TranslationProvider first = registry.createProvider(EngineType.OPENAI, ProviderConfig.defaults());
        TranslationProvider refreshed = registry.createProvider(EngineType.OPENAI,
                ProviderConfig.of(null, "gpt-other"), true);

        assertThat(refreshed).isNotSameAs(first);
        assertThat(((ChatCompletionTranslationProvider) refreshed).model()).isEqualTo("gpt-other");
        assertThat(registry.provider(EngineType.OPENAI)).containsSame(refreshed);
    }

    @Test
    void concurrentCreationYieldsOneInstance() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<TranslationProvider>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    return registry.createProvider(EngineType.GOOGLE, ProviderConfig.defaults());
                }));
            }
            go.countDown();
            TranslationProvider first = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<TranslationProvider> f : futures) {
                assertThat(f.get(5, TimeUnit.SECONDS)).isSameAs(first);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void registerReplacesAndUnregisterRemoves() {
        FakeTranslationProvider fake = new FakeTranslationProvider("claude");

        registry.register(fake, EngineType.CLAUDE);
        assertThat(registry.provider(EngineType.CLAUDE)).containsSame(fake);
        assertThat(registry.createProvider(EngineType.CLAUDE, ProviderConfig.defaults())).isSameAs(fake);

        assertThat(registry.unregister(EngineType.CLAUDE)).isTrue();
        assertThat(registry.unregister(EngineType.CLAUDE)).isFalse();
        assertThat(registry.provider(EngineType.CLAUDE)).isEmpty();
    }

    @Test
    void availableEnginesSkipsUnavailableAndFailingProbes() {
        FakeTranslationProvider down = new FakeTranslationProvider("self-hosted");
        down.available = false;
        registry.register(down, EngineType.SELF_HOSTED);
        registry.register(new FakeTranslationProvider("openai"), EngineType.OPENAI);
        registry.register(new FakeTranslationProvider("deepl") {
            @Override
            public boolean isAvailable() {
                throw new IllegalStateException("availability check exploded");
            }
        }, EngineType.DEEPL);

        assertThat(registry.availableEngines()).containsExactly(EngineType.LOCAL, EngineType.OPENAI);
        assertThat(registry.isEngineAvailable(EngineType.SELF_HOSTED)).isFalse();
        assertThat(registry.isEngineAvailable(EngineType.GOOGLE)).isFalse();
    }

    @Test
    void configuredCheckUsesCredentialStoreOnly() {
        assertThat(registry.isEngineConfigured(EngineType.LOCAL)).isTrue();
        assertThat(registry.isEngineConfigured(EngineType.OLLAMA)).isTrue();
        assertThat(registry.isEngineConfigured(EngineType.DEEPL)).isFalse();

        credentials.putKey("deepl", "k");
        credentials.putKey("baidu", "k");
        assertThat(registry.isEngineConfigured(EngineType.DEEPL)).isTrue();
        assertThat(registry.isEngineConfigured(EngineType.BAIDU)).isFalse();

        credentials.put("baidu", new StoredCredentials("k", "app"));
        assertThat(registry.isEngineConfigured(EngineType.BAIDU)).isTrue();
        assertThat(registry.registeredEngines()).doesNotContain(EngineType.DEEPL, EngineType.BAIDU);
    }

    @Test
    void compatibleProvidersAreCachedByCompositeId() {
        CompatibleEndpoint studio = new CompatibleEndpoint("LM Studio", "http://localhost:1234/v1", "qwen", false);

        CompatibleTranslationProvider first = registry.createCompatibleProvider(studio, 0, false);
        CompatibleTranslationProvider again = registry.createCompatibleProvider(studio, 0, false);
        CompatibleTranslationProvider other = registry.createCompatibleProvider(studio, 1, false);

        assertThat(first.id()).isEqualTo("custom:0");
        assertThat(again).isSameAs(first);
        assertThat(other).isNotSameAs(first);
        assertThat(registry.compatibleProviderIds()).containsExactly("custom:0", "custom:1");
        assertThat(registry.compatibleProvider("custom:1")).containsSame(other);

        assertThat(registry.removeCompatibleProvider("custom:0")).isTrue();
        assertThat(registry.compatibleProvider("custom:0")).isEmpty();
        registry.clearCompatibleProviders();
        assertThat(registry.compatibleProviderIds()).isEmpty();
    }
}
