package com.phillippitts.screentranslate.service.translation.selfhosted;

import com.phillippitts.screentranslate.domain.ProviderConfig;
import com.phillippitts.screentranslate.domain.TranslationResult;
import com.phillippitts.screentranslate.exception.TranslationProviderException;
import com.phillippitts.screentranslate.testutil.InMemoryCredentialStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.ConnectException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.ExpectedCount.manyTimes;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.headerDoesNotExist;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SelfHostedTranslationProviderTest {

    private static final String BASE = "http://127.0.0.1:8989";

    private MockRestServiceServer server;
    private MockRestServiceServer healthServer;
    private InMemoryCredentialStore credentials;
    private SelfHostedTranslationProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        RestTemplate healthTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        healthServer = MockRestServiceServer.bindTo(healthTemplate).ignoreExpectOrder(true).build();
        credentials = new InMemoryCredentialStore();
        provider = new SelfHostedTranslationProvider(restTemplate, healthTemplate,
                ProviderConfig.of(BASE + "/", null), credentials);
    }

    @Test
    void postsJsonAndReadsTranslation() {
        server.expect(requestTo(BASE + "/translate"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"text\":\"Hello\",\"source_lang\":\"auto\",\"target_lang\":\"zh\"}"))
                .andExpect(headerDoesNotExist("Authorization"))
                .andRespond(withSuccess("{\"translation\":\"你好\"}", MediaType.APPLICATION_JSON));

        TranslationResult result = provider.translate("Hello", null, "zh");

        assertThat(result.translatedText()).isEqualTo("你好");
        server.verify();
    }

    @Test
    void sendsSharedSecretWhenStored() {
        credentials.putKey("self-hosted", "shared-secret");
        server.expect(requestTo(BASE + "/translate"))
                .andExpect(header("Authorization", "Bearer shared-secret"))
                .andRespond(withSuccess("{\"translation\":\"Bonjour\"}", MediaType.APPLICATION_JSON));

        assertThat(provider.translate("Hello", "en", "fr").translatedText()).isEqualTo("Bonjour");
    }

    @Test
    void batchIsTranslatedItemByItem() {
        server.expect(requestTo(BASE + "/translate"))
                .andRespond(withSuccess("{\"translation\":\"一\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/translate"))
                .andRespond(withSuccess("{\"translation\":\"二\"}", MediaType.APPLICATION_JSON));

        List<TranslationResult> results = provider.translate(List.of("one", "two"), "en", "zh");

        assertThat(results).extracting(TranslationResult::translatedText).containsExactly("一", "二");
        server.verify();
    }

    @Test
    void refusedConnectionIsConnectionFailure() {
        server.expect(requestTo(BASE + "/translate"))
                .andRespond(withException(new ConnectException("Connection refused")));

        assertThatThrownBy(() -> provider.translate("Hello", "en", "zh"))
                .isInstanceOfSatisfying(TranslationProviderException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(TranslationProviderException.Kind.CONNECTION_FAILED);
                    assertThat(e.getRecoverySuggestion()).contains("server is running");
                });
    }

    @Test
    void responseWithoutTranslationFieldFails() {
        server.expect(requestTo(BASE + "/translate"))
                .andRespond(withSuccess("{\"result\":\"x\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.translate("Hello", "en", "zh"))
                .isInstanceOf(TranslationProviderException.class)
                .hasMessageContaining("translation");
    }

    @Test
    void anyHttpResponseCountsAsReachable() {
        healthServer.expect(requestTo(BASE + "/health")).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(provider.isAvailable()).isTrue();
    }

    @Test
    void unreachableServerIsUnavailable() {
        healthServer.expect(manyTimes(), requestTo(org.hamcrest.Matchers.startsWith(BASE)))
                .andRespond(withException(new IOException("Connection refused")));

        assertThat(provider.isAvailable()).isFalse();
    }

    @Test
    void localhostIsPinnedToLoopback() {
        assertThat(SelfHostedTranslationProvider.baseUrlFor("localhost", 8989)).isEqualTo("http://127.0.0.1:8989");
        assertThat(SelfHostedTranslationProvider.baseUrlFor("10.0.0.5", 9000)).isEqualTo("http://10.0.0.5:9000");
    }
}
