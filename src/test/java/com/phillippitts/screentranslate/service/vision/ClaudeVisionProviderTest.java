package com.phillippitts.screentranslate.service.vision;

import com.phillippitts.screentranslate.config.properties.VisionProperties;
import com.phillippitts.screentranslate.exception.AnalysisException;
import com.phillippitts.screentranslate.testutil.InMemoryCredentialStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ClaudeVisionProviderTest {

    private MockRestServiceServer server;
    private ClaudeVisionProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        VisionProperties properties = new VisionProperties(VisionProviderType.CLAUDE,
                "https://claude.test", null, 60, 1024, 0, 0.85f, 0.0);
        provider = new ClaudeVisionProvider(restTemplate, properties,
                new InMemoryCredentialStore().putKey("claude", "ak-test"));
    }

    @Test
    void concatenatesTextBlocks() {
        server.expect(requestTo("https://claude.test/v1/messages"))
                .andExpect(header("x-api-key", "ak-test"))
                .andExpect(header("anthropic-version", ClaudeVisionProvider.API_VERSION))
                .andRespond(withSuccess("{\"content\":[{\"type\":\"text\",\"text\":\"{\\\"segments\\\"\"},"
                        + "{\"type\":\"text\",\"text\":\":[]}\"}]}", MediaType.APPLICATION_JSON));

        assertThat(provider.extractText("QUJD", "system", "user")).isEqualTo("{\"segments\":[]}");
        server.verify();
    }

    @Test
    void rateLimitCarriesRetryHint() {
        org.springframework.http.HttpHeaders headers = new org.springframework.http.HttpHeaders();
        headers.set("Retry-After", "30");
        server.expect(requestTo("https://claude.test/v1/messages"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).headers(headers));

        assertThatThrownBy(() -> provider.extractText("QUJD", "system", "user"))
                .isInstanceOfSatisfying(AnalysisException.class,
                        e -> assertThat(e.getKind()).isEqualTo(AnalysisException.Kind.RATE_LIMITED))
                .hasMessageContaining("retry after 30 seconds");
    }

    @Test
    void replyWithoutTextIsInvalid() {
        server.expect(requestTo("https://claude.test/v1/messages"))
                .andRespond(withSuccess("{\"content\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.extractText("QUJD", "system", "user"))
                .isInstanceOfSatisfying(AnalysisException.class,
                        e -> assertThat(e.getKind()).isEqualTo(AnalysisException.Kind.INVALID_RESPONSE));
    }
}
