package com.phillippitts.screentranslate.service.translation.cloud;

import com.phillippitts.screentranslate.domain.ProviderConfig;
import com.phillippitts.screentranslate.domain.TranslationResult;
import com.phillippitts.screentranslate.exception.TranslationProviderException;
import com.phillippitts.screentranslate.testutil.InMemoryCredentialStore;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GoogleTranslationProviderTest {

    private static final String ENDPOINT = "https://google.test/language/translate/v2";

    private final RestTemplate restTemplate = new RestTemplate();
    private final MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
    private final GoogleTranslationProvider provider = new GoogleTranslationProvider(restTemplate,
            ProviderConfig.of(ENDPOINT, null), new InMemoryCredentialStore().putKey("google", "g-key"));

    @Test
    void sendsKeyAsQueryParameterAndBatchAsQ() {
        server.expect(requestTo(ENDPOINT + "?key=g-key"))
                .andExpect(queryParam("key", "g-key"))
                .andExpect(content().json("{\"q\":[\"Hello\",\"World\"],\"target\":\"zh-CN\",\"format\":\"text\"}"))
                .andRespond(withSuccess("{\"data\":{\"translations\":["
                        + "{\"translatedText\":\"你好\",\"detectedSourceLanguage\":\"en\"},"
                        + "{\"translatedText\":\"世界\",\"detectedSourceLanguage\":\"en\"}]}}",
                        MediaType.APPLICATION_JSON));

        List<TranslationResult> results = provider.translate(List.of("Hello", "World"), "auto", "zh-Hans");

        assertThat(results).extracting(TranslationResult::translatedText).containsExactly("你好", "世界");
        server.verify();
    }

    @Test
    void countMismatchFailsTheBatch() {
        server.expect(requestTo(ENDPOINT + "?key=g-key"))
                .andRespond(withSuccess("{\"data\":{\"translations\":[{\"translatedText\":\"你好\"}]}}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.translate(List.of("Hello", "World", "Test"), "en", "zh"))
                .isInstanceOf(TranslationProviderException.class)
                .hasMessageContaining("expected 3 translations but got 1");
    }

    @Test
    void forbiddenIsInvalidConfiguration() {
        server.expect(requestTo(ENDPOINT + "?key=g-key")).andRespond(withStatus(HttpStatus.FORBIDDEN));

        assertThatThrownBy(() -> provider.translate("Hello", "en", "zh"))
                .isInstanceOfSatisfying(TranslationProviderException.class,
                        e -> assertThat(e.getKind()).isEqualTo(TranslationProviderException.Kind.INVALID_CONFIGURATION));
    }

    @Test
    void serverErrorIsTranslationFailure() {
        server.expect(requestTo(ENDPOINT + "?key=g-key")).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        assertThatThrownBy(() -> provider.translate("Hello", "en", "zh"))
                .isInstanceOfSatisfying(TranslationProviderException.class,
                        e -> assertThat(e.getKind()).isEqualTo(TranslationProviderException.Kind.TRANSLATION_FAILED))
                .hasMessageContaining("500");
    }
}
