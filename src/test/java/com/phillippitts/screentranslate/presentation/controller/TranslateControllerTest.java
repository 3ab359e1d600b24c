package com.phillippitts.screentranslate.presentation.controller;

import com.phillippitts.screentranslate.config.properties.TranslationProperties;
import com.phillippitts.screentranslate.domain.TranslationResult;
import com.phillippitts.screentranslate.exception.TranslationProviderException;
import com.phillippitts.screentranslate.service.orchestration.TranslationOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = TranslateController.class)
@Import(TranslationProperties.class)
class TranslateControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private TranslationOrchestrator orchestrator;

    @Test
    void translatesWithConfiguredEngineAndTargetByDefault() throws Exception {
        when(orchestrator.translateText("Hello", "zh-Hans", null, null))
                .thenReturn(new TranslationResult("Hello", "你好", "en", "zh-Hans"));

        mvc.perform(post("/api/translate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Hello\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sourceText").value("Hello"))
                .andExpect(jsonPath("$.translatedText").value("你好"))
                .andExpect(jsonPath("$.targetLanguage").value("zh-Hans"));
    }

    @Test
    void passesExplicitEngineAndLanguagesThrough() throws Exception {
        when(orchestrator.translateText("Hello", "ja", "custom:1", "en"))
                .thenReturn(new TranslationResult("Hello", "こんにちは", "en", "ja"));

        mvc.perform(post("/api/translate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Hello\",\"target\":\"ja\",\"source\":\"en\",\"engine\":\"custom:1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.translatedText").value("こんにちは"));

        verify(orchestrator).translateText("Hello", "ja", "custom:1", "en");
    }

    @Test
    void blankEngineFallsBackToConfiguredSelection() throws Exception {
        when(orchestrator.translateText(eq("Hello"), eq("zh-Hans"), isNull(), isNull()))
                .thenReturn(new TranslationResult("Hello", "你好", null, "zh-Hans"));

        mvc.perform(post("/api/translate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Hello\",\"engine\":\"  \"}"))
                .andExpect(status().isOk());

        verify(orchestrator).translateText(eq("Hello"), eq("zh-Hans"), isNull(), isNull());
    }

    @Test
    void blankTextIsRejected() throws Exception {
        mvc.perform(post("/api/translate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ValidationFailed"));

        verify(orchestrator, never()).translateText(anyString(), anyString(), any(), any());
    }

    @Test
    void rateLimitedEngineMapsTo429WithRetryAfter() throws Exception {
        when(orchestrator.translateText(eq("Hello"), anyString(), any(), any()))
                .thenThrow(TranslationProviderException.rateLimited("deepl", Duration.ofSeconds(30)));

        mvc.perform(post("/api/translate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Hello\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "30"))
                .andExpect(jsonPath("$.errorCode").value("RATE_LIMITED"));
    }

    @Test
    void unavailableEngineMapsTo503() throws Exception {
        when(orchestrator.translateText(eq("Hello"), anyString(), any(), any()))
                .thenThrow(TranslationProviderException.notAvailable("self-hosted"));

        mvc.perform(post("/api/translate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Hello\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("NOT_AVAILABLE"));
    }

    @Test
    void unknownEngineMapsTo400() throws Exception {
        when(orchestrator.translateText(eq("Hello"), anyString(), eq("babelfish"), any()))
                .thenThrow(new IllegalArgumentException("Unknown translation engine: babelfish"));

        mvc.perform(post("/api/translate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Hello\",\"engine\":\"babelfish\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BadRequest"));
    }
}
