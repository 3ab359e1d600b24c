package com.phillippitts.screentranslate;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Tag("integration")
@AutoConfigureMockMvc
@SpringBootTest(
    properties = {
        "translation.target-language=zh-Hans",
        "translation.self-hosted.port=1" // nothing listens there
    }
)
class ScreenTranslateApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void contextLoads() {
    }

    @Test
    void shippedDefaultsFallBackToLocalWhenSelfHostedServerIsDown() throws Exception {
        mockMvc.perform(post("/api/translate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Hello\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.translatedText").value("你好"))
                .andExpect(jsonPath("$.targetLanguage").value("zh-Hans"));
    }

    @Test
    void explicitLocalEngineSkipsFallback() throws Exception {
        mockMvc.perform(post("/api/translate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Settings\",\"engine\":\"local\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.translatedText").value("设置"));
    }

    @Test
    void rejectsBlankText() throws Exception {
        mockMvc.perform(post("/api/translate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ValidationFailed"));
    }

    @Test
    void rejectsUnknownEngine() throws Exception {
        mockMvc.perform(post("/api/translate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Hello\",\"engine\":\"babelfish\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BadRequest"));
    }

    @Test
    void listsEnginesWithEagerLocalProviders() throws Exception {
        mockMvc.perform(get("/api/engines"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.id == 'local')].registered").value(hasItem(true)))
                .andExpect(jsonPath("$[?(@.id == 'self-hosted')].registered").value(hasItem(true)))
                .andExpect(jsonPath("$[?(@.id == 'deepl')].registered").value(hasItem(false)));
    }

    @Test
    void idleFlowReportsIdlePhase() throws Exception {
        mockMvc.perform(get("/api/flows/current"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.phase").value("idle"))
                .andExpect(jsonPath("$.progress").value(0.0));
    }
}
