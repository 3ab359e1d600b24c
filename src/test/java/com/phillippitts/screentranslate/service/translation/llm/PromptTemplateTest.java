package com.phillippitts.screentranslate.service.translation.llm;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PromptTemplateTest {

    @Test
    void defaultTemplateNamesLanguagesAndEmbedsText() {
        String prompt = PromptTemplate.render(null, "en", "ja", "Good morning");

        assertThat(prompt)
                .contains("from English to Japanese")
                .endsWith("Good morning");
    }

    @Test
    void missingSourceRendersAsAutoDetect() {
        assertThat(PromptTemplate.render(null, null, "ja", "x")).contains("from auto-detect to Japanese");
    }

    @Test
    void customTemplateIsUsedAsWritten() {
        String template = "{source_language}>{target_language}: {text}";

        assertThat(PromptTemplate.render(template, "en", "fr", "Hi")).isEqualTo("English>French: Hi");
        assertThat(PromptTemplate.renderBatch(template, "en", "fr", "a\n---\nb", 2)).isEqualTo("English>French: a\n---\nb");
    }

    @Test
    void batchPromptStatesSegmentCount() {
        String prompt = PromptTemplate.renderBatch(null, "en", "fr", "a\n---\nb", 2);

        assertThat(prompt).contains("2 segments").endsWith("a\n---\nb");
    }
}
