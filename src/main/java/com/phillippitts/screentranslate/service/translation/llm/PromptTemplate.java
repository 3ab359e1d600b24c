package com.phillippitts.screentranslate.service.translation.llm;

import java.util.Locale;

/**
 * Builds translation prompts for generative backends.
 *
 * <p>Templates use the placeholders {@code {source_language}}, {@code {target_language}} and
 * {@code {text}}. Language codes are rendered as English display names so models see
 * "Chinese (Simplified)" rather than {@code zh-Hans}.
 */
public final class PromptTemplate {

    public static final String SOURCE_PLACEHOLDER = "{source_language}";
    public static final String TARGET_PLACEHOLDER = "{target_language}";
    public static final String TEXT_PLACEHOLDER = "{text}";

    public static final String DEFAULT_TEMPLATE = """
            Translate the following text from {source_language} to {target_language}.
            Provide ONLY the translated text without any explanations, notes, or formatting.

            Text to translate:
            {text}""";

    static final String BATCH_INSTRUCTION = """
            The text contains %d segments separated by lines that contain only ---.
            Translate each segment separately and keep every --- separator line exactly as it is.""";

    private PromptTemplate() {
        // Utility class - prevent instantiation
    }

    /**
     * @param template template text, or {@code null} for {@link #DEFAULT_TEMPLATE}
     * @param from source language code, or {@code null} for auto-detect
     * @param to target language code
     * @param text text to embed
     */
    public static String render(String template, String from, String to, String text) {
        String t = (template == null || template.isBlank()) ? DEFAULT_TEMPLATE : template;
        return t.replace(SOURCE_PLACEHOLDER, languageName(from))
                .replace(TARGET_PLACEHOLDER, languageName(to))
                .replace(TEXT_PLACEHOLDER, text);
    }

    /**
     * Renders a prompt for {@code segmentCount} delimiter-joined segments. The batch instruction
     * is only added to the built-in template; custom templates are used as written.
     */
    public static String renderBatch(String template, String from, String to, String joinedText, int segmentCount) {
        if (template != null && !template.isBlank()) {
            return render(template, from, to, joinedText);
        }
        String withInstruction = DEFAULT_TEMPLATE.replace("\n\nText to translate:",
                "\n" + String.format(BATCH_INSTRUCTION, segmentCount) + "\n\nText to translate:");
        return render(withInstruction, from, to, joinedText);
    }

    static String languageName(String code) {
        if (code == null || code.isBlank() || "auto".equalsIgnoreCase(code)) {
            return "auto-detect";
        }
        Locale locale = Locale.forLanguageTag(code.replace('_', '-'));
        String name = locale.getDisplayName(Locale.ENGLISH);
        return name.isBlank() ? code : name;
    }
}
