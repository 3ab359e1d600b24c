package com.phillippitts.screentranslate.service.orchestration;

import java.util.Arrays;

/**
 * Where a translation request comes from. Scenes can be bound to their own engines and prompt
 * under {@code translation.scenes.<id>}.
 */
public enum TranslationScene {
    SCREENSHOT("screenshot"),
    TEXT_SELECTION("text-selection"),
    TRANSLATE_AND_INSERT("translate-and-insert");

    private final String id;

    TranslationScene(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * @throws IllegalArgumentException if no scene matches
     */
    public static TranslationScene fromId(String value) {
        return Arrays.stream(values())
                .filter(s -> s.id.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown translation scene: " + value));
    }
}
