package com.phillippitts.screentranslate.service.orchestration;

import java.util.Objects;
import java.util.Optional;

/**
 * Engines and prompt used for one {@link TranslationScene}.
 *
 * @param scene the bound scene
 * @param primaryEngine engine id tried first; built-in id or {@code custom:<index>}
 * @param fallbackEngine engine id tried once if the primary fails, or {@code null}
 * @param fallbackEnabled whether the fallback is used at all
 * @param promptTemplate prompt for prompt-driven engines in this scene, or {@code null} for the engine's own
 */
public record SceneEngineBinding(TranslationScene scene, String primaryEngine, String fallbackEngine,
                                 boolean fallbackEnabled, String promptTemplate) {

    public SceneEngineBinding {
        Objects.requireNonNull(scene, "scene");
        if (primaryEngine == null || primaryEngine.isBlank()) {
            throw new IllegalArgumentException("primaryEngine must not be blank");
        }
        if (promptTemplate != null && promptTemplate.isBlank()) {
            promptTemplate = null;
        }
    }

    /**
     * @return the fallback to try, empty when disabled, unset or the same as the primary
     */
    public Optional<String> effectiveFallback() {
        if (!fallbackEnabled || fallbackEngine == null || fallbackEngine.isBlank()
                || fallbackEngine.equalsIgnoreCase(primaryEngine)) {
            return Optional.empty();
        }
        return Optional.of(fallbackEngine);
    }

    public Optional<String> prompt() {
        return Optional.ofNullable(promptTemplate);
    }
}
