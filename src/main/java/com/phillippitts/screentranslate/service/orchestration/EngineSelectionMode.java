package com.phillippitts.screentranslate.service.orchestration;

/**
 * How the {@link TranslationOrchestrator} picks engines for a request.
 */
public enum EngineSelectionMode {

    /** Preferred engine, then the fallback engine once if it fails. */
    PRIMARY_WITH_FALLBACK,

    /** Every configured engine concurrently; each engine's outcome is reported on its own. */
    PARALLEL,

    /** Preferred engine only. Callers switch engines by asking again. */
    QUICK_SWITCH,

    /** Primary engine, fallback and prompt chosen by the request's {@link TranslationScene}. */
    SCENE_BINDING
}
