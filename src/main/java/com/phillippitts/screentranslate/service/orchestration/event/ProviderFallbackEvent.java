package com.phillippitts.screentranslate.service.orchestration.event;

import java.time.Instant;

/**
 * Published when the preferred translation engine failed and the fallback engine was tried.
 *
 * @param fromEngine engine that failed
 * @param toEngine fallback engine
 * @param reason failure kind of the preferred engine
 * @param at when the fallback started
 */
public record ProviderFallbackEvent(String fromEngine, String toEngine, String reason, Instant at) {}
