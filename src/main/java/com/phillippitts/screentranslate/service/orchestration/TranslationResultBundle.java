package com.phillippitts.screentranslate.service.orchestration;

import com.phillippitts.screentranslate.exception.TranslationProviderException;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Results of one request across the engines that handled it.
 *
 * <p>Primary-with-fallback, quick-switch and scene-binding requests carry a single result from
 * the engine that succeeded. Parallel requests carry one result per engine, successful or not,
 * in the configured engine order.
 *
 * @param results per-engine results
 * @param primaryEngine engine whose result is shown by default
 * @param mode selection mode that produced the bundle
 * @param scene scene of the request
 * @param timestamp when the bundle was assembled
 */
public record TranslationResultBundle(List<EngineResult> results, String primaryEngine,
                                      EngineSelectionMode mode, TranslationScene scene, Instant timestamp) {

    public TranslationResultBundle {
        results = List.copyOf(Objects.requireNonNull(results, "results"));
        Objects.requireNonNull(primaryEngine, "primaryEngine");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public Optional<EngineResult> result(String engineId) {
        return results.stream().filter(r -> r.engineId().equals(engineId)).findFirst();
    }

    /**
     * @return the primary engine's result if it succeeded
     */
    public Optional<EngineResult> primaryResult() {
        return result(primaryEngine).filter(EngineResult::isSuccess);
    }

    /**
     * @return the primary result, or else the first successful one
     */
    public Optional<EngineResult> bestResult() {
        return primaryResult().or(() -> results.stream().filter(EngineResult::isSuccess).findFirst());
    }

    public List<String> successfulEngines() {
        return results.stream().filter(EngineResult::isSuccess).map(EngineResult::engineId).toList();
    }

    public List<String> failedEngines() {
        return results.stream().filter(r -> !r.isSuccess()).map(EngineResult::engineId).toList();
    }

    public boolean hasErrors() {
        return results.stream().anyMatch(r -> !r.isSuccess());
    }

    public boolean allFailed() {
        return !results.isEmpty() && results.stream().noneMatch(EngineResult::isSuccess);
    }

    /**
     * @return the primary engine's error, or else the first error; empty if nothing failed
     */
    public Optional<TranslationProviderException> firstError() {
        return result(primaryEngine).map(EngineResult::error)
                .or(() -> results.stream().map(EngineResult::error).filter(Objects::nonNull).findFirst());
    }
}
