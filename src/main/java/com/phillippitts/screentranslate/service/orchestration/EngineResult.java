package com.phillippitts.screentranslate.service.orchestration;

import com.phillippitts.screentranslate.domain.BilingualSegment;
import com.phillippitts.screentranslate.exception.TranslationProviderException;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one engine within a {@link TranslationResultBundle}. Either carries one segment
 * per input or the error that stopped the engine, never both.
 *
 * @param engineId engine that produced the result
 * @param segments translated segments in input order; empty on failure
 * @param latency time spent in the engine
 * @param error failure, or {@code null} on success
 */
public record EngineResult(String engineId, List<BilingualSegment> segments, Duration latency,
                           TranslationProviderException error) {

    public EngineResult {
        Objects.requireNonNull(engineId, "engineId");
        Objects.requireNonNull(latency, "latency");
        segments = error != null ? List.of() : List.copyOf(Objects.requireNonNull(segments, "segments"));
    }

    public static EngineResult success(String engineId, List<BilingualSegment> segments, Duration latency) {
        return new EngineResult(engineId, segments, latency, null);
    }

    public static EngineResult failure(String engineId, TranslationProviderException error, Duration latency) {
        return new EngineResult(engineId, List.of(), latency, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }
}
