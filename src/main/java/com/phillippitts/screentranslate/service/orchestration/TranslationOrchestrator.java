package com.phillippitts.screentranslate.service.orchestration;

import com.phillippitts.screentranslate.config.properties.TranslationProperties;
import com.phillippitts.screentranslate.domain.BilingualSegment;
import com.phillippitts.screentranslate.domain.TextSegment;
import com.phillippitts.screentranslate.domain.TranslationResult;
import com.phillippitts.screentranslate.exception.TranslationProviderException;
import com.phillippitts.screentranslate.service.orchestration.event.ProviderFallbackEvent;
import com.phillippitts.screentranslate.service.translation.EngineType;
import com.phillippitts.screentranslate.service.translation.ProviderRegistry;
import com.phillippitts.screentranslate.service.translation.TranslationProvider;
import com.phillippitts.screentranslate.service.translation.llm.CompatibleEndpoint;
import com.phillippitts.screentranslate.service.translation.llm.CompatibleTranslationProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Translates extracted segments through the {@link ProviderRegistry}.
 *
 * <p><b>Algorithm (primary with fallback):</b>
 * <ol>
 *   <li>Resolve the preferred provider (created on first use)</li>
 *   <li>Issue one batch call for all segment texts; an unavailable provider fails with
 *       {@code NOT_AVAILABLE} without being called</li>
 *   <li>If it throws and a fallback engine is configured, publish a {@link ProviderFallbackEvent}
 *       and issue the batch once against the fallback</li>
 *   <li>Zip the segments with the results positionally</li>
 * </ol>
 *
 * <p>{@link #translateForScene} applies the configured {@link EngineSelectionMode}: parallel mode
 * runs every configured engine on the translation executor and reports each engine's outcome in
 * a {@link TranslationResultBundle}; quick-switch mode never falls back; scene-binding mode takes
 * engines and prompt from the scene's {@link SceneEngineBinding}.
 *
 * <p>A result count that differs from the segment count is a provider defect and fails the call;
 * segments are never zipped partially. The same provider is never retried. Providers belong to
 * the registry; this class only references them, except for prompt-specific copies it builds
 * for scene bindings.
 *
 * <p>Engine ids are {@link EngineType} ids or {@code custom:<index>} for a configured
 * OpenAI-compatible endpoint.
 */
public class TranslationOrchestrator {

    private static final Logger LOG = LogManager.getLogger(TranslationOrchestrator.class);

    private final ProviderRegistry registry;
    private final TranslationProperties properties;
    private final ApplicationEventPublisher publisher;
    private final TranslationMetricsPublisher metrics;
    private final Executor parallelExecutor;
    private final Map<String, TranslationProvider> promptProviders = new ConcurrentHashMap<>();

    /**
     * Creates an orchestrator that runs parallel engines on the calling thread.
     */
    public TranslationOrchestrator(ProviderRegistry registry, TranslationProperties properties,
                                   ApplicationEventPublisher publisher, TranslationMetricsPublisher metrics) {
        this(registry, properties, publisher, metrics, Runnable::run);
    }

    public TranslationOrchestrator(ProviderRegistry registry, TranslationProperties properties,
                                   ApplicationEventPublisher publisher, TranslationMetricsPublisher metrics,
                                   Executor parallelExecutor) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = metrics != null ? metrics : TranslationMetricsPublisher.NOOP;
        this.parallelExecutor = Objects.requireNonNull(parallelExecutor, "parallelExecutor must not be null");
    }

    /**
     * Translates segments using the configured fallback engine, if any.
     *
     * @param segments segments to translate, in display order
     * @param to target language
     * @param preferredEngine id of the engine to try first
     * @param from source language, or {@code null} to auto-detect
     * @return one bilingual segment per input, same order
     * @throws TranslationProviderException if the preferred engine (and fallback, when configured) fail
     * @throws IllegalArgumentException if an engine id is unknown
     */
    public List<BilingualSegment> translate(List<TextSegment> segments, String to,
                                            String preferredEngine, String from) {
        return translate(segments, to, preferredEngine, from, properties.fallbackEngineId().orElse(null));
    }

    /**
     * @param fallbackEngine id of the engine to try once if the preferred engine fails; {@code null} for none
     */
    public List<BilingualSegment> translate(List<TextSegment> segments, String to, String preferredEngine,
                                            String from, String fallbackEngine) {
        Objects.requireNonNull(segments, "segments must not be null");
        Objects.requireNonNull(preferredEngine, "preferredEngine must not be null");
        if (segments.isEmpty()) {
            return List.of();
        }
        Plan plan = new Plan(preferredEngine, fallbackEngine, null);
        Attempt attempt = translateWithFallback(plan, texts(segments), from, to);
        return zip(segments, attempt.results(), to);
    }

    /**
     * Translates segments for a scene using the configured {@link EngineSelectionMode}.
     *
     * <p>Only parallel mode reports failed engines inside the bundle; the other modes throw when
     * no engine succeeds.
     *
     * @param scene where the request comes from
     * @param engineOverride engine chosen by the caller, or {@code null} to use the configuration.
     *        In parallel mode it runs first and becomes the primary engine.
     * @throws TranslationProviderException if a non-parallel request fails on every engine tried
     */
    public TranslationResultBundle translateForScene(List<TextSegment> segments, String to, String from,
                                                     TranslationScene scene, String engineOverride) {
        Objects.requireNonNull(segments, "segments must not be null");
        Objects.requireNonNull(scene, "scene must not be null");
        EngineSelectionMode mode = properties.getSelectionMode();
        if (mode == EngineSelectionMode.PARALLEL) {
            return translateParallel(segments, to, from, scene, engineOverride);
        }
        Plan plan = planFor(scene, engineOverride, mode);
        if (segments.isEmpty()) {
            return new TranslationResultBundle(List.of(), plan.primary(), mode, scene, Instant.now());
        }
        long start = System.nanoTime();
        Attempt attempt = translateWithFallback(plan, texts(segments), from, to);
        EngineResult result = EngineResult.success(attempt.engineId(), zip(segments, attempt.results(), to),
                Duration.ofNanos(System.nanoTime() - start));
        return new TranslationResultBundle(List.of(result), attempt.engineId(), mode, scene, Instant.now());
    }

    /**
     * Translates free text, e.g. a text selection, in the {@link TranslationScene#TEXT_SELECTION}
     * scene. Parallel mode does not apply; the request uses the preferred engine and fallback.
     *
     * @param engineId engine to use, or {@code null} for the configured one
     */
    public TranslationResult translateText(String text, String to, String engineId, String from) {
        EngineSelectionMode mode = properties.getSelectionMode() == EngineSelectionMode.PARALLEL
                ? EngineSelectionMode.PRIMARY_WITH_FALLBACK
                : properties.getSelectionMode();
        Plan plan = planFor(TranslationScene.TEXT_SELECTION, engineId, mode);
        return translateWithFallback(plan, List.of(text), from, to).results().get(0);
    }

    /**
     * Looks up a provider by id, creating it on first use.
     *
     * @throws IllegalArgumentException for unknown ids or unconfigured custom endpoints
     */
    public TranslationProvider resolve(String engineId) {
        Objects.requireNonNull(engineId, "engineId must not be null");
        String id = engineId.trim();
        if (CompatibleEndpoint.isCompositeId(id)) {
            return registry.compatibleProvider(id).orElseGet(() -> createCompatible(id));
        }
        EngineType type = EngineType.fromId(id);
        return registry.provider(type).orElseGet(() -> registry.createProvider(type, properties.configFor(type)));
    }

    private CompatibleTranslationProvider createCompatible(String compositeId) {
        List<CompatibleEndpoint> endpoints = properties.compatibleEndpoints();
        int index = CompatibleEndpoint.indexOf(compositeId);
        if (index < 0 || index >= endpoints.size()) {
            throw new IllegalArgumentException("No compatible endpoint configured for " + compositeId);
        }
        return registry.createCompatibleProvider(endpoints.get(index), index, false);
    }

    private Plan planFor(TranslationScene scene, String engineOverride, EngineSelectionMode mode) {
        String override = (engineOverride == null || engineOverride.isBlank()) ? null : engineOverride.trim();
        String preferred = override != null ? override : properties.preferredEngineId();
        return switch (mode) {
            case QUICK_SWITCH -> new Plan(preferred, null, null);
            case SCENE_BINDING -> {
                SceneEngineBinding binding = properties.bindingFor(scene);
                String primary = override != null ? override : binding.primaryEngine();
                yield new Plan(primary, binding.effectiveFallback().orElse(null), binding.promptTemplate());
            }
            default -> new Plan(preferred, properties.fallbackEngineId().orElse(null), null);
        };
    }

    /**
     * Resolves a provider for an engine, using a prompt-specific copy when a scene prompt applies
     * to a built-in prompt-driven engine.
     */
    private TranslationProvider providerFor(String engineId, String promptTemplate) {
        if (promptTemplate == null || CompatibleEndpoint.isCompositeId(engineId.trim())) {
            return resolve(engineId);
        }
        EngineType type = EngineType.fromId(engineId);
        if (!type.isPromptDriven()) {
            return resolve(engineId);
        }
        return promptProviders.computeIfAbsent(type.id() + '\n' + promptTemplate, key -> {
            LOG.debug("Creating {} provider with a scene prompt", type.id());
            return registry.createDetachedProvider(type, properties.configFor(type).withPromptTemplate(promptTemplate));
        });
    }

    private Attempt translateWithFallback(Plan plan, List<String> texts, String from, String to) {
        TranslationProvider preferred = providerFor(plan.primary(), plan.prompt());
        TranslationProvider fallback = plan.fallback() == null ? null : providerFor(plan.fallback(), plan.prompt());
        if (fallback != null && fallback.id().equals(preferred.id())) {
            fallback = null;
        }
        try {
            return new Attempt(preferred.id(), translateBatch(preferred, texts, from, to));
        } catch (TranslationProviderException e) {
            if (fallback == null) {
                throw e;
            }
            LOG.info("Engine {} failed ({}); falling back to {}", preferred.id(), e.getKind(), fallback.id());
            publisher.publishEvent(new ProviderFallbackEvent(preferred.id(), fallback.id(),
                    e.getKind().name(), Instant.now()));
            metrics.recordFallback(preferred.id(), fallback.id());
            try {
                return new Attempt(fallback.id(), translateBatch(fallback, texts, from, to));
            } catch (TranslationProviderException fallbackError) {
                fallbackError.addSuppressed(e);
                throw fallbackError;
            }
        }
    }

    private TranslationResultBundle translateParallel(List<TextSegment> segments, String to, String from,
                                                      TranslationScene scene, String engineOverride) {
        List<String> engines = new ArrayList<>(properties.parallelEngineIds());
        if (engineOverride != null && !engineOverride.isBlank()) {
            String override = engineOverride.trim();
            engines.removeIf(override::equalsIgnoreCase);
            engines.add(0, override);
        }
        String primary = engines.get(0);
        if (segments.isEmpty()) {
            return new TranslationResultBundle(List.of(), primary, EngineSelectionMode.PARALLEL, scene, Instant.now());
        }
        List<String> texts = texts(segments);
        List<CompletableFuture<EngineResult>> futures = engines.stream()
                .map(engineId -> CompletableFuture.supplyAsync(
                        () -> runEngine(engineId, segments, texts, from, to), parallelExecutor))
                .toList();

        long timeoutMs = TimeUnit.SECONDS.toMillis(properties.getParallelTimeoutSeconds());
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Parallel translation timed out after {} ms", timeoutMs);
            futures.forEach(f -> f.cancel(true));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
        } catch (ExecutionException e) {
            LOG.debug("Parallel engine task failed outside its own error handling", e.getCause());
        }

        List<EngineResult> results = new ArrayList<>(engines.size());
        for (int i = 0; i < engines.size(); i++) {
            results.add(collect(futures.get(i), engines.get(i), timeoutMs));
        }
        TranslationResultBundle bundle = new TranslationResultBundle(results, primary,
                EngineSelectionMode.PARALLEL, scene, Instant.now());
        LOG.info("Parallel translation: {} succeeded, {} failed", bundle.successfulEngines(), bundle.failedEngines());
        return bundle;
    }

    private EngineResult runEngine(String engineId, List<TextSegment> segments, List<String> texts,
                                   String from, String to) {
        long start = System.nanoTime();
        try {
            TranslationProvider provider = resolve(engineId);
            List<BilingualSegment> bilingual = zip(segments, translateBatch(provider, texts, from, to), to);
            return EngineResult.success(provider.id(), bilingual, Duration.ofNanos(System.nanoTime() - start));
        } catch (TranslationProviderException e) {
            return EngineResult.failure(engineId, e, Duration.ofNanos(System.nanoTime() - start));
        } catch (IllegalArgumentException e) {
            return EngineResult.failure(engineId,
                    TranslationProviderException.invalidConfiguration(engineId, e.getMessage()),
                    Duration.ofNanos(System.nanoTime() - start));
        } catch (RuntimeException e) {
            LOG.error("Engine {} failed unexpectedly", engineId, e);
            return EngineResult.failure(engineId,
                    TranslationProviderException.translationFailed(engineId, String.valueOf(e.getMessage()), e),
                    Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private static EngineResult collect(CompletableFuture<EngineResult> future, String engineId, long timeoutMs) {
        if (future.isDone() && !future.isCompletedExceptionally() && !future.isCancelled()) {
            return future.join();
        }
        return EngineResult.failure(engineId,
                TranslationProviderException.translationFailed(engineId, "timed out after " + timeoutMs + " ms"),
                Duration.ofMillis(timeoutMs));
    }

    private List<TranslationResult> translateBatch(TranslationProvider provider, List<String> texts,
                                                   String from, String to) {
        long start = System.nanoTime();
        try {
            if (!isAvailableSafely(provider)) {
                throw TranslationProviderException.notAvailable(provider.id());
            }
            List<TranslationResult> results = provider.translate(texts, from, to);
            metrics.recordSuccess(provider.id(), System.nanoTime() - start);
            LOG.debug("Engine {} translated {} segments", provider.id(), texts.size());
            return results;
        } catch (TranslationProviderException e) {
            metrics.recordFailure(provider.id(), e.getKind());
            LOG.warn("Engine {} failed: {}", provider.id(), e.getMessage());
            throw e;
        }
    }

    private static boolean isAvailableSafely(TranslationProvider provider) {
        try {
            return provider.isAvailable();
        } catch (RuntimeException e) {
            LOG.warn("Availability check failed for {}: {}", provider.id(), e.toString());
            return false;
        }
    }

    private static List<String> texts(List<TextSegment> segments) {
        return segments.stream().map(TextSegment::text).toList();
    }

    private static List<BilingualSegment> zip(List<TextSegment> segments, List<TranslationResult> results, String to) {
        if (results.size() != segments.size()) {
            throw TranslationProviderException.translationFailed("orchestrator", "provider returned "
                    + results.size() + " results for " + segments.size() + " segments");
        }
        List<BilingualSegment> bilingual = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            TranslationResult result = results.get(i);
            bilingual.add(new BilingualSegment(segments.get(i), result.translatedText(),
                    result.sourceLanguage(), result.targetLanguage() != null ? result.targetLanguage() : to));
        }
        return bilingual;
    }

    private record Plan(String primary, String fallback, String prompt) {}

    private record Attempt(String engineId, List<TranslationResult> results) {}
}
