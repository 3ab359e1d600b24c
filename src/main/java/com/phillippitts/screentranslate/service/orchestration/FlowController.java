package com.phillippitts.screentranslate.service.orchestration;

import com.phillippitts.screentranslate.config.properties.TranslationProperties;
import com.phillippitts.screentranslate.domain.BilingualSegment;
import com.phillippitts.screentranslate.domain.FlowError;
import com.phillippitts.screentranslate.domain.FlowPhase;
import com.phillippitts.screentranslate.domain.FlowResult;
import com.phillippitts.screentranslate.domain.ScreenAnalysisResult;
import com.phillippitts.screentranslate.exception.AnalysisException;
import com.phillippitts.screentranslate.exception.FlowException;
import com.phillippitts.screentranslate.exception.TranslationProviderException;
import com.phillippitts.screentranslate.service.orchestration.event.FlowFailedEvent;
import com.phillippitts.screentranslate.service.orchestration.event.FlowPhaseChangedEvent;
import com.phillippitts.screentranslate.service.rendering.OverlayRenderer;
import com.phillippitts.screentranslate.service.rendering.OverlayStyle;
import com.phillippitts.screentranslate.service.vision.TextExtractionEngine;
import com.phillippitts.screentranslate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.awt.image.BufferedImage;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the capture-to-overlay pipeline: analyze, translate, render.
 *
 * <p>At most one flow is current. {@link #start} cancels whatever is running and the new flow
 * is in {@code ANALYZING} before the call returns. Cancellation is cooperative: the running
 * flow's token is checked at every phase boundary, and a flow that is no longer current can
 * never publish a result.
 *
 * <p>Every phase change is published as a {@link FlowPhaseChangedEvent}. User-visible failures
 * also publish a {@link FlowFailedEvent}; cancellation is silent. A flow either completes with
 * a full {@link FlowResult} or fails with no partial output.
 */
public class FlowController {

    private static final Logger LOG = LogManager.getLogger(FlowController.class);
    static final String MDC_FLOW_ID = "flowId";

    private final TextExtractionEngine extractionEngine;
    private final TranslationOrchestrator orchestrator;
    private final OverlayRenderer renderer;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final TranslationMetricsPublisher metrics;
    private final TranslationProperties translationProperties;
    private final OverlayStyle defaultStyle;
    private final FlowStateMachine stateMachine = new FlowStateMachine();
    private final AtomicReference<CompletableFuture<Void>> currentTask = new AtomicReference<>();

    public FlowController(TextExtractionEngine extractionEngine,
                          TranslationOrchestrator orchestrator,
                          OverlayRenderer renderer,
                          Executor executor,
                          ApplicationEventPublisher publisher,
                          TranslationMetricsPublisher metrics,
                          TranslationProperties translationProperties,
                          OverlayStyle defaultStyle) {
        this.extractionEngine = Objects.requireNonNull(extractionEngine, "extractionEngine must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = metrics != null ? metrics : TranslationMetricsPublisher.NOOP;
        this.translationProperties = Objects.requireNonNull(translationProperties,
                "translationProperties must not be null");
        this.defaultStyle = Objects.requireNonNull(defaultStyle, "defaultStyle must not be null");
    }

    /**
     * Starts a flow with the configured languages, engine selection and overlay style.
     */
    public UUID start(BufferedImage image) {
        return start(new FlowRequest(image,
                translationProperties.getTargetLanguage(),
                translationProperties.sourceLanguageOrNull(),
                null,
                defaultStyle));
    }

    /**
     * Starts a flow, cancelling and replacing any flow still running.
     *
     * @return id of the new flow
     */
    public UUID start(FlowRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        UUID flowId = UUID.randomUUID();
        CancellationToken token = new CancellationToken();

        Optional<UUID> superseded = stateMachine.begin(flowId, token);
        superseded.ifPresent(previous -> {
            LOG.info("Flow {} replaced by {}", previous, flowId);
            metrics.recordFlowOutcome(FlowError.Kind.CANCELLED.name());
        });
        publishPhase(flowId, FlowPhase.ANALYZING);

        try {
            CompletableFuture<Void> task = CompletableFuture.runAsync(() -> run(flowId, token, request), executor);
            CompletableFuture<Void> previousTask = currentTask.getAndSet(task);
            if (previousTask != null && !previousTask.isDone()) {
                previousTask.cancel(false);
            }
        } catch (RejectedExecutionException e) {
            LOG.error("Flow executor rejected flow {}", flowId, e);
            fail(flowId, FlowError.analysisFailure("flow executor is saturated"), e);
        }
        return flowId;
    }

    /**
     * Cancels the current flow if it is still processing. The flow ends in
     * {@code FAILED(CANCELLED)} with no result.
     *
     * @return {@code true} if a flow was cancelled
     */
    public boolean cancel() {
        Optional<UUID> cancelled = stateMachine.cancel();
        cancelled.ifPresent(flowId -> {
            LOG.info("Flow {} cancelled", flowId);
            metrics.recordFlowOutcome(FlowError.Kind.CANCELLED.name());
            publishPhase(flowId, FlowPhase.failed(FlowError.cancelled()));
        });
        return cancelled.isPresent();
    }

    /**
     * Cancels anything running and returns to {@code IDLE}, discarding the last result.
     */
    public void reset() {
        Optional<UUID> previous = stateMachine.flowId();
        stateMachine.reset();
        LOG.debug("Flow controller reset");
        previous.ifPresent(flowId -> publishPhase(flowId, FlowPhase.IDLE));
    }

    public FlowPhase currentPhase() {
        return stateMachine.phase();
    }

    public double progress() {
        return stateMachine.phase().progress();
    }

    /**
     * @return the result of the current flow, present only once it has completed
     */
    public Optional<FlowResult> currentResult() {
        return stateMachine.result();
    }

    public Optional<UUID> currentFlowId() {
        return stateMachine.flowId();
    }

    private void run(UUID flowId, CancellationToken token, FlowRequest request) {
        ThreadContext.put(MDC_FLOW_ID, flowId.toString());
        long start = System.nanoTime();
        try {
            token.throwIfCancelled();
            ScreenAnalysisResult analysis = analyze(request.image());
            token.throwIfCancelled();
            if (analysis.isEmpty()) {
                throw new FlowException(FlowError.noTextFound());
            }

            enter(flowId, FlowPhase.TRANSLATING);
            List<BilingualSegment> segments = translate(analysis, request);

            enter(flowId, FlowPhase.RENDERING);
            BufferedImage rendered = renderer.render(request.image(), segments, request.style());
            if (rendered == null) {
                throw new FlowException(FlowError.renderingFailure("the renderer produced no image"));
            }
            token.throwIfCancelled();

            FlowResult result = new FlowResult(flowId, request.image(), rendered, segments,
                    TimeUtils.elapsed(start));
            if (stateMachine.complete(flowId, result)) {
                LOG.info("Flow completed in {} ms ({} segment(s))", TimeUtils.elapsedMillis(start), segments.size());
                metrics.recordFlowOutcome(FlowPhase.Kind.COMPLETED.name());
                publishPhase(flowId, FlowPhase.COMPLETED);
            } else {
                LOG.debug("Flow finished after it was superseded; result discarded");
            }
        } catch (FlowException e) {
            if (e.getKind() == FlowError.Kind.CANCELLED) {
                LOG.debug("Flow stopped at a phase boundary after cancellation");
            } else {
                fail(flowId, e.getError(), e.getCause());
            }
        } catch (RuntimeException e) {
            LOG.error("Unexpected flow failure", e);
            fail(flowId, FlowError.analysisFailure(String.valueOf(e.getMessage())), e);
        } finally {
            ThreadContext.remove(MDC_FLOW_ID);
        }
    }

    private ScreenAnalysisResult analyze(BufferedImage image) {
        try {
            return extractionEngine.analyze(image);
        } catch (AnalysisException e) {
            throw new FlowException(FlowError.analysisFailure(e.getMessage()), e);
        } catch (RuntimeException e) {
            throw new FlowException(FlowError.analysisFailure(String.valueOf(e.getMessage())), e);
        }
    }

    private List<BilingualSegment> translate(ScreenAnalysisResult analysis, FlowRequest request) {
        try {
            TranslationResultBundle bundle = orchestrator.translateForScene(analysis.segments(),
                    request.targetLanguage(), request.sourceLanguage(), TranslationScene.SCREENSHOT,
                    request.preferredEngine());
            Optional<EngineResult> best = bundle.bestResult();
            if (best.isEmpty()) {
                throw bundle.firstError().orElseGet(() -> TranslationProviderException.translationFailed(
                        bundle.primaryEngine(), "no engine produced a result"));
            }
            if (bundle.hasErrors()) {
                LOG.info("Rendering {} after engines {} failed", best.get().engineId(), bundle.failedEngines());
            }
            return best.get().segments();
        } catch (TranslationProviderException e) {
            throw new FlowException(FlowError.translationFailure(e.getMessage(), e.getRecoverySuggestion()), e);
        } catch (RuntimeException e) {
            throw new FlowException(FlowError.translationFailure(String.valueOf(e.getMessage()), null), e);
        }
    }

    private void enter(UUID flowId, FlowPhase phase) {
        if (!stateMachine.transition(flowId, phase)) {
            throw new FlowException(FlowError.cancelled());
        }
        LOG.debug("Flow entered {}", phase.kind());
        publishPhase(flowId, phase);
    }

    private void fail(UUID flowId, FlowError error, Throwable cause) {
        if (!stateMachine.fail(flowId, error)) {
            LOG.debug("Ignoring failure of superseded flow {}: {}", flowId, error.kind());
            return;
        }
        LOG.warn("Flow failed ({}): {}", error.kind(), error.message());
        if (cause != null) {
            LOG.debug("Flow failure cause", cause);
        }
        metrics.recordFlowOutcome(error.kind().name());
        publishPhase(flowId, FlowPhase.failed(error));
        if (error.isUserVisible()) {
            publisher.publishEvent(new FlowFailedEvent(flowId, error, Instant.now()));
        }
    }

    private void publishPhase(UUID flowId, FlowPhase phase) {
        publisher.publishEvent(new FlowPhaseChangedEvent(flowId, phase, Instant.now()));
    }
}
