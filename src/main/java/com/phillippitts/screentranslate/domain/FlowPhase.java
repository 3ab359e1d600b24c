package com.phillippitts.screentranslate.domain;

import java.util.Objects;

/**
 * Observable state of the translation flow.
 *
 * <pre>
 * IDLE → ANALYZING → TRANSLATING → RENDERING → COMPLETED
 *             ↘            ↘            ↘
 *                         FAILED(error)
 * </pre>
 *
 * <p>Cancellation is {@code FAILED} with {@link FlowError.Kind#CANCELLED}.
 *
 * @param kind phase
 * @param error failure detail, non-null exactly when {@code kind == FAILED}
 */
public record FlowPhase(Kind kind, FlowError error) {

    public enum Kind {
        IDLE(0.0),
        ANALYZING(0.25),
        TRANSLATING(0.5),
        RENDERING(0.75),
        COMPLETED(1.0),
        FAILED(0.0);

        private final double progress;

        Kind(double progress) {
            this.progress = progress;
        }

        public double progress() {
            return progress;
        }
    }

    public static final FlowPhase IDLE = new FlowPhase(Kind.IDLE, null);
    public static final FlowPhase ANALYZING = new FlowPhase(Kind.ANALYZING, null);
    public static final FlowPhase TRANSLATING = new FlowPhase(Kind.TRANSLATING, null);
    public static final FlowPhase RENDERING = new FlowPhase(Kind.RENDERING, null);
    public static final FlowPhase COMPLETED = new FlowPhase(Kind.COMPLETED, null);

    public FlowPhase {
        Objects.requireNonNull(kind, "kind");
        if ((kind == Kind.FAILED) != (error != null)) {
            throw new IllegalArgumentException("error must be present exactly for FAILED, kind=" + kind);
        }
    }

    public static FlowPhase failed(FlowError error) {
        return new FlowPhase(Kind.FAILED, Objects.requireNonNull(error, "error"));
    }

    public double progress() {
        return kind.progress();
    }

    public boolean isProcessing() {
        return kind == Kind.ANALYZING || kind == Kind.TRANSLATING || kind == Kind.RENDERING;
    }

    public boolean isTerminal() {
        return kind == Kind.COMPLETED || kind == Kind.FAILED;
    }

    public boolean isCancelled() {
        return kind == Kind.FAILED && error.kind() == FlowError.Kind.CANCELLED;
    }
}
